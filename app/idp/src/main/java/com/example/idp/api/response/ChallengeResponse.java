package com.example.idp.api.response;

import com.example.idp.model.Challenge;
import java.time.Instant;
import java.util.List;

public record ChallengeResponse(
    String client, String redirect, String user, List<String> scopes, Instant expiresAt) {

  public static ChallengeResponse from(Challenge challenge) {
    return new ChallengeResponse(
        challenge.client(),
        challenge.redirect(),
        challenge.user(),
        challenge.scopes(),
        challenge.expires());
  }
}
