/*
 * Where: IdP domain model
 * What: the fixed claim schema of a consent-challenge token
 * Why: claim shape is validated once at the token boundary instead of per field access
 */
package com.example.idp.model;

import java.time.Instant;
import java.util.List;

public record ChallengeClaims(
    String audience, String redirect, List<String> scopes, Instant expiresAt) {

  public ChallengeClaims {
    scopes = scopes == null ? List.of() : List.copyOf(scopes);
  }
}
