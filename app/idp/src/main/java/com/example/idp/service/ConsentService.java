/*
 * Where: IdP service layer
 * What: starts a consent flow and turns the user's decision into a redirect
 * Why: the authorization server expects a signed consent response on the client's redirect
 */
package com.example.idp.service;

import com.example.idp.config.ConsentProperties;
import com.example.idp.model.Challenge;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

@Service
@RequiredArgsConstructor
public class ConsentService {

  private static final Logger logger = LoggerFactory.getLogger(ConsentService.class);

  static final String CONSENT_PARAMETER = "consent";
  static final String REFUSED = "false";

  private final IdentityProvider identityProvider;
  private final ChallengeStore challengeStore;
  private final ConsentProperties properties;
  private final IdpMetrics metrics;
  private final Clock clock;

  public Challenge beginConsent(HttpServletRequest request, String user) {
    final Challenge challenge;
    try {
      challenge = identityProvider.newChallenge(request, user);
    } catch (RuntimeException ex) {
      metrics.recordChallengeResult("rejected");
      throw ex;
    }
    challengeStore.save(request, challenge);
    metrics.recordChallengeResult("accepted");
    logger.info(
        "consent challenge accepted client={} user={} scopes={}",
        challenge.client(),
        challenge.user(),
        challenge.scopes());
    return challenge;
  }

  public Challenge currentChallenge(HttpServletRequest request) {
    return identityProvider.getChallenge(request);
  }

  /**
   * Signs a consent response for the stored challenge and returns the client redirect. The
   * challenge is consumed before signing; it is put back only when signing fails.
   */
  public URI grantAccess(HttpServletRequest request) {
    final Challenge challenge = identityProvider.checkChallenge(challengeStore.take(request));
    final String consentToken;
    try {
      consentToken = signConsent(challenge);
    } catch (RuntimeException ex) {
      challengeStore.save(request, challenge);
      throw ex;
    }
    metrics.recordConsentDecision("granted");
    logger.info("consent granted client={} user={}", challenge.client(), challenge.user());
    return redirectWithConsent(challenge, consentToken);
  }

  public URI refuseAccess(HttpServletRequest request) {
    final Challenge challenge = identityProvider.checkChallenge(challengeStore.take(request));
    metrics.recordConsentDecision("refused");
    logger.info("consent refused client={} user={}", challenge.client(), challenge.user());
    return redirectWithConsent(challenge, REFUSED);
  }

  String signConsent(Challenge challenge) {
    final Instant now = Instant.now(clock);
    final JWTClaimsSet claims =
        new JWTClaimsSet.Builder()
            .jwtID(UUID.randomUUID().toString())
            .audience(challenge.client())
            .subject(challenge.user())
            .claim(ChallengeCodec.SCOPES_CLAIM, challenge.scopes())
            .issueTime(Date.from(now))
            .expirationTime(Date.from(now.plus(properties.responseTtl())))
            .build();
    final SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.RS256), claims);
    try {
      jwt.sign(new RSASSASigner(challenge.identityProvider().getConsentKey()));
    } catch (JOSEException ex) {
      throw new IllegalStateException("failed to sign consent response", ex);
    }
    return jwt.serialize();
  }

  // the redirect comes from a verified challenge and is already URI-encoded
  private URI redirectWithConsent(Challenge challenge, String consent) {
    return UriComponentsBuilder.fromUriString(challenge.redirect())
        .queryParam(CONSENT_PARAMETER, consent)
        .build(true)
        .toUri();
  }
}
