/*
 * Where: IdP service layer
 * What: verifies and decodes the signed challenge token issued by the authorization server
 * Why: redirect target and scopes are only trusted after the RSA signature has been checked
 */
package com.example.idp.service;

import com.example.idp.model.ChallengeClaims;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.security.interfaces.RSAPublicKey;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChallengeCodec {

  static final String REDIRECT_CLAIM = "redir";
  static final String SCOPES_CLAIM = "scp";

  private final Clock clock;

  /**
   * Decodes {@code token}. The verification key is requested only once the header names an RSA
   * signature algorithm, so key lookup errors surface after signing-method errors.
   *
   * @throws IdpException BAD_REQUEST for a blank token, CHALLENGE_EXPIRED once {@code exp} has
   *     passed
   * @throws InvalidChallengeTokenException for malformed tokens, non-RSA algorithms, bad
   *     signatures or malformed claims
   */
  public ChallengeClaims decode(String token, Supplier<RSAPublicKey> verificationKey) {
    if (token == null || token.isBlank()) {
      throw new IdpException(IdpException.Reason.BAD_REQUEST, "challenge token is required");
    }
    final SignedJWT jwt = parse(token);
    requireRsaAlgorithm(jwt.getHeader());
    verifySignature(jwt, verificationKey.get());

    final JWTClaimsSet claims = claimsOf(jwt);
    final Instant now = Instant.now(clock);
    requireActive(claims, now);
    final Instant expiresAt = requireNotExpired(claims, now);
    return extractClaims(claims, expiresAt);
  }

  private SignedJWT parse(String token) {
    try {
      return SignedJWT.parse(token);
    } catch (ParseException ex) {
      throw new InvalidChallengeTokenException("challenge token is not a signed JWT", ex);
    }
  }

  private void requireRsaAlgorithm(JWSHeader header) {
    if (!JWSAlgorithm.Family.RSA.contains(header.getAlgorithm())) {
      throw new InvalidChallengeTokenException(
          "unexpected signing method: " + header.getAlgorithm());
    }
  }

  private void verifySignature(SignedJWT jwt, RSAPublicKey key) {
    final boolean valid;
    try {
      valid = jwt.verify(new RSASSAVerifier(key));
    } catch (JOSEException ex) {
      throw new InvalidChallengeTokenException("challenge signature could not be verified", ex);
    }
    if (!valid) {
      throw new InvalidChallengeTokenException("challenge signature is invalid");
    }
  }

  private JWTClaimsSet claimsOf(SignedJWT jwt) {
    try {
      return jwt.getJWTClaimsSet();
    } catch (ParseException ex) {
      throw new InvalidChallengeTokenException("challenge claims are malformed", ex);
    }
  }

  private Instant requireNotExpired(JWTClaimsSet claims, Instant now) {
    final Date expiration = claims.getExpirationTime();
    if (expiration == null) {
      throw new InvalidChallengeTokenException("exp claim is required");
    }
    final Instant expiresAt = expiration.toInstant();
    if (!expiresAt.isAfter(now)) {
      throw new IdpException(IdpException.Reason.CHALLENGE_EXPIRED, "challenge expired");
    }
    return expiresAt;
  }

  private void requireActive(JWTClaimsSet claims, Instant now) {
    final Date notBefore = claims.getNotBeforeTime();
    if (notBefore != null && notBefore.toInstant().isAfter(now)) {
      throw new InvalidChallengeTokenException("challenge is not valid yet");
    }
    final Date issuedAt = claims.getIssueTime();
    if (issuedAt != null && issuedAt.toInstant().isAfter(now)) {
      throw new InvalidChallengeTokenException("challenge was issued in the future");
    }
  }

  private ChallengeClaims extractClaims(JWTClaimsSet claims, Instant expiresAt) {
    final List<String> audience = claims.getAudience();
    if (audience.size() != 1 || isBlank(audience.get(0))) {
      throw new InvalidChallengeTokenException("aud claim must name exactly one client");
    }
    final String redirect;
    final List<String> scopes;
    try {
      redirect = claims.getStringClaim(REDIRECT_CLAIM);
      scopes = claims.getStringListClaim(SCOPES_CLAIM);
    } catch (ParseException ex) {
      throw new InvalidChallengeTokenException("challenge claims are malformed", ex);
    }
    if (isBlank(redirect)) {
      throw new InvalidChallengeTokenException("redir claim is required");
    }
    if (scopes == null) {
      throw new InvalidChallengeTokenException("scp claim is required");
    }
    return new ChallengeClaims(audience.get(0), redirect, scopes, expiresAt);
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
