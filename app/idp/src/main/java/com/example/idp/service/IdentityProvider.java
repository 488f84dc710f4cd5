/*
 * Where: IdP service layer
 * What: facade over trust bootstrap, key cache, challenge decoding and challenge storage
 * Why: the consent endpoints need one entry point that owns the authorization server session
 */
package com.example.idp.service;

import com.example.idp.model.Challenge;
import com.example.idp.model.ChallengeClaims;
import com.example.idp.model.KeyRole;
import jakarta.annotation.PreDestroy;
import jakarta.servlet.http.HttpServletRequest;
import java.security.Key;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class IdentityProvider implements KeyFetcher {

  private static final Logger logger = LoggerFactory.getLogger(IdentityProvider.class);

  static final String CHALLENGE_PARAMETER = "challenge";

  private final TrustBootstrap trustBootstrap;
  private final HydraKeyClient hydraKeyClient;
  private final KeyCache keyCache;
  private final ChallengeCodec challengeCodec;
  private final ChallengeStore challengeStore;
  private final Clock clock;

  private volatile TrustSession session;

  public IdentityProvider(
      TrustBootstrap trustBootstrap,
      HydraKeyClient hydraKeyClient,
      KeyCache keyCache,
      ChallengeCodec challengeCodec,
      ChallengeStore challengeStore,
      Clock clock) {
    this.trustBootstrap = trustBootstrap;
    this.hydraKeyClient = hydraKeyClient;
    this.keyCache = keyCache;
    this.challengeCodec = challengeCodec;
    this.challengeStore = challengeStore;
    this.clock = clock;
  }

  /**
   * Establishes trust with the authorization server and primes both keys. Any failure propagates;
   * a failed bootstrap leaves no transport behind.
   */
  public synchronized void connect() {
    final TrustSession established;
    try {
      established = trustBootstrap.connect();
    } catch (RuntimeException ex) {
      session = null;
      throw ex;
    }
    session = established;

    final RSAPublicKey verificationKey = hydraKeyClient.fetchVerificationKey(established.transport());
    keyCache.set(KeyRole.VERIFICATION_KEY, verificationKey);
    final RSAPrivateKey consentKey = hydraKeyClient.fetchConsentKey(established.transport());
    keyCache.set(KeyRole.CONSENT_SIGNING_KEY, consentKey);
    logger.info("identity provider connected keyTtl={}", keyCache.defaultTtl());
  }

  @Override
  public Key fetch(KeyRole role) {
    final TrustSession current = session;
    if (current == null) {
      throw new IllegalStateException("identity provider is not connected");
    }
    return hydraKeyClient.fetch(current.transport(), role);
  }

  /** Starts a challenge from the {@code challenge} request parameter. */
  public Challenge newChallenge(HttpServletRequest request, String user) {
    return newChallenge(request.getParameter(CHALLENGE_PARAMETER), user);
  }

  public Challenge newChallenge(String token, String user) {
    final ChallengeClaims claims = challengeCodec.decode(token, this::getVerificationKey);
    return Challenge.create(
        claims.audience(),
        claims.redirect(),
        user,
        claims.scopes(),
        claims.expiresAt(),
        clock,
        this);
  }

  /** Returns the challenge stored for this browser, re-attached to this provider. */
  public Challenge getChallenge(HttpServletRequest request) {
    return checkChallenge(challengeStore.load(request));
  }

  /** Validates a value read from the {@link ChallengeStore} and attaches it to this provider. */
  public Challenge checkChallenge(Object stored) {
    if (!(stored instanceof Challenge challenge)) {
      throw new IdpException(
          IdpException.Reason.BAD_CHALLENGE_COOKIE, "no challenge stored for this session");
    }
    if (challenge.isExpired(clock)) {
      throw new IdpException(IdpException.Reason.CHALLENGE_EXPIRED, "challenge expired");
    }
    return challenge.attachedTo(this);
  }

  public RSAPublicKey getVerificationKey() {
    final Key key = requireKey(KeyRole.VERIFICATION_KEY);
    if (!(key instanceof RSAPublicKey publicKey)) {
      throw new IdpException(
          IdpException.Reason.BAD_KEY, "cached verification key is not an RSA public key");
    }
    return publicKey;
  }

  public RSAPrivateKey getConsentKey() {
    final Key key = requireKey(KeyRole.CONSENT_SIGNING_KEY);
    if (!(key instanceof RSAPrivateKey privateKey)) {
      throw new IdpException(
          IdpException.Reason.BAD_KEY, "cached consent key is not an RSA private key");
    }
    return privateKey;
  }

  public boolean isConnected() {
    return session != null;
  }

  public boolean isReady() {
    return isConnected()
        && keyCache.get(KeyRole.VERIFICATION_KEY).isPresent()
        && keyCache.get(KeyRole.CONSENT_SIGNING_KEY).isPresent();
  }

  @PreDestroy
  public synchronized void close() {
    final boolean wasConnected = session != null;
    session = null;
    keyCache.flush();
    if (wasConnected) {
      logger.info("identity provider closed");
    }
  }

  private Key requireKey(KeyRole role) {
    return keyCache
        .get(role)
        .orElseThrow(
            () ->
                new IdpException(
                    IdpException.Reason.NO_KEY, "no " + role.value() + " key cached"));
  }
}
