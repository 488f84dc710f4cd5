package com.example.idp.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.idp.model.ChallengeClaims;
import com.example.idp.support.TestKeys;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import java.security.KeyPair;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class ChallengeCodecTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
  private final ChallengeCodec codec = new ChallengeCodec(clock);
  private final KeyPair keyPair = TestKeys.rsaKeyPair();
  private final Supplier<RSAPublicKey> verificationKey = () -> (RSAPublicKey) keyPair.getPublic();

  @Test
  void decodesValidChallenge() {
    final String token = TestKeys.sign(keyPair, validClaims().build());

    final ChallengeClaims claims = codec.decode(token, verificationKey);

    assertThat(claims.audience()).isEqualTo("app-1");
    assertThat(claims.redirect()).isEqualTo("https://app.example/cb");
    assertThat(claims.scopes()).containsExactly("openid", "profile");
    assertThat(claims.expiresAt()).isEqualTo(NOW.plusSeconds(300));
  }

  @Test
  void blankTokenIsBadRequestWithoutKeyLookup() {
    final AtomicInteger lookups = new AtomicInteger();

    assertThatThrownBy(
            () ->
                codec.decode(
                    " ",
                    () -> {
                      lookups.incrementAndGet();
                      return (RSAPublicKey) keyPair.getPublic();
                    }))
        .isInstanceOfSatisfying(
            IdpException.class,
            ex -> assertThat(ex.reason()).isEqualTo(IdpException.Reason.BAD_REQUEST));
    assertThat(lookups).hasValue(0);
  }

  @Test
  void expiredTokenIsChallengeExpired() {
    final String token =
        TestKeys.sign(
            keyPair, validClaims().expirationTime(Date.from(NOW.minusSeconds(1))).build());

    assertThatThrownBy(() -> codec.decode(token, verificationKey))
        .isInstanceOfSatisfying(
            IdpException.class,
            ex -> assertThat(ex.reason()).isEqualTo(IdpException.Reason.CHALLENGE_EXPIRED));
  }

  @Test
  void tokenExpiringNowIsChallengeExpired() {
    final String token =
        TestKeys.sign(keyPair, validClaims().expirationTime(Date.from(NOW)).build());

    assertThatThrownBy(() -> codec.decode(token, verificationKey))
        .isInstanceOfSatisfying(
            IdpException.class,
            ex -> assertThat(ex.reason()).isEqualTo(IdpException.Reason.CHALLENGE_EXPIRED));
  }

  @Test
  void symmetricAlgorithmIsRejectedBeforeKeyLookupAndExpiry() throws JOSEException {
    final AtomicInteger lookups = new AtomicInteger();
    final String token =
        TestKeys.sign(
            new MACSigner(new byte[32]),
            JWSAlgorithm.HS256,
            validClaims().expirationTime(Date.from(NOW.minusSeconds(60))).build());

    assertThatThrownBy(
            () ->
                codec.decode(
                    token,
                    () -> {
                      lookups.incrementAndGet();
                      return (RSAPublicKey) keyPair.getPublic();
                    }))
        .isInstanceOf(InvalidChallengeTokenException.class)
        .hasMessageContaining("HS256");
    assertThat(lookups).hasValue(0);
  }

  @Test
  void signatureFromOtherKeyIsRejected() {
    final String token = TestKeys.sign(TestKeys.rsaKeyPair(), validClaims().build());

    assertThatThrownBy(() -> codec.decode(token, verificationKey))
        .isInstanceOf(InvalidChallengeTokenException.class)
        .hasMessageContaining("signature");
  }

  @Test
  void missingKeyPropagatesUnchanged() {
    final String token = TestKeys.sign(keyPair, validClaims().build());
    final IdpException noKey = new IdpException(IdpException.Reason.NO_KEY, "no key");

    assertThatThrownBy(
            () ->
                codec.decode(
                    token,
                    () -> {
                      throw noKey;
                    }))
        .isSameAs(noKey);
  }

  @Test
  void notYetValidTokenIsRejected() {
    final String token =
        TestKeys.sign(keyPair, validClaims().notBeforeTime(Date.from(NOW.plusSeconds(30))).build());

    assertThatThrownBy(() -> codec.decode(token, verificationKey))
        .isInstanceOf(InvalidChallengeTokenException.class);
  }

  @Test
  void garbageTokenIsRejectedWithCause() {
    assertThatThrownBy(() -> codec.decode("not-a-jwt", verificationKey))
        .isInstanceOf(InvalidChallengeTokenException.class)
        .hasCauseInstanceOf(java.text.ParseException.class);
  }

  @Test
  void multipleAudiencesAreRejected() {
    final String token =
        TestKeys.sign(keyPair, validClaims().audience(List.of("app-1", "app-2")).build());

    assertThatThrownBy(() -> codec.decode(token, verificationKey))
        .isInstanceOf(InvalidChallengeTokenException.class)
        .hasMessageContaining("aud");
  }

  @Test
  void missingRedirectIsRejected() {
    final String token = TestKeys.sign(keyPair, validClaims().claim("redir", null).build());

    assertThatThrownBy(() -> codec.decode(token, verificationKey))
        .isInstanceOf(InvalidChallengeTokenException.class)
        .hasMessageContaining("redir");
  }

  @Test
  void mistypedScopesAreRejected() {
    final String token = TestKeys.sign(keyPair, validClaims().claim("scp", 42).build());

    assertThatThrownBy(() -> codec.decode(token, verificationKey))
        .isInstanceOf(InvalidChallengeTokenException.class);
  }

  @Test
  void missingExpiryIsRejected() {
    final String token = TestKeys.sign(keyPair, validClaims().expirationTime(null).build());

    assertThatThrownBy(() -> codec.decode(token, verificationKey))
        .isInstanceOf(InvalidChallengeTokenException.class)
        .hasMessageContaining("exp");
  }

  private JWTClaimsSet.Builder validClaims() {
    return new JWTClaimsSet.Builder()
        .audience("app-1")
        .claim("redir", "https://app.example/cb")
        .claim("scp", List.of("openid", "profile"))
        .expirationTime(Date.from(NOW.plusSeconds(300)));
  }
}
