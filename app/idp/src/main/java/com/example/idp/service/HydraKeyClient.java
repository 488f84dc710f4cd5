/*
 * Where: IdP service layer
 * What: fetches JSON Web Key sets from the authorization server's key API
 * Why: the challenge verification key and the consent signing key live on the server
 */
package com.example.idp.service;

import com.example.idp.model.KeyRole;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import java.security.Key;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.text.ParseException;
import java.util.List;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class HydraKeyClient {

  private static final Logger logger = LoggerFactory.getLogger(HydraKeyClient.class);

  static final String KEYS_PATH = "/keys/{set}/{kind}";

  public Key fetch(@NonNull RestClient transport, @NonNull KeyRole role) {
    return switch (role) {
      case VERIFICATION_KEY -> fetchVerificationKey(transport);
      case CONSENT_SIGNING_KEY -> fetchConsentKey(transport);
    };
  }

  public RSAPublicKey fetchVerificationKey(@NonNull RestClient transport) {
    final KeyRole role = KeyRole.VERIFICATION_KEY;
    final RSAKey rsaKey = requireRsa(fetchKey(transport, role.keySet(), role.kind()), role);
    try {
      return rsaKey.toRSAPublicKey();
    } catch (JOSEException ex) {
      logger.warn("verification key could not be decoded set={}", role.keySet(), ex);
      throw new KeyFetchException("verification key could not be decoded", ex);
    }
  }

  public RSAPrivateKey fetchConsentKey(@NonNull RestClient transport) {
    final KeyRole role = KeyRole.CONSENT_SIGNING_KEY;
    final RSAKey rsaKey = requireRsa(fetchKey(transport, role.keySet(), role.kind()), role);
    if (!rsaKey.isPrivate()) {
      logger.warn("consent key set returned a public key only set={}", role.keySet());
      throw new KeyFetchException("consent signing key has no private part");
    }
    try {
      return rsaKey.toRSAPrivateKey();
    } catch (JOSEException ex) {
      logger.warn("consent signing key could not be decoded set={}", role.keySet(), ex);
      throw new KeyFetchException("consent signing key could not be decoded", ex);
    }
  }

  /**
   * Returns the first key of {@code GET /keys/{set}/{kind}}. HTTP failures propagate as {@link
   * org.springframework.web.client.RestClientException}.
   */
  public JWK fetchKey(@NonNull RestClient transport, String keySet, String kind) {
    final String body = transport.get().uri(KEYS_PATH, keySet, kind).retrieve().body(String.class);
    if (body == null || body.isBlank()) {
      logger.warn("key set response is empty set={} kind={}", keySet, kind);
      throw new KeyFetchException("key set " + keySet + "/" + kind + " response is empty");
    }
    final List<JWK> keys;
    try {
      keys = JWKSet.parse(body).getKeys();
    } catch (ParseException ex) {
      logger.warn("key set response could not be parsed set={} kind={}", keySet, kind, ex);
      throw new KeyFetchException("key set " + keySet + "/" + kind + " could not be parsed", ex);
    }
    if (keys.isEmpty()) {
      logger.warn("key set contains no keys set={} kind={}", keySet, kind);
      throw new KeyFetchException("key set " + keySet + "/" + kind + " contains no keys");
    }
    return keys.get(0);
  }

  private RSAKey requireRsa(JWK jwk, KeyRole role) {
    if (!(jwk instanceof RSAKey rsaKey)) {
      logger.warn("key set returned a non-RSA key set={} type={}", role.keySet(), jwk.getKeyType());
      throw new KeyFetchException(
          "key set " + role.keySet() + " returned " + jwk.getKeyType() + " key, expected RSA");
    }
    return rsaKey;
  }
}
