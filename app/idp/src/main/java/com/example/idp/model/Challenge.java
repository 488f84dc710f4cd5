package com.example.idp.model;

import com.example.idp.service.IdentityProvider;
import com.example.idp.service.IdpException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.Serial;
import java.io.Serializable;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A pending consent decision for one client and redirect target, bound to the user that
 * authenticated before the challenge was accepted.
 *
 * <p>Instances are immutable. The identity provider reference is a lookup handle for the consent
 * signing key; it is not serialized with the session and is re-attached on every read.
 */
public final class Challenge implements Serializable {

  @Serial private static final long serialVersionUID = 1L;

  private final String client;
  private final String redirect;
  private final String user;
  private final List<String> scopes;
  private final Instant expires;
  private final transient IdentityProvider identityProvider;

  private Challenge(
      String client,
      String redirect,
      String user,
      List<String> scopes,
      Instant expires,
      IdentityProvider identityProvider) {
    this.client = client;
    this.redirect = redirect;
    this.user = user;
    this.scopes = scopes;
    this.expires = expires;
    this.identityProvider = identityProvider;
  }

  /**
   * Builds a challenge that is still valid at {@code clock}'s current instant.
   *
   * @throws IdpException with {@link IdpException.Reason#CHALLENGE_EXPIRED} when {@code expires}
   *     is not strictly in the future
   */
  public static Challenge create(
      String client,
      String redirect,
      String user,
      List<String> scopes,
      Instant expires,
      Clock clock,
      IdentityProvider identityProvider) {
    Objects.requireNonNull(expires, "expires is required");
    if (!expires.isAfter(Instant.now(clock))) {
      throw new IdpException(IdpException.Reason.CHALLENGE_EXPIRED, "challenge expired");
    }
    return new Challenge(
        client,
        redirect,
        user,
        scopes == null ? List.of() : List.copyOf(scopes),
        expires,
        identityProvider);
  }

  public String client() {
    return client;
  }

  public String redirect() {
    return redirect;
  }

  public String user() {
    return user;
  }

  public List<String> scopes() {
    return scopes;
  }

  public Instant expires() {
    return expires;
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "IdentityProvider is a shared Spring singleton and cannot be copied")
  public IdentityProvider identityProvider() {
    return identityProvider;
  }

  public boolean isExpired(Clock clock) {
    return !expires.isAfter(Instant.now(clock));
  }

  /** Returns a copy of this challenge that resolves keys through {@code provider}. */
  public Challenge attachedTo(IdentityProvider provider) {
    return new Challenge(client, redirect, user, scopes, expires, provider);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Challenge that)) {
      return false;
    }
    return Objects.equals(client, that.client)
        && Objects.equals(redirect, that.redirect)
        && Objects.equals(user, that.user)
        && scopes.equals(that.scopes)
        && expires.equals(that.expires);
  }

  @Override
  public int hashCode() {
    return Objects.hash(client, redirect, user, scopes, expires);
  }

  @Override
  public String toString() {
    return "Challenge[client="
        + client
        + ", redirect="
        + redirect
        + ", user="
        + user
        + ", scopes="
        + scopes
        + ", expires="
        + expires
        + "]";
  }
}
