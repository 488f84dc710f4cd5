package com.example.idp.service;

/** Failures of the consent flow that callers are expected to branch on. */
public class IdpException extends RuntimeException {

  public enum Reason {
    /** No key cached for the requested role. */
    NO_KEY,
    /** A key is cached for the role but is not of the expected type. */
    BAD_KEY,
    /** The consent request carries no challenge token. */
    BAD_REQUEST,
    /** The challenge token or the stored challenge is past its expiry. */
    CHALLENGE_EXPIRED,
    /** No challenge, or something other than a challenge, is stored in the session. */
    BAD_CHALLENGE_COOKIE
  }

  private final Reason reason;

  public IdpException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public IdpException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
