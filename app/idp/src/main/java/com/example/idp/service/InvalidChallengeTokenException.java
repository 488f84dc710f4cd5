package com.example.idp.service;

/**
 * The challenge token could not be parsed, was signed with an unexpected algorithm, failed
 * signature or claim validation, or carries claims of the wrong shape.
 */
public class InvalidChallengeTokenException extends RuntimeException {

  public InvalidChallengeTokenException(String message) {
    super(message);
  }

  public InvalidChallengeTokenException(String message, Throwable cause) {
    super(message, cause);
  }
}
