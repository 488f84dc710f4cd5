package com.example.idp.service;

// Thrown when a key set is empty or its first key cannot be decoded into the expected type.
public class KeyFetchException extends RuntimeException {

  public KeyFetchException(String message) {
    super(message);
  }

  public KeyFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
