/*
 * Where: IdP domain model
 * What: the two purposes a cached asymmetric key serves
 * Why: each role maps to a fixed key set and kind on the key-publishing endpoint
 */
package com.example.idp.model;

public enum KeyRole {
  VERIFICATION_KEY("verification", "consent.challenge", "public"),
  CONSENT_SIGNING_KEY("consent", "consent.endpoint", "private");

  private final String value;
  private final String keySet;
  private final String kind;

  KeyRole(String value, String keySet, String kind) {
    this.value = value;
    this.keySet = keySet;
    this.kind = kind;
  }

  /** Short name used in logs and metric tags. */
  public String value() {
    return value;
  }

  public String keySet() {
    return keySet;
  }

  public String kind() {
    return kind;
  }
}
