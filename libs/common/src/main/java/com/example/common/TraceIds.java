package com.example.common;

import java.util.UUID;

/** Correlation ids for work that does not start from an HTTP request. */
public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String newTraceId(String prefix) {
    return prefix + "-" + newTraceId();
  }
}
