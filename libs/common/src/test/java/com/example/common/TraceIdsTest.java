package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void prefixedTraceIdEndsWithUuid() {
    final String traceId = TraceIds.newTraceId("key-refresh");

    assertThat(traceId).startsWith("key-refresh-");
    assertThat(UUID.fromString(traceId.substring("key-refresh-".length()))).isNotNull();
  }

  @Test
  void traceIdsAreUnique() {
    assertThat(TraceIds.newTraceId()).isNotEqualTo(TraceIds.newTraceId());
  }
}
