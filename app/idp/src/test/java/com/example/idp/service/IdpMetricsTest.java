/*
 * Where: IdP service layer tests
 * What: metric names and tags recorded by IdpMetrics
 * Why: dashboards and alerts query these names directly
 */
package com.example.idp.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class IdpMetricsTest {

  @Test
  void recordsKeyRefreshByRoleAndResult() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final IdpMetrics metrics = new IdpMetrics(registry);

    metrics.recordKeyRefresh("verification", "success");
    metrics.recordKeyRefresh("verification", "success");
    metrics.recordKeyRefresh("consent", "failure");

    assertThat(
            registry
                .get("idp.key.refresh.total")
                .tags("role", "verification", "result", "success")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(
            registry
                .get("idp.key.refresh.total")
                .tags("role", "consent", "result", "failure")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void recordsChallengeConsentAndErrorCounters() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final IdpMetrics metrics = new IdpMetrics(registry);

    metrics.recordChallengeResult("accepted");
    metrics.recordConsentDecision("refused");
    metrics.recordError("CHALLENGE_EXPIRED");

    assertThat(registry.get("idp.challenge.total").tag("result", "accepted").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("idp.consent.total").tag("decision", "refused").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("idp.error.total").tag("code", "CHALLENGE_EXPIRED").counter().count())
        .isEqualTo(1.0d);
  }
}
