/*
 * Where: IdP service layer
 * What: counters for key refreshes, challenge outcomes, consent decisions and API errors
 * Why: repeated refresh failures and rising error codes must be visible from Prometheus
 */
package com.example.idp.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring component and cannot be copied")
public class IdpMetrics {

  private static final String METRIC_KEY_REFRESH_TOTAL = "idp.key.refresh.total";
  private static final String METRIC_CHALLENGE_TOTAL = "idp.challenge.total";
  private static final String METRIC_CONSENT_TOTAL = "idp.consent.total";
  private static final String METRIC_ERROR_TOTAL = "idp.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> keyRefreshCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> challengeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> consentCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

  public IdpMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordKeyRefresh(String role, String result) {
    final String key = role + "|" + result;
    keyRefreshCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_KEY_REFRESH_TOTAL)
                    .description("Key cache refresh attempts after eviction")
                    .tags(Tags.of("role", role, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordChallengeResult(String result) {
    challengeCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_CHALLENGE_TOTAL)
                    .description("Consent challenge outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordConsentDecision(String decision) {
    consentCounters
        .computeIfAbsent(
            decision,
            ignored ->
                Counter.builder(METRIC_CONSENT_TOTAL)
                    .description("Consent decisions by the user")
                    .tags(Tags.of("decision", decision))
                    .register(meterRegistry))
        .increment();
  }

  public void recordError(String code) {
    errorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_ERROR_TOTAL)
                    .description("IdP API errors by code")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }
}
