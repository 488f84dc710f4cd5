package com.example.idp.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.idp.model.KeyRole;
import com.example.idp.support.MutableClock;
import com.example.idp.support.TestKeys;
import java.security.Key;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.web.client.ResourceAccessException;

class KeyRefreshWorkerTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
  private final KeyCache cache = new KeyCache(clock, Duration.ofMinutes(10));
  private final KeyFetcher fetcher = mock(KeyFetcher.class);
  private final IdpMetrics metrics = mock(IdpMetrics.class);

  @BeforeEach
  void setUp() {
    new KeyRefreshWorker(cache, fetcher, new SyncTaskExecutor(), metrics).register();
  }

  @Test
  void evictedKeyIsReplacedWithFreshlyFetchedKey() {
    final Key first = TestKeys.rsaKeyPair().getPublic();
    final Key second = TestKeys.rsaKeyPair().getPublic();
    when(fetcher.fetch(KeyRole.VERIFICATION_KEY)).thenReturn(second);
    cache.set(KeyRole.VERIFICATION_KEY, first);
    assertThat(cache.get(KeyRole.VERIFICATION_KEY)).containsSame(first);

    clock.advance(Duration.ofMinutes(11));
    cache.evictExpired();

    assertThat(cache.get(KeyRole.VERIFICATION_KEY)).containsSame(second);
    verify(metrics).recordKeyRefresh("verification", KeyRefreshWorker.RESULT_SUCCESS);
  }

  @Test
  void refreshedKeyUsesDefaultTtl() {
    when(fetcher.fetch(KeyRole.CONSENT_SIGNING_KEY))
        .thenReturn(TestKeys.rsaKeyPair().getPrivate());
    cache.set(KeyRole.CONSENT_SIGNING_KEY, TestKeys.rsaKeyPair().getPrivate(), Duration.ofSeconds(1));

    clock.advance(Duration.ofSeconds(2));
    cache.evictExpired();
    clock.advance(Duration.ofMinutes(9));

    assertThat(cache.get(KeyRole.CONSENT_SIGNING_KEY)).isPresent();
  }

  @Test
  void fetchFailureLeavesRoleAbsentAndRecordsFailure() {
    when(fetcher.fetch(KeyRole.VERIFICATION_KEY))
        .thenThrow(new ResourceAccessException("connection refused"));
    cache.set(KeyRole.VERIFICATION_KEY, TestKeys.rsaKeyPair().getPublic());

    clock.advance(Duration.ofMinutes(11));
    cache.evictExpired();

    assertThat(cache.get(KeyRole.VERIFICATION_KEY)).isEmpty();
    verify(metrics).recordKeyRefresh("verification", KeyRefreshWorker.RESULT_FAILURE);
    assertThat(MDC.get("trace_id")).isNull();
  }

  @Test
  void keyFetchedAcrossFlushIsDiscarded() {
    when(fetcher.fetch(KeyRole.VERIFICATION_KEY))
        .thenAnswer(
            invocation -> {
              cache.flush();
              return TestKeys.rsaKeyPair().getPublic();
            });
    cache.set(KeyRole.VERIFICATION_KEY, TestKeys.rsaKeyPair().getPublic());

    clock.advance(Duration.ofMinutes(11));
    cache.evictExpired();

    assertThat(cache.get(KeyRole.VERIFICATION_KEY)).isEmpty();
    verify(metrics).recordKeyRefresh("verification", KeyRefreshWorker.RESULT_DISCARDED);
  }

  @Test
  void rejectedRefreshIsCounted() {
    final TaskExecutor rejecting = mock(TaskExecutor.class);
    doThrow(new TaskRejectedException("full")).when(rejecting).execute(any(Runnable.class));
    final KeyRefreshWorker worker = new KeyRefreshWorker(cache, fetcher, rejecting, metrics);

    worker.enqueue(KeyRole.CONSENT_SIGNING_KEY);

    verify(metrics).recordKeyRefresh("consent", KeyRefreshWorker.RESULT_REJECTED);
  }
}
