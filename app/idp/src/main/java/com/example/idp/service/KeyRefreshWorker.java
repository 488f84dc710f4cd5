/*
 * Where: IdP service layer
 * What: re-fetches a key once after the cache evicts it
 * Why: the sweeper must not block on network I/O while keys are refreshed
 */
package com.example.idp.service;

import com.example.common.TraceIds;
import com.example.idp.model.KeyRole;
import jakarta.annotation.PostConstruct;
import java.security.Key;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Makes exactly one fetch attempt per evicted role. On failure the role stays absent and the
 * failure is logged and counted; there is no retry. A key fetched across a cache flush (the
 * provider was closed) is dropped.
 */
@Component
public class KeyRefreshWorker {

  private static final Logger logger = LoggerFactory.getLogger(KeyRefreshWorker.class);

  static final String RESULT_SUCCESS = "success";
  static final String RESULT_FAILURE = "failure";
  static final String RESULT_REJECTED = "rejected";
  static final String RESULT_DISCARDED = "discarded";

  private final KeyCache keyCache;
  private final KeyFetcher keyFetcher;
  private final TaskExecutor executor;
  private final IdpMetrics metrics;

  public KeyRefreshWorker(
      KeyCache keyCache,
      KeyFetcher keyFetcher,
      @Qualifier("keyRefreshExecutor") TaskExecutor executor,
      IdpMetrics metrics) {
    this.keyCache = keyCache;
    this.keyFetcher = keyFetcher;
    this.executor = executor;
    this.metrics = metrics;
  }

  @PostConstruct
  public void register() {
    keyCache.onEvicted(this::enqueue);
  }

  public void enqueue(KeyRole role) {
    try {
      executor.execute(() -> refresh(role));
    } catch (TaskRejectedException ex) {
      logger.warn("key refresh rejected role={}", role.value(), ex);
      metrics.recordKeyRefresh(role.value(), RESULT_REJECTED);
    }
  }

  void refresh(KeyRole role) {
    MDC.put("trace_id", TraceIds.newTraceId("key-refresh"));
    try {
      final long generation = keyCache.generation();
      final Key key = keyFetcher.fetch(role);
      if (!keyCache.setIfGeneration(role, key, generation)) {
        metrics.recordKeyRefresh(role.value(), RESULT_DISCARDED);
        logger.info("key refresh discarded role={}; cache was flushed meanwhile", role.value());
        return;
      }
      metrics.recordKeyRefresh(role.value(), RESULT_SUCCESS);
      logger.info("key refreshed role={} ttl={}", role.value(), keyCache.defaultTtl());
    } catch (RuntimeException ex) {
      metrics.recordKeyRefresh(role.value(), RESULT_FAILURE);
      logger.warn("key refresh failed role={}; key stays absent", role.value(), ex);
    } finally {
      MDC.remove("trace_id");
    }
  }
}
