package com.example.idp.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "idp.key-cache.sweep-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class KeyCacheSweepWorker {

  private final KeyCache keyCache;

  @Scheduled(fixedDelayString = "${idp.key-cache.cleanup-interval}")
  public void sweep() {
    keyCache.evictExpired();
  }
}
