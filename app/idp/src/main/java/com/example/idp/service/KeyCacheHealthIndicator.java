package com.example.idp.service;

import com.example.idp.model.KeyRole;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Reports DOWN while either key is missing, e.g. after a failed refresh. */
@Component
@RequiredArgsConstructor
public class KeyCacheHealthIndicator implements HealthIndicator {

  private final IdentityProvider identityProvider;
  private final KeyCache keyCache;

  @Override
  public Health health() {
    boolean allCached = true;
    final Health.Builder builder = Health.unknown();
    builder.withDetail("connected", identityProvider.isConnected());
    for (KeyRole role : KeyRole.values()) {
      final boolean cached = keyCache.get(role).isPresent();
      allCached &= cached;
      builder.withDetail(role.value(), cached ? "cached" : "missing");
    }
    if (allCached && identityProvider.isConnected()) {
      return builder.up().build();
    }
    return builder.down().build();
  }
}
