/*
 * Where: IdP configuration binding
 * What: lifetime of cached keys and the interval of the expiry sweep
 * Why: key rotation cadence differs between authorization server deployments
 */
package com.example.idp.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "idp.key-cache")
@Validated
public record KeyCacheProperties(@NotNull Duration expiration, @NotNull Duration cleanupInterval) {

  @AssertTrue(message = "idp.key-cache.expiration must be positive")
  public boolean isExpirationPositive() {
    return isPositiveDuration(expiration);
  }

  @AssertTrue(message = "idp.key-cache.cleanup-interval must be positive")
  public boolean isCleanupIntervalPositive() {
    return isPositiveDuration(cleanupInterval);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null is reported by @NotNull
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
