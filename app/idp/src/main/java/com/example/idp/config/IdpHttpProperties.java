/*
 * Where: IdP configuration binding
 * What: timeouts and certificate trust of the transport to the authorization server
 * Why: trust for a self-signed counterpart is an explicit per-deployment setting
 */
package com.example.idp.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "idp.http")
@Validated
public record IdpHttpProperties(
    Duration connectTimeout, Duration readTimeout, String sslBundle, boolean insecureSkipVerify) {

  public IdpHttpProperties {
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    sslBundle = sslBundle == null || sslBundle.isBlank() ? null : sslBundle;
  }

  @AssertTrue(message = "idp.http.connect-timeout and idp.http.read-timeout must be positive")
  public boolean isTimeoutsPositive() {
    return isPositive(connectTimeout) && isPositive(readTimeout);
  }

  @AssertTrue(message = "idp.http.ssl-bundle and idp.http.insecure-skip-verify are exclusive")
  public boolean isTrustSettingUnambiguous() {
    return sslBundle == null || !insecureSkipVerify;
  }

  private boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
