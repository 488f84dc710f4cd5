package com.example.idp.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "idp.consent")
public record ConsentProperties(Duration responseTtl) {

  public ConsentProperties {
    responseTtl = responseTtl == null ? Duration.ofMinutes(5) : responseTtl;
  }
}
