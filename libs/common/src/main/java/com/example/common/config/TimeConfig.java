/*
 * Where: shared configuration for every app module
 * What: exposes the UTC Clock used for key expiry and challenge expiry checks
 * Why: tests replace it with a fixed or mutable clock
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
