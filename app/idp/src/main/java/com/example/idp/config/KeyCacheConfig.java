package com.example.idp.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties({KeyCacheProperties.class, ConsentProperties.class})
public class KeyCacheConfig {

  // one refresh at a time; both roles fit in the queue
  @Bean
  ThreadPoolTaskExecutor keyRefreshExecutor() {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(8);
    executor.setThreadNamePrefix("key-refresh-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }
}
