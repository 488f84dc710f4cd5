package com.example.idp.config;

import com.example.idp.service.TrustBootstrap;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({IdpProperties.class, IdpHttpProperties.class})
public class AuthServerClientConfig {

  @Bean
  AuthServerRequestFactory authServerRequestFactory(
      IdpHttpProperties properties, SslBundles sslBundles) {
    return AuthServerRequestFactory.create(properties, sslBundles);
  }

  @Bean
  TrustBootstrap trustBootstrap(
      IdpProperties properties,
      IdpHttpProperties httpProperties,
      RestClient.Builder restClientBuilder,
      AuthServerRequestFactory authServerRequestFactory,
      Clock clock) {
    return new TrustBootstrap(
        properties,
        httpProperties,
        restClientBuilder.clone().requestFactory(authServerRequestFactory),
        clock);
  }
}
