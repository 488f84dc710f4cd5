package com.example.idp.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

// Connects before traffic is served; an exception here aborts startup.
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "idp.connect-on-startup", havingValue = "true", matchIfMissing = true)
public class IdentityProviderStartup implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(IdentityProviderStartup.class);

  private final IdentityProvider identityProvider;

  @Override
  public void run(ApplicationArguments args) {
    logger.info("connecting identity provider to authorization server");
    identityProvider.connect();
  }
}
