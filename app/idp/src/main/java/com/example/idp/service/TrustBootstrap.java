/*
 * Where: IdP service layer
 * What: establishes an authenticated transport to the authorization server
 * Why: key retrieval requires an access token obtained with the client credentials grant
 */
package com.example.idp.service;

import com.example.idp.config.IdpHttpProperties;
import com.example.idp.config.IdpProperties;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.converter.FormHttpMessageConverter;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.security.oauth2.client.AuthorizedClientServiceOAuth2AuthorizedClientManager;
import org.springframework.security.oauth2.client.InMemoryOAuth2AuthorizedClientService;
import org.springframework.security.oauth2.client.OAuth2AuthorizeRequest;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClient;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClientManager;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClientProvider;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClientProviderBuilder;
import org.springframework.security.oauth2.client.endpoint.RestClientClientCredentialsTokenResponseClient;
import org.springframework.security.oauth2.client.http.OAuth2ErrorResponseErrorHandler;
import org.springframework.security.oauth2.client.registration.ClientRegistration;
import org.springframework.security.oauth2.client.registration.ClientRegistrationRepository;
import org.springframework.security.oauth2.client.registration.InMemoryClientRegistrationRepository;
import org.springframework.security.oauth2.core.AuthorizationGrantType;
import org.springframework.security.oauth2.core.ClientAuthenticationMethod;
import org.springframework.security.oauth2.core.http.converter.OAuth2AccessTokenResponseHttpMessageConverter;
import org.springframework.web.client.RestClient;

public class TrustBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(TrustBootstrap.class);

  static final String REGISTRATION_ID = "authorization-server";

  private final IdpProperties properties;
  private final IdpHttpProperties httpProperties;
  private final RestClient.Builder restClientBuilder;
  private final Clock clock;

  /**
   * @param restClientBuilder builder already carrying the request factory for the authorization
   *     server; it is cloned, never mutated
   */
  public TrustBootstrap(
      IdpProperties properties,
      IdpHttpProperties httpProperties,
      RestClient.Builder restClientBuilder,
      Clock clock) {
    this.properties = properties;
    this.httpProperties = httpProperties;
    this.restClientBuilder = restClientBuilder;
    this.clock = clock;
  }

  /**
   * Obtains a first access token and returns a transport that attaches a valid token to every
   * request, re-acquiring it when it expires.
   *
   * @throws org.springframework.security.oauth2.core.OAuth2AuthorizationException when the token
   *     endpoint rejects the credentials or cannot be reached
   */
  public TrustSession connect() {
    if (httpProperties.insecureSkipVerify()) {
      logger.warn(
          "connecting to authorization server without certificate verification address={}",
          properties.authServerAddress());
    }
    final ClientRegistration registration = clientRegistration();
    final OAuth2AuthorizedClientManager manager = authorizedClientManager(registration);
    final OAuth2AuthorizeRequest authorizeRequest =
        OAuth2AuthorizeRequest.withClientRegistrationId(REGISTRATION_ID)
            .principal(properties.clientId())
            .build();

    final OAuth2AuthorizedClient prefetched = manager.authorize(authorizeRequest);
    if (prefetched == null) {
      throw new IllegalStateException("authorization server did not issue an access token");
    }
    logger.info(
        "authorization server token acquired clientId={} scopes={} expiresAt={}",
        properties.clientId(),
        prefetched.getAccessToken().getScopes(),
        prefetched.getAccessToken().getExpiresAt());

    final RestClient transport =
        restClientBuilder
            .clone()
            .baseUrl(properties.authServerAddress())
            .requestInterceptor(bearerToken(manager, authorizeRequest))
            .build();
    return new TrustSession(transport, Instant.now(clock));
  }

  ClientRegistration clientRegistration() {
    return ClientRegistration.withRegistrationId(REGISTRATION_ID)
        .clientId(properties.clientId())
        .clientSecret(properties.clientSecret())
        .clientAuthenticationMethod(ClientAuthenticationMethod.CLIENT_SECRET_BASIC)
        .authorizationGrantType(AuthorizationGrantType.CLIENT_CREDENTIALS)
        .scope(properties.scopes())
        .tokenUri(properties.tokenUri())
        .build();
  }

  private OAuth2AuthorizedClientManager authorizedClientManager(ClientRegistration registration) {
    final ClientRegistrationRepository registrations =
        new InMemoryClientRegistrationRepository(registration);
    final RestClientClientCredentialsTokenResponseClient tokenResponseClient =
        new RestClientClientCredentialsTokenResponseClient();
    tokenResponseClient.setRestClient(tokenRestClient());

    final OAuth2AuthorizedClientProvider provider =
        OAuth2AuthorizedClientProviderBuilder.builder()
            .clientCredentials(
                clientCredentials ->
                    clientCredentials.accessTokenResponseClient(tokenResponseClient).clock(clock))
            .build();
    final AuthorizedClientServiceOAuth2AuthorizedClientManager manager =
        new AuthorizedClientServiceOAuth2AuthorizedClientManager(
            registrations, new InMemoryOAuth2AuthorizedClientService(registrations));
    manager.setAuthorizedClientProvider(provider);
    return manager;
  }

  private RestClient tokenRestClient() {
    return restClientBuilder
        .clone()
        .messageConverters(
            converters -> {
              converters.clear();
              converters.add(new FormHttpMessageConverter());
              converters.add(new OAuth2AccessTokenResponseHttpMessageConverter());
            })
        .defaultStatusHandler(new OAuth2ErrorResponseErrorHandler())
        .build();
  }

  private ClientHttpRequestInterceptor bearerToken(
      OAuth2AuthorizedClientManager manager, OAuth2AuthorizeRequest authorizeRequest) {
    return (request, body, execution) -> {
      final OAuth2AuthorizedClient client = manager.authorize(authorizeRequest);
      if (client == null) {
        throw new IllegalStateException("authorization server did not issue an access token");
      }
      request.getHeaders().setBearerAuth(client.getAccessToken().getTokenValue());
      return execution.execute(request, body);
    };
  }
}
