/*
 * Where: IdP configuration binding
 * What: client credentials and address of the authorization server
 * Why: credentials come from the environment per deployment
 */
package com.example.idp.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "idp")
@Validated
public record IdpProperties(
    @NotBlank String clientId,
    @NotBlank String clientSecret,
    @NotBlank String authServerAddress,
    List<String> scopes,
    Boolean connectOnStartup) {

  public static final List<String> DEFAULT_SCOPES = List.of("core", "hydra.keys.get");

  public IdpProperties {
    scopes = scopes == null || scopes.isEmpty() ? DEFAULT_SCOPES : List.copyOf(scopes);
    connectOnStartup = connectOnStartup == null ? Boolean.TRUE : connectOnStartup;
    if (authServerAddress != null && authServerAddress.endsWith("/")) {
      authServerAddress = authServerAddress.substring(0, authServerAddress.length() - 1);
    }
  }

  public String tokenUri() {
    return authServerAddress + "/oauth2/token";
  }
}
