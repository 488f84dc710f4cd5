package com.example.idp.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "idp.basic-auth")
@Validated
public record BasicAuthProperties(@NotBlank String htpasswd, String realm) {

  public BasicAuthProperties {
    realm = realm == null || realm.isBlank() ? "idp" : realm;
  }
}
