package com.example.idp.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.www.BasicAuthenticationEntryPoint;

@Configuration
@EnableConfigurationProperties(BasicAuthProperties.class)
public class IdpSecurityConfig {
  private final boolean csrfEnabled;

  public IdpSecurityConfig(@Value("${app.security.csrf-enabled:true}") boolean csrfEnabled) {
    this.csrfEnabled = csrfEnabled;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, BasicAuthenticationEntryPoint authenticationEntryPoint) throws Exception {
    if (csrfEnabled) {
      http.csrf(Customizer.withDefaults());
    } else {
      http.csrf(csrf -> csrf.disable());
    }
    http.sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.IF_REQUIRED))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers("/consent", "/consent/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .httpBasic(basic -> basic.authenticationEntryPoint(authenticationEntryPoint))
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint));

    return http.build();
  }

  @Bean
  BasicAuthenticationEntryPoint basicAuthenticationEntryPoint(BasicAuthProperties properties) {
    final BasicAuthenticationEntryPoint entryPoint = new BasicAuthenticationEntryPoint();
    entryPoint.setRealmName(properties.realm());
    return entryPoint;
  }

  @Bean
  PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }
}
