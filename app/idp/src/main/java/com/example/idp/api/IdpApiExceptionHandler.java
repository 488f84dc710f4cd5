package com.example.idp.api;

import com.example.idp.service.IdpException;
import com.example.idp.service.IdpMetrics;
import com.example.idp.service.InvalidChallengeTokenException;
import com.example.idp.service.KeyFetchException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.core.OAuth2AuthorizationException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.client.RestClientException;

@RestControllerAdvice
@RequiredArgsConstructor
public class IdpApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(IdpApiExceptionHandler.class);

  private final IdpMetrics idpMetrics;

  @ExceptionHandler(IdpException.class)
  public ResponseEntity<ApiErrorResponse> handleIdp(IdpException ex) {
    final HttpStatus status =
        switch (ex.reason()) {
          case BAD_REQUEST, BAD_CHALLENGE_COOKIE -> HttpStatus.BAD_REQUEST;
          case CHALLENGE_EXPIRED -> HttpStatus.GONE;
          case NO_KEY, BAD_KEY -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    if (status.is5xxServerError()) {
      logger.warn("consent request failed reason={} message={}", ex.reason(), ex.getMessage());
    }
    return respond(status, ex.reason().name(), ex.getMessage());
  }

  @ExceptionHandler(InvalidChallengeTokenException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidChallengeToken(
      InvalidChallengeTokenException ex) {
    logger.info("challenge token rejected: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "INVALID_CHALLENGE_TOKEN", ex.getMessage());
  }

  @ExceptionHandler(KeyFetchException.class)
  public ResponseEntity<ApiErrorResponse> handleKeyFetch(KeyFetchException ex) {
    logger.warn("key fetch failed: {}", ex.getMessage(), ex);
    return respond(HttpStatus.BAD_GATEWAY, "KEY_FETCH_FAILED", ex.getMessage());
  }

  @ExceptionHandler(OAuth2AuthorizationException.class)
  public ResponseEntity<ApiErrorResponse> handleAuthorization(OAuth2AuthorizationException ex) {
    logger.warn("authorization server rejected client: {}", ex.getMessage(), ex);
    return respond(
        HttpStatus.BAD_GATEWAY, "AUTH_SERVER_UNAUTHORIZED", "authorization server rejected client");
  }

  @ExceptionHandler(RestClientException.class)
  public ResponseEntity<ApiErrorResponse> handleTransport(RestClientException ex) {
    logger.warn("authorization server request failed: {}", ex.getMessage(), ex);
    return respond(
        HttpStatus.BAD_GATEWAY, "AUTH_SERVER_UNAVAILABLE", "authorization server request failed");
  }

  private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message) {
    idpMetrics.recordError(code);
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }
}
