/*
 * Where: IdP API layer tests
 * What: error codes, HTTP statuses and error metrics produced by the exception handler
 * Why: clients and alerts branch on these codes
 */
package com.example.idp.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.example.idp.service.IdpException;
import com.example.idp.service.IdpMetrics;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.core.OAuth2AuthorizationException;
import org.springframework.security.oauth2.core.OAuth2Error;

class IdpApiExceptionHandlerTest {

  @Test
  void mapsEveryReasonToStatusAndRecordsMetric() {
    final IdpMetrics metrics = Mockito.mock(IdpMetrics.class);
    final IdpApiExceptionHandler handler = new IdpApiExceptionHandler(metrics);

    assertThat(status(handler, IdpException.Reason.BAD_REQUEST)).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(status(handler, IdpException.Reason.BAD_CHALLENGE_COOKIE))
        .isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(status(handler, IdpException.Reason.CHALLENGE_EXPIRED)).isEqualTo(HttpStatus.GONE);
    assertThat(status(handler, IdpException.Reason.NO_KEY))
        .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(status(handler, IdpException.Reason.BAD_KEY))
        .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);

    verify(metrics).recordError("CHALLENGE_EXPIRED");
    verify(metrics).recordError("BAD_KEY");
  }

  @Test
  void authorizationFailureHidesServerDetails() {
    final IdpMetrics metrics = Mockito.mock(IdpMetrics.class);
    final IdpApiExceptionHandler handler = new IdpApiExceptionHandler(metrics);

    final ResponseEntity<ApiErrorResponse> response =
        handler.handleAuthorization(
            new OAuth2AuthorizationException(new OAuth2Error("invalid_client", "secret=abc", null)));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().message()).doesNotContain("secret");
    verify(metrics).recordError("AUTH_SERVER_UNAUTHORIZED");
  }

  private HttpStatus status(IdpApiExceptionHandler handler, IdpException.Reason reason) {
    return HttpStatus.valueOf(
        handler.handleIdp(new IdpException(reason, "failure")).getStatusCode().value());
  }
}
