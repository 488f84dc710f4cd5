package com.example.idp.api;

import com.example.idp.api.response.ChallengeResponse;
import com.example.idp.service.ConsentService;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.security.Principal;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/consent")
@RequiredArgsConstructor
public class ConsentController {

  private final ConsentService consentService;

  /** Accepts the {@code challenge} token for the authenticated user and stores it. */
  @GetMapping
  public ChallengeResponse begin(HttpServletRequest request, Principal principal) {
    return ChallengeResponse.from(consentService.beginConsent(request, principal.getName()));
  }

  @GetMapping("/current")
  public ChallengeResponse current(HttpServletRequest request) {
    return ChallengeResponse.from(consentService.currentChallenge(request));
  }

  @PostMapping("/accept")
  public ResponseEntity<Void> accept(HttpServletRequest request) {
    return redirect(consentService.grantAccess(request));
  }

  @PostMapping("/refuse")
  public ResponseEntity<Void> refuse(HttpServletRequest request) {
    return redirect(consentService.refuseAccess(request));
  }

  private ResponseEntity<Void> redirect(URI location) {
    return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
  }
}
