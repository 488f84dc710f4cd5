package com.example.idp.service;

import com.example.idp.model.Challenge;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

/**
 * Keeps the challenge in the servlet session. The session's inactivity timeout is shortened to the
 * challenge's remaining lifetime so the session cookie does not outlive it.
 */
@Component
@RequiredArgsConstructor
public class HttpSessionChallengeStore implements ChallengeStore {

  private final Clock clock;

  @Override
  public Object load(HttpServletRequest request) {
    final HttpSession session = request.getSession(false);
    if (session == null) {
      return null;
    }
    return session.getAttribute(ATTRIBUTE_NAME);
  }

  @Override
  public void save(HttpServletRequest request, Challenge challenge) {
    final HttpSession session = request.getSession(true);
    session.setAttribute(ATTRIBUTE_NAME, challenge);
    final long remainingSeconds =
        Duration.between(Instant.now(clock), challenge.expires()).toSeconds();
    session.setMaxInactiveInterval((int) Math.max(1L, Math.min(remainingSeconds, Integer.MAX_VALUE)));
  }

  @Override
  public void delete(HttpServletRequest request) {
    final HttpSession session = request.getSession(false);
    if (session != null) {
      session.removeAttribute(ATTRIBUTE_NAME);
    }
  }

  @Override
  public Object take(HttpServletRequest request) {
    final HttpSession session = request.getSession(false);
    if (session == null) {
      return null;
    }
    synchronized (WebUtils.getSessionMutex(session)) {
      final Object stored = session.getAttribute(ATTRIBUTE_NAME);
      if (stored != null) {
        session.removeAttribute(ATTRIBUTE_NAME);
      }
      return stored;
    }
  }
}
