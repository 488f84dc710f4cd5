package com.example.idp.service;

import com.example.idp.model.Challenge;
import jakarta.servlet.http.HttpServletRequest;

/** Per-browser storage of the challenge awaiting a consent decision. */
public interface ChallengeStore {

  String ATTRIBUTE_NAME = "idp-challenge";

  /** Returns the raw stored value, or {@code null} when nothing is stored. */
  Object load(HttpServletRequest request);

  void save(HttpServletRequest request, Challenge challenge);

  void delete(HttpServletRequest request);

  /**
   * Removes and returns the stored value in one step, so only one of several concurrent callers
   * sees it. Returns {@code null} when nothing is stored.
   */
  Object take(HttpServletRequest request);
}
