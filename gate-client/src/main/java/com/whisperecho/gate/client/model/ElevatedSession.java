package com.whisperecho.gate.client.model;

import java.time.Instant;

/**
 * An operator's elevated-access session. Immutable; replaced or cleared as a whole.
 *
 * @param username  operator username
 * @param token     encoded elevated-access token sent on every request
 * @param loginTime when the session was established
 */
public record ElevatedSession(String username, String token, Instant loginTime) {

  @Override
  public String toString() {
    return "ElevatedSession[username=" + username + ", loginTime=" + loginTime + "]";
  }
}
