package com.whisperecho.gate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model carrying a bearer token in a request body.
 * <p>
 * Used by: {@code POST /auth/token/verify} and {@code POST /auth/token/refresh}
 *
 * @param token the bearer token, without the {@code Bearer } prefix
 */
public record TokenRequest(@JsonProperty("token") String token) {

  /**
   * Returns the token, rejecting a missing value.
   *
   * @return the token
   * @throws IllegalArgumentException if the token is null or blank
   */
  public String requireToken() {
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("Missing required field: token");
    }
    return token.trim();
  }
}
