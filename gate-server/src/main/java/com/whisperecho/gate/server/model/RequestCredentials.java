package com.whisperecho.gate.server.model;

import static com.whisperecho.gate.model.GateHeaders.AUTHORIZATION;
import static com.whisperecho.gate.model.GateHeaders.BEARER_PREFIX;
import static com.whisperecho.gate.model.GateHeaders.ELEVATED_MODE;
import static com.whisperecho.gate.model.GateHeaders.ELEVATED_MODE_ENABLED;
import static com.whisperecho.gate.model.GateHeaders.ELEVATED_TOKEN;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Candidate credentials extracted from a request's headers, before any verification.
 *
 * @param authorization the raw {@code Authorization} header
 * @param elevatedMode  the raw elevated-mode marker header
 * @param elevatedToken the raw elevated-access token header
 */
public record RequestCredentials(String authorization, String elevatedMode, String elevatedToken) {

  private static final RequestCredentials NONE = new RequestCredentials(null, null, null);

  /**
   * Extracts the candidate headers through a framework-specific, case-insensitive lookup.
   *
   * @param headerLookup returns the first value of a header, or null
   * @return the candidates
   */
  public static RequestCredentials fromHeaders(UnaryOperator<String> headerLookup) {
    return new RequestCredentials(
        headerLookup.apply(AUTHORIZATION),
        headerLookup.apply(ELEVATED_MODE),
        headerLookup.apply(ELEVATED_TOKEN));
  }

  public static RequestCredentials none() {
    return NONE;
  }

  public static RequestCredentials bearer(String token) {
    return new RequestCredentials(BEARER_PREFIX + token, null, null);
  }

  public static RequestCredentials elevated(String token) {
    return new RequestCredentials(null, ELEVATED_MODE_ENABLED, token);
  }

  /**
   * Whether the elevated path applies: the marker is {@code true} and a token is present.
   *
   * @return true when both elevated headers are usable
   */
  public boolean elevatedRequested() {
    return elevatedMode != null
        && ELEVATED_MODE_ENABLED.equalsIgnoreCase(elevatedMode.trim())
        && elevatedToken != null
        && !elevatedToken.isBlank();
  }

  /**
   * Whether any {@code Authorization} value was presented, usable or not.
   *
   * @return true when the header is non-blank
   */
  public boolean bearerPresented() {
    return authorization != null && !authorization.isBlank();
  }

  /**
   * The bearer token when the header is a well-formed {@code Bearer <token>} value.
   *
   * @return the token, or empty for a missing header, another scheme, or an empty token
   */
  public Optional<String> bearerToken() {
    if (!bearerPresented()) {
      return Optional.empty();
    }
    String value = authorization.trim();
    if (!value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return Optional.empty();
    }
    String token = value.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }

  @Override
  public String toString() {
    return "RequestCredentials[bearerPresented=" + bearerPresented()
        + ", elevatedRequested=" + elevatedRequested() + "]";
  }
}
