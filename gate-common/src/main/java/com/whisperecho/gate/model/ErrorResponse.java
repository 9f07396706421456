package com.whisperecho.gate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for every response the gate rejects.
 * <p>
 * Used by: any gated route when authentication or authorization fails.
 *
 * @param reason  machine-readable reason, one of the {@link FailureReason} names
 * @param message human-readable description, never containing credential material
 */
public record ErrorResponse(@JsonProperty("reason") String reason,
                            @JsonProperty("message") String message) {

  /**
   * Instantiates an error response for a failure reason.
   *
   * @param reason  the failure reason
   * @param message the message
   */
  public ErrorResponse(FailureReason reason, String message) {
    this(reason.name(), message);
  }

  /**
   * Parses {@link #reason()} back into a {@link FailureReason}.
   *
   * @return the reason, or null if the server sent one this client does not know
   */
  public FailureReason failureReason() {
    if (reason == null) {
      return null;
    }
    try {
      return FailureReason.valueOf(reason);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
