package com.whisperecho.gate.client.exceptions;

import com.whisperecho.gate.model.FailureReason;

/**
 * A request to a gated server failed.
 */
public class GateAccessException extends RuntimeException {

  private final FailureReason reason;
  private final int status;

  /**
   * Instantiates a new gate access exception for a transport failure.
   *
   * @param message the message
   * @param cause   the cause
   */
  public GateAccessException(final String message, final Throwable cause) {
    this(message, cause, null, 0);
  }

  /**
   * Instantiates a new gate access exception for a rejected request.
   *
   * @param message the message
   * @param cause   the cause
   * @param reason  the reason the server gave, null if none or unknown
   * @param status  the HTTP status, 0 if no response was received
   */
  public GateAccessException(final String message, final Throwable cause,
                             final FailureReason reason, final int status) {
    super(message, cause);
    this.reason = reason;
    this.status = status;
  }

  /**
   * The reason the server gave.
   *
   * @return the reason, or null
   */
  public FailureReason reason() {
    return reason;
  }

  public int status() {
    return status;
  }
}
