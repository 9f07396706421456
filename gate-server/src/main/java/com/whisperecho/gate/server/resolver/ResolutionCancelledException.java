package com.whisperecho.gate.server.resolver;

/**
 * Resolution was abandoned because the caller was interrupted, typically on client disconnect.
 * <p>
 * Deliberately not a {@link Resolution}: a cancelled request has no outcome to report or cache.
 */
public class ResolutionCancelledException extends RuntimeException {

  /**
   * Instantiates a new resolution cancelled exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ResolutionCancelledException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
