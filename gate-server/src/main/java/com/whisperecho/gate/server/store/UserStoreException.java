package com.whisperecho.gate.server.store;

/**
 * The user store could not answer a lookup for infrastructure reasons.
 */
public class UserStoreException extends RuntimeException {

  /**
   * Instantiates a new user store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public UserStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
