package com.whisperecho.gate.server.resolver;

/**
 * Why a request's credentials did not resolve to a principal.
 */
public enum ResolutionError {
  /** No usable elevated or bearer credential was presented. */
  NO_CREDENTIAL,
  /** The elevated token could not be decoded or was outside its maximum age. */
  INVALID_ELEVATED_CREDENTIAL,
  /** The bearer token was malformed, badly signed or expired. */
  INVALID_BEARER_CREDENTIAL,
  /** The bearer token was valid but its user no longer exists. */
  PRINCIPAL_NOT_FOUND,
  /** The user store failed. Not a statement about the credential. */
  LOOKUP_FAILED,
  /** The user store did not answer in time. Not a statement about the credential. */
  LOOKUP_TIMED_OUT;

  /**
   * Whether this error is an infrastructure fault rather than a credential problem.
   *
   * @return true for store failures and timeouts
   */
  public boolean isServerFault() {
    return this == LOOKUP_FAILED || this == LOOKUP_TIMED_OUT;
  }
}
