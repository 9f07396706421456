package com.whisperecho.gate.model;

/**
 * Machine-readable failure reasons returned by the gate, with the HTTP status each maps to.
 * <p>
 * This is the one table translating internal failure kinds to the external contract. Clients
 * use {@link #discardsCredential()} to decide whether a stored credential is dead: server-side
 * faults never invalidate a credential that may still be good.
 */
public enum FailureReason {

  NO_CREDENTIAL(401, true),
  INVALID_ELEVATED_CREDENTIAL(401, true),
  INVALID_BEARER_CREDENTIAL(401, true),
  PRINCIPAL_NOT_FOUND(401, true),
  INSUFFICIENT_ROLE(403, false),
  SERVER_FAULT(500, false),
  LOOKUP_TIMEOUT(503, false);

  private final int status;
  private final boolean discardsCredential;

  FailureReason(int status, boolean discardsCredential) {
    this.status = status;
    this.discardsCredential = discardsCredential;
  }

  /**
   * HTTP status code for this reason.
   *
   * @return the status code
   */
  public int status() {
    return status;
  }

  /**
   * Whether a client holding the credential that produced this failure should throw it away.
   *
   * @return true for credential failures, false for authorization and server faults
   */
  public boolean discardsCredential() {
    return discardsCredential;
  }

  /**
   * Whether the response must carry a {@code WWW-Authenticate} challenge.
   *
   * @return true for 401 reasons
   */
  public boolean isUnauthorized() {
    return status == 401;
  }
}
