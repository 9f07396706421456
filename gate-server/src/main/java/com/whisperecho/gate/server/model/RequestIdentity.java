package com.whisperecho.gate.server.model;

import java.util.Optional;

/**
 * Identity attached to an admitted request: either an authenticated principal or the anonymous
 * marker with its session identifier. Never both, never neither.
 *
 * @param principal         the principal, null when anonymous
 * @param sessionIdentifier the session identifier, null when authenticated
 */
public record RequestIdentity(GatePrincipal principal, SessionIdentifier sessionIdentifier) {

  public RequestIdentity {
    if ((principal == null) == (sessionIdentifier == null)) {
      throw new IllegalArgumentException("Exactly one of principal or sessionIdentifier must be set");
    }
  }

  public static RequestIdentity authenticated(GatePrincipal principal) {
    return new RequestIdentity(principal, null);
  }

  public static RequestIdentity anonymous(SessionIdentifier sessionIdentifier) {
    return new RequestIdentity(null, sessionIdentifier);
  }

  public boolean isAnonymous() {
    return principal == null;
  }

  public Optional<GatePrincipal> principalIfPresent() {
    return Optional.ofNullable(principal);
  }

  public Capability capability() {
    return isAnonymous() ? Capability.ANONYMOUS : principal.capability();
  }
}
