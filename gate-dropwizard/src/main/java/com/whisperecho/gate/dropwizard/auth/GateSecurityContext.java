package com.whisperecho.gate.dropwizard.auth;

import com.whisperecho.gate.server.model.Capability;
import com.whisperecho.gate.server.model.GatePrincipal;
import com.whisperecho.gate.server.model.RequestIdentity;
import com.whisperecho.gate.server.model.Role;
import jakarta.ws.rs.core.SecurityContext;

/**
 * {@link SecurityContext} exposing an admitted request's identity to Jersey and to
 * {@code @Auth GatePrincipal} parameters.
 */
public class GateSecurityContext implements SecurityContext {

  /**
   * Authentication scheme reported for gate-authenticated requests.
   */
  public static final String SCHEME = "Gate";

  private final RequestIdentity identity;
  private final boolean secure;

  /**
   * Instantiates a new gate security context.
   *
   * @param identity the admitted identity
   * @param secure   whether the request arrived over a secure channel
   */
  public GateSecurityContext(RequestIdentity identity, boolean secure) {
    this.identity = identity;
    this.secure = secure;
  }

  public RequestIdentity identity() {
    return identity;
  }

  @Override
  public GatePrincipal getUserPrincipal() {
    return identity.principal();
  }

  @Override
  public boolean isUserInRole(String role) {
    if (identity.isAnonymous()) {
      return false;
    }
    try {
      return identity.capability().satisfies(Capability.of(Role.fromWire(role)));
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  @Override
  public boolean isSecure() {
    return secure;
  }

  @Override
  public String getAuthenticationScheme() {
    return identity.isAnonymous() ? null : SCHEME;
  }
}
