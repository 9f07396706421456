package com.whisperecho.gate.server.resolver;

import com.whisperecho.gate.server.model.GatePrincipal;
import java.util.Objects;
import java.util.Optional;

/**
 * Atomic outcome of identity resolution: a principal, or an error with a loggable detail.
 *
 * @param principal the resolved principal, null on failure
 * @param error     the failure, null on success
 * @param detail    diagnostic for logs and messages, never credential material
 */
public record Resolution(GatePrincipal principal, ResolutionError error, String detail) {

  public Resolution {
    if ((principal == null) == (error == null)) {
      throw new IllegalArgumentException("Exactly one of principal or error must be set");
    }
  }

  public static Resolution resolved(GatePrincipal principal) {
    return new Resolution(Objects.requireNonNull(principal, "principal"), null, null);
  }

  public static Resolution failed(ResolutionError error, String detail) {
    return new Resolution(null, Objects.requireNonNull(error, "error"), detail);
  }

  public boolean isResolved() {
    return principal != null;
  }

  public Optional<GatePrincipal> principalIfResolved() {
    return Optional.ofNullable(principal);
  }

  @Override
  public String toString() {
    return isResolved()
        ? "Resolution{RESOLVED, principal=" + principal.id() + ", role=" + principal.role() + "}"
        : "Resolution{FAILED, error=" + error + ", detail=" + detail + "}";
  }
}
