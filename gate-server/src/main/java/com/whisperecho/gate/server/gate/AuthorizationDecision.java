package com.whisperecho.gate.server.gate;

import com.whisperecho.gate.model.FailureReason;
import com.whisperecho.gate.server.model.RequestIdentity;
import java.util.Objects;

/**
 * Outcome of gating one request: proceed with an identity, or stop with a reason.
 */
public sealed interface AuthorizationDecision {

  boolean isAllowed();

  /**
   * The request proceeds to its handler with this identity attached.
   *
   * @param identity the identity downstream handlers read
   */
  record Allow(RequestIdentity identity) implements AuthorizationDecision {
    public Allow {
      Objects.requireNonNull(identity, "identity");
    }

    @Override
    public boolean isAllowed() {
      return true;
    }
  }

  /**
   * The request is rejected before reaching its handler.
   *
   * @param reason  failure reason, which fixes the status code
   * @param message human-readable message, never credential material
   */
  record Deny(FailureReason reason, String message) implements AuthorizationDecision {
    public Deny {
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public boolean isAllowed() {
      return false;
    }
  }
}
