package com.whisperecho.gate.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.whisperecho.gate.server.auth.BearerTokenManager;
import com.whisperecho.gate.server.auth.ElevatedAccessVerifier;

/**
 * Health check that verifies the gate has an administrator credential and a signing secret
 * of adequate length.
 */
public class GateHealthCheck extends HealthCheck {

  static final int MIN_SECRET_BYTES = 32;

  private final BearerTokenManager bearerTokenManager;
  private final ElevatedAccessVerifier elevatedAccessVerifier;

  /**
   * Instantiates a new gate health check.
   *
   * @param bearerTokenManager     the bearer token manager
   * @param elevatedAccessVerifier the elevated access verifier
   */
  public GateHealthCheck(BearerTokenManager bearerTokenManager,
                         ElevatedAccessVerifier elevatedAccessVerifier) {
    this.bearerTokenManager = bearerTokenManager;
    this.elevatedAccessVerifier = elevatedAccessVerifier;
  }

  @Override
  protected Result check() {
    if (elevatedAccessVerifier == null || elevatedAccessVerifier.adminPrincipal() == null) {
      return Result.unhealthy("Administrator credential is not provisioned");
    }
    if (bearerTokenManager.secretLength() < MIN_SECRET_BYTES) {
      return Result.unhealthy("Signing secret is %d bytes, need at least %d",
          bearerTokenManager.secretLength(), MIN_SECRET_BYTES);
    }
    return Result.healthy("issuer=%s secretLength=%d", bearerTokenManager.issuer(),
        bearerTokenManager.secretLength());
  }
}
