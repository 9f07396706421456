package com.whisperecho.gate.springboot.health;

import com.whisperecho.gate.server.auth.BearerTokenManager;
import com.whisperecho.gate.server.auth.ElevatedAccessVerifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("gate")
public class GateHealthIndicator implements HealthIndicator {

  static final int MIN_SECRET_BYTES = 32;

  private final BearerTokenManager bearerTokenManager;
  private final ElevatedAccessVerifier elevatedAccessVerifier;

  public GateHealthIndicator(BearerTokenManager bearerTokenManager,
                             ElevatedAccessVerifier elevatedAccessVerifier) {
    this.bearerTokenManager = bearerTokenManager;
    this.elevatedAccessVerifier = elevatedAccessVerifier;
  }

  @Override
  public Health health() {
    if (elevatedAccessVerifier.adminPrincipal() == null) {
      return Health.down().withDetail("reason", "Administrator credential is not provisioned").build();
    }
    if (bearerTokenManager.secretLength() < MIN_SECRET_BYTES) {
      return Health.down()
          .withDetail("reason", "Signing secret is shorter than " + MIN_SECRET_BYTES + " bytes")
          .withDetail("secretLength", bearerTokenManager.secretLength())
          .build();
    }
    return Health.up()
        .withDetail("issuer", bearerTokenManager.issuer())
        .withDetail("secretLength", bearerTokenManager.secretLength())
        .build();
  }
}
