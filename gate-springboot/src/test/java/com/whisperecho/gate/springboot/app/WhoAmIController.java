package com.whisperecho.gate.springboot.app;

import com.whisperecho.gate.model.PrincipalView;
import com.whisperecho.gate.server.model.Capability;
import com.whisperecho.gate.server.model.GatePrincipal;
import com.whisperecho.gate.server.model.RequiresCapability;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Test-only endpoint for any signed-in user.
 * Demonstrates how consumers protect their own routes with {@code @AuthenticationPrincipal}.
 */
@RestController
public class WhoAmIController {

  @GetMapping("/api/whoami")
  @RequiresCapability(Capability.USER)
  public PrincipalView whoAmI(@AuthenticationPrincipal GatePrincipal principal) {
    return principal.toView();
  }
}
