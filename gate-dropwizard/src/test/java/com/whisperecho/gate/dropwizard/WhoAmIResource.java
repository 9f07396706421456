package com.whisperecho.gate.dropwizard;

import com.whisperecho.gate.model.PrincipalView;
import com.whisperecho.gate.server.model.Capability;
import com.whisperecho.gate.server.model.GatePrincipal;
import com.whisperecho.gate.server.model.RequiresCapability;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Test-only endpoint for any signed-in user.
 * Demonstrates how consumers protect their own routes with {@code @Auth GatePrincipal}.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  @GET
  @RequiresCapability(Capability.USER)
  public PrincipalView whoAmI(@Auth GatePrincipal principal) {
    return principal.toView();
  }
}
