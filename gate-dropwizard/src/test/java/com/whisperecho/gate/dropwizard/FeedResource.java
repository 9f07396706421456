package com.whisperecho.gate.dropwizard;

import com.whisperecho.gate.dropwizard.auth.GateAuthFilter;
import com.whisperecho.gate.server.model.Capability;
import com.whisperecho.gate.server.model.RequestIdentity;
import com.whisperecho.gate.server.model.RequiresCapability;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

/**
 * Test-only public endpoint that reports who the gate decided the caller is.
 */
@Path("/api/feed")
@Produces(MediaType.APPLICATION_JSON)
public class FeedResource {

  @GET
  @RequiresCapability(Capability.ANONYMOUS)
  public Map<String, String> feed(@Context ContainerRequestContext requestContext) {
    RequestIdentity identity = GateAuthFilter.identityOf(requestContext)
        .orElseThrow(() -> new IllegalStateException("Gate did not run"));
    return identity.isAnonymous()
        ? Map.of("anonymous", "true", "sessionId", identity.sessionIdentifier().value())
        : Map.of("anonymous", "false", "principalId", identity.principal().id());
  }
}
