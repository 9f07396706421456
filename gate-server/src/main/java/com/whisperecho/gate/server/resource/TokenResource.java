package com.whisperecho.gate.server.resource;

import com.whisperecho.gate.model.PrincipalView;
import com.whisperecho.gate.model.TokenRequest;
import com.whisperecho.gate.model.TokenResponse;
import com.whisperecho.gate.server.manager.TokenService;
import com.whisperecho.gate.server.store.UserStoreException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token verification and refresh endpoints.
 */
@Path("/auth/token")
public class TokenResource {
  private static final Logger log = LoggerFactory.getLogger(TokenResource.class);

  private final TokenService tokenService;

  /**
   * Instantiates a new token resource.
   *
   * @param tokenService the token service
   */
  public TokenResource(final TokenService tokenService) {
    this.tokenService = tokenService;
    log.info("TokenResource({})", tokenService);
  }

  /**
   * Verify a token.
   *
   * @param request the request
   * @return the principal the token belongs to
   */
  @POST
  @Path("/verify")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  public PrincipalView verify(final TokenRequest request) {
    log.trace("verify()");
    return translate(() -> tokenService.verify(requireToken(request)));
  }

  /**
   * Refresh a token.
   *
   * @param request the request
   * @return the new token
   */
  @POST
  @Path("/refresh")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  public TokenResponse refresh(final TokenRequest request) {
    log.trace("refresh()");
    return translate(() -> tokenService.refresh(requireToken(request)));
  }

  private static String requireToken(final TokenRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Missing request body");
    }
    return request.requireToken();
  }

  private static <T> T translate(final Supplier<T> call) {
    try {
      return call.get();
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (SecurityException e) {
      throw new WebApplicationException("Invalid or expired token", Response.Status.UNAUTHORIZED);
    } catch (UserStoreException e) {
      throw new WebApplicationException("Authentication service error",
          Response.Status.INTERNAL_SERVER_ERROR);
    } catch (IllegalStateException e) {
      throw new WebApplicationException("Authentication service unavailable",
          Response.Status.SERVICE_UNAVAILABLE);
    }
  }
}
