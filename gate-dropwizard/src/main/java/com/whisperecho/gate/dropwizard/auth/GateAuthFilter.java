package com.whisperecho.gate.dropwizard.auth;

import com.whisperecho.gate.model.ErrorResponse;
import com.whisperecho.gate.model.GateHeaders;
import com.whisperecho.gate.server.gate.AuthorizationDecision;
import com.whisperecho.gate.server.gate.AuthorizationGate;
import com.whisperecho.gate.server.model.Capability;
import com.whisperecho.gate.server.model.ConnectionInfo;
import com.whisperecho.gate.server.model.RequestCredentials;
import com.whisperecho.gate.server.model.RequestIdentity;
import com.whisperecho.gate.server.model.RequiresCapability;
import jakarta.annotation.Priority;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.lang.reflect.Method;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jersey filter that gates every resource method annotated with {@link RequiresCapability}.
 * <p>
 * The method annotation wins over the class annotation; unannotated resources pass through
 * untouched. Admitted requests get a {@link GateSecurityContext} and the
 * {@link RequestIdentity} as the {@value #IDENTITY_PROPERTY} request property. Denied requests
 * are aborted with the {@link ErrorResponse} body and, for 401, a {@code WWW-Authenticate}
 * challenge.
 */
@Priority(Priorities.AUTHENTICATION)
public class GateAuthFilter implements ContainerRequestFilter {

  /**
   * Request property carrying the admitted {@link RequestIdentity}.
   */
  public static final String IDENTITY_PROPERTY = "com.whisperecho.gate.identity";

  private static final Logger log = LoggerFactory.getLogger(GateAuthFilter.class);

  private final AuthorizationGate gate;
  private final String realm;

  @Context
  private ResourceInfo resourceInfo;

  @Context
  private HttpServletRequest servletRequest;

  /**
   * Instantiates a new gate auth filter.
   *
   * @param gate  the authorization gate
   * @param realm realm advertised in challenges
   */
  public GateAuthFilter(AuthorizationGate gate, String realm) {
    this.gate = gate;
    this.realm = realm;
  }

  /**
   * Reads the identity an earlier run of this filter attached to the request.
   *
   * @param requestContext the request
   * @return the identity, or empty on ungated routes
   */
  public static Optional<RequestIdentity> identityOf(ContainerRequestContext requestContext) {
    Object value = requestContext.getProperty(IDENTITY_PROPERTY);
    return value instanceof RequestIdentity identity ? Optional.of(identity) : Optional.empty();
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    Optional<Capability> required = requiredCapability();
    if (required.isEmpty()) {
      return;
    }
    RequestCredentials credentials = RequestCredentials.fromHeaders(requestContext::getHeaderString);
    ConnectionInfo connection = new ConnectionInfo(
        servletRequest == null ? null : servletRequest.getRemoteAddr(),
        requestContext.getHeaderString(HttpHeaders.USER_AGENT));

    AuthorizationDecision decision = gate.admit(credentials, connection, required.get());
    if (decision instanceof AuthorizationDecision.Allow allow) {
      boolean secure = requestContext.getSecurityContext() != null
          && requestContext.getSecurityContext().isSecure();
      requestContext.setSecurityContext(new GateSecurityContext(allow.identity(), secure));
      requestContext.setProperty(IDENTITY_PROPERTY, allow.identity());
      return;
    }
    AuthorizationDecision.Deny deny = (AuthorizationDecision.Deny) decision;
    log.debug("Rejecting {} {}: {}", requestContext.getMethod(),
        requestContext.getUriInfo().getPath(), deny.reason());
    Response.ResponseBuilder response = Response.status(deny.reason().status())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(deny.reason(), deny.message()));
    if (deny.reason().isUnauthorized()) {
      response.header(GateHeaders.WWW_AUTHENTICATE, GateHeaders.bearerChallenge(realm));
    }
    requestContext.abortWith(response.build());
  }

  private Optional<Capability> requiredCapability() {
    if (resourceInfo == null) {
      return Optional.empty();
    }
    Method method = resourceInfo.getResourceMethod();
    if (method != null && method.isAnnotationPresent(RequiresCapability.class)) {
      return Optional.of(method.getAnnotation(RequiresCapability.class).value());
    }
    Class<?> resourceClass = resourceInfo.getResourceClass();
    if (resourceClass != null && resourceClass.isAnnotationPresent(RequiresCapability.class)) {
      return Optional.of(resourceClass.getAnnotation(RequiresCapability.class).value());
    }
    return Optional.empty();
  }
}
