package com.whisperecho.gate.springboot.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whisperecho.gate.model.ErrorResponse;
import com.whisperecho.gate.model.GateHeaders;
import com.whisperecho.gate.server.gate.AuthorizationDecision;
import com.whisperecho.gate.server.gate.AuthorizationGate;
import com.whisperecho.gate.server.model.Capability;
import com.whisperecho.gate.server.model.ConnectionInfo;
import com.whisperecho.gate.server.model.RequestCredentials;
import com.whisperecho.gate.server.model.RequestIdentity;
import com.whisperecho.gate.server.model.RequiresCapability;
import com.whisperecho.gate.server.resolver.Resolution;
import com.whisperecho.gate.springboot.security.GateAuthenticationFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies the gate's decision to handlers annotated with {@link RequiresCapability}.
 * <p>
 * The method annotation wins over the controller annotation. Admitted requests carry their
 * {@link RequestIdentity} as the {@link #IDENTITY_ATTRIBUTE} request attribute; denied requests
 * get the {@link ErrorResponse} body.
 */
public class GateAuthorizationInterceptor implements HandlerInterceptor {

  public static final String IDENTITY_ATTRIBUTE = "com.whisperecho.gate.identity";

  private static final Logger log = LoggerFactory.getLogger(GateAuthorizationInterceptor.class);

  private final AuthorizationGate gate;
  private final ObjectMapper objectMapper;
  private final String realm;

  public GateAuthorizationInterceptor(AuthorizationGate gate, ObjectMapper objectMapper, String realm) {
    this.gate = gate;
    this.objectMapper = objectMapper;
    this.realm = realm;
  }

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
      throws IOException {
    if (!(handler instanceof HandlerMethod handlerMethod)) {
      return true;
    }
    Optional<Capability> required = requiredCapability(handlerMethod);
    if (required.isEmpty()) {
      return true;
    }
    ConnectionInfo connection = new ConnectionInfo(request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT));
    AuthorizationDecision decision;
    if (request.getAttribute(GateAuthenticationFilter.RESOLUTION_ATTRIBUTE) instanceof Resolution resolution) {
      decision = gate.decide(resolution, connection, required.get());
    } else {
      decision = gate.admit(RequestCredentials.fromHeaders(request::getHeader), connection, required.get());
    }

    if (decision instanceof AuthorizationDecision.Allow allow) {
      request.setAttribute(IDENTITY_ATTRIBUTE, allow.identity());
      return true;
    }
    AuthorizationDecision.Deny deny = (AuthorizationDecision.Deny) decision;
    log.debug("Rejecting {} {}: {}", request.getMethod(), request.getRequestURI(), deny.reason());
    response.setStatus(deny.reason().status());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    if (deny.reason().isUnauthorized()) {
      response.setHeader(GateHeaders.WWW_AUTHENTICATE, GateHeaders.bearerChallenge(realm));
    }
    objectMapper.writeValue(response.getOutputStream(), new ErrorResponse(deny.reason(), deny.message()));
    return false;
  }

  private static Optional<Capability> requiredCapability(HandlerMethod handlerMethod) {
    RequiresCapability annotation = handlerMethod.getMethodAnnotation(RequiresCapability.class);
    if (annotation == null) {
      annotation = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), RequiresCapability.class);
    }
    return Optional.ofNullable(annotation).map(RequiresCapability::value);
  }
}
