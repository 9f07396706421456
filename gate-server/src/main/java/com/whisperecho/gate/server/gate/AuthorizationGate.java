package com.whisperecho.gate.server.gate;

import com.whisperecho.gate.model.FailureReason;
import com.whisperecho.gate.server.model.Capability;
import com.whisperecho.gate.server.model.ConnectionInfo;
import com.whisperecho.gate.server.model.RequestCredentials;
import com.whisperecho.gate.server.model.RequestIdentity;
import com.whisperecho.gate.server.resolver.IdentityResolver;
import com.whisperecho.gate.server.resolver.Resolution;
import com.whisperecho.gate.server.resolver.ResolutionCancelledException;
import com.whisperecho.gate.server.resolver.ResolutionError;
import com.whisperecho.gate.server.session.SessionIdentifierDeriver;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a request may proceed to its handler.
 * <p>
 * Framework adapters call {@link #admit} (or {@link #decide} when resolution already ran in an
 * earlier filter) and translate the {@link AuthorizationDecision} to their own response type.
 * This class holds the only mapping from {@link ResolutionError} to {@link FailureReason}.
 * <p>
 * Only an absent credential degrades to anonymous access. A presented but invalid credential is
 * rejected even on routes that allow anonymous callers.
 */
public class AuthorizationGate {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationGate.class);

  private final IdentityResolver identityResolver;
  private final SessionIdentifierDeriver sessionIdentifierDeriver;
  private final Clock clock;

  /**
   * Instantiates a new authorization gate.
   *
   * @param identityResolver         the identity resolver
   * @param sessionIdentifierDeriver the session identifier deriver
   * @param clock                    clock stamping anonymous session identifiers
   */
  public AuthorizationGate(IdentityResolver identityResolver,
                           SessionIdentifierDeriver sessionIdentifierDeriver,
                           Clock clock) {
    this.identityResolver = identityResolver;
    this.sessionIdentifierDeriver = sessionIdentifierDeriver;
    this.clock = clock;
  }

  /**
   * Resolves the request's credentials and decides.
   *
   * @param credentials candidate credentials from the request headers
   * @param connection  connection attributes for anonymous labelling
   * @param required    capability the route requires
   * @return the decision
   * @throws ResolutionCancelledException if the request was cancelled during resolution
   */
  public AuthorizationDecision admit(RequestCredentials credentials, ConnectionInfo connection,
                                     Capability required) {
    return decide(identityResolver.resolve(credentials), connection, required);
  }

  /**
   * Decides from an existing resolution.
   *
   * @param resolution the resolution
   * @param connection connection attributes for anonymous labelling
   * @param required   capability the route requires
   * @return the decision
   */
  public AuthorizationDecision decide(Resolution resolution, ConnectionInfo connection,
                                      Capability required) {
    if (resolution.isResolved()) {
      return authorize(RequestIdentity.authenticated(resolution.principal()), required);
    }
    ResolutionError error = resolution.error();
    if (error == ResolutionError.NO_CREDENTIAL && required == Capability.ANONYMOUS) {
      return new AuthorizationDecision.Allow(RequestIdentity.anonymous(
          sessionIdentifierDeriver.deriveSessionId(connection.sourceAddress(),
              connection.agentString(), clock.millis())));
    }
    FailureReason reason = toFailureReason(error);
    log.debug("Denied: error={} reason={} required={}", error, reason, required);
    return new AuthorizationDecision.Deny(reason, messageFor(error));
  }

  /**
   * Compares an identity's capability with a route's requirement.
   *
   * @param identity the identity
   * @param required capability the route requires
   * @return allow when the identity's capability is at least the requirement
   */
  public AuthorizationDecision authorize(RequestIdentity identity, Capability required) {
    if (identity.capability().satisfies(required)) {
      return new AuthorizationDecision.Allow(identity);
    }
    if (identity.isAnonymous()) {
      return new AuthorizationDecision.Deny(FailureReason.NO_CREDENTIAL, "Authentication required");
    }
    log.debug("Insufficient role: principal={} role={} required={}",
        identity.principal().id(), identity.principal().role(), required);
    return new AuthorizationDecision.Deny(FailureReason.INSUFFICIENT_ROLE,
        "Insufficient role for this resource");
  }

  static FailureReason toFailureReason(ResolutionError error) {
    return switch (error) {
      case NO_CREDENTIAL -> FailureReason.NO_CREDENTIAL;
      case INVALID_ELEVATED_CREDENTIAL -> FailureReason.INVALID_ELEVATED_CREDENTIAL;
      case INVALID_BEARER_CREDENTIAL -> FailureReason.INVALID_BEARER_CREDENTIAL;
      case PRINCIPAL_NOT_FOUND -> FailureReason.PRINCIPAL_NOT_FOUND;
      case LOOKUP_FAILED -> FailureReason.SERVER_FAULT;
      case LOOKUP_TIMED_OUT -> FailureReason.LOOKUP_TIMEOUT;
    };
  }

  private static String messageFor(ResolutionError error) {
    return switch (error) {
      case NO_CREDENTIAL -> "Authentication required";
      case INVALID_ELEVATED_CREDENTIAL -> "Invalid admin token";
      case INVALID_BEARER_CREDENTIAL -> "Invalid or expired token";
      case PRINCIPAL_NOT_FOUND -> "User not found";
      case LOOKUP_FAILED -> "Authentication service error";
      case LOOKUP_TIMED_OUT -> "Authentication service unavailable";
    };
  }
}
