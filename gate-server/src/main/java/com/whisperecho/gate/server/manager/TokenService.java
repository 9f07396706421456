package com.whisperecho.gate.server.manager;

import com.whisperecho.gate.model.PrincipalView;
import com.whisperecho.gate.model.TokenResponse;
import com.whisperecho.gate.server.auth.BearerTokenManager;
import com.whisperecho.gate.server.auth.IssuedToken;
import com.whisperecho.gate.server.model.GatePrincipal;
import com.whisperecho.gate.server.model.RequestCredentials;
import com.whisperecho.gate.server.resolver.IdentityResolver;
import com.whisperecho.gate.server.resolver.Resolution;
import com.whisperecho.gate.server.resolver.ResolutionError;
import com.whisperecho.gate.server.store.UserStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic bearer token lifecycle: issue, verify and refresh.
 * <p>
 * Exception contract used by framework adapters to map to HTTP responses:
 * <ul>
 *   <li>{@link IllegalArgumentException}: bad input, map to 400</li>
 *   <li>{@link SecurityException}: token rejected or user gone, map to 401</li>
 *   <li>{@link UserStoreException}: user store failed, map to 500</li>
 *   <li>{@link IllegalStateException}: user store timed out, map to 503</li>
 * </ul>
 * The last two match the statuses the gate gives the same faults on gated routes.
 */
public class TokenService {

  private static final Logger log = LoggerFactory.getLogger(TokenService.class);

  private final BearerTokenManager bearerTokenManager;
  private final IdentityResolver identityResolver;

  /**
   * Instantiates a new token service.
   *
   * @param bearerTokenManager the bearer token manager
   * @param identityResolver   the identity resolver, used so verification follows request rules
   */
  public TokenService(BearerTokenManager bearerTokenManager, IdentityResolver identityResolver) {
    this.bearerTokenManager = bearerTokenManager;
    this.identityResolver = identityResolver;
    log.info("TokenService(issuer={})", bearerTokenManager.issuer());
  }

  /**
   * Issues a token for a user that has just authenticated by other means.
   *
   * @param userId the user id
   * @return the token response
   * @throws IllegalArgumentException if the user id is blank
   */
  public TokenResponse issue(String userId) {
    return toResponse(bearerTokenManager.issue(userId));
  }

  /**
   * Verifies a bearer token and returns who it belongs to.
   *
   * @param token the bearer token
   * @return the principal view
   */
  public PrincipalView verify(String token) {
    return resolveBearer(token).toView();
  }

  /**
   * Exchanges a still-valid token for a fresh one for the same user.
   *
   * @param token the bearer token
   * @return the new token
   */
  public TokenResponse refresh(String token) {
    GatePrincipal principal = resolveBearer(token);
    log.debug("Refreshing bearer token for principal={}", principal.id());
    return toResponse(bearerTokenManager.issue(principal.id()));
  }

  private GatePrincipal resolveBearer(String token) {
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("Missing required field: token");
    }
    Resolution resolution = identityResolver.resolve(RequestCredentials.bearer(token.trim()));
    if (resolution.isResolved()) {
      return resolution.principal();
    }
    if (resolution.error() == ResolutionError.LOOKUP_FAILED) {
      throw new UserStoreException(resolution.detail(), null);
    }
    if (resolution.error() == ResolutionError.LOOKUP_TIMED_OUT) {
      throw new IllegalStateException(resolution.detail());
    }
    throw new SecurityException(resolution.detail());
  }

  private static TokenResponse toResponse(IssuedToken issued) {
    return new TokenResponse(issued.token(), issued.expiresAt().toString());
  }
}
