package com.whisperecho.gate.server.resolver;

import com.whisperecho.gate.codec.DecodeResult;
import com.whisperecho.gate.codec.ElevatedCredential;
import com.whisperecho.gate.codec.ElevatedTokenCodec;
import com.whisperecho.gate.server.auth.BearerClaims;
import com.whisperecho.gate.server.auth.BearerTokenManager;
import com.whisperecho.gate.server.auth.ElevatedAccessVerifier;
import com.whisperecho.gate.server.model.GatePrincipal;
import com.whisperecho.gate.server.model.RequestCredentials;
import com.whisperecho.gate.server.store.UserRecordStore;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a request's candidate credentials to a {@link GatePrincipal}.
 * <p>
 * Precedence is fixed:
 * <ol>
 *   <li>Elevated path, when the marker is {@code true} and a token is present. An undecodable
 *       token fails with {@link ResolutionError#INVALID_ELEVATED_CREDENTIAL} and never falls
 *       through, so a broken admin console cannot silently downgrade to user auth.</li>
 *   <li>A matching elevated credential yields the administrator principal with no store
 *       lookup. A non-matching one falls through.</li>
 *   <li>Bearer path: verify the JWT, then load the referenced user from the store.</li>
 *   <li>Otherwise {@link ResolutionError#NO_CREDENTIAL}.</li>
 * </ol>
 * The store lookup is the only blocking step. It runs on a daemon pool and is bounded by
 * {@code lookupTimeout}; a timed-out lookup is cancelled with interruption. If the resolving
 * thread itself is interrupted the lookup is cancelled and {@link ResolutionCancelledException}
 * is thrown.
 */
public class IdentityResolver {

  private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

  private final ElevatedAccessVerifier elevatedAccessVerifier;
  private final BearerTokenManager bearerTokenManager;
  private final UserRecordStore userRecordStore;
  private final Duration lookupTimeout;

  private final ExecutorService lookupExecutor;

  /**
   * Instantiates a new identity resolver.
   *
   * @param elevatedAccessVerifier the provisioned administrator credential
   * @param bearerTokenManager     the bearer token verifier
   * @param userRecordStore        the user store
   * @param lookupTimeout          bound on a single store lookup
   */
  public IdentityResolver(ElevatedAccessVerifier elevatedAccessVerifier,
                          BearerTokenManager bearerTokenManager,
                          UserRecordStore userRecordStore,
                          Duration lookupTimeout) {
    if (lookupTimeout.isNegative() || lookupTimeout.isZero()) {
      throw new IllegalArgumentException("Lookup timeout must be positive");
    }
    this.elevatedAccessVerifier = elevatedAccessVerifier;
    this.bearerTokenManager = bearerTokenManager;
    this.userRecordStore = userRecordStore;
    this.lookupTimeout = lookupTimeout;
    AtomicInteger threadCount = new AtomicInteger();
    this.lookupExecutor = Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "gate-user-lookup-" + threadCount.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  /**
   * Shuts down the lookup thread pool.
   * <p>
   * Should be called on application shutdown. In Dropwizard, register it as a {@code Managed}
   * component. In Spring Boot, declare the bean with {@code @Bean(destroyMethod = "shutdown")}.
   */
  public void shutdown() {
    lookupExecutor.shutdownNow();
  }

  /**
   * Resolves the candidate credentials of one request.
   *
   * @param credentials the candidates extracted from the request headers
   * @return the principal or a typed failure
   * @throws ResolutionCancelledException if the calling thread is interrupted during the lookup
   */
  public Resolution resolve(RequestCredentials credentials) {
    if (credentials.elevatedRequested()) {
      DecodeResult<ElevatedCredential> decoded = ElevatedTokenCodec.decode(credentials.elevatedToken());
      if (!decoded.isSuccess()) {
        log.debug("Elevated token rejected: {}", decoded.error().detail());
        return Resolution.failed(ResolutionError.INVALID_ELEVATED_CREDENTIAL,
            "Elevated token could not be decoded");
      }
      switch (elevatedAccessVerifier.verify(decoded.value())) {
        case ACCEPTED -> {
          log.debug("Elevated credential accepted for principal={}",
              elevatedAccessVerifier.adminPrincipal().id());
          return Resolution.resolved(elevatedAccessVerifier.adminPrincipal());
        }
        case STALE -> {
          log.debug("Elevated credential outside maximum age");
          return Resolution.failed(ResolutionError.INVALID_ELEVATED_CREDENTIAL,
              "Elevated token has expired");
        }
        case MISMATCH -> log.debug("Elevated credential mismatch, trying bearer credential");
        default -> throw new IllegalStateException("Unhandled verdict");
      }
    }

    if (!credentials.bearerPresented()) {
      return Resolution.failed(ResolutionError.NO_CREDENTIAL, "No credential presented");
    }
    Optional<String> token = credentials.bearerToken();
    if (token.isEmpty()) {
      return Resolution.failed(ResolutionError.INVALID_BEARER_CREDENTIAL,
          "Authorization header is not a bearer token");
    }
    DecodeResult<BearerClaims> claims = bearerTokenManager.decode(token.get());
    if (!claims.isSuccess()) {
      log.debug("Bearer token rejected: kind={} detail={}", claims.error().kind(), claims.error().detail());
      return Resolution.failed(ResolutionError.INVALID_BEARER_CREDENTIAL,
          "Bearer token rejected: " + claims.error().kind());
    }
    return lookup(claims.value().subject());
  }

  private Resolution lookup(String userId) {
    // The principal is built on the lookup thread so a bad record surfaces as ExecutionException.
    Future<Optional<GatePrincipal>> pending = lookupExecutor.submit(
        () -> userRecordStore.findById(userId).map(GatePrincipal::fromRecord));
    try {
      Optional<GatePrincipal> principal = pending.get(lookupTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (principal.isEmpty()) {
        log.debug("Bearer subject {} not found", userId);
        return Resolution.failed(ResolutionError.PRINCIPAL_NOT_FOUND, "User not found");
      }
      return Resolution.resolved(principal.get());
    } catch (TimeoutException e) {
      pending.cancel(true);
      log.warn("User lookup for {} exceeded {} ms", userId, lookupTimeout.toMillis());
      return Resolution.failed(ResolutionError.LOOKUP_TIMED_OUT, "User lookup timed out");
    } catch (ExecutionException e) {
      log.error("User lookup for {} failed", userId, e.getCause());
      return Resolution.failed(ResolutionError.LOOKUP_FAILED, "User lookup failed");
    } catch (InterruptedException e) {
      pending.cancel(true);
      Thread.currentThread().interrupt();
      throw new ResolutionCancelledException("Resolution cancelled during user lookup", e);
    }
  }
}
