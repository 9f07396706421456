package com.whisperecho.gate.dropwizard;

import com.whisperecho.gate.dropwizard.auth.GateAuthFilter;
import com.whisperecho.gate.dropwizard.health.GateHealthCheck;
import com.whisperecho.gate.server.auth.BearerTokenManager;
import com.whisperecho.gate.server.auth.ElevatedAccessVerifier;
import com.whisperecho.gate.server.gate.AuthorizationGate;
import com.whisperecho.gate.server.manager.TokenService;
import com.whisperecho.gate.server.model.GatePrincipal;
import com.whisperecho.gate.server.resolver.IdentityResolver;
import com.whisperecho.gate.server.resource.TokenResource;
import com.whisperecho.gate.server.session.SessionIdentifierDeriver;
import com.whisperecho.gate.server.store.InMemoryUserRecordStore;
import com.whisperecho.gate.server.store.UserRecordStore;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that puts the request gate in front of an existing Dropwizard application.
 * <p>
 * Registers the gate filter, the {@code @Auth GatePrincipal} binder, the token endpoints and the
 * health check. Requires a {@link GateConfiguration} block in the application's YAML config.
 * <p>
 * Resources opt in per method or per class:
 * <pre>{@code
 *   @GET
 *   @RequiresCapability(Capability.ADMIN)
 *   public Stats stats(@Auth GatePrincipal principal) { ... }
 * }</pre>
 * <p>
 * Embed with an in-memory user store (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new GateBundle<>());
 * }</pre>
 * <p>
 * Or supply the application's own store:
 * <pre>{@code
 *   bootstrap.addBundle(new GateBundle<>(myUserRecordStore));
 * }</pre>
 */
public class GateBundle<C extends GateConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(GateBundle.class);

  private final UserRecordStore userRecordStore;

  private TokenService tokenService;

  /**
   * Creates a bundle backed by an empty in-memory user store.
   * <p>
   * For dev/test only. Only the elevated-access path can authenticate until users are added.
   */
  public GateBundle() {
    this(new InMemoryUserRecordStore());
    log.warn("""
        #################################################################
        # WARNING: Using an in-memory user store. Users are lost on     #
        # restart. Do not use in production.                            #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied user store.
   *
   * @param userRecordStore the user store
   */
  public GateBundle(UserRecordStore userRecordStore) {
    this.userRecordStore = userRecordStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    BearerTokenManager bearerTokenManager = buildBearerTokenManager(configuration);
    ElevatedAccessVerifier elevatedAccessVerifier = ElevatedAccessVerifier.fromConfiguration(
        configuration.getAdminUsername(),
        configuration.getAdminSecretSha256Hex(),
        Duration.ofSeconds(configuration.getElevatedTokenMaxAgeSeconds()),
        configuration.getAdminPrincipalId(),
        configuration.getAdminEmail());

    IdentityResolver identityResolver = new IdentityResolver(elevatedAccessVerifier,
        bearerTokenManager, userRecordStore,
        Duration.ofMillis(configuration.getUserLookupTimeoutMillis()));
    environment.lifecycle().manage(new Managed() {
      @Override
      public void start() {
        // Nothing to start
      }

      @Override
      public void stop() {
        identityResolver.shutdown();
      }
    });

    AuthorizationGate gate = new AuthorizationGate(identityResolver, new SessionIdentifierDeriver(),
        Clock.systemUTC());
    environment.jersey().register(new GateAuthFilter(gate, configuration.getRealm()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(GatePrincipal.class));

    tokenService = new TokenService(bearerTokenManager, identityResolver);
    environment.jersey().register(new TokenResource(tokenService));
    environment.healthChecks().register("gate",
        new GateHealthCheck(bearerTokenManager, elevatedAccessVerifier));
  }

  /**
   * The token service built by {@link #run}, for login flows that issue bearer tokens.
   *
   * @return the token service
   * @throws IllegalStateException if the bundle has not run yet
   */
  public TokenService tokenService() {
    if (tokenService == null) {
      throw new IllegalStateException("GateBundle has not been run");
    }
    return tokenService;
  }

  private BearerTokenManager buildBearerTokenManager(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new BearerTokenManager(secret, configuration.getJwtIssuer(),
        Duration.ofSeconds(configuration.getJwtTtlSeconds()));
  }
}
