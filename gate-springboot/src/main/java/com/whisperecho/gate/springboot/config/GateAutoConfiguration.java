package com.whisperecho.gate.springboot.config;

import com.whisperecho.gate.server.auth.BearerTokenManager;
import com.whisperecho.gate.server.auth.ElevatedAccessVerifier;
import com.whisperecho.gate.server.gate.AuthorizationGate;
import com.whisperecho.gate.server.manager.TokenService;
import com.whisperecho.gate.server.resolver.IdentityResolver;
import com.whisperecho.gate.server.session.SessionIdentifierDeriver;
import com.whisperecho.gate.server.store.InMemoryUserRecordStore;
import com.whisperecho.gate.server.store.UserRecordStore;
import com.whisperecho.gate.springboot.controller.TokenController;
import com.whisperecho.gate.springboot.health.GateHealthIndicator;
import com.whisperecho.gate.springboot.security.GateSecurityConfig;
import com.whisperecho.gate.springboot.web.GateWebConfig;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@AutoConfiguration
@EnableConfigurationProperties(GateProperties.class)
@Import({GateSecurityConfig.class, GateWebConfig.class, TokenController.class, GateHealthIndicator.class})
public class GateAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(GateAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock gateClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public UserRecordStore userRecordStore() {
    log.warn("Using in-memory user store. All users will be lost on restart. Do not use in production.");
    return new InMemoryUserRecordStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public BearerTokenManager bearerTokenManager(GateProperties props, SecureRandom secureRandom) {
    String secretHex = props.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      secureRandom.nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new BearerTokenManager(secret, props.getJwtIssuer(), Duration.ofSeconds(props.getJwtTtlSeconds()));
  }

  /**
   * The administrator credential. There is no default: {@code gate.admin-username} and
   * {@code gate.admin-secret-sha256-hex} must be set or the context fails to start.
   */
  @Bean
  @ConditionalOnMissingBean
  public ElevatedAccessVerifier elevatedAccessVerifier(GateProperties props) {
    return ElevatedAccessVerifier.fromConfiguration(
        props.getAdminUsername(),
        props.getAdminSecretSha256Hex(),
        Duration.ofSeconds(props.getElevatedTokenMaxAgeSeconds()),
        props.getAdminPrincipalId(),
        props.getAdminEmail());
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public IdentityResolver identityResolver(ElevatedAccessVerifier elevatedAccessVerifier,
                                           BearerTokenManager bearerTokenManager,
                                           UserRecordStore userRecordStore,
                                           GateProperties props) {
    return new IdentityResolver(elevatedAccessVerifier, bearerTokenManager, userRecordStore,
        Duration.ofMillis(props.getUserLookupTimeoutMillis()));
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionIdentifierDeriver sessionIdentifierDeriver() {
    return new SessionIdentifierDeriver();
  }

  @Bean
  @ConditionalOnMissingBean
  public AuthorizationGate authorizationGate(IdentityResolver identityResolver,
                                             SessionIdentifierDeriver sessionIdentifierDeriver,
                                             Clock gateClock) {
    return new AuthorizationGate(identityResolver, sessionIdentifierDeriver, gateClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public TokenService tokenService(BearerTokenManager bearerTokenManager, IdentityResolver identityResolver) {
    return new TokenService(bearerTokenManager, identityResolver);
  }
}
