package com.whisperecho.gate.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.whisperecho.gate.model.PrincipalView;
import com.whisperecho.gate.model.TokenResponse;
import com.whisperecho.gate.server.auth.BearerTokenManager;
import com.whisperecho.gate.server.auth.ElevatedAccessVerifier;
import com.whisperecho.gate.server.model.Role;
import com.whisperecho.gate.server.model.UserRecord;
import com.whisperecho.gate.server.resolver.IdentityResolver;
import com.whisperecho.gate.server.store.InMemoryUserRecordStore;
import com.whisperecho.gate.server.store.UserStoreException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenServiceTest {

  private static final byte[] SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);

  private InMemoryUserRecordStore store;
  private BearerTokenManager bearerTokenManager;
  private IdentityResolver resolver;
  private TokenService tokenService;

  @BeforeEach
  void setUp() {
    store = new InMemoryUserRecordStore();
    store.put(new UserRecord("u-alice", "alice", "alice@example.com", Role.USER, "hash"));
    bearerTokenManager = new BearerTokenManager(SECRET, "test-issuer", Duration.ofDays(7));
    ElevatedAccessVerifier verifier = new ElevatedAccessVerifier("superadmin",
        ElevatedAccessVerifier.digest("WhisperEcho@2025"), Duration.ZERO, Clock.systemUTC(),
        "admin-superadmin", "admin@whisperecho.com");
    resolver = new IdentityResolver(verifier, bearerTokenManager, store, Duration.ofSeconds(2));
    tokenService = new TokenService(bearerTokenManager, resolver);
  }

  @AfterEach
  void tearDown() {
    resolver.shutdown();
  }

  @Test
  void verify_validToken_returnsView() {
    TokenResponse issued = tokenService.issue("u-alice");

    PrincipalView view = tokenService.verify(issued.token());

    assertThat(view).isEqualTo(new PrincipalView("u-alice", "user", "alice", "alice@example.com"));
  }

  @Test
  void issue_expiresAtIsIsoInstantInFuture() {
    TokenResponse issued = tokenService.issue("u-alice");

    assertThat(Instant.parse(issued.expiresAt())).isAfter(Instant.now().plus(Duration.ofDays(6)));
  }

  @Test
  void refresh_validToken_issuesNewTokenForSameUser() {
    String original = tokenService.issue("u-alice").token();

    TokenResponse refreshed = tokenService.refresh(original);

    assertThat(refreshed.token()).isNotEqualTo(original);
    assertThat(bearerTokenManager.decode(refreshed.token()).value().subject()).isEqualTo("u-alice");
  }

  @Test
  void refresh_deletedUser_throwsSecurityException() {
    String token = tokenService.issue("u-alice").token();
    store.remove("u-alice");

    assertThatThrownBy(() -> tokenService.refresh(token)).isInstanceOf(SecurityException.class);
  }

  @Test
  void verify_garbage_throwsSecurityException() {
    assertThatThrownBy(() -> tokenService.verify("not.a.token")).isInstanceOf(SecurityException.class);
  }

  @Test
  void verify_blank_throwsIllegalArgument() {
    assertThatThrownBy(() -> tokenService.verify("  ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void verify_storeFault_throwsUserStoreException() {
    IdentityResolver broken = new IdentityResolver(
        new ElevatedAccessVerifier("superadmin", ElevatedAccessVerifier.digest("x"), Duration.ZERO,
            Clock.systemUTC(), "admin-superadmin", "admin@whisperecho.com"),
        bearerTokenManager,
        id -> {
          throw new UserStoreException("db down", null);
        },
        Duration.ofSeconds(2));
    try {
      TokenService service = new TokenService(bearerTokenManager, broken);
      String token = bearerTokenManager.issue("u-alice").token();

      assertThatThrownBy(() -> service.verify(token)).isInstanceOf(UserStoreException.class);
    } finally {
      broken.shutdown();
    }
  }

  @Test
  void verify_storeTimeout_throwsIllegalState() {
    CountDownLatch never = new CountDownLatch(1);
    IdentityResolver slow = new IdentityResolver(
        new ElevatedAccessVerifier("superadmin", ElevatedAccessVerifier.digest("x"), Duration.ZERO,
            Clock.systemUTC(), "admin-superadmin", "admin@whisperecho.com"),
        bearerTokenManager,
        id -> {
          try {
            never.await();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return Optional.empty();
        },
        Duration.ofMillis(100));
    try {
      TokenService service = new TokenService(bearerTokenManager, slow);
      String token = bearerTokenManager.issue("u-alice").token();

      assertThatThrownBy(() -> service.verify(token))
          .isInstanceOf(IllegalStateException.class)
          .isNotInstanceOf(UserStoreException.class);
    } finally {
      slow.shutdown();
    }
  }
}
