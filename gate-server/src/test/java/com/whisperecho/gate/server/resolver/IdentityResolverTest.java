package com.whisperecho.gate.server.resolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.whisperecho.gate.codec.ElevatedTokenCodec;
import com.whisperecho.gate.server.auth.BearerTokenManager;
import com.whisperecho.gate.server.auth.ElevatedAccessVerifier;
import com.whisperecho.gate.server.model.GatePrincipal;
import com.whisperecho.gate.server.model.RequestCredentials;
import com.whisperecho.gate.server.model.Role;
import com.whisperecho.gate.server.model.UserRecord;
import com.whisperecho.gate.server.store.UserRecordStore;
import com.whisperecho.gate.server.store.UserStoreException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

  private static final byte[] SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);
  private static final String ADMIN_USER = "superadmin";
  private static final String ADMIN_SECRET = "WhisperEcho@2025";
  private static final UserRecord ALICE =
      new UserRecord("u-alice", "alice", "alice@example.com", Role.USER, "$2a$hash");

  @Mock private UserRecordStore userRecordStore;

  private BearerTokenManager bearerTokenManager;
  private IdentityResolver resolver;

  @BeforeEach
  void setUp() {
    bearerTokenManager = new BearerTokenManager(SECRET, "test-issuer", Duration.ofHours(1));
    resolver = newResolver(Duration.ZERO, Duration.ofSeconds(2));
  }

  @AfterEach
  void tearDown() {
    resolver.shutdown();
  }

  private IdentityResolver newResolver(Duration maxAge, Duration lookupTimeout) {
    ElevatedAccessVerifier verifier = new ElevatedAccessVerifier(ADMIN_USER,
        ElevatedAccessVerifier.digest(ADMIN_SECRET), maxAge, Clock.systemUTC(),
        "admin-superadmin", "admin@whisperecho.com");
    return new IdentityResolver(verifier, bearerTokenManager, userRecordStore, lookupTimeout);
  }

  private static String adminToken(String username, String secret, long issuedAt) {
    return ElevatedTokenCodec.encode(username, secret, issuedAt);
  }

  @Test
  void resolve_validBearer_returnsStoredPrincipal() {
    when(userRecordStore.findById("u-alice")).thenReturn(Optional.of(ALICE));
    String token = bearerTokenManager.issue("u-alice").token();

    Resolution resolution = resolver.resolve(RequestCredentials.bearer(token));

    assertThat(resolution.isResolved()).isTrue();
    assertThat(resolution.principal()).isEqualTo(GatePrincipal.fromRecord(ALICE));
    assertThat(resolution.principal().role()).isEqualTo(Role.USER);
  }

  @Test
  void resolve_bearerForAdminRecord_returnsAdminRole() {
    UserRecord moderator = new UserRecord("u-mod", "mod", "mod@example.com", Role.ADMIN, "h");
    when(userRecordStore.findById("u-mod")).thenReturn(Optional.of(moderator));

    Resolution resolution = resolver.resolve(
        RequestCredentials.bearer(bearerTokenManager.issue("u-mod").token()));

    assertThat(resolution.principal().role()).isEqualTo(Role.ADMIN);
  }

  @Test
  void resolve_elevatedMatch_returnsAdminWithoutStoreLookup() {
    Resolution resolution = resolver.resolve(
        RequestCredentials.elevated(adminToken(ADMIN_USER, ADMIN_SECRET, 123L)));

    assertThat(resolution.principal().id()).isEqualTo("admin-superadmin");
    assertThat(resolution.principal().role()).isEqualTo(Role.ADMIN);
    verifyNoInteractions(userRecordStore);
  }

  @Test
  void resolve_undecodableElevated_neverFallsThroughToValidBearer() {
    String bearer = bearerTokenManager.issue("u-alice").token();
    RequestCredentials credentials = new RequestCredentials("Bearer " + bearer, "true", "%%%not-base64");

    Resolution resolution = resolver.resolve(credentials);

    assertThat(resolution.error()).isEqualTo(ResolutionError.INVALID_ELEVATED_CREDENTIAL);
    verifyNoInteractions(userRecordStore);
  }

  @Test
  void resolve_elevatedWrongFieldCount_isInvalid() {
    String twoFields = Base64.getEncoder().encodeToString("superadmin:WhisperEcho@2025".getBytes(StandardCharsets.UTF_8));

    assertThat(resolver.resolve(RequestCredentials.elevated(twoFields)).error())
        .isEqualTo(ResolutionError.INVALID_ELEVATED_CREDENTIAL);
  }

  @Test
  void resolve_elevatedMismatchAlone_isNoCredential() {
    Resolution resolution = resolver.resolve(
        RequestCredentials.elevated(adminToken(ADMIN_USER, "wrong-password", 1L)));

    assertThat(resolution.error()).isEqualTo(ResolutionError.NO_CREDENTIAL);
  }

  @Test
  void resolve_elevatedMismatch_fallsThroughToBearer() {
    when(userRecordStore.findById("u-alice")).thenReturn(Optional.of(ALICE));
    String bearer = bearerTokenManager.issue("u-alice").token();
    RequestCredentials credentials = new RequestCredentials("Bearer " + bearer, "true",
        adminToken(ADMIN_USER, "wrong-password", 1L));

    assertThat(resolver.resolve(credentials).principal().id()).isEqualTo("u-alice");
  }

  @Test
  void resolve_staleElevated_isInvalidWhenMaxAgeConfigured() {
    IdentityResolver bounded = newResolver(Duration.ofMinutes(5), Duration.ofSeconds(2));
    try {
      Resolution resolution = bounded.resolve(
          RequestCredentials.elevated(adminToken(ADMIN_USER, ADMIN_SECRET, 1L)));

      assertThat(resolution.error()).isEqualTo(ResolutionError.INVALID_ELEVATED_CREDENTIAL);
    } finally {
      bounded.shutdown();
    }
  }

  @Test
  void resolve_nothingPresented_isNoCredential() {
    assertThat(resolver.resolve(RequestCredentials.none()).error()).isEqualTo(ResolutionError.NO_CREDENTIAL);
  }

  @Test
  void resolve_nonBearerScheme_isInvalidBearer() {
    RequestCredentials basic = new RequestCredentials("Basic dXNlcjpwYXNz", null, null);

    assertThat(resolver.resolve(basic).error()).isEqualTo(ResolutionError.INVALID_BEARER_CREDENTIAL);
  }

  @Test
  void resolve_tamperedBearer_isInvalidWithoutStoreLookup() {
    String token = bearerTokenManager.issue("u-alice").token();
    String tampered = token.substring(0, token.length() - 2) + (token.endsWith("AA") ? "BB" : "AA");

    assertThat(resolver.resolve(RequestCredentials.bearer(tampered)).error())
        .isEqualTo(ResolutionError.INVALID_BEARER_CREDENTIAL);
    verify(userRecordStore, never()).findById(anyString());
  }

  @Test
  void resolve_deletedUser_isPrincipalNotFound() {
    when(userRecordStore.findById("u-gone")).thenReturn(Optional.empty());

    assertThat(resolver.resolve(RequestCredentials.bearer(bearerTokenManager.issue("u-gone").token())).error())
        .isEqualTo(ResolutionError.PRINCIPAL_NOT_FOUND);
  }

  @Test
  void resolve_storeFault_isLookupFailed() {
    when(userRecordStore.findById("u-alice")).thenThrow(new UserStoreException("db down", null));

    Resolution resolution = resolver.resolve(RequestCredentials.bearer(bearerTokenManager.issue("u-alice").token()));

    assertThat(resolution.error()).isEqualTo(ResolutionError.LOOKUP_FAILED);
    assertThat(resolution.error().isServerFault()).isTrue();
  }

  @Test
  void resolve_unusableStoredRecord_isLookupFailed() {
    when(userRecordStore.findById("u-alice"))
        .thenReturn(Optional.of(new UserRecord("u-alice", "alice", "alice@example.com", null, "$2a$hash")));

    Resolution resolution = resolver.resolve(RequestCredentials.bearer(bearerTokenManager.issue("u-alice").token()));

    assertThat(resolution.error()).isEqualTo(ResolutionError.LOOKUP_FAILED);
    assertThat(resolution.principal()).isNull();
  }

  @Test
  void resolve_storeReturnsNullOptional_isLookupFailed() {
    when(userRecordStore.findById("u-alice")).thenReturn(null);

    Resolution resolution = resolver.resolve(RequestCredentials.bearer(bearerTokenManager.issue("u-alice").token()));

    assertThat(resolution.error()).isEqualTo(ResolutionError.LOOKUP_FAILED);
  }

  @Test
  void resolve_slowStore_timesOutAndCancelsLookup() throws Exception {
    IdentityResolver impatient = newResolver(Duration.ZERO, Duration.ofMillis(100));
    CountDownLatch never = new CountDownLatch(1);
    CountDownLatch lookupInterrupted = new CountDownLatch(1);
    when(userRecordStore.findById("u-alice")).thenAnswer(invocation -> {
      try {
        never.await();
      } catch (InterruptedException e) {
        lookupInterrupted.countDown();
        throw e;
      }
      return Optional.of(ALICE);
    });
    try {
      Resolution resolution = impatient.resolve(
          RequestCredentials.bearer(bearerTokenManager.issue("u-alice").token()));

      assertThat(resolution.error()).isEqualTo(ResolutionError.LOOKUP_TIMED_OUT);
      assertThat(lookupInterrupted.await(2, TimeUnit.SECONDS)).isTrue();
    } finally {
      impatient.shutdown();
    }
  }

  @Test
  void resolve_interruptedCaller_throwsCancelledAndKeepsInterruptFlag() {
    String token = bearerTokenManager.issue("u-alice").token();
    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> resolver.resolve(RequestCredentials.bearer(token)))
          .isInstanceOf(ResolutionCancelledException.class)
          .hasCauseInstanceOf(InterruptedException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void constructor_nonPositiveTimeout_throws() {
    assertThatThrownBy(() -> newResolver(Duration.ZERO, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
