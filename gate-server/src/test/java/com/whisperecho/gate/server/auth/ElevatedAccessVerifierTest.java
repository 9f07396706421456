package com.whisperecho.gate.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.whisperecho.gate.codec.ElevatedCredential;
import com.whisperecho.gate.server.auth.ElevatedAccessVerifier.Verdict;
import com.whisperecho.gate.server.model.Role;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ElevatedAccessVerifierTest {

  private static final String USERNAME = "superadmin";
  private static final String SECRET = "WhisperEcho@2025";
  private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

  private ElevatedAccessVerifier verifier(Duration maxAge) {
    return new ElevatedAccessVerifier(USERNAME, ElevatedAccessVerifier.digest(SECRET), maxAge,
        Clock.fixed(NOW, ZoneOffset.UTC), "admin-superadmin", "admin@whisperecho.com");
  }

  @ParameterizedTest
  @ValueSource(longs = {0L, 1L, 1_700_000_000_000L, Long.MAX_VALUE})
  void verify_matchingPair_acceptedForAnyTimestampWhenUnchecked(long issuedAt) {
    assertThat(verifier(Duration.ZERO).verify(new ElevatedCredential(USERNAME, SECRET, issuedAt)))
        .isEqualTo(Verdict.ACCEPTED);
  }

  @Test
  void verify_wrongSecret_mismatch() {
    assertThat(verifier(Duration.ZERO).verify(new ElevatedCredential(USERNAME, "guess", 1L)))
        .isEqualTo(Verdict.MISMATCH);
  }

  @Test
  void verify_wrongUsername_mismatch() {
    assertThat(verifier(Duration.ZERO).verify(new ElevatedCredential("root", SECRET, 1L)))
        .isEqualTo(Verdict.MISMATCH);
  }

  @Test
  void verify_withMaxAge_staleAndFresh() {
    ElevatedAccessVerifier bounded = verifier(Duration.ofHours(1));

    assertThat(bounded.verify(new ElevatedCredential(USERNAME, SECRET,
        NOW.minus(Duration.ofMinutes(30)).toEpochMilli()))).isEqualTo(Verdict.ACCEPTED);
    assertThat(bounded.verify(new ElevatedCredential(USERNAME, SECRET,
        NOW.minus(Duration.ofHours(2)).toEpochMilli()))).isEqualTo(Verdict.STALE);
    assertThat(bounded.verify(new ElevatedCredential(USERNAME, SECRET,
        NOW.plus(Duration.ofHours(2)).toEpochMilli()))).isEqualTo(Verdict.STALE);
  }

  @Test
  void verify_withMaxAge_mismatchTakesPrecedenceOverStale() {
    assertThat(verifier(Duration.ofHours(1)).verify(new ElevatedCredential(USERNAME, "guess", 0L)))
        .isEqualTo(Verdict.MISMATCH);
  }

  @Test
  void adminPrincipal_isWellKnownAdmin() {
    var principal = verifier(Duration.ZERO).adminPrincipal();

    assertThat(principal.id()).isEqualTo("admin-superadmin");
    assertThat(principal.role()).isEqualTo(Role.ADMIN);
    assertThat(principal.displayFields().username()).isEqualTo(USERNAME);
    assertThat(principal.displayFields().email()).isEqualTo("admin@whisperecho.com");
  }

  @Test
  void fromConfiguration_hexDigest_accepts() {
    String hex = Hex.toHexString(ElevatedAccessVerifier.digest(SECRET));
    ElevatedAccessVerifier configured = ElevatedAccessVerifier.fromConfiguration(USERNAME, hex,
        Duration.ZERO, "admin-superadmin", "admin@whisperecho.com");

    assertThat(configured.verify(new ElevatedCredential(USERNAME, SECRET, 5L))).isEqualTo(Verdict.ACCEPTED);
  }

  @Test
  void fromConfiguration_missingOrInvalid_throws() {
    assertThatThrownBy(() -> ElevatedAccessVerifier.fromConfiguration(USERNAME, null,
        Duration.ZERO, "id", "e")).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> ElevatedAccessVerifier.fromConfiguration(USERNAME, "zz-not-hex",
        Duration.ZERO, "id", "e")).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> ElevatedAccessVerifier.fromConfiguration(USERNAME, "abcd",
        Duration.ZERO, "id", "e")).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> ElevatedAccessVerifier.fromConfiguration(" ",
        Hex.toHexString(ElevatedAccessVerifier.digest(SECRET)), Duration.ZERO, "id", "e"))
        .isInstanceOf(IllegalStateException.class);
  }
}
