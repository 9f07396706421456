package com.whisperecho.gate.server.auth;

import com.whisperecho.gate.codec.ElevatedCredential;
import com.whisperecho.gate.server.model.DisplayFields;
import com.whisperecho.gate.server.model.GatePrincipal;
import com.whisperecho.gate.server.model.Role;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * Checks a decoded elevated-access credential against the provisioned administrator credential.
 * <p>
 * The administrator secret is held only as its SHA-256 digest and compared in constant time.
 * When {@code maxAge} is zero the token timestamp is not checked at all.
 */
public class ElevatedAccessVerifier {

  /**
   * Outcome of a verification.
   */
  public enum Verdict {
    /** Username and secret match, and the timestamp is within the maximum age. */
    ACCEPTED,
    /** Username or secret differ from the provisioned credential. */
    MISMATCH,
    /** Username and secret match but the token is outside the maximum age. */
    STALE
  }

  private static final int DIGEST_LENGTH = 32;

  private final byte[] username;
  private final byte[] secretDigest;
  private final Duration maxAge;
  private final Clock clock;
  private final GatePrincipal adminPrincipal;

  /**
   * Instantiates a new elevated access verifier.
   *
   * @param username         provisioned administrator username
   * @param secretDigest     SHA-256 digest of the provisioned administrator secret
   * @param maxAge           maximum token age, zero to disable the check
   * @param clock            clock used for the age check
   * @param adminPrincipalId well-known id of the synthesized administrator principal
   * @param adminEmail       display email of the synthesized administrator principal
   */
  public ElevatedAccessVerifier(String username, byte[] secretDigest, Duration maxAge, Clock clock,
                                String adminPrincipalId, String adminEmail) {
    if (username == null || username.isBlank()) {
      throw new IllegalStateException("Administrator username must be provisioned");
    }
    if (secretDigest == null || secretDigest.length != DIGEST_LENGTH) {
      throw new IllegalStateException("Administrator secret digest must be a 32-byte SHA-256 value");
    }
    if (maxAge.isNegative()) {
      throw new IllegalArgumentException("Maximum elevated token age must not be negative");
    }
    this.username = username.getBytes(StandardCharsets.UTF_8);
    this.secretDigest = secretDigest.clone();
    this.maxAge = maxAge;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.adminPrincipal = new GatePrincipal(adminPrincipalId, Role.ADMIN,
        new DisplayFields(username, adminEmail));
  }

  /**
   * Builds a verifier from configuration values.
   *
   * @param username         provisioned administrator username
   * @param secretSha256Hex  hex-encoded SHA-256 digest of the administrator secret
   * @param maxAge           maximum token age, zero to disable the check
   * @param adminPrincipalId well-known id of the synthesized administrator principal
   * @param adminEmail       display email of the synthesized administrator principal
   * @return the verifier
   * @throws IllegalStateException if the credential is missing or the digest is not valid hex
   */
  public static ElevatedAccessVerifier fromConfiguration(String username, String secretSha256Hex,
                                                         Duration maxAge, String adminPrincipalId,
                                                         String adminEmail) {
    if (secretSha256Hex == null || secretSha256Hex.isBlank()) {
      throw new IllegalStateException("Administrator secret digest must be provisioned. "
          + "Generate one with: printf '%s' \"$SECRET\" | sha256sum");
    }
    byte[] digest;
    try {
      digest = Hex.decode(secretSha256Hex.trim());
    } catch (RuntimeException e) {
      throw new IllegalStateException("Administrator secret digest is not valid hex", e);
    }
    return new ElevatedAccessVerifier(username, digest, maxAge, Clock.systemUTC(),
        adminPrincipalId, adminEmail);
  }

  /**
   * SHA-256 digest of a secret's UTF-8 bytes.
   *
   * @param secret the secret
   * @return the 32-byte digest
   */
  public static byte[] digest(String secret) {
    byte[] in = secret.getBytes(StandardCharsets.UTF_8);
    SHA256Digest sha256 = new SHA256Digest();
    sha256.update(in, 0, in.length);
    byte[] out = new byte[sha256.getDigestSize()];
    sha256.doFinal(out, 0);
    return out;
  }

  /**
   * Verifies a decoded credential.
   *
   * @param credential the decoded credential
   * @return the verdict
   */
  public Verdict verify(ElevatedCredential credential) {
    boolean usernameMatches = Arrays.constantTimeAreEqual(username,
        credential.username().getBytes(StandardCharsets.UTF_8));
    boolean secretMatches = Arrays.constantTimeAreEqual(secretDigest, digest(credential.secret()));
    if (!(usernameMatches & secretMatches)) {
      return Verdict.MISMATCH;
    }
    if (!maxAge.isZero()) {
      Instant issuedAt = Instant.ofEpochMilli(credential.issuedAtEpochMillis());
      Duration age = Duration.between(issuedAt, clock.instant()).abs();
      if (age.compareTo(maxAge) > 0) {
        return Verdict.STALE;
      }
    }
    return Verdict.ACCEPTED;
  }

  /**
   * The principal every accepted elevated credential resolves to.
   *
   * @return the administrator principal
   */
  public GatePrincipal adminPrincipal() {
    return adminPrincipal;
  }
}
