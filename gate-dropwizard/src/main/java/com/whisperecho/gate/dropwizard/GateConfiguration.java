package com.whisperecho.gate.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the request gate.
 * <p>
 * The administrator credential has no default: {@code adminUsername} and
 * {@code adminSecretSha256Hex} must be provisioned or the bundle refuses to start. The secret
 * itself never appears in configuration, only its SHA-256 digest. Generate one with:
 * {@code printf '%s' "$SECRET" | sha256sum}
 * <p>
 * For production also supply {@code jwtSecretHex} (generate with {@code openssl rand -hex 32})
 * so bearer tokens survive restarts.
 */
public class GateConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for bearer tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * Bearer token issuer claim, required on verification.
   */
  @NotEmpty
  private String jwtIssuer = "whisper-gate";

  /**
   * Bearer token time-to-live in seconds. Defaults to seven days.
   */
  @Min(1)
  private long jwtTtlSeconds = 604800;

  /**
   * Provisioned administrator username.
   */
  private String adminUsername = "";

  /**
   * Hex-encoded SHA-256 digest of the administrator secret.
   */
  private String adminSecretSha256Hex = "";

  /**
   * Id of the principal every accepted elevated credential resolves to.
   */
  @NotEmpty
  private String adminPrincipalId = "admin-superadmin";

  /**
   * Display email of the administrator principal.
   */
  @NotEmpty
  private String adminEmail = "admin@whisperecho.com";

  /**
   * Maximum age of an elevated token, in seconds. 0 leaves the timestamp unchecked.
   */
  @Min(0)
  private long elevatedTokenMaxAgeSeconds = 0;

  /**
   * Upper bound on a single user store lookup, in milliseconds.
   */
  @Min(1)
  private long userLookupTimeoutMillis = 2000;

  /**
   * Realm advertised in {@code WWW-Authenticate} challenges.
   */
  @NotEmpty
  private String realm = "whisperecho";

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets jwt ttl seconds.
   *
   * @return the jwt ttl seconds
   */
  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  /**
   * Sets jwt ttl seconds.
   *
   * @param jwtTtlSeconds the jwt ttl seconds
   */
  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  /**
   * Gets admin username.
   *
   * @return the admin username
   */
  @JsonProperty
  public String getAdminUsername() {
    return adminUsername;
  }

  /**
   * Sets admin username.
   *
   * @param adminUsername the admin username
   */
  @JsonProperty
  public void setAdminUsername(String adminUsername) {
    this.adminUsername = adminUsername;
  }

  /**
   * Gets admin secret sha 256 hex.
   *
   * @return the admin secret sha 256 hex
   */
  @JsonProperty
  public String getAdminSecretSha256Hex() {
    return adminSecretSha256Hex;
  }

  /**
   * Sets admin secret sha 256 hex.
   *
   * @param adminSecretSha256Hex the admin secret sha 256 hex
   */
  @JsonProperty
  public void setAdminSecretSha256Hex(String adminSecretSha256Hex) {
    this.adminSecretSha256Hex = adminSecretSha256Hex;
  }

  /**
   * Gets admin principal id.
   *
   * @return the admin principal id
   */
  @JsonProperty
  public String getAdminPrincipalId() {
    return adminPrincipalId;
  }

  /**
   * Sets admin principal id.
   *
   * @param adminPrincipalId the admin principal id
   */
  @JsonProperty
  public void setAdminPrincipalId(String adminPrincipalId) {
    this.adminPrincipalId = adminPrincipalId;
  }

  /**
   * Gets admin email.
   *
   * @return the admin email
   */
  @JsonProperty
  public String getAdminEmail() {
    return adminEmail;
  }

  /**
   * Sets admin email.
   *
   * @param adminEmail the admin email
   */
  @JsonProperty
  public void setAdminEmail(String adminEmail) {
    this.adminEmail = adminEmail;
  }

  /**
   * Gets elevated token max age seconds.
   *
   * @return the elevated token max age seconds
   */
  @JsonProperty
  public long getElevatedTokenMaxAgeSeconds() {
    return elevatedTokenMaxAgeSeconds;
  }

  /**
   * Sets elevated token max age seconds.
   *
   * @param elevatedTokenMaxAgeSeconds the elevated token max age seconds
   */
  @JsonProperty
  public void setElevatedTokenMaxAgeSeconds(long elevatedTokenMaxAgeSeconds) {
    this.elevatedTokenMaxAgeSeconds = elevatedTokenMaxAgeSeconds;
  }

  /**
   * Gets user lookup timeout millis.
   *
   * @return the user lookup timeout millis
   */
  @JsonProperty
  public long getUserLookupTimeoutMillis() {
    return userLookupTimeoutMillis;
  }

  /**
   * Sets user lookup timeout millis.
   *
   * @param userLookupTimeoutMillis the user lookup timeout millis
   */
  @JsonProperty
  public void setUserLookupTimeoutMillis(long userLookupTimeoutMillis) {
    this.userLookupTimeoutMillis = userLookupTimeoutMillis;
  }

  /**
   * Gets realm.
   *
   * @return the realm
   */
  @JsonProperty
  public String getRealm() {
    return realm;
  }

  /**
   * Sets realm.
   *
   * @param realm the realm
   */
  @JsonProperty
  public void setRealm(String realm) {
    this.realm = realm;
  }
}
