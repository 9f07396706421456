package com.whisperecho.gate.springboot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gate")
public class GateProperties {

  private String jwtSecretHex = "";
  private String jwtIssuer = "whisper-gate";
  private long jwtTtlSeconds = 604800;
  private String adminUsername = "";
  private String adminSecretSha256Hex = "";
  private String adminPrincipalId = "admin-superadmin";
  private String adminEmail = "admin@whisperecho.com";
  private long elevatedTokenMaxAgeSeconds = 0;
  private long userLookupTimeoutMillis = 2000;
  private String realm = "whisperecho";

  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  public String getJwtIssuer() {
    return jwtIssuer;
  }

  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  public String getAdminUsername() {
    return adminUsername;
  }

  public void setAdminUsername(String adminUsername) {
    this.adminUsername = adminUsername;
  }

  public String getAdminSecretSha256Hex() {
    return adminSecretSha256Hex;
  }

  public void setAdminSecretSha256Hex(String adminSecretSha256Hex) {
    this.adminSecretSha256Hex = adminSecretSha256Hex;
  }

  public String getAdminPrincipalId() {
    return adminPrincipalId;
  }

  public void setAdminPrincipalId(String adminPrincipalId) {
    this.adminPrincipalId = adminPrincipalId;
  }

  public String getAdminEmail() {
    return adminEmail;
  }

  public void setAdminEmail(String adminEmail) {
    this.adminEmail = adminEmail;
  }

  public long getElevatedTokenMaxAgeSeconds() {
    return elevatedTokenMaxAgeSeconds;
  }

  public void setElevatedTokenMaxAgeSeconds(long elevatedTokenMaxAgeSeconds) {
    this.elevatedTokenMaxAgeSeconds = elevatedTokenMaxAgeSeconds;
  }

  public long getUserLookupTimeoutMillis() {
    return userLookupTimeoutMillis;
  }

  public void setUserLookupTimeoutMillis(long userLookupTimeoutMillis) {
    this.userLookupTimeoutMillis = userLookupTimeoutMillis;
  }

  public String getRealm() {
    return realm;
  }

  public void setRealm(String realm) {
    this.realm = realm;
  }
}
