package com.whisperecho.gate.server.auth;

import java.time.Instant;

/**
 * A freshly signed bearer token.
 *
 * @param token     the compact JWT
 * @param jwtId     the token id
 * @param issuedAt  issuance time
 * @param expiresAt expiry time
 */
public record IssuedToken(String token, String jwtId, Instant issuedAt, Instant expiresAt) {

  @Override
  public String toString() {
    return "IssuedToken[jwtId=" + jwtId + ", expiresAt=" + expiresAt + "]";
  }
}
