package com.whisperecho.gate.codec;

/**
 * Decoded contents of an elevated-access token.
 *
 * @param username            claimed administrator username
 * @param secret              claimed administrator secret
 * @param issuedAtEpochMillis client clock at minting time
 */
public record ElevatedCredential(String username, String secret, long issuedAtEpochMillis) {

  @Override
  public String toString() {
    return "ElevatedCredential[username=" + username + ", secret=***, issuedAtEpochMillis="
        + issuedAtEpochMillis + "]";
  }
}
