package com.whisperecho.gate.server.auth;

import java.time.Instant;

/**
 * Verified claims of a bearer identity token.
 *
 * @param subject   the referenced user id
 * @param jwtId     the token id
 * @param issuedAt  issuance time
 * @param expiresAt expiry time
 */
public record BearerClaims(String subject, String jwtId, Instant issuedAt, Instant expiresAt) {
}
