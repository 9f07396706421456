package com.whisperecho.gate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a freshly issued bearer token.
 * <p>
 * Used by: {@code POST /auth/token/refresh} response
 *
 * @param token     the signed bearer token
 * @param expiresAt ISO-8601 instant after which the token is rejected
 */
public record TokenResponse(@JsonProperty("token") String token,
                            @JsonProperty("expiresAt") String expiresAt) {
}
