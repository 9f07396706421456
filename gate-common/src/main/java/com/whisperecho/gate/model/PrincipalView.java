package com.whisperecho.gate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of a resolved principal, with no credential or hash material.
 * <p>
 * Used by: {@code POST /auth/token/verify} response
 *
 * @param id       stable principal identifier
 * @param role     {@code user} or {@code admin}
 * @param username display username
 * @param email    display email
 */
public record PrincipalView(@JsonProperty("id") String id,
                            @JsonProperty("role") String role,
                            @JsonProperty("username") String username,
                            @JsonProperty("email") String email) {
}
