package com.whisperecho.gate.server.model;

/**
 * Deterministic fingerprint labelling an anonymous request. Carries no privilege.
 *
 * @param value lowercase hex SHA-256 digest
 */
public record SessionIdentifier(String value) {
}
