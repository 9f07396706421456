package com.whisperecho.gate.server.model;

/**
 * Non-authoritative principal metadata, used only for logging and response shaping.
 *
 * @param username display username
 * @param email    display email
 */
public record DisplayFields(String username, String email) {
}
