package com.whisperecho.gate.server.model;

import java.util.Locale;

/**
 * Persisted role of a principal.
 */
public enum Role {
  USER("user"),
  ADMIN("admin");

  private final String wireName;

  Role(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Parses the role field of a stored user record.
   *
   * @param value {@code user} or {@code admin}, any case
   * @return the role
   * @throws IllegalArgumentException for any other value
   */
  public static Role fromWire(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (Role role : values()) {
        if (role.wireName.equals(normalized)) {
          return role;
        }
      }
    }
    throw new IllegalArgumentException("Unknown role: " + value);
  }
}
