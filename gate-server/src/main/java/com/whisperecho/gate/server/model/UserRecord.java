package com.whisperecho.gate.server.model;

/**
 * A persisted user as seen by the gate. The store owns the record; the gate only reads it.
 *
 * @param id           stable identifier, the subject of bearer tokens
 * @param username     username
 * @param email        email
 * @param role         persisted role
 * @param passwordHash password hash, never copied into a principal
 */
public record UserRecord(String id, String username, String email, Role role, String passwordHash) {

  @Override
  public String toString() {
    return "UserRecord[id=" + id + ", username=" + username + ", role=" + role + "]";
  }
}
