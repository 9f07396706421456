package com.whisperecho.gate.server.model;

import com.whisperecho.gate.model.PrincipalView;
import java.security.Principal;
import java.util.Objects;

/**
 * Resolved identity of a request. Attached to the request for its lifetime and never persisted.
 * <p>
 * {@link Role#ADMIN} only ever comes from the elevated-access path or from a stored
 * {@link UserRecord} whose role is admin.
 *
 * @param id            stable principal identifier
 * @param role          resolved role
 * @param displayFields logging and response metadata
 */
public record GatePrincipal(String id, Role role, DisplayFields displayFields) implements Principal {

  public GatePrincipal {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(displayFields, "displayFields");
  }

  /**
   * Builds a principal from a stored user, dropping the password hash.
   *
   * @param record the stored user
   * @return the principal
   */
  public static GatePrincipal fromRecord(UserRecord record) {
    return new GatePrincipal(record.id(), record.role(),
        new DisplayFields(record.username(), record.email()));
  }

  public Capability capability() {
    return Capability.of(role);
  }

  public PrincipalView toView() {
    return new PrincipalView(id, role.wireName(), displayFields.username(), displayFields.email());
  }

  @Override
  public String getName() {
    return id;
  }
}
