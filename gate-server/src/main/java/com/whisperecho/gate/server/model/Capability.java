package com.whisperecho.gate.server.model;

/**
 * Ordered capability levels gating route access: {@code ANONYMOUS < USER < ADMIN}.
 * <p>
 * A level satisfies every level at or below it and nothing else.
 */
public enum Capability {
  ANONYMOUS,
  USER,
  ADMIN;

  /**
   * Whether holding this capability is enough for a route requiring {@code required}.
   *
   * @param required the route's requirement
   * @return true when this level is at least {@code required}
   */
  public boolean satisfies(Capability required) {
    return compareTo(required) >= 0;
  }

  /**
   * Capability granted by a persisted role.
   *
   * @param role the role
   * @return the matching capability
   */
  public static Capability of(Role role) {
    return switch (role) {
      case USER -> USER;
      case ADMIN -> ADMIN;
    };
  }
}
