package com.whisperecho.gate.model;

/**
 * Header names and literal values making up the gate's request-side wire contract.
 * <p>
 * Header lookups are case-insensitive in every supported framework; the casing here is the
 * canonical form clients send.
 */
public final class GateHeaders {

  /**
   * Standard bearer identity header: {@code Authorization: Bearer <jwt>}.
   */
  public static final String AUTHORIZATION = "Authorization";

  /**
   * Prefix of the {@link #AUTHORIZATION} value, including the separating space.
   */
  public static final String BEARER_PREFIX = "Bearer ";

  /**
   * Marker header sent by the admin console to request the elevated-access path.
   */
  public static final String ELEVATED_MODE = "X-Admin-Auth";

  /**
   * The only value of {@link #ELEVATED_MODE} that enables the elevated-access path.
   */
  public static final String ELEVATED_MODE_ENABLED = "true";

  /**
   * Header carrying the reversible-encoded elevated-access token.
   */
  public static final String ELEVATED_TOKEN = "X-Admin-Token";

  /**
   * Challenge header added to every 401 response.
   */
  public static final String WWW_AUTHENTICATE = "WWW-Authenticate";

  private GateHeaders() {
  }

  /**
   * Builds the {@code WWW-Authenticate} challenge value for a realm.
   *
   * @param realm the realm name
   * @return the challenge, e.g. {@code Bearer realm="whisperecho"}
   */
  public static String bearerChallenge(String realm) {
    return "Bearer realm=\"" + realm + "\"";
  }
}
