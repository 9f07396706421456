package com.whisperecho.gate.client.manager;

import com.whisperecho.gate.client.model.ElevatedSession;
import com.whisperecho.gate.codec.ElevatedTokenCodec;
import com.whisperecho.gate.model.FailureReason;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the operator's elevated-access session.
 * <p>
 * There is exactly one piece of state, swapped atomically, so the "logged in" flag and the token
 * can never disagree. Nothing is verified locally: the server decides whether the token is good,
 * and {@link #invalidateOn(FailureReason, String)} drops the session when it says no.
 */
@Singleton
public class ElevatedSessionManager {
  private static final Logger log = LoggerFactory.getLogger(ElevatedSessionManager.class);

  private final AtomicReference<ElevatedSession> session = new AtomicReference<>();
  private final Clock clock;

  /**
   * Instantiates a new elevated session manager.
   *
   * @param clock the clock stamping minted tokens
   */
  @Inject
  public ElevatedSessionManager(final Clock clock) {
    this.clock = clock;
  }

  /**
   * Mints an elevated token from the operator-supplied pair and makes it the current session.
   *
   * @param username the operator username
   * @param secret   the operator secret
   * @return the new session
   * @throws IllegalArgumentException if either value is empty or contains the field delimiter
   */
  public ElevatedSession login(final String username, final String secret) {
    final long now = clock.millis();
    final String token = ElevatedTokenCodec.encode(username, secret, now);
    final ElevatedSession created = new ElevatedSession(username, token, clock.instant());
    session.set(created);
    log.info("Elevated session started for {}", username);
    return created;
  }

  public Optional<ElevatedSession> current() {
    return Optional.ofNullable(session.get());
  }

  /**
   * Ends the current session, if any.
   */
  public void logout() {
    final ElevatedSession previous = session.getAndSet(null);
    if (previous != null) {
      log.info("Elevated session ended for {}", previous.username());
    }
  }

  /**
   * Drops the session when the server rejected the elevated token that was sent with a request.
   * <p>
   * Only {@link FailureReason#INVALID_ELEVATED_CREDENTIAL} and {@link FailureReason#NO_CREDENTIAL}
   * condemn the elevated token; bearer failures leave it alone. A session started after the
   * request went out is kept.
   *
   * @param reason    the reason the server gave
   * @param sentToken the elevated token the rejected request carried
   * @return true if a session was dropped
   */
  public boolean invalidateOn(final FailureReason reason, final String sentToken) {
    if (sentToken == null || !condemnsElevatedToken(reason)) {
      return false;
    }
    final ElevatedSession current = session.get();
    if (current == null || !current.token().equals(sentToken) || !session.compareAndSet(current, null)) {
      return false;
    }
    log.warn("Elevated session for {} invalidated: {}", current.username(), reason);
    return true;
  }

  private static boolean condemnsElevatedToken(final FailureReason reason) {
    return reason == FailureReason.INVALID_ELEVATED_CREDENTIAL || reason == FailureReason.NO_CREDENTIAL;
  }
}
