package com.whisperecho.gate.server.store;

import com.whisperecho.gate.server.model.UserRecord;
import java.util.Optional;

/**
 * Read access to persisted user records, keyed by user id.
 * <p>
 * Implementations must be thread-safe. Typical production implementations back this with the
 * application's document database.
 * <p>
 * An absent user is {@link Optional#empty()}. Infrastructure faults must be thrown as
 * {@link UserStoreException} so the gate never mistakes them for a missing user. Lookups may be
 * cancelled by thread interruption and should stop promptly when interrupted.
 */
public interface UserRecordStore {

  /**
   * Loads a user record.
   *
   * @param id the user id
   * @return the record, or empty if no such user exists
   * @throws UserStoreException if the store could not answer
   */
  Optional<UserRecord> findById(String id);
}
