package com.whisperecho.gate.server.store;

import com.whisperecho.gate.server.model.UserRecord;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link UserRecordStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All records are lost on server restart. Suitable for development and integration testing
 * only; replace with a database-backed implementation for production.
 */
public class InMemoryUserRecordStore implements UserRecordStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserRecordStore.class);

  private final ConcurrentHashMap<String, UserRecord> store = new ConcurrentHashMap<>();

  public InMemoryUserRecordStore() {
    log.warn("Using InMemoryUserRecordStore. Users will NOT survive restarts. "
        + "Replace with a persistent UserRecordStore for production.");
  }

  /**
   * Stores or replaces a record.
   *
   * @param record the record
   */
  public void put(UserRecord record) {
    store.put(record.id(), record);
    log.debug("Stored user record id={}", record.id());
  }

  /**
   * Removes a record, if present.
   *
   * @param id the user id
   */
  public void remove(String id) {
    store.remove(id);
  }

  @Override
  public Optional<UserRecord> findById(String id) {
    return Optional.ofNullable(store.get(id));
  }
}
