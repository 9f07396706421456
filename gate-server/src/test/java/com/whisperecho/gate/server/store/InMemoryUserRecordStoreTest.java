package com.whisperecho.gate.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.whisperecho.gate.server.model.Role;
import com.whisperecho.gate.server.model.UserRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryUserRecordStoreTest {

  private InMemoryUserRecordStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryUserRecordStore();
  }

  @Test
  void putAndFind_roundTrip() {
    UserRecord record = new UserRecord("u1", "alice", "alice@example.com", Role.USER, "$2a$hash");
    store.put(record);

    assertThat(store.findById("u1")).contains(record);
  }

  @Test
  void findById_unknown_returnsEmpty() {
    assertThat(store.findById("missing")).isEmpty();
  }

  @Test
  void remove_makesRecordUnresolvable() {
    store.put(new UserRecord("u1", "alice", "alice@example.com", Role.USER, "$2a$hash"));
    store.remove("u1");

    assertThat(store.findById("u1")).isEmpty();
  }

  @Test
  void toString_omitsPasswordHash() {
    UserRecord record = new UserRecord("u1", "alice", "alice@example.com", Role.USER, "$2a$hash");

    assertThat(record.toString()).doesNotContain("$2a$hash");
  }
}
