package io.github.suppierk.decider.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.decider.exception.ConcurrencyConflictException;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryStoreTest {
  UUID id;
  InMemoryStore<UUID, String> store;

  @BeforeEach
  void setUp() {
    id = UUID.randomUUID();
    store = new InMemoryStore<>();
  }

  @Nested
  class Find {
    @Test
    void when_id_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> store.find(null));
    }

    @Test
    void when_nothing_was_stored_result_is_empty() {
      assertTrue(store.find(id).isEmpty());
    }
  }

  @Nested
  class Upsert {
    @Test
    void when_any_argument_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () -> store.upsert(null, "value", Versioned.ABSENT_VERSION));
      assertThrows(
          IllegalArgumentException.class, () -> store.upsert(id, null, Versioned.ABSENT_VERSION));
    }

    @Test
    void when_record_is_absent_and_expected_so_it_is_inserted_at_first_version() {
      final var stored = store.upsert(id, "value", Versioned.ABSENT_VERSION);

      assertEquals(new Versioned<>("value", Versioned.FIRST_VERSION), stored);
      assertEquals(stored, store.find(id).orElseThrow());
      assertEquals(1, store.size());
    }

    @Test
    void when_expected_version_matches_record_is_replaced_and_version_incremented() {
      store.upsert(id, "first", Versioned.ABSENT_VERSION);
      final var stored = store.upsert(id, "second", 1L);

      assertEquals(new Versioned<>("second", 2L), stored);
      assertEquals(stored, store.find(id).orElseThrow());
    }

    @Test
    void when_expected_version_is_stale_concurrency_conflict_is_thrown_and_record_kept() {
      store.upsert(id, "first", Versioned.ABSENT_VERSION);
      store.upsert(id, "second", 1L);

      final var exception =
          assertThrows(ConcurrencyConflictException.class, () -> store.upsert(id, "third", 1L));

      assertEquals(id, exception.getAggregateId());
      assertEquals(new Versioned<>("second", 2L), store.find(id).orElseThrow());
    }

    @Test
    void when_record_exists_and_absence_is_expected_concurrency_conflict_is_thrown() {
      store.upsert(id, "first", Versioned.ABSENT_VERSION);

      assertThrows(
          ConcurrencyConflictException.class,
          () -> store.upsert(id, "again", Versioned.ABSENT_VERSION));
    }

    @Test
    void when_record_is_absent_and_version_is_expected_concurrency_conflict_is_thrown() {
      assertThrows(ConcurrencyConflictException.class, () -> store.upsert(id, "value", 1L));
      assertTrue(store.find(id).isEmpty());
    }

    @Test
    void when_different_ids_are_stored_they_do_not_interfere() {
      final var other = UUID.randomUUID();
      store.upsert(id, "first", Versioned.ABSENT_VERSION);
      store.upsert(other, "other", Versioned.ABSENT_VERSION);
      store.upsert(id, "second", 1L);

      assertEquals(new Versioned<>("other", 1L), store.find(other).orElseThrow());
      assertEquals(2, store.size());
    }
  }

  @Nested
  class VersionedValue {
    @Test
    void when_value_is_null_or_version_is_below_first_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new Versioned<>(null, 1L));
      assertThrows(
          IllegalArgumentException.class, () -> new Versioned<>("value", Versioned.ABSENT_VERSION));
    }
  }
}
