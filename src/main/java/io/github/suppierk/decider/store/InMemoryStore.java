/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.decider.store;

import io.github.suppierk.decider.exception.ConcurrencyConflictException;
import java.io.Serializable;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Store} keeping records in memory.
 *
 * <p>Each write is a single {@link ConcurrentMap#compute} call, which is atomic per key and does
 * not block writers of other keys.
 *
 * @param <ID> the type of the record identity
 * @param <RECORD> the type of the stored record
 */
@SuppressWarnings("squid:S119")
public final class InMemoryStore<ID extends Serializable, RECORD> implements Store<ID, RECORD> {
  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryStore.class);

  private final ConcurrentMap<ID, Versioned<RECORD>> records = new ConcurrentHashMap<>();

  /** {@inheritDoc} */
  @Override
  public Optional<Versioned<RECORD>> find(final ID id) {
    if (id == null) {
      throw new IllegalArgumentException("Identifier cannot be null");
    }

    return Optional.ofNullable(records.get(id));
  }

  /** {@inheritDoc} */
  @Override
  public Versioned<RECORD> upsert(final ID id, final RECORD record, final long expectedVersion) {
    if (id == null) {
      throw new IllegalArgumentException("Identifier cannot be null");
    }

    if (record == null) {
      throw new IllegalArgumentException("Record cannot be null");
    }

    final Versioned<RECORD> stored =
        records.compute(
            id,
            (key, current) -> {
              final long currentVersion =
                  current == null ? Versioned.ABSENT_VERSION : current.version();

              if (currentVersion != expectedVersion) {
                throw new ConcurrencyConflictException(key, expectedVersion);
              }

              return new Versioned<>(record, expectedVersion + 1);
            });

    LOGGER.debug("Stored '{}' at version {}", id, stored.version());
    return stored;
  }

  /**
   * @return amount of stored records
   */
  public int size() {
    return records.size();
  }
}
