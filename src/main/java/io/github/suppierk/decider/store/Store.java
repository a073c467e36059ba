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

/**
 * Abstract contract for keyed storage of version-stamped records.
 *
 * <p>Implementations must serialize writes per identity only: writes for different identities
 * must not wait for each other. Implementations may block on I/O - callers never hold locks while
 * invoking them.
 *
 * @param <ID> the type of the record identity
 * @param <RECORD> the type of the stored record
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public interface Store<ID extends Serializable, RECORD> {
  /**
   * @param id of the record
   * @return the latest stored record along with its version, or empty if none was stored yet
   */
  Optional<Versioned<RECORD>> find(final ID id);

  /**
   * Compare-and-swap write of the record.
   *
   * @param id of the record
   * @param record to store
   * @param expectedVersion the caller read before deciding on the change, {@link
   *     Versioned#ABSENT_VERSION} when the record must not exist yet
   * @return stored record with version {@code expectedVersion + 1}
   * @throws ConcurrencyConflictException if the stored version differs from {@code
   *     expectedVersion}
   */
  Versioned<RECORD> upsert(final ID id, final RECORD record, final long expectedVersion);
}
