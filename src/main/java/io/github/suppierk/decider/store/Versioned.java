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

/**
 * A stored value stamped with the version it was written at.
 *
 * @param value as stored
 * @param version of the value, starting from {@link #FIRST_VERSION}
 * @param <RECORD> the type of the stored value
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public record Versioned<RECORD>(RECORD value, long version) {
  /** Version to expect when the value must not exist yet. */
  public static final long ABSENT_VERSION = 0L;

  /** Version assigned to the value by its first write. */
  public static final long FIRST_VERSION = 1L;

  public Versioned {
    if (value == null) {
      throw new IllegalArgumentException("Versioned value cannot be null");
    }

    if (version < FIRST_VERSION) {
      throw new IllegalArgumentException(
          "Version must be at least %d, got %d".formatted(FIRST_VERSION, version));
    }
  }
}
