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

package io.github.suppierk.decider.cqrs;

/**
 * Defines how many times {@link AggregateRepository} attempts a command before giving up on
 * concurrent modifications.
 *
 * @param maxAttempts total amount of attempts, including the first one
 */
public record RetryPolicy(int maxAttempts) {
  private static final RetryPolicy DEFAULTS = new RetryPolicy(5);
  private static final RetryPolicy NO_RETRIES = new RetryPolicy(1);

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException(
          "Max attempts must be positive, got %d".formatted(maxAttempts));
    }
  }

  /**
   * @return policy allowing up to five attempts
   */
  public static RetryPolicy defaults() {
    return DEFAULTS;
  }

  /**
   * @return policy failing on the first conflict
   */
  public static RetryPolicy noRetries() {
    return NO_RETRIES;
  }
}
