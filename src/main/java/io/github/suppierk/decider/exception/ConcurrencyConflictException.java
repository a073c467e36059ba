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

package io.github.suppierk.decider.exception;

import java.io.Serial;
import java.io.Serializable;

/**
 * Thrown when an optimistic write failed because the record changed between load and persist.
 *
 * <p>Stores raise it for a single failed compare-and-swap. The repository retries those internally
 * and raises it again, with the last store failure as its cause, once its retry budget or the
 * caller's deadline is spent.
 */
public class ConcurrencyConflictException extends DomainException {
  @Serial private static final long serialVersionUID = 6950244115924085736L;

  /**
   * @param aggregateId which was modified concurrently
   * @param expectedVersion the writer based its change on
   */
  public ConcurrencyConflictException(Serializable aggregateId, long expectedVersion) {
    this(
        aggregateId,
        "Aggregate '%s' is no longer at version %d".formatted(aggregateId, expectedVersion));
  }

  /**
   * @param aggregateId which was modified concurrently
   * @param message the detail message
   */
  public ConcurrencyConflictException(Serializable aggregateId, String message) {
    super(aggregateId, message);
  }

  /**
   * @param aggregateId which was modified concurrently
   * @param message the detail message
   * @param cause the last conflict observed, can be {@code null}
   */
  public ConcurrencyConflictException(Serializable aggregateId, String message, Throwable cause) {
    super(aggregateId, message, cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 409;
  }
}
