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

/** Thrown when a creation command targets an identity which already has a record. */
public class AggregateAlreadyExistsException extends DomainException {
  @Serial private static final long serialVersionUID = -1529870716254032158L;

  /**
   * @param aggregateId which already exists
   */
  public AggregateAlreadyExistsException(Serializable aggregateId) {
    this(aggregateId, "Aggregate '%s' already exists".formatted(aggregateId));
  }

  /**
   * @param aggregateId which already exists
   * @param message the detail message
   */
  public AggregateAlreadyExistsException(Serializable aggregateId, String message) {
    super(aggregateId, message);
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
