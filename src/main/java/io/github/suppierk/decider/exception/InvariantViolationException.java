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
 * Thrown when decisions and projections disagree with each other, e.g. an event is folded onto a
 * record of another aggregate.
 *
 * <p>Must be unreachable for correctly written deciders - seeing it signals a bug.
 */
public class InvariantViolationException extends DomainException {
  @Serial private static final long serialVersionUID = -8811342370937145283L;

  /**
   * @param aggregateId which state is inconsistent
   * @param message the detail message
   */
  public InvariantViolationException(Serializable aggregateId, String message) {
    super(aggregateId, message);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/500">500 Internal
   *     Server Error</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 500;
  }
}
