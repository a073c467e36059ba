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

/** Thrown when a command or an event targets an aggregate which does not exist yet. */
public class AggregateNotFoundException extends DomainException {
  @Serial private static final long serialVersionUID = 4418503957013460672L;

  /**
   * @param aggregateId which was not found
   */
  public AggregateNotFoundException(Serializable aggregateId) {
    this(aggregateId, "Aggregate '%s' does not exist".formatted(aggregateId));
  }

  /**
   * @param aggregateId which was not found
   * @param message the detail message
   */
  public AggregateNotFoundException(Serializable aggregateId, String message) {
    super(aggregateId, message);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/404">404 Not Found</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 404;
  }
}
