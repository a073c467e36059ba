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
 * Thrown when a command cannot be applied to the current state of an aggregate, e.g. confirming an
 * already cancelled reservation.
 */
public class InvalidTransitionException extends DomainException {
  @Serial private static final long serialVersionUID = 2203794021893326617L;

  private final String currentState;
  private final String requestedState;

  /**
   * @param aggregateId which rejected the command
   * @param currentState the aggregate is in
   * @param requestedState the command attempted to move the aggregate to
   */
  public InvalidTransitionException(
      Serializable aggregateId, String currentState, String requestedState) {
    super(
        aggregateId,
        "Aggregate '%s' cannot move from %s to %s"
            .formatted(aggregateId, currentState, requestedState));
    this.currentState = currentState;
    this.requestedState = requestedState;
  }

  /**
   * @return the state the aggregate was in when the command was rejected
   */
  public String getCurrentState() {
    return currentState;
  }

  /**
   * @return the state the command attempted to reach
   */
  public String getRequestedState() {
    return requestedState;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/422">422 Unprocessable
   *     Content</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 422;
  }
}
