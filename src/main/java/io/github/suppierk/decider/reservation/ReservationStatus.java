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

package io.github.suppierk.decider.reservation;

/** Lifecycle of a reservation. {@link #CANCELLED} is terminal. */
public enum ReservationStatus {
  PENDING,
  CONFIRMED,
  CANCELLED;

  /**
   * @param target status to move to
   * @return {@code true} if a reservation in this status may move to the target status
   */
  public boolean canTransitionTo(final ReservationStatus target) {
    if (target == null) {
      return false;
    }

    switch (this) {
      case PENDING:
        return target == CONFIRMED || target == CANCELLED;
      case CONFIRMED:
        return target == CANCELLED;
      default:
        return false;
    }
  }
}
