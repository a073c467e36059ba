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

import java.util.UUID;

/**
 * Queryable state of a reservation.
 *
 * @param id of the reservation
 * @param number of the reservation
 * @param status the reservation is in
 */
public record ReservationRecord(UUID id, String number, ReservationStatus status) {
  public ReservationRecord {
    if (id == null) {
      throw new IllegalArgumentException("Reservation identifier cannot be null");
    }

    if (number == null) {
      throw new IllegalArgumentException("Reservation number cannot be null");
    }

    if (status == null) {
      throw new IllegalArgumentException("Reservation status cannot be null");
    }
  }

  /**
   * @param newStatus to replace the current one with
   * @return a copy of this record in the new status
   */
  public ReservationRecord withStatus(final ReservationStatus newStatus) {
    return new ReservationRecord(id, number, newStatus);
  }
}
