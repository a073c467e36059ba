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

import io.github.suppierk.decider.cqrs.DomainCommand;
import java.util.UUID;

/**
 * Intent to confirm a pending reservation.
 *
 * @param id of the reservation
 */
public record ConfirmReservation(UUID id) implements DomainCommand.Update<UUID> {
  public ConfirmReservation {
    if (id == null) {
      throw new IllegalArgumentException("Reservation identifier cannot be null");
    }
  }

  @Override
  public UUID aggregateId() {
    return id;
  }
}
