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

import io.github.suppierk.decider.exception.InvalidTransitionException;
import io.github.suppierk.decider.reservation.ReservationEvent.ReservationCanceled;
import io.github.suppierk.decider.reservation.ReservationEvent.ReservationConfirmed;
import io.github.suppierk.decider.reservation.ReservationEvent.ReservationCreated;
import java.util.List;
import java.util.UUID;

/**
 * Decision logic of a reservation.
 *
 * <p>Instances are rebuilt from {@link ReservationRecord} right before every decision and thrown
 * away afterwards. None of the methods have side effects.
 */
public final class ReservationAggregate {
  private final UUID id;
  private final String number;
  private final ReservationStatus status;

  private ReservationAggregate(final UUID id, final String number, final ReservationStatus status) {
    this.id = id;
    this.number = number;
    this.status = status;
  }

  /**
   * @param record to rebuild the aggregate from
   * @return aggregate in the state of the record
   * @throws IllegalArgumentException if record is null
   */
  public static ReservationAggregate from(final ReservationRecord record) {
    if (record == null) {
      throw new IllegalArgumentException("Reservation record cannot be null");
    }

    return new ReservationAggregate(record.id(), record.number(), record.status());
  }

  /**
   * @param command to create a reservation
   * @return events bringing the reservation into existence
   */
  public static List<ReservationEvent> create(final CreateReservation command) {
    return List.of(
        new ReservationCreated(command.id(), command.number(), ReservationStatus.PENDING));
  }

  /**
   * @param command to confirm this reservation
   * @return events confirming the reservation
   * @throws InvalidTransitionException if the reservation is not pending
   */
  public List<ReservationEvent> confirm(final ConfirmReservation command) {
    requireTransitionTo(ReservationStatus.CONFIRMED);
    return List.of(new ReservationConfirmed(id, ReservationStatus.CONFIRMED));
  }

  /**
   * @param command to cancel this reservation
   * @return events canceling the reservation
   * @throws InvalidTransitionException if the reservation is already cancelled
   */
  public List<ReservationEvent> cancel(final CancelReservation command) {
    requireTransitionTo(ReservationStatus.CANCELLED);
    return List.of(new ReservationCanceled(id, ReservationStatus.CANCELLED));
  }

  public UUID getId() {
    return id;
  }

  public String getNumber() {
    return number;
  }

  public ReservationStatus getStatus() {
    return status;
  }

  private void requireTransitionTo(final ReservationStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidTransitionException(id, status.name(), target.name());
    }
  }
}
