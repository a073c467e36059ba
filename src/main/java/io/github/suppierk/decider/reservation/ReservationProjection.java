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

import io.github.suppierk.decider.cqrs.DomainProjection;
import io.github.suppierk.decider.exception.AggregateNotFoundException;
import io.github.suppierk.decider.exception.InvariantViolationException;
import io.github.suppierk.decider.reservation.ReservationEvent.ReservationCanceled;
import io.github.suppierk.decider.reservation.ReservationEvent.ReservationConfirmed;
import io.github.suppierk.decider.reservation.ReservationEvent.ReservationCreated;
import java.util.Optional;
import java.util.UUID;

/** Folds {@link ReservationEvent}s into {@link ReservationRecord}. */
public final class ReservationProjection
    implements DomainProjection<UUID, ReservationEvent, ReservationRecord> {

  /** {@inheritDoc} */
  @Override
  public ReservationRecord fold(
      final Optional<ReservationRecord> record, final ReservationEvent event) {
    if (record == null) {
      throw new IllegalArgumentException("Reservation record cannot be null");
    }

    if (event == null) {
      throw new IllegalArgumentException("Reservation event cannot be null");
    }

    return event.accept(
        new ReservationEvent.Visitor<ReservationRecord>() {
          @Override
          public ReservationRecord visitCreated(final ReservationCreated created) {
            if (record.isPresent()) {
              throw new InvariantViolationException(
                  created.id(), "Reservation '%s' already exists".formatted(created.id()));
            }

            return new ReservationRecord(created.id(), created.number(), created.status());
          }

          @Override
          public ReservationRecord visitConfirmed(final ReservationConfirmed confirmed) {
            return existing(confirmed.id()).withStatus(confirmed.status());
          }

          @Override
          public ReservationRecord visitCanceled(final ReservationCanceled canceled) {
            return existing(canceled.id()).withStatus(canceled.status());
          }

          private ReservationRecord existing(final UUID eventId) {
            final ReservationRecord current =
                record.orElseThrow(() -> new AggregateNotFoundException(eventId));

            if (!current.id().equals(eventId)) {
              throw new InvariantViolationException(
                  eventId,
                  "Event for reservation '%s' cannot be applied to reservation '%s'"
                      .formatted(eventId, current.id()));
            }

            return current;
          }
        });
  }
}
