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

import io.github.suppierk.decider.cqrs.DomainEvent;
import java.util.UUID;

/**
 * Facts about a reservation. The set of events is closed, consumers match it exhaustively with a
 * {@link Visitor}.
 */
public sealed interface ReservationEvent extends DomainEvent<UUID>
    permits ReservationEvent.ReservationCreated,
        ReservationEvent.ReservationConfirmed,
        ReservationEvent.ReservationCanceled {

  /**
   * @param visitor to dispatch to
   * @param <R> is the result type of the visitor
   * @return the result of the matching visitor method
   */
  <R> R accept(final Visitor<R> visitor);

  /**
   * Exhaustive match over {@link ReservationEvent}s.
   *
   * @param <R> is the result type
   */
  interface Visitor<R> {
    R visitCreated(final ReservationCreated event);

    R visitConfirmed(final ReservationConfirmed event);

    R visitCanceled(final ReservationCanceled event);
  }

  /**
   * @param id of the new reservation
   * @param number of the new reservation
   * @param status the reservation starts with
   */
  record ReservationCreated(UUID id, String number, ReservationStatus status)
      implements ReservationEvent {
    public ReservationCreated {
      if (id == null || number == null || status == null) {
        throw new IllegalArgumentException("Reservation created event cannot have null fields");
      }
    }

    @Override
    public UUID aggregateId() {
      return id;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitCreated(this);
    }
  }

  /**
   * @param id of the confirmed reservation
   * @param status the reservation moved to
   */
  record ReservationConfirmed(UUID id, ReservationStatus status) implements ReservationEvent {
    public ReservationConfirmed {
      if (id == null || status == null) {
        throw new IllegalArgumentException("Reservation confirmed event cannot have null fields");
      }
    }

    @Override
    public UUID aggregateId() {
      return id;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitConfirmed(this);
    }
  }

  /**
   * @param id of the canceled reservation
   * @param status the reservation moved to
   */
  record ReservationCanceled(UUID id, ReservationStatus status) implements ReservationEvent {
    public ReservationCanceled {
      if (id == null || status == null) {
        throw new IllegalArgumentException("Reservation canceled event cannot have null fields");
      }
    }

    @Override
    public UUID aggregateId() {
      return id;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitCanceled(this);
    }
  }
}
