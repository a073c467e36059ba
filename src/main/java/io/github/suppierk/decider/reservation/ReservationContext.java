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

import io.github.suppierk.decider.async.DomainEventPublisher;
import io.github.suppierk.decider.cqrs.AggregateRepository;
import io.github.suppierk.decider.cqrs.BoundedContext;
import io.github.suppierk.decider.cqrs.RetryPolicy;
import io.github.suppierk.decider.exception.AggregateNotFoundException;
import io.github.suppierk.decider.store.InMemoryStore;
import io.github.suppierk.decider.store.Store;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Entry point for reservations: accepts {@link CreateReservation}, {@link ConfirmReservation} and
 * {@link CancelReservation} and serves the resulting {@link ReservationRecord}s.
 *
 * <p>Safe for concurrent use. Commands for different reservations never contend, commands for the
 * same reservation are serialized by optimistic retries.
 */
public final class ReservationContext
    extends BoundedContext<UUID, ReservationRecord, ReservationAggregate, ReservationEvent> {

  /**
   * Constructs a context with default retries, no event publishing and system UTC clock.
   *
   * @param store to keep reservations in
   */
  public ReservationContext(final Store<UUID, ReservationRecord> store) {
    this(store, RetryPolicy.defaults(), DomainEventPublisher.empty(), Clock.systemUTC());
  }

  /**
   * Default constructor.
   *
   * @param store to keep reservations in
   * @param retryPolicy to limit attempts on concurrent modifications
   * @param eventPublisher to hand stored events over to
   * @param clock to check deadlines against
   * @throws IllegalArgumentException if any argument is null
   */
  public ReservationContext(
      final Store<UUID, ReservationRecord> store,
      final RetryPolicy retryPolicy,
      final DomainEventPublisher eventPublisher,
      final Clock clock) {
    super(
        new AggregateRepository<>(
            store,
            new ReservationProjection(),
            ReservationAggregate::from,
            retryPolicy,
            eventPublisher,
            clock));

    addDomainCommandHandler(new CreateReservationHandler());
    addDomainCommandHandler(new ConfirmReservationHandler());
    addDomainCommandHandler(new CancelReservationHandler());
  }

  /**
   * @return context keeping reservations in memory
   */
  public static ReservationContext inMemory() {
    return new ReservationContext(new InMemoryStore<>());
  }

  public ReservationRecord createReservation(final CreateReservation command) {
    return createReservation(command, Instant.MAX);
  }

  /**
   * @param command to execute
   * @param deadline after which no further attempt is started on concurrent modifications
   * @return the new reservation
   */
  public ReservationRecord createReservation(
      final CreateReservation command, final Instant deadline) {
    return execute(command, deadline)
        .orElseThrow(() -> new AggregateNotFoundException(command.id()));
  }

  public ReservationRecord confirmReservation(final ConfirmReservation command) {
    return confirmReservation(command, Instant.MAX);
  }

  /**
   * @param command to execute
   * @param deadline after which no further attempt is started on concurrent modifications
   * @return the confirmed reservation
   */
  public ReservationRecord confirmReservation(
      final ConfirmReservation command, final Instant deadline) {
    return execute(command, deadline)
        .orElseThrow(() -> new AggregateNotFoundException(command.id()));
  }

  public ReservationRecord cancelReservation(final CancelReservation command) {
    return cancelReservation(command, Instant.MAX);
  }

  /**
   * @param command to execute
   * @param deadline after which no further attempt is started on concurrent modifications
   * @return the cancelled reservation
   */
  public ReservationRecord cancelReservation(
      final CancelReservation command, final Instant deadline) {
    return execute(command, deadline)
        .orElseThrow(() -> new AggregateNotFoundException(command.id()));
  }
}
