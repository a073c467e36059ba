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

package io.github.suppierk.decider.cqrs;

import io.github.suppierk.decider.async.DomainEventPublisher;
import io.github.suppierk.decider.exception.ConcurrencyConflictException;
import io.github.suppierk.decider.exception.InvariantViolationException;
import io.github.suppierk.decider.store.Store;
import io.github.suppierk.decider.store.Versioned;
import java.io.Serializable;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single choke point through which every change of an aggregate flows:
 *
 * <ul>
 *   <li>Load the record and its version from the {@link Store}.
 *   <li>Build a view of the aggregate from the record.
 *   <li>Ask the decision for {@link DomainEvent}s.
 *   <li>Fold the events into the record with the {@link DomainProjection}.
 *   <li>Write the record back only if its version did not change in the meantime, otherwise start
 *       over.
 *   <li>Publish the events via {@link DomainEventPublisher}.
 * </ul>
 *
 * <p>No lock is held at any point: concurrent changes of the same aggregate are detected by the
 * store and resolved by running the whole sequence again, so decisions must be free of side
 * effects. Changes of different aggregates never interfere with each other.
 *
 * <p><b>Design note</b>: whichever parameters can be controlled must be covered with null checks
 * and {@code final} (if possible), whichever parameters are expected to be provided by consumer
 * must be checked with the help of {@link Suspicious} methods.
 *
 * @param <ID> the type of the aggregate identifier
 * @param <RECORD> the type of the stored record
 * @param <VIEW> the type of the aggregate view decisions are made upon
 * @param <EVENT> the type of the events produced by decisions
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public final class AggregateRepository<
  ID extends Serializable,
  RECORD,
  VIEW,
  EVENT extends DomainEvent<ID>
> extends Suspicious {
// @formatter:on
  private static final Logger LOGGER = LoggerFactory.getLogger(AggregateRepository.class);

  private final Store<ID, RECORD> store;
  private final DomainProjection<ID, EVENT, RECORD> projection;
  private final Function<RECORD, VIEW> viewFactory;
  private final RetryPolicy retryPolicy;
  private final DomainEventPublisher eventPublisher;
  private final Clock clock;

  /**
   * Constructs a repository with {@link RetryPolicy#defaults()}, no event publishing and system
   * UTC clock.
   *
   * @param store to keep records in
   * @param projection to fold events with
   * @param viewFactory to build aggregate views from records
   */
  public AggregateRepository(
      final Store<ID, RECORD> store,
      final DomainProjection<ID, EVENT, RECORD> projection,
      final Function<RECORD, VIEW> viewFactory) {
    this(
        store,
        projection,
        viewFactory,
        RetryPolicy.defaults(),
        DomainEventPublisher.empty(),
        Clock.systemUTC());
  }

  /**
   * Default constructor.
   *
   * @param store to keep records in
   * @param projection to fold events with
   * @param viewFactory to build aggregate views from records
   * @param retryPolicy to limit attempts on concurrent modifications
   * @param eventPublisher to hand stored events over to
   * @param clock to check deadlines against
   */
  public AggregateRepository(
      final Store<ID, RECORD> store,
      final DomainProjection<ID, EVENT, RECORD> projection,
      final Function<RECORD, VIEW> viewFactory,
      final RetryPolicy retryPolicy,
      final DomainEventPublisher eventPublisher,
      final Clock clock) {
    this.store = throwIllegalArgumentIfNull(store, "Store");
    this.projection = throwIllegalArgumentIfNull(projection, "Projection");
    this.viewFactory = throwIllegalArgumentIfNull(viewFactory, "View factory");
    this.retryPolicy = throwIllegalArgumentIfNull(retryPolicy, "Retry policy");
    this.eventPublisher = throwIllegalArgumentIfNull(eventPublisher, "Event publisher");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
  }

  /**
   * @param id of the aggregate
   * @return the latest stored record of the aggregate
   */
  public Optional<RECORD> find(final ID id) {
    final ID nonNullId = throwIllegalArgumentIfNull(id, "Aggregate identifier");
    return throwIllegalStateIfNull(store.find(nonNullId), "Stored record").map(Versioned::value);
  }

  /**
   * Same as {@link #apply(Serializable, Function, Instant)} without a deadline.
   *
   * @param id of the aggregate
   * @param decision producing events for the current view of the aggregate
   * @return the record after the change, empty only if the aggregate still does not exist
   */
  public Optional<RECORD> apply(
      final ID id, final Function<Optional<VIEW>, List<EVENT>> decision) {
    return apply(id, decision, Instant.MAX);
  }

  /**
   * Runs the decision against the latest state of the aggregate and stores its outcome.
   *
   * <p>Failures of the decision and of the projection are propagated as is, without retrying. An
   * empty list of events is a no-op: nothing is stored or published.
   *
   * @param id of the aggregate
   * @param decision producing events for the current view of the aggregate, empty if the aggregate
   *     does not exist
   * @param deadline after which no further attempt is started
   * @return the record after the change, empty only if the aggregate still does not exist
   * @throws IllegalArgumentException if any argument is null
   * @throws IllegalStateException if the decision, projection or store produced null
   * @throws InvariantViolationException if an event targets another aggregate
   * @throws ConcurrencyConflictException if attempts or time ran out because of concurrent changes
   */
  public Optional<RECORD> apply(
      final ID id, final Function<Optional<VIEW>, List<EVENT>> decision, final Instant deadline) {
    final ID nonNullId = throwIllegalArgumentIfNull(id, "Aggregate identifier");
    final Function<Optional<VIEW>, List<EVENT>> nonNullDecision =
        throwIllegalArgumentIfNull(decision, "Decision");
    final Instant nonNullDeadline = throwIllegalArgumentIfNull(deadline, "Deadline");

    ConcurrencyConflictException lastConflict = null;

    for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
      if (clock.instant().isAfter(nonNullDeadline)) {
        LOGGER.warn(
            "Deadline {} passed for aggregate '{}' after {} attempt(s)",
            nonNullDeadline,
            nonNullId,
            attempt - 1);
        throw new ConcurrencyConflictException(
            nonNullId,
            "Deadline %s passed for aggregate '%s' after %d attempt(s)"
                .formatted(nonNullDeadline, nonNullId, attempt - 1),
            lastConflict);
      }

      final Optional<Versioned<RECORD>> current =
          throwIllegalStateIfNull(store.find(nonNullId), "Stored record");
      final Optional<RECORD> currentRecord = current.map(Versioned::value);
      final Optional<VIEW> view =
          currentRecord.map(
              record -> throwIllegalStateIfNull(viewFactory.apply(record), "Aggregate view"));

      final List<EVENT> decided =
          throwIllegalStateIfNull(nonNullDecision.apply(view), "Decision events");
      for (EVENT event : decided) {
        throwIllegalStateIfNull(event, "Decision event");
      }

      final List<EVENT> events = List.copyOf(decided);

      if (events.isEmpty()) {
        LOGGER.debug("Decision for aggregate '{}' produced no events", nonNullId);
        return currentRecord;
      }

      final RECORD folded = fold(nonNullId, currentRecord, events);
      final long expectedVersion =
          current.map(Versioned::version).orElse(Versioned.ABSENT_VERSION);

      Versioned<RECORD> stored;
      try {
        stored =
            throwIllegalStateIfNull(
                store.upsert(nonNullId, folded, expectedVersion), "Stored record");
      } catch (ConcurrencyConflictException e) {
        LOGGER.debug(
            "Aggregate '{}' changed concurrently, attempt {} of {}",
            nonNullId,
            attempt,
            retryPolicy.maxAttempts());
        lastConflict = e;
        continue;
      }

      for (EVENT event : events) {
        eventPublisher.publish(event);
      }

      return Optional.of(stored.value());
    }

    LOGGER.warn(
        "Aggregate '{}' kept changing concurrently, gave up after {} attempt(s)",
        nonNullId,
        retryPolicy.maxAttempts());
    throw new ConcurrencyConflictException(
        nonNullId,
        "Aggregate '%s' kept changing concurrently, gave up after %d attempt(s)"
            .formatted(nonNullId, retryPolicy.maxAttempts()),
        lastConflict);
  }

  /**
   * @param id of the aggregate every event must belong to
   * @param record to fold events into
   * @param events non-empty list of events to fold in order
   * @return the record after all events were folded
   */
  private RECORD fold(final ID id, final Optional<RECORD> record, final List<EVENT> events) {
    Optional<RECORD> folded = record;

    for (EVENT event : events) {
      if (!id.equals(event.aggregateId())) {
        throw new InvariantViolationException(
            id,
            "Event '%s' targets aggregate '%s' instead of '%s'"
                .formatted(event.getClass().getSimpleName(), event.aggregateId(), id));
      }

      final RECORD next = throwIllegalStateIfNull(projection.fold(folded, event), "Folded record");
      folded = Optional.of(next);
    }

    return folded.orElseThrow();
  }
}
