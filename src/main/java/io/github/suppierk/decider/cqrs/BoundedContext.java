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

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Describes the set of interactions possible with one kind of aggregate: {@link
 * DomainCommandHandler}s registered per {@link DomainCommand} class and read access to the stored
 * records.
 *
 * <p>Every command is dispatched to its handler through the {@link AggregateRepository}, which
 * makes the load-decide-fold-persist sequence atomic from the caller's perspective.
 *
 * <p>Handlers are expected to be registered once, typically in the constructor of a subclass.
 * Registration and lookup are guarded by a read-write lock which is never held while a command is
 * being executed.
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
public abstract non-sealed class BoundedContext<
  ID extends Serializable,
  RECORD,
  VIEW,
  EVENT extends DomainEvent<ID>
> extends Suspicious {
// @formatter:on
  private static final Logger LOGGER = LoggerFactory.getLogger(BoundedContext.class);

  private final AggregateRepository<ID, RECORD, VIEW, EVENT> repository;

  private final ReentrantReadWriteLock handlersLock = new ReentrantReadWriteLock();
  private final Map<Class<?>, DomainCommandHandler<ID, ?, VIEW, EVENT>> handlers = new HashMap<>();

  /**
   * Default constructor.
   *
   * @param repository to execute commands with
   */
  protected BoundedContext(final AggregateRepository<ID, RECORD, VIEW, EVENT> repository) {
    this.repository = throwIllegalArgumentIfNull(repository, "Repository");
  }

  /**
   * @param handler to register for its {@link DomainCommandHandler#getCommandClass()}
   * @throws IllegalArgumentException if handler is null
   * @throws IllegalStateException if a handler for the same command class is already registered
   */
  public final void addDomainCommandHandler(
      final DomainCommandHandler<ID, ? extends DomainCommand<ID>, VIEW, EVENT> handler) {
    final var nonNullHandler = throwIllegalArgumentIfNull(handler, "Command handler");
    final Class<?> commandClass =
        throwIllegalStateIfNull(nonNullHandler.getCommandClass(), "Command handler class");

    handlersLock.writeLock().lock();
    try {
      if (handlers.containsKey(commandClass)) {
        throw new IllegalStateException(
            "Handler for '%s' command is already registered"
                .formatted(commandClass.getSimpleName()));
      }

      handlers.put(commandClass, nonNullHandler);
    } finally {
      handlersLock.writeLock().unlock();
    }

    LOGGER.info("Registered handler for '{}' command", commandClass.getSimpleName());
  }

  /**
   * @return command classes this context can execute
   */
  public final Set<Class<?>> getSupportedDomainCommandClasses() {
    handlersLock.readLock().lock();
    try {
      return Set.copyOf(handlers.keySet());
    } finally {
      handlersLock.readLock().unlock();
    }
  }

  /**
   * Same as {@link #execute(DomainCommand, Instant)} without a deadline.
   *
   * @param command to execute
   * @return the record after the command, empty only if the aggregate still does not exist
   */
  public final Optional<RECORD> execute(final DomainCommand<ID> command) {
    return execute(command, Instant.MAX);
  }

  /**
   * Dispatches the command to its handler.
   *
   * @param command to execute
   * @param deadline after which no further attempt is started on concurrent modifications
   * @return the record after the command, empty only if the aggregate still does not exist
   * @throws IllegalArgumentException if any argument is null
   * @throws IllegalStateException if the command has no aggregate identifier
   * @throws UnsupportedOperationException if no handler is registered for the command class
   * @see AggregateRepository#apply(Serializable, java.util.function.Function, Instant)
   */
  public final Optional<RECORD> execute(final DomainCommand<ID> command, final Instant deadline) {
    final DomainCommand<ID> nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final Instant nonNullDeadline = throwIllegalArgumentIfNull(deadline, "Deadline");
    final ID id =
        throwIllegalStateIfNull(nonNullCommand.aggregateId(), "Command's aggregate identifier");

    final DomainCommandHandler<ID, DomainCommand<ID>, VIEW, EVENT> handler =
        throwUnsupportedOperationIfNull(
            findHandler(nonNullCommand.getClass()),
            "Handler for '%s' command".formatted(nonNullCommand.getClass().getSimpleName()));

    LOGGER.debug(
        "Dispatching '{}' command to aggregate '{}'",
        nonNullCommand.getClass().getSimpleName(),
        id);

    return repository.apply(
        id, view -> handler.runInContext(nonNullCommand, view), nonNullDeadline);
  }

  /**
   * @param id of the aggregate
   * @return the latest stored record of the aggregate
   * @throws IllegalArgumentException if id is null
   */
  public final Optional<RECORD> find(final ID id) {
    return repository.find(id);
  }

  /**
   * @return {@code true} if handlers are being registered at the moment
   */
  final boolean isAnyWriteLockHeld() {
    return handlersLock.isWriteLocked();
  }

  /**
   * @return {@code true} if handlers are being looked up at the moment
   */
  final boolean isAnyReadLockHeld() {
    return handlersLock.getReadLockCount() > 0;
  }

  @SuppressWarnings("unchecked")
  private DomainCommandHandler<ID, DomainCommand<ID>, VIEW, EVENT> findHandler(
      final Class<?> commandClass) {
    handlersLock.readLock().lock();
    try {
      return (DomainCommandHandler<ID, DomainCommand<ID>, VIEW, EVENT>) handlers.get(commandClass);
    } finally {
      handlersLock.readLock().unlock();
    }
  }
}
