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

import io.github.suppierk.decider.exception.AggregateAlreadyExistsException;
import io.github.suppierk.decider.exception.AggregateNotFoundException;
import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Class to accept and decide upon a specific {@link DomainCommand}:
 *
 * <ul>
 *   <li>Assert that the aggregate exists or does not exist, depending on the command variant.
 *   <li>Run the business logic, producing an ordered list of {@link DomainEvent}s.
 *   <li>Assert that the business logic did not produce {@code null}s.
 * </ul>
 *
 * <p>Handlers never touch the storage: they receive a view of the aggregate built by the {@link
 * AggregateRepository} and must be pure, since the repository invokes them again whenever the
 * aggregate was concurrently modified.
 *
 * <p>Because {@link DomainCommand} leverages new Java {@code sealed} feature, for more type safety
 * this class also makes use of the same feature.
 *
 * @param <ID> the type of the aggregate identifier
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @param <VIEW> the type of the aggregate view the decision is made upon
 * @param <EVENT> the type of the events produced by the decision
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainCommandHandler<
  ID extends Serializable,
  COMMAND extends DomainCommand<ID>,
  VIEW,
  EVENT extends DomainEvent<ID>
>
extends
  Suspicious
permits
  DomainCommandHandler.Create, DomainCommandHandler.Update
{
// @formatter:on
  private final Class<COMMAND> commandClass;

  /**
   * Constructs a new {@link DomainCommandHandler} for a specific {@link DomainCommand} class.
   *
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @throws IllegalArgumentException if the command class is null
   */
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
  }

  /**
   * Returns the class type of the command being handled by this {@link DomainCommandHandler}.
   *
   * @return the class type of the command
   */
  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  /**
   * Checks the prior state and executes the business logic of the command.
   *
   * @param command being executed
   * @param view of the aggregate, empty if the aggregate does not exist
   * @return events produced by the command
   */
  protected abstract List<EVENT> internalRunContract(
      final COMMAND command, final Optional<VIEW> view);

  /**
   * General business logic invocation to be used by {@link BoundedContext}.
   *
   * <p>This method is package-private as it is intended to be invoked by {@link BoundedContext}
   * only.
   *
   * @param command being executed
   * @param view of the aggregate, empty if the aggregate does not exist
   * @return immutable list of events produced by the command
   * @throws IllegalArgumentException if the command is null
   * @throws IllegalStateException if command identifier, view or produced events are null
   */
  final List<EVENT> runInContext(final COMMAND command, final Optional<VIEW> view) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    throwIllegalStateIfNull(nonNullCommand.aggregateId(), "Command's aggregate identifier");
    final Optional<VIEW> nonNullView = throwIllegalStateIfNull(view, "Aggregate view");

    final List<EVENT> events =
        throwIllegalStateIfNull(
            internalRunContract(nonNullCommand, nonNullView), "Command handler events");

    for (EVENT event : events) {
      throwIllegalStateIfNull(event, "Command handler event");
    }

    return List.copyOf(events);
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Create}.
   *
   * @param <ID> the type of the aggregate identifier
   * @param <CREATE> the type of the particular {@link DomainCommand.Create}
   * @param <VIEW> the type of the aggregate view
   * @param <EVENT> the type of the produced events
   */
  // @formatter:off
  public abstract static non-sealed class Create<
    ID extends Serializable,
    CREATE extends DomainCommand.Create<ID>,
    VIEW,
    EVENT extends DomainEvent<ID>
  > extends DomainCommandHandler<ID, CREATE, VIEW, EVENT> {
  // @formatter:on
    protected Create(final Class<CREATE> commandClass) {
      super(commandClass);
    }

    /**
     * Business logic to bring a new aggregate into existence.
     *
     * @param command containing the data required to create the aggregate
     * @return events describing the creation
     */
    protected abstract List<EVENT> decide(final CREATE command);

    /**
     * {@inheritDoc}
     *
     * @throws AggregateAlreadyExistsException if the view is present
     */
    @Override
    protected final List<EVENT> internalRunContract(
        final CREATE command, final Optional<VIEW> view) {
      if (view.isPresent()) {
        throw new AggregateAlreadyExistsException(command.aggregateId());
      }

      return decide(command);
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Update}.
   *
   * @param <ID> the type of the aggregate identifier
   * @param <UPDATE> the type of the particular {@link DomainCommand.Update}
   * @param <VIEW> the type of the aggregate view
   * @param <EVENT> the type of the produced events
   */
  // @formatter:off
  public abstract static non-sealed class Update<
    ID extends Serializable,
    UPDATE extends DomainCommand.Update<ID>,
    VIEW,
    EVENT extends DomainEvent<ID>
  > extends DomainCommandHandler<ID, UPDATE, VIEW, EVENT> {
  // @formatter:on
    protected Update(final Class<UPDATE> commandClass) {
      super(commandClass);
    }

    /**
     * Business logic to change an existing aggregate.
     *
     * @param command containing the data required to change the aggregate
     * @param view of the aggregate as currently stored
     * @return events describing the change, empty if nothing has to change
     */
    protected abstract List<EVENT> decide(final UPDATE command, final VIEW view);

    /**
     * {@inheritDoc}
     *
     * @throws AggregateNotFoundException if the view is absent
     */
    @Override
    protected final List<EVENT> internalRunContract(
        final UPDATE command, final Optional<VIEW> view) {
      return decide(
          command, view.orElseThrow(() -> new AggregateNotFoundException(command.aggregateId())));
    }
  }
}
