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

/**
 * Represents an immutable intent to change a single aggregate.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Confirm Reservation' instead of 'Set
 * Reservation status to CONFIRMED'.
 *
 * <p>A command either brings a new aggregate into existence or acts on an existing one. We leverage
 * Java {@code sealed} feature to make this distinction explicit, so that the {@link
 * AggregateRepository} can enforce the presence or absence of prior state before any business logic
 * runs.
 *
 * @param <ID> is the type of the aggregate identifier
 */
// @formatter:off
public sealed interface DomainCommand<
  ID extends Serializable
> extends DomainMessage<ID>
permits
  DomainCommand.Create, DomainCommand.Update
{
// @formatter:on

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to create a new
   * aggregate in the system.
   */
  non-sealed interface Create<ID extends Serializable> extends DomainCommand<ID> {}

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to change an
   * existing aggregate in the system.
   */
  non-sealed interface Update<ID extends Serializable> extends DomainCommand<ID> {}
}
