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
import java.util.Optional;

/**
 * Folds {@link DomainEvent}s, one at a time, into the record which is stored and queried.
 *
 * <p>Projections never validate business rules - those were already checked by the {@link
 * DomainCommandHandler} which produced the event. They only guard against events which cannot
 * belong to the given record at all.
 *
 * @param <ID> the type of the aggregate identifier
 * @param <EVENT> the type of the folded events
 * @param <RECORD> the type of the resulting record
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@FunctionalInterface
@SuppressWarnings("squid:S119")
public interface DomainProjection<ID extends Serializable, EVENT extends DomainEvent<ID>, RECORD> {
  /**
   * @param record current record, empty if the aggregate does not exist yet
   * @param event to fold
   * @return a new record reflecting the event
   */
  RECORD fold(final Optional<RECORD> record, final EVENT event);
}
