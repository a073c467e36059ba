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

package io.github.suppierk.decider.async;

import io.github.suppierk.decider.cqrs.DomainEvent;

/**
 * Abstract contract for an entity which is able to hand {@link DomainEvent}s over to other parts of
 * the system.
 *
 * <p>Events are published only after the record they were folded into has been stored, one by one,
 * in the order the decider produced them. Implementations are expected to either enqueue the event
 * for later delivery or deliver it quickly, as the caller waits for this method to return.
 *
 * @see <a href="https://microservices.io/patterns/data/transactional-outbox.html">Transactional
 *     outbox</a>
 */
public interface DomainEventPublisher {
  /**
   * @return an instance of publisher which does not perform any operations
   */
  static DomainEventPublisher empty() {
    return NoOp.INSTANCE;
  }

  /**
   * Hands over a single {@link DomainEvent}.
   *
   * @param event to publish
   * @param <E> is a generic {@link DomainEvent} type
   */
  <E extends DomainEvent<?>> void publish(final E event);

  /** Default implementation of the fake publisher */
  final class NoOp implements DomainEventPublisher {
    private static final DomainEventPublisher INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public <E extends DomainEvent<?>> void publish(final E event) {
      // Do nothing
    }
  }
}
