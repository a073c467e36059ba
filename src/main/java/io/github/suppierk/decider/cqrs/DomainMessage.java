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
 * Describes general properties of messages exchanged with an aggregate.
 *
 * @param <ID> is the type of the aggregate identifier
 */
public interface DomainMessage<ID extends Serializable> extends Serializable {

  /**
   * Defined as {@code aggregateId()} because:
   *
   * <ul>
   *   <li>{@code getAggregateId()} is not friendly towards Java {@link Record}s.
   *   <li>{@code id()} is quite frequently taken by the record components of the message itself.
   * </ul>
   *
   * @return an identifier of the aggregate this message belongs to
   */
  ID aggregateId();
}
