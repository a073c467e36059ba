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
 * Represents an immutable fact which happened to an aggregate as a result of a {@link
 * DomainCommand}.
 *
 * <p>Events are named in past tense - e.g. 'Reservation Confirmed'. Once folded and persisted they
 * never change.
 *
 * @param <ID> is the type of the aggregate identifier
 */
public interface DomainEvent<ID extends Serializable> extends DomainMessage<ID> {}
