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

/**
 * Defines general contract rules used by the codebase.
 *
 * <p>Here is an example to help explain how different domain objects are related to each other -
 * let's assume that we are running a front desk which takes reservations:
 *
 * <ul>
 *   <li>A guest asking to book, confirm or cancel is a {@link
 *       io.github.suppierk.decider.cqrs.DomainCommand}. It only states an intent and may be
 *       rejected.
 *   <li>The front desk clerk is a {@link io.github.suppierk.decider.cqrs.DomainCommandHandler}:
 *       <ul>
 *         <li>The clerk looks the booking up first. Booking twice under the same identifier or
 *             confirming a booking which was never made is refused without looking any further.
 *         <li>Then the clerk checks the booking itself, for example that a cancelled booking
 *             cannot be confirmed, and writes down what happened as {@link
 *             io.github.suppierk.decider.cqrs.DomainEvent}s.
 *       </ul>
 *   <li>The reservation book is a {@link io.github.suppierk.decider.store.Store}, and copying
 *       events into its pages is a {@link io.github.suppierk.decider.cqrs.DomainProjection}.
 *   <li>When two clerks serve the same booking at once, the {@link
 *       io.github.suppierk.decider.cqrs.AggregateRepository} notices that the page changed while
 *       the second clerk was deciding and lets that clerk look at the page again.
 *   <li>The front desk as a whole, with all its clerks, is a {@link
 *       io.github.suppierk.decider.cqrs.BoundedContext}.
 * </ul>
 */
package io.github.suppierk.decider.cqrs;
