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

/**
 * Defines internal sealed utility for verifying values which cross the boundary between this
 * library and consumer code.
 *
 * <p>Consumers supply the {@link io.github.suppierk.decider.store.Store}, the {@link
 * DomainProjection}, the view factory and the {@link DomainCommandHandler}s. Whatever they return
 * (stored records, folded records, views, events) is checked for {@code null} right where it
 * enters the {@link AggregateRepository} loop, so that a faulty implementation fails with a message
 * naming the culprit instead of a {@link NullPointerException} somewhere further down.
 *
 * <ul>
 *   <li>Arguments of public methods are rejected with {@link IllegalArgumentException}.
 *   <li>Values produced by consumer code are rejected with {@link IllegalStateException}.
 *   <li>Commands without a registered handler are rejected with {@link
 *       UnsupportedOperationException}.
 * </ul>
 */
abstract sealed class Suspicious permits AggregateRepository, BoundedContext, DomainCommandHandler {
  /**
   * This method must be used whenever we deal with values produced by user code or properties of
   * method arguments.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(T value, String whatMustNotBeNull)
      throws IllegalStateException {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * This method must be used whenever we deal with method arguments only. When we need to check
   * method argument properties use {@link #throwIllegalStateIfNull(Object, String)} instead.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T throwIllegalArgumentIfNull(T value, String whatMustNotBeNull)
      throws IllegalArgumentException {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * This method must be used whenever we cannot provide services because expected resource was
   * missing, for example when no handler was registered for a command.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws UnsupportedOperationException when the value is {@code null}
   */
  protected final <T> T throwUnsupportedOperationIfNull(T value, String whatMustNotBeNull)
      throws UnsupportedOperationException {
    if (value == null) {
      throw new UnsupportedOperationException("%s is null".formatted(whatMustNotBeNull));
    }

    return value;
  }
}
