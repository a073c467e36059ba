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

package io.github.suppierk.decider.exception;

import java.io.Serial;
import java.io.Serializable;

/**
 * Common parent of every failure which can be raised while executing a command against an
 * aggregate.
 *
 * <p>Each failure knows which aggregate it relates to and provides the most appropriate HTTP status
 * code, so that a thin service layer can translate it without inspecting the exact type.
 */
public abstract class DomainException extends RuntimeException {
  @Serial private static final long serialVersionUID = -3427150867196311704L;

  private final Serializable aggregateId;

  /**
   * Constructs a new domain exception with the specified detail message.
   *
   * @param aggregateId the identifier of the aggregate which caused the failure, can be {@code
   *     null} when unknown
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  protected DomainException(Serializable aggregateId, String message) {
    super(message);
    this.aggregateId = aggregateId;
  }

  /**
   * Constructs a new domain exception with the specified detail message and cause.
   *
   * @param aggregateId the identifier of the aggregate which caused the failure, can be {@code
   *     null} when unknown
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  protected DomainException(Serializable aggregateId, String message, Throwable cause) {
    super(message, cause);
    this.aggregateId = aggregateId;
  }

  /**
   * @return the identifier of the aggregate which caused the failure
   */
  public final Serializable getAggregateId() {
    return aggregateId;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   */
  public abstract int getStatusCode();
}
