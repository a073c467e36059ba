package io.github.suppierk.decider.exception;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class DomainExceptionTest {
  static final UUID ID = UUID.randomUUID();

  @Test
  void must_have_not_found_http_status_code() {
    final var exception = new AggregateNotFoundException(ID);

    assertEquals(404, exception.getStatusCode());
    assertEquals(ID, exception.getAggregateId());
    assertTrue(exception.getMessage().contains(ID.toString()));
  }

  @Test
  void must_have_conflict_http_status_code_when_aggregate_already_exists() {
    final var exception = new AggregateAlreadyExistsException(ID, "Taken");

    assertEquals(409, exception.getStatusCode());
    assertEquals(ID, exception.getAggregateId());
    assertEquals("Taken", exception.getMessage());
  }

  @Test
  void must_have_unprocessable_content_http_status_code_on_invalid_transition() {
    final var exception = new InvalidTransitionException(ID, "CANCELLED", "CONFIRMED");

    assertEquals(422, exception.getStatusCode());
    assertEquals("CANCELLED", exception.getCurrentState());
    assertEquals("CONFIRMED", exception.getRequestedState());
    assertEquals(
        "Aggregate '%s' cannot move from CANCELLED to CONFIRMED".formatted(ID),
        exception.getMessage());
  }

  @Test
  void must_have_conflict_http_status_code_on_concurrent_modification() {
    final var cause = new ConcurrencyConflictException(ID, 3L);
    final var exception = new ConcurrencyConflictException(ID, "Gave up", cause);

    assertEquals(409, exception.getStatusCode());
    assertEquals("Aggregate '%s' is no longer at version 3".formatted(ID), cause.getMessage());
    assertNull(cause.getCause());
    assertSame(cause, exception.getCause());
  }

  @Test
  void must_have_internal_server_error_http_status_code_on_invariant_violation() {
    final var exception = new InvariantViolationException(ID, "Broken");

    assertEquals(500, exception.getStatusCode());
    assertEquals(ID, exception.getAggregateId());
  }
}
