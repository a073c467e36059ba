package io.github.suppierk.decider.cqrs;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.decider.reservation.CreateReservation;
import io.github.suppierk.decider.reservation.ReservationAggregate;
import io.github.suppierk.decider.reservation.ReservationEvent;
import io.github.suppierk.decider.reservation.ReservationEvent.ReservationCreated;
import io.github.suppierk.decider.reservation.ReservationProjection;
import io.github.suppierk.decider.reservation.ReservationRecord;
import io.github.suppierk.decider.reservation.ReservationStatus;
import io.github.suppierk.decider.store.InMemoryStore;
import io.github.suppierk.test.TestCommands;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BoundedContextTest {
  static class TestContext
      extends BoundedContext<UUID, ReservationRecord, ReservationAggregate, ReservationEvent> {
    TestContext() {
      super(
          new AggregateRepository<>(
              new InMemoryStore<>(), new ReservationProjection(), ReservationAggregate::from));
    }
  }

  static class TestCreateHandler
      extends DomainCommandHandler.Create<
          UUID, CreateReservation, ReservationAggregate, ReservationEvent> {
    TestCreateHandler() {
      super(CreateReservation.class);
    }

    @Override
    protected List<ReservationEvent> decide(CreateReservation command) {
      return List.of(
          new ReservationCreated(command.id(), command.number(), ReservationStatus.PENDING));
    }
  }

  @Nested
  class Construction {
    @Test
    void when_repository_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new BoundedContext<UUID, ReservationRecord, ReservationAggregate, ReservationEvent>(
                  null) {});
    }

    @Test
    void when_adding_null_command_handler_illegal_argument_must_be_thrown() {
      final var context = new TestContext();
      assertThrows(IllegalArgumentException.class, () -> context.addDomainCommandHandler(null));
      assertTrue(context.getSupportedDomainCommandClasses().isEmpty());
    }

    @Test
    void when_adding_existing_command_handler_illegal_state_must_be_thrown() {
      final var context = new TestContext();
      context.addDomainCommandHandler(new TestCreateHandler());

      assertEquals(Set.of(CreateReservation.class), context.getSupportedDomainCommandClasses());
      assertFalse(context.isAnyWriteLockHeld());

      assertThrows(
          IllegalStateException.class,
          () -> context.addDomainCommandHandler(new TestCreateHandler()));
      assertFalse(context.isAnyWriteLockHeld());
    }
  }

  @Nested
  class Execution {
    @Test
    void when_command_is_null_illegal_argument_exception_is_thrown() {
      final var context = new TestContext();
      assertThrows(IllegalArgumentException.class, () -> context.execute(null));
      assertThrows(
          IllegalArgumentException.class,
          () -> context.execute(new CreateReservation(UUID.randomUUID(), "R-1"), null));
    }

    @Test
    void when_command_has_no_aggregate_identifier_illegal_state_exception_is_thrown() {
      final var context = new TestContext();
      assertThrows(
          IllegalStateException.class,
          () -> context.execute(new TestCommands.AnonymousCommand()));
    }

    @Test
    void when_command_is_not_supported_unsupported_operation_exception_is_thrown() {
      final var context = new TestContext();
      context.addDomainCommandHandler(new TestCreateHandler());

      assertThrows(
          UnsupportedOperationException.class,
          () -> context.execute(new TestCommands.UnknownCommand(UUID.randomUUID())));
      assertFalse(context.isAnyReadLockHeld());
    }

    @Test
    void when_command_is_supported_it_is_dispatched_and_record_is_readable() {
      final var context = new TestContext();
      context.addDomainCommandHandler(new TestCreateHandler());
      final var id = UUID.randomUUID();

      final var result =
          assertDoesNotThrow(
              () -> context.execute(new CreateReservation(id, "R-1"), Instant.MAX));

      final var expected = new ReservationRecord(id, "R-1", ReservationStatus.PENDING);
      assertEquals(expected, result.orElseThrow());
      assertEquals(expected, context.find(id).orElseThrow());
      assertFalse(context.isAnyReadLockHeld());
      assertFalse(context.isAnyWriteLockHeld());
    }

    @Test
    void when_aggregate_is_unknown_find_returns_empty() {
      final var context = new TestContext();
      assertTrue(context.find(UUID.randomUUID()).isEmpty());
      assertThrows(IllegalArgumentException.class, () -> context.find(null));
    }
  }
}
