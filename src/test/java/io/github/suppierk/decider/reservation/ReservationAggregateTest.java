package io.github.suppierk.decider.reservation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.decider.exception.InvalidTransitionException;
import io.github.suppierk.decider.reservation.ReservationEvent.ReservationCanceled;
import io.github.suppierk.decider.reservation.ReservationEvent.ReservationConfirmed;
import io.github.suppierk.decider.reservation.ReservationEvent.ReservationCreated;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReservationAggregateTest {
  static final UUID ID = UUID.randomUUID();

  static ReservationAggregate aggregate(ReservationStatus status) {
    return ReservationAggregate.from(new ReservationRecord(ID, "R-100", status));
  }

  @Nested
  class Status {
    @Test
    void pending_may_move_to_confirmed_or_cancelled() {
      assertTrue(ReservationStatus.PENDING.canTransitionTo(ReservationStatus.CONFIRMED));
      assertTrue(ReservationStatus.PENDING.canTransitionTo(ReservationStatus.CANCELLED));
      assertFalse(ReservationStatus.PENDING.canTransitionTo(ReservationStatus.PENDING));
    }

    @Test
    void confirmed_may_move_to_cancelled_only() {
      assertTrue(ReservationStatus.CONFIRMED.canTransitionTo(ReservationStatus.CANCELLED));
      assertFalse(ReservationStatus.CONFIRMED.canTransitionTo(ReservationStatus.CONFIRMED));
      assertFalse(ReservationStatus.CONFIRMED.canTransitionTo(ReservationStatus.PENDING));
    }

    @Test
    void cancelled_is_terminal() {
      for (ReservationStatus target : ReservationStatus.values()) {
        assertFalse(ReservationStatus.CANCELLED.canTransitionTo(target));
      }

      assertFalse(ReservationStatus.PENDING.canTransitionTo(null));
    }
  }

  @Nested
  class Commands {
    @Test
    void when_identifier_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new CreateReservation(null, "R-100"));
      assertThrows(IllegalArgumentException.class, () -> new ConfirmReservation(null));
      assertThrows(IllegalArgumentException.class, () -> new CancelReservation(null));
    }

    @Test
    void when_number_is_null_or_blank_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new CreateReservation(ID, null));
      assertThrows(IllegalArgumentException.class, () -> new CreateReservation(ID, " "));
    }

    @Test
    void commands_target_their_reservation() {
      assertEquals(ID, new CreateReservation(ID, "R-100").aggregateId());
      assertEquals(ID, new ConfirmReservation(ID).aggregateId());
      assertEquals(ID, new CancelReservation(ID).aggregateId());
    }
  }

  @Nested
  class Decisions {
    @Test
    void create_yields_pending_reservation() {
      assertEquals(
          List.of(new ReservationCreated(ID, "R-100", ReservationStatus.PENDING)),
          ReservationAggregate.create(new CreateReservation(ID, "R-100")));
    }

    @Test
    void confirm_of_pending_reservation_yields_confirmed_event() {
      assertEquals(
          List.of(new ReservationConfirmed(ID, ReservationStatus.CONFIRMED)),
          aggregate(ReservationStatus.PENDING).confirm(new ConfirmReservation(ID)));
    }

    @Test
    void confirm_of_not_pending_reservation_is_invalid_transition() {
      for (ReservationStatus status :
          List.of(ReservationStatus.CONFIRMED, ReservationStatus.CANCELLED)) {
        final var exception =
            assertThrows(
                InvalidTransitionException.class,
                () -> aggregate(status).confirm(new ConfirmReservation(ID)));

        assertEquals(ID, exception.getAggregateId());
        assertEquals(status.name(), exception.getCurrentState());
        assertEquals(ReservationStatus.CONFIRMED.name(), exception.getRequestedState());
      }
    }

    @Test
    void cancel_of_pending_or_confirmed_reservation_yields_canceled_event() {
      final var expected = List.of(new ReservationCanceled(ID, ReservationStatus.CANCELLED));

      assertEquals(
          expected, aggregate(ReservationStatus.PENDING).cancel(new CancelReservation(ID)));
      assertEquals(
          expected, aggregate(ReservationStatus.CONFIRMED).cancel(new CancelReservation(ID)));
    }

    @Test
    void cancel_of_cancelled_reservation_is_invalid_transition() {
      final var aggregate = aggregate(ReservationStatus.CANCELLED);

      assertThrows(
          InvalidTransitionException.class, () -> aggregate.cancel(new CancelReservation(ID)));
    }

    @Test
    void when_record_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> ReservationAggregate.from(null));
    }
  }
}
