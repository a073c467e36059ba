package io.github.suppierk.decider.async;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import io.github.suppierk.decider.reservation.ReservationEvent.ReservationConfirmed;
import io.github.suppierk.decider.reservation.ReservationStatus;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class DomainEventPublisherTest {
  @Test
  void when_empty_publisher_is_requested_it_must_not_be_null_and_it_must_be_functional() {
    final var publisher = DomainEventPublisher.empty();

    assertNotNull(publisher);
    assertSame(publisher, DomainEventPublisher.empty());
    assertDoesNotThrow(() -> publisher.publish(null));
    assertDoesNotThrow(
        () ->
            publisher.publish(
                new ReservationConfirmed(UUID.randomUUID(), ReservationStatus.CONFIRMED)));
  }
}
