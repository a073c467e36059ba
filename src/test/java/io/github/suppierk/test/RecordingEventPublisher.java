package io.github.suppierk.test;

import io.github.suppierk.decider.async.DomainEventPublisher;
import io.github.suppierk.decider.cqrs.DomainEvent;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingEventPublisher implements DomainEventPublisher {
  private final List<DomainEvent<?>> events = new CopyOnWriteArrayList<>();

  @Override
  public <E extends DomainEvent<?>> void publish(E event) {
    events.add(event);
  }

  public List<DomainEvent<?>> getEvents() {
    return List.copyOf(events);
  }

  public long count(Class<?> eventClass) {
    return events.stream().filter(eventClass::isInstance).count();
  }
}
