package io.github.suppierk.test;

import io.github.suppierk.decider.exception.ConcurrencyConflictException;
import io.github.suppierk.decider.store.Store;
import io.github.suppierk.decider.store.Versioned;
import java.io.Serializable;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/** Rejects the first {@code conflicts} writes as if another writer got there first. */
public final class ConflictingStore<ID extends Serializable, RECORD> implements Store<ID, RECORD> {
  private final Store<ID, RECORD> delegate;
  private final AtomicInteger remainingConflicts;
  private final AtomicInteger upserts = new AtomicInteger();

  public ConflictingStore(Store<ID, RECORD> delegate, int conflicts) {
    this.delegate = delegate;
    this.remainingConflicts = new AtomicInteger(conflicts);
  }

  @Override
  public Optional<Versioned<RECORD>> find(ID id) {
    return delegate.find(id);
  }

  @Override
  public Versioned<RECORD> upsert(ID id, RECORD record, long expectedVersion) {
    upserts.incrementAndGet();

    if (remainingConflicts.getAndDecrement() > 0) {
      throw new ConcurrencyConflictException(id, expectedVersion);
    }

    return delegate.upsert(id, record, expectedVersion);
  }

  public int getUpserts() {
    return upserts.get();
  }
}
