package io.github.suppierk.test;

import io.github.suppierk.decider.store.Store;
import io.github.suppierk.decider.store.Versioned;
import java.io.Serializable;
import java.util.Optional;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Once armed, holds the next {@code parties} reads until all of them arrived, so that every reader
 * observes the same version before any of them writes.
 */
public final class RendezvousStore<ID extends Serializable, RECORD> implements Store<ID, RECORD> {
  private final Store<ID, RECORD> delegate;
  private final AtomicInteger remainingParties = new AtomicInteger();
  private volatile CyclicBarrier barrier;

  public RendezvousStore(Store<ID, RECORD> delegate) {
    this.delegate = delegate;
  }

  public void arm(int parties) {
    barrier = new CyclicBarrier(parties);
    remainingParties.set(parties);
  }

  @Override
  public Optional<Versioned<RECORD>> find(ID id) {
    final Optional<Versioned<RECORD>> result = delegate.find(id);

    if (remainingParties.getAndDecrement() > 0) {
      try {
        barrier.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException(e);
      } catch (Exception e) {
        throw new IllegalStateException(e);
      }
    }

    return result;
  }

  @Override
  public Versioned<RECORD> upsert(ID id, RECORD record, long expectedVersion) {
    return delegate.upsert(id, record, expectedVersion);
  }
}
