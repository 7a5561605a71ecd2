/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import com.google.common.base.Preconditions;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Bounded pool of reusable objects. Objects are cleared before they go back into the pool, so a
 * pooled object never carries data from a previous use. Safe for concurrent use.
 *
 * @param <T> pooled type
 */
public class ObjectPool<T> {

  private final ConcurrentLinkedDeque<T> free = new ConcurrentLinkedDeque<>();
  private final AtomicInteger pooled = new AtomicInteger();
  private final Supplier<T> factory;
  private final Consumer<T> clearer;
  private final int maxPooled;
  private final int size;

  /**
   * @param size nominal size of the pooled objects, callers needing more allocate their own
   * @param maxPooled upper bound on idle objects kept
   * @param factory creates a new object
   * @param clearer empties an object before it is pooled
   */
  public ObjectPool(int size, int maxPooled, Supplier<T> factory, Consumer<T> clearer) {
    Preconditions.checkArgument(size > 0, "pool object size must be positive");
    this.size = size;
    this.maxPooled = maxPooled;
    this.factory = factory;
    this.clearer = clearer;
  }

  public T get() {
    T object = free.pollFirst();
    if (object == null) {
      return factory.get();
    }
    pooled.decrementAndGet();
    return object;
  }

  public void put(T object) {
    if (object == null) {
      return;
    }
    clearer.accept(object);
    if (pooled.incrementAndGet() > maxPooled) {
      pooled.decrementAndGet();
      return;
    }
    free.offerFirst(object);
  }

  /** Nominal size of the pooled objects. */
  public int size() {
    return size;
  }

  public int idle() {
    return pooled.get();
  }
}
