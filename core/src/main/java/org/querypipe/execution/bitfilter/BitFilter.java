/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.bitfilter;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.querypipe.common.exception.ExecutionInternalException;

/**
 * A bloom filter shared between the build side and the probe side of a join. The filter starts in
 * {@link Mode#BUILD} mode, where every parallel build instance merges its own filter in, and moves
 * to {@link Mode#PROBE} on the first {@link #getFilter()}. Builds that arrive after that are
 * rejected. The filter contents are dropped when the last probe instance calls {@link
 * #clearFilter()}.
 */
public class BitFilter {

  /** Lifecycle of a shared filter. */
  public enum Mode {
    BUILD,
    PROBE
  }

  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicInteger count = new AtomicInteger();
  private volatile Mode mode = Mode.BUILD;
  private BloomFilter filter;

  /**
   * Merges a build side filter in. The caller keeps ownership of {@code buildFilter}.
   *
   * @return false if probing has started and the filter was not added
   * @throws ExecutionInternalException if the dimensions do not match
   */
  public boolean setFilter(BloomFilter buildFilter) {
    lock.lock();
    try {
      if (mode == Mode.PROBE) {
        return false;
      }
      if (filter == null) {
        filter = buildFilter.copy();
      } else {
        filter.merge(buildFilter);
      }
      return true;
    } catch (IllegalArgumentException e) {
      throw new ExecutionInternalException("BitFilter merge failed: " + e.getMessage(), e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes a reference to the filter for probing.
   *
   * @throws ExecutionInternalException if the filter is still being built by another caller
   */
  public BloomFilter getFilter() {
    lock.lock();
    try {
      if (count.incrementAndGet() == 1) {
        mode = Mode.PROBE;
      } else if (mode != Mode.PROBE) {
        throw new ExecutionInternalException("Getting bit filter when it's not in probe mode");
      }
      return filter;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Releases a probe reference.
   *
   * @return true if this was the last reference and the contents were dropped
   */
  public boolean clearFilter() {
    if (count.decrementAndGet() <= 0) {
      lock.lock();
      try {
        filter = null;
      } finally {
        lock.unlock();
      }
      return true;
    }
    return false;
  }

  public Mode getMode() {
    return mode;
  }

  public int getRefCount() {
    return count.get();
  }
}
