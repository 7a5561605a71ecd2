/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.bitfilter;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/** The bit filters built for one join alias, keyed by the probe side index id. */
class BitFilterTerm {

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, BitFilter> indexFilters;

  BitFilterTerm(int expectedIndexes) {
    this.indexFilters = new HashMap<>(Math.max(4, expectedIndexes * 2));
  }

  BloomFilter getBitFilter(String indexId) {
    BitFilter bitFilter;
    lock.readLock().lock();
    try {
      bitFilter = indexFilters.get(indexId);
    } finally {
      lock.readLock().unlock();
    }
    return bitFilter == null ? null : bitFilter.getFilter();
  }

  boolean setBitFilter(String indexId, BloomFilter filter) {
    BitFilter bitFilter;
    lock.readLock().lock();
    try {
      bitFilter = indexFilters.get(indexId);
    } finally {
      lock.readLock().unlock();
    }
    if (bitFilter == null) {
      lock.writeLock().lock();
      try {
        bitFilter = indexFilters.computeIfAbsent(indexId, id -> new BitFilter());
      } finally {
        lock.writeLock().unlock();
      }
    }
    return bitFilter.setFilter(filter);
  }

  /**
   * Releases one probe reference on a filter.
   *
   * @return true if no filters remain for this alias
   */
  boolean clearBitFilter(String indexId) {
    lock.writeLock().lock();
    try {
      BitFilter bitFilter = indexFilters.get(indexId);
      if (bitFilter != null && bitFilter.clearFilter()) {
        indexFilters.remove(indexId);
      }
      return indexFilters.isEmpty();
    } finally {
      lock.writeLock().unlock();
    }
  }

  BitFilter peek(String indexId) {
    lock.readLock().lock();
    try {
      return indexFilters.get(indexId);
    } finally {
      lock.readLock().unlock();
    }
  }
}
