/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.bitfilter;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.log4j.Log4j2;

/**
 * Request wide registry of published bit filters, keyed by the build side join alias and the probe
 * side index id.
 */
@Log4j2
public class BitFilterRegistry {

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, BitFilterTerm> terms = new HashMap<>();

  /**
   * Publishes (or merges) a build side filter.
   *
   * @param alias build side alias
   * @param indexId probe side index id
   * @param expectedIndexes number of index ids expected for this alias, a sizing hint
   * @param filter the locally built filter
   * @return false if probing had already started and the filter was not added
   */
  public boolean setBitFilter(
      String alias, String indexId, int expectedIndexes, BloomFilter filter) {
    BitFilterTerm term;
    lock.readLock().lock();
    try {
      term = terms.get(alias);
    } finally {
      lock.readLock().unlock();
    }
    if (term == null) {
      lock.writeLock().lock();
      try {
        term = terms.computeIfAbsent(alias, a -> new BitFilterTerm(expectedIndexes));
      } finally {
        lock.writeLock().unlock();
      }
    }
    boolean added = term.setBitFilter(indexId, filter);
    if (added) {
      log.debug("Published bit filter {} for {}/{}", filter, alias, indexId);
    }
    return added;
  }

  /**
   * Takes a probe reference on a published filter. The first call switches the filter to probe
   * mode.
   *
   * @return the filter, or null if nothing was published for this key
   */
  public BloomFilter getBitFilter(String alias, String indexId) {
    BitFilterTerm term;
    lock.readLock().lock();
    try {
      term = terms.get(alias);
    } finally {
      lock.readLock().unlock();
    }
    return term == null ? null : term.getBitFilter(indexId);
  }

  /** Releases a probe reference taken with {@link #getBitFilter}. */
  public void clearBitFilter(String alias, String indexId) {
    lock.writeLock().lock();
    try {
      BitFilterTerm term = terms.get(alias);
      if (term != null && term.clearBitFilter(indexId)) {
        terms.remove(alias);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Returns the shared filter state for inspection, or null. */
  public BitFilter peek(String alias, String indexId) {
    lock.readLock().lock();
    try {
      BitFilterTerm term = terms.get(alias);
      return term == null ? null : term.peek(indexId);
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isEmpty() {
    lock.readLock().lock();
    try {
      return terms.isEmpty();
    } finally {
      lock.readLock().unlock();
    }
  }
}
