/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.hash;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiConsumer;
import lombok.extern.log4j.Log4j2;
import org.querypipe.common.exception.ExecutionInternalException;
import org.querypipe.common.exception.HashTableMaxSizeExceededException;
import org.querypipe.data.ValueMarshaller;

/**
 * Open addressing hash table over canonical value keys, used by hash join and in-list evaluation.
 * Keys are compared by their canonical marshalled form; several payloads may share one key.
 *
 * <p>The table moves through distinct modes: it is filled with {@link #put}, then read with {@link
 * #get}/{@link #getNext} or {@link #iterate}, then released with {@link #drop}. Inserting after
 * reading has started, or reading after the table was dropped, is an internal error. Slots are
 * probed with a triangular sequence over a power of two sized array and the array doubles once
 * three quarters of the slots are in use.
 *
 * @param <T> payload type
 */
@Log4j2
public class HashTable<T> {

  public static final int MIN_SIZE = 1024;
  public static final int MIN_SIZE_IN_LIST = 32;
  public static final int MAX_SIZE = 16 * 1024 * 1024;
  static final double LOAD_FACTOR = 0.75;

  private static final HashFunction HASH = Hashing.murmur3_128();

  /** Operating mode. */
  public enum Mode {
    INIT,
    PUT,
    GET,
    GROW,
    ITERATE,
    DROP
  }

  private static final class Entry<T> {
    private final long hashCode;
    private final byte[] key;
    private final Object value;
    private final List<T> payloads = new ArrayList<>(1);

    private Entry(long hashCode, byte[] key, Object value) {
      this.hashCode = hashCode;
      this.key = key;
      this.value = value;
    }
  }

  private final int maxSize;
  private Entry<T>[] buckets;
  private int distinct;
  private int numPayloads;
  private Mode mode = Mode.INIT;

  private Entry<T> cursorEntry;
  private int cursorIndex;

  /** Creates a table for join use sized for the estimated number of distinct keys. */
  public HashTable(double estimatedCardinality) {
    this(initialSize(estimatedCardinality, MIN_SIZE), MAX_SIZE);
  }

  /** Creates a table sized for an in-list of the given length. */
  public static <T> HashTable<T> forInList(int size) {
    return new HashTable<>(initialSize(size, MIN_SIZE_IN_LIST), MAX_SIZE);
  }

  @VisibleForTesting
  @SuppressWarnings("unchecked")
  public HashTable(int initialSize, int maxSize) {
    Preconditions.checkArgument(
        initialSize > 0 && Integer.bitCount(initialSize) == 1,
        "initial size must be a power of two: %s",
        initialSize);
    Preconditions.checkArgument(initialSize <= maxSize, "initial size above max size");
    this.maxSize = maxSize;
    this.buckets = (Entry<T>[]) new Entry[initialSize];
  }

  static int initialSize(double cardinality, int minSize) {
    if (cardinality <= 0) {
      return minSize;
    }
    double wanted = Math.ceil(cardinality / LOAD_FACTOR);
    if (wanted >= MAX_SIZE) {
      return MAX_SIZE;
    }
    int size = Integer.highestOneBit((int) wanted);
    if (size < wanted) {
      size <<= 1;
    }
    return Math.max(minSize, Math.min(MAX_SIZE, size));
  }

  /**
   * Adds a payload under a key. Keys equal under canonical encoding share one entry.
   *
   * @throws HashTableMaxSizeExceededException if growing would exceed the maximum size
   * @throws ExecutionInternalException if the table is no longer accepting inserts
   */
  public void put(Object key, T payload) {
    if (mode != Mode.INIT && mode != Mode.PUT) {
      throw new ExecutionInternalException("HashTable.put called in " + mode + " mode");
    }
    mode = Mode.PUT;
    if ((double) (distinct + 1) / buckets.length > LOAD_FACTOR) {
      grow();
    }
    byte[] encoded = ValueMarshaller.marshal(key);
    long hashCode = HASH.hashBytes(encoded).asLong();
    if (putEntry(hashCode, encoded, key, payload, null)) {
      distinct++;
    }
    numPayloads++;
  }

  /**
   * Inserts either a payload or a whole moved entry.
   *
   * @return true if a new slot was used
   */
  private boolean putEntry(long hashCode, byte[] encoded, Object key, T payload, Entry<T> moved) {
    int mask = buckets.length - 1;
    int index = (int) (hashCode & mask);
    for (int i = 0; i < buckets.length; i++) {
      Entry<T> entry = buckets[index];
      if (entry == null) {
        if (moved != null) {
          buckets[index] = moved;
        } else {
          Entry<T> created = new Entry<>(hashCode, encoded, key);
          created.payloads.add(payload);
          buckets[index] = created;
        }
        return true;
      }
      if (entry.hashCode == hashCode && Arrays.equals(entry.key, encoded)) {
        if (mode == Mode.GROW) {
          throw new ExecutionInternalException("HashTable found duplicate key while growing");
        }
        entry.payloads.add(payload);
        return false;
      }
      index = (index + i + 1) & mask;
    }
    throw new ExecutionInternalException("HashTable has no free slot");
  }

  private void grow() {
    int newSize = buckets.length * 2;
    if (newSize > maxSize) {
      throw new HashTableMaxSizeExceededException(maxSize);
    }
    mode = Mode.GROW;
    Entry<T>[] old = buckets;
    @SuppressWarnings("unchecked")
    Entry<T>[] grown = (Entry<T>[]) new Entry[newSize];
    buckets = grown;
    for (Entry<T> entry : old) {
      if (entry != null) {
        putEntry(entry.hashCode, entry.key, entry.value, null, entry);
      }
    }
    mode = Mode.PUT;
    log.debug("HashTable grew from {} to {} slots ({} keys)", old.length, newSize, distinct);
  }

  /**
   * Returns the first payload stored under a key, or null. Further payloads for the same key are
   * returned by {@link #getNext()}.
   */
  public T get(Object key) {
    checkReadable("get");
    mode = Mode.GET;
    cursorEntry = null;
    cursorIndex = 0;
    if (distinct == 0) {
      return null;
    }
    byte[] encoded = ValueMarshaller.marshal(key);
    long hashCode = HASH.hashBytes(encoded).asLong();
    int mask = buckets.length - 1;
    int index = (int) (hashCode & mask);
    for (int i = 0; i < buckets.length; i++) {
      Entry<T> entry = buckets[index];
      if (entry == null) {
        return null;
      }
      if (entry.hashCode == hashCode && Arrays.equals(entry.key, encoded)) {
        if (entry.payloads.size() > 1) {
          cursorEntry = entry;
          cursorIndex = 1;
        }
        return entry.payloads.get(0);
      }
      index = (index + i + 1) & mask;
    }
    return null;
  }

  /** Returns the next payload for the key of the last {@link #get}, or null when exhausted. */
  public T getNext() {
    if (mode != Mode.GET) {
      throw new ExecutionInternalException("HashTable.getNext called in " + mode + " mode");
    }
    if (cursorEntry == null) {
      return null;
    }
    T payload = cursorEntry.payloads.get(cursorIndex++);
    if (cursorIndex >= cursorEntry.payloads.size()) {
      cursorEntry = null;
      cursorIndex = 0;
    }
    return payload;
  }

  /** Visits every key with every payload stored under it. */
  public void iterate(BiConsumer<Object, T> visitor) {
    checkReadable("iterate");
    mode = Mode.ITERATE;
    for (Entry<T> entry : buckets) {
      if (entry != null) {
        for (T payload : entry.payloads) {
          visitor.accept(entry.value, payload);
        }
      }
    }
  }

  /** Releases all entries. The table cannot be used afterwards. */
  public void drop() {
    mode = Mode.DROP;
    Arrays.fill(buckets, null);
    distinct = 0;
    numPayloads = 0;
    cursorEntry = null;
  }

  private void checkReadable(String operation) {
    if (mode == Mode.DROP || mode == Mode.GROW) {
      throw new ExecutionInternalException(
          "HashTable." + operation + " called in " + mode + " mode");
    }
  }

  public int numKeys() {
    return distinct;
  }

  public int numPayloads() {
    return numPayloads;
  }

  public int capacity() {
    return buckets.length;
  }

  public Mode getMode() {
    return mode;
  }

  public boolean isEmpty() {
    return numPayloads == 0;
  }
}
