/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.bitfilter;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Fixed size bloom filter over byte strings.
 *
 * <p>The filter is an array of 64 bit words whose length is the next power of two at or above
 * {@code 1.44 * log2(1 / falsePositiveRate) * n / 64}. Each element sets {@code k} bits, where
 * {@code k} is 4 or 5 depending on the false positive rate. The bit positions come from one 128 bit
 * murmur3 hash split into two 64 bit lanes {@code h1, h2}; position {@code i} is {@code h1 + i *
 * h2} modulo the number of bits.
 *
 * <p>Not thread safe for concurrent {@link #add}; concurrent {@link #test} calls are safe once
 * building has finished.
 */
public final class BloomFilter {

  public static final double DEFAULT_FALSE_POSITIVE_RATE = 0.05;

  static final int WORD_SIZE = Long.SIZE;

  private static final HashFunction HASH = Hashing.murmur3_128(0x51ed2701);

  private final long[] words;
  private final int numLocations;
  private final long bitMask;

  @VisibleForTesting
  BloomFilter(int numWords, int numLocations) {
    Preconditions.checkArgument(
        numWords > 0 && Integer.bitCount(numWords) == 1, "word count must be a power of two");
    this.words = new long[numWords];
    this.numLocations = numLocations;
    this.bitMask = (long) numWords * WORD_SIZE - 1;
  }

  /**
   * Creates a filter for an expected number of elements at the default false positive rate.
   *
   * @return the filter, or null if no elements are expected
   */
  public static BloomFilter create(long expectedElements) {
    return create(expectedElements, DEFAULT_FALSE_POSITIVE_RATE);
  }

  /**
   * Creates a filter for an expected number of elements and false positive rate.
   *
   * @return the filter, or null if no elements are expected
   */
  public static BloomFilter create(long expectedElements, double falsePositiveRate) {
    Preconditions.checkArgument(
        falsePositiveRate > 0.0 && falsePositiveRate < 1.0,
        "false positive rate must be in (0, 1): %s",
        falsePositiveRate);
    if (expectedElements <= 0) {
      return null;
    }
    return new BloomFilter(
        wordsFor(expectedElements, falsePositiveRate), locationsFor(falsePositiveRate));
  }

  static int wordsFor(long expectedElements, double falsePositiveRate) {
    double bits = 1.44 * log2(1.0 / falsePositiveRate) * expectedElements;
    long wordCount = Math.max(1L, (long) Math.ceil(bits / WORD_SIZE));
    long power = Long.highestOneBit(wordCount);
    if (power < wordCount) {
      power <<= 1;
    }
    Preconditions.checkArgument(power <= (1 << 30), "bloom filter too large: %s words", power);
    return (int) power;
  }

  static int locationsFor(double falsePositiveRate) {
    long k = Math.round(log2(1.0 / falsePositiveRate));
    return (int) Math.min(5, Math.max(4, k));
  }

  private static double log2(double x) {
    return Math.log(x) / Math.log(2.0);
  }

  public void add(byte[] data) {
    long[] lanes = lanes(data);
    long position = lanes[0];
    for (int i = 0; i < numLocations; i++) {
      long bit = position & bitMask;
      words[(int) (bit >>> 6)] |= 1L << (bit & 63);
      position += lanes[1];
    }
  }

  /** Returns false only if {@code data} was certainly never added. */
  public boolean test(byte[] data) {
    long[] lanes = lanes(data);
    long position = lanes[0];
    for (int i = 0; i < numLocations; i++) {
      long bit = position & bitMask;
      if ((words[(int) (bit >>> 6)] & (1L << (bit & 63))) == 0) {
        return false;
      }
      position += lanes[1];
    }
    return true;
  }

  /**
   * ORs another filter into this one.
   *
   * @throws IllegalArgumentException if the filters differ in size or location count
   */
  public void merge(BloomFilter other) {
    if (other.words.length != words.length || other.numLocations != numLocations) {
      throw new IllegalArgumentException(
          String.format(
              "cannot merge bloom filters of different dimensions (%d/%d vs %d/%d)",
              words.length, numLocations, other.words.length, other.numLocations));
    }
    for (int i = 0; i < words.length; i++) {
      words[i] |= other.words[i];
    }
  }

  public BloomFilter copy() {
    BloomFilter copy = new BloomFilter(words.length, numLocations);
    System.arraycopy(words, 0, copy.words, 0, words.length);
    return copy;
  }

  public int sizeInWords() {
    return words.length;
  }

  public int getNumLocations() {
    return numLocations;
  }

  private static long[] lanes(byte[] data) {
    byte[] hash = HASH.hashBytes(data).asBytes();
    ByteBuffer buffer = ByteBuffer.wrap(hash).order(ByteOrder.LITTLE_ENDIAN);
    long h1 = buffer.getLong(0);
    // odd stride so successive positions differ modulo a power of two
    long h2 = buffer.getLong(8) | 1L;
    return new long[] {h1, h2};
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BloomFilter)) {
      return false;
    }
    BloomFilter that = (BloomFilter) o;
    return numLocations == that.numLocations && Arrays.equals(words, that.words);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(words) + numLocations;
  }

  @Override
  public String toString() {
    return String.format("BloomFilter(words=%d, k=%d)", words.length, numLocations);
  }
}
