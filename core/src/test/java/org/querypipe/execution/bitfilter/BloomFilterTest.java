/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.bitfilter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.querypipe.common.exception.ExecutionInternalException;
import org.querypipe.data.ValueMarshaller;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class BloomFilterTest {

  // ===== SIZING =====

  @Test
  void word_count_is_a_power_of_two() {
    for (long n : new long[] {1, 3, 100, 1000, 12345}) {
      int words = BloomFilter.wordsFor(n, BloomFilter.DEFAULT_FALSE_POSITIVE_RATE);
      assertEquals(1, Integer.bitCount(words), "words for " + n);
    }
  }

  @Test
  void location_count_stays_between_four_and_five() {
    assertEquals(4, BloomFilter.locationsFor(0.05));
    assertEquals(4, BloomFilter.locationsFor(0.5));
    assertEquals(5, BloomFilter.locationsFor(0.0001));
  }

  @Test
  void no_filter_is_created_for_no_elements() {
    assertNull(BloomFilter.create(0));
  }

  @Test
  void invalid_false_positive_rate_is_rejected() {
    assertThrows(IllegalArgumentException.class, () -> BloomFilter.create(10, 1.0));
  }

  // ===== MEMBERSHIP =====

  @Test
  void added_keys_always_test_positive() {
    BloomFilter filter = BloomFilter.create(1000);
    for (long i = 0; i < 1000; i++) {
      filter.add(key(i));
    }

    for (long i = 0; i < 1000; i++) {
      assertTrue(filter.test(key(i)), "key " + i);
    }
  }

  @Test
  void filter_of_small_set_rejects_other_key() {
    // Given
    BloomFilter filter = BloomFilter.create(3);
    filter.add(key(1L));
    filter.add(key(2L));
    filter.add(key(3L));

    // Then
    assertFalse(filter.test(key(4L)));
  }

  @Test
  void false_positive_rate_is_near_the_target() {
    BloomFilter filter = BloomFilter.create(2000);
    for (long i = 0; i < 2000; i++) {
      filter.add(key(i));
    }

    int positives = 0;
    for (long i = 100_000; i < 110_000; i++) {
      if (filter.test(key(i))) {
        positives++;
      }
    }
    assertTrue(positives < 1000, "false positives: " + positives);
  }

  @Test
  void integral_double_and_long_keys_collide() {
    BloomFilter filter = BloomFilter.create(10);
    filter.add(key(7L));

    assertTrue(filter.test(key(7.0)));
  }

  // ===== MERGE =====

  @Test
  void merged_filter_contains_both_sides() {
    BloomFilter left = BloomFilter.create(100);
    BloomFilter right = BloomFilter.create(100);
    left.add(key("a"));
    right.add(key("b"));

    left.merge(right);

    assertTrue(left.test(key("a")));
    assertTrue(left.test(key("b")));
  }

  @Test
  void merge_is_commutative() {
    BloomFilter left = filterOf("a", "b", "c");
    BloomFilter right = filterOf("c", "d");

    BloomFilter leftThenRight = left.copy();
    leftThenRight.merge(right);
    BloomFilter rightThenLeft = right.copy();
    rightThenLeft.merge(left);

    assertEquals(leftThenRight, rightThenLeft);
  }

  @Test
  void merge_is_idempotent() {
    BloomFilter filter = filterOf("a", "b", "c");
    BloomFilter merged = filter.copy();

    merged.merge(filter);

    assertEquals(filter, merged);
  }

  @Test
  void filters_of_different_size_do_not_merge() {
    BloomFilter small = BloomFilter.create(10);
    BloomFilter large = BloomFilter.create(100_000);

    assertThrows(IllegalArgumentException.class, () -> small.merge(large));
  }

  @Test
  void copy_is_independent() {
    BloomFilter filter = BloomFilter.create(10);
    BloomFilter copy = filter.copy();
    copy.add(key("x"));

    assertEquals(filter.sizeInWords(), copy.sizeInWords());
    assertFalse(filter.equals(copy));
  }

  // ===== SHARED FILTERS =====

  @Test
  void shared_filter_merges_builds_until_probed() {
    BitFilter shared = new BitFilter();
    BloomFilter first = BloomFilter.create(10);
    BloomFilter second = BloomFilter.create(10);
    first.add(key(1L));
    second.add(key(2L));
    shared.setFilter(first);
    shared.setFilter(second);

    BloomFilter probed = shared.getFilter();

    assertSame(BitFilter.Mode.PROBE, shared.getMode());
    assertTrue(probed.test(key(1L)));
    assertTrue(probed.test(key(2L)));
  }

  @Test
  void build_arriving_after_probing_started_is_rejected() {
    // Given
    BitFilter shared = new BitFilter();
    shared.setFilter(filterOf(1L));
    BloomFilter probed = shared.getFilter();
    BloomFilter before = probed.copy();

    // When
    boolean added = shared.setFilter(filterOf(2L, 3L));

    // Then
    assertFalse(added);
    assertSame(BitFilter.Mode.PROBE, shared.getMode());
    assertEquals(before, probed);
  }

  @Test
  void registry_reports_a_rejected_late_build() {
    BitFilterRegistry registry = new BitFilterRegistry();
    assertTrue(registry.setBitFilter("o", "idx", 1, filterOf("k")));
    registry.getBitFilter("o", "idx");

    assertFalse(registry.setBitFilter("o", "idx", 1, filterOf("late")));
  }

  @Test
  void shared_filter_leaves_the_published_filter_untouched() {
    // Given
    BitFilter shared = new BitFilter();
    BloomFilter first = filterOf(1L);
    BloomFilter published = first.copy();

    // When
    shared.setFilter(first);
    shared.setFilter(filterOf(2L));

    // Then
    assertEquals(published, first);
    assertTrue(shared.getFilter().test(key(2L)));
  }

  @Test
  void filters_of_different_size_fail_to_merge_into_a_shared_filter() {
    BitFilter shared = new BitFilter();
    shared.setFilter(BloomFilter.create(10));

    assertThrows(
        ExecutionInternalException.class, () -> shared.setFilter(BloomFilter.create(100_000)));
  }

  @Test
  void last_probe_release_drops_the_filter() {
    BitFilter shared = new BitFilter();
    shared.setFilter(BloomFilter.create(10));
    shared.getFilter();
    shared.getFilter();

    assertFalse(shared.clearFilter());
    assertTrue(shared.clearFilter());
  }

  @Test
  void registry_forgets_term_after_last_release() {
    BitFilterRegistry registry = new BitFilterRegistry();
    BloomFilter filter = BloomFilter.create(10);
    filter.add(key("k"));
    registry.setBitFilter("o", "idx", 1, filter);

    BloomFilter probed = registry.getBitFilter("o", "idx");
    registry.clearBitFilter("o", "idx");

    assertTrue(probed.test(key("k")));
    assertNull(registry.getBitFilter("missing", "idx"));
    assertTrue(registry.isEmpty());
  }

  private static BloomFilter filterOf(Object... values) {
    BloomFilter filter = BloomFilter.create(10);
    for (Object value : values) {
      filter.add(key(value));
    }
    return filter;
  }

  private static byte[] key(Object value) {
    return ValueMarshaller.marshalKey(List.of(value));
  }
}
