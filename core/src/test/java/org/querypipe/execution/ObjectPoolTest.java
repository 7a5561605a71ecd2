/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ObjectPoolTest {

  private final ObjectPool<List<String>> pool = new ObjectPool<>(4, 2, ArrayList::new, List::clear);

  @Test
  void returned_objects_are_cleared_and_reused() {
    List<String> list = pool.get();
    list.add("a");

    pool.put(list);
    List<String> reused = pool.get();

    assertSame(list, reused);
    assertTrue(reused.isEmpty());
  }

  @Test
  void idle_objects_are_bounded() {
    pool.put(new ArrayList<>());
    pool.put(new ArrayList<>());
    pool.put(new ArrayList<>());

    assertEquals(2, pool.idle());
  }

  @Test
  void empty_pool_creates_new_objects() {
    assertNotSame(pool.get(), pool.get());
    assertEquals(0, pool.idle());
  }

  @Test
  void null_is_ignored() {
    pool.put(null);

    assertEquals(0, pool.idle());
  }

  @Test
  void object_size_must_be_positive() {
    assertThrows(
        IllegalArgumentException.class, () -> new ObjectPool<>(0, 1, ArrayList::new, List::clear));
  }
}
