/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.spill;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import com.google.common.util.concurrent.MoreExecutors;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.querypipe.common.setting.DefaultSettings;
import org.querypipe.common.setting.RequestSettings;
import org.querypipe.common.setting.Settings.Key;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.ResultSink;
import org.querypipe.storage.InMemoryDatastore;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class MemorySpillDeciderTest {

  private static final long MB = 1024 * 1024;

  private static ExecutionContext context(RequestSettings settings) {
    return new ExecutionContext(
        "spill-test",
        settings,
        new InMemoryDatastore(),
        mock(ResultSink.class),
        MoreExecutors.newDirectExecutorService());
  }

  @Test
  void without_quota_spills_above_the_heap_share() {
    ExecutionContext context = context(new RequestSettings(new DefaultSettings()));
    long perProcessor = 400 * MB * Runtime.getRuntime().availableProcessors();
    MemorySpillDecider decider = new MemorySpillDecider(context, "Order", () -> perProcessor);

    // a 15% share of 400MB is 60MB
    assertFalse(decider.shouldSpill(50 * MB, MB));
    assertTrue(decider.shouldSpill(59 * MB, 2 * MB));
  }

  @Test
  void small_heaps_still_buffer_a_minimum() {
    ExecutionContext context = context(new RequestSettings(new DefaultSettings()));
    MemorySpillDecider decider = new MemorySpillDecider(context, "Group", () -> 0L);

    assertFalse(decider.shouldSpill(MemorySpillDecider.MIN_SIZE - 1, 1));
    assertTrue(decider.shouldSpill(MemorySpillDecider.MIN_SIZE, 1));
  }

  @Test
  void with_quota_spills_once_the_request_is_under_pressure() {
    // Given: a 10MB quota, so operators may buffer 1MB before pressure matters
    ExecutionContext context =
        context(new RequestSettings(new DefaultSettings()).with(Key.MEMORY_QUOTA, 10));
    MemorySpillDecider decider = new MemorySpillDecider(context, "Order", () -> 0L);

    // When / Then
    assertFalse(decider.shouldSpill(2 * MB, 0));
    context.trackValueSize(8 * MB);
    assertTrue(decider.shouldSpill(2 * MB, 0));
    assertFalse(decider.shouldSpill(MB / 2, 0));
  }
}
