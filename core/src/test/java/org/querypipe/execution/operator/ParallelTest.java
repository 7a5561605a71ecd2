/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.querypipe.expression.DSL.greater;
import static org.querypipe.expression.DSL.literal;
import static org.querypipe.expression.DSL.ref;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.querypipe.common.setting.RequestSettings;
import org.querypipe.common.setting.Settings.Key;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.Operator;
import org.querypipe.execution.OperatorState;
import org.querypipe.execution.Parallel;
import org.querypipe.planner.physical.FilterPhysicalOperator;
import org.querypipe.planner.physical.LimitPhysicalOperator;
import org.querypipe.planner.physical.OffsetPhysicalOperator;
import org.querypipe.planner.physical.ParallelPhysicalOperator;
import org.querypipe.planner.physical.ValuesPhysicalOperator;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ParallelTest extends OperatorTestBase {

  private static ValuesPhysicalOperator numbers(int count) {
    List<Map<String, Object>> rows = new ArrayList<>(count);
    for (long i = 0; i < count; i++) {
      rows.add(row("x", i));
    }
    return new ValuesPhysicalOperator(rows);
  }

  /** Adds the copies of every parallel operator under {@code operator}, outer copies first. */
  private static void collectCopies(Operator operator, List<Operator> copies) {
    if (operator instanceof Parallel) {
      for (Operator copy : ((Parallel) operator).getCopies()) {
        copies.add(copy);
        collectCopies(copy, copies);
      }
      return;
    }
    for (Operator child : operator.getChildren()) {
      collectCopies(child, copies);
    }
  }

  private static void assertTerminal(Operator operator) {
    OperatorState state = operator.getState();
    assertTrue(
        state == OperatorState.DONE
            || state == OperatorState.ENDED
            || state == OperatorState.KILLED,
        operator.getPlan().describe() + " is " + state);
  }

  private void assertNoActiveWorker() {
    ThreadPoolExecutor pool = (ThreadPoolExecutor) workers;
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (pool.getActiveCount() > 0 && System.nanoTime() < deadline) {
      Thread.onSpinWait();
    }
    assertEquals(0, pool.getActiveCount());
  }

  private static ParallelPhysicalOperator parallelFilter(long above, int copies) {
    return new ParallelPhysicalOperator(
        new FilterPhysicalOperator(greater(ref("x"), literal(above))), copies);
  }

  @Test
  void copies_together_pass_every_matching_item_once() {
    Run run = run(numbers(1000), parallelFilter(499, 4));

    Set<Object> expected = LongStream.range(500, 1000).boxed().collect(Collectors.toSet());
    List<Object> seen = column(run.rows, "x");
    assertEquals(500, seen.size());
    assertEquals(expected, new HashSet<>(seen));
  }

  @Test
  void limit_after_parallel_stops_the_copies() {
    Run run = run(numbers(5000), parallelFilter(-1, 4), new LimitPhysicalOperator(5));

    assertEquals(5, run.rows.size());
  }

  @Test
  void nested_parallel_copies_feed_the_outer_consumer() {
    Run run = run(numbers(2000), new ParallelPhysicalOperator(parallelFilter(999, 4), 4));

    Set<Object> expected = LongStream.range(1000, 2000).boxed().collect(Collectors.toSet());
    List<Object> seen = column(run.rows, "x");
    assertEquals(1000, seen.size());
    assertEquals(expected, new HashSet<>(seen));
  }

  @Test
  void limit_after_nested_parallel_takes_one_item() {
    Run run =
        run(
            numbers(2000),
            new ParallelPhysicalOperator(parallelFilter(-1, 4), 4),
            new LimitPhysicalOperator(1));

    assertEquals(1, run.rows.size());
  }

  @Test
  void single_copies_nest_under_a_limit() {
    Run run =
        run(
            numbers(2000),
            new ParallelPhysicalOperator(parallelFilter(-1, 1), 1),
            new LimitPhysicalOperator(1));

    assertEquals(List.of(0L), column(run.rows, "x"));
  }

  @Test
  void every_nested_copy_completes_once_all_rows_are_read() {
    // Given
    int fanOut = 4;

    // When
    Run run =
        run(numbers(2000), new ParallelPhysicalOperator(parallelFilter(-1, fanOut), fanOut));

    // Then: fan-out copies at each of the two levels have all finished
    List<Operator> copies = new ArrayList<>();
    collectCopies(run.root, copies);
    assertEquals(fanOut + fanOut * fanOut, copies.size());
    copies.forEach(ParallelTest::assertTerminal);
    assertEquals(2000, run.rows.size());
    assertNoActiveWorker();
  }

  @Test
  void stop_reaches_every_nested_copy() {
    // When: a limit stops the nested copies while they still have input
    Run run =
        run(
            numbers(20000),
            new ParallelPhysicalOperator(parallelFilter(-1, 4), 4),
            new LimitPhysicalOperator(3));

    // Then
    List<Operator> copies = new ArrayList<>();
    collectCopies(run.root, copies);
    assertFalse(copies.isEmpty());
    copies.forEach(ParallelTest::assertTerminal);
    assertEquals(3, run.rows.size());
    assertNoActiveWorker();
  }

  @Test
  void offset_and_limit_skip_then_take() {
    Run run = run(numbers(10), new OffsetPhysicalOperator(3), new LimitPhysicalOperator(4));

    assertEquals(List.of(3L, 4L, 5L, 6L), column(run.rows, "x"));
  }

  @Test
  void request_setting_caps_parallelism() {
    // Given
    RequestSettings settings = settings().with(Key.MAX_PARALLELISM, 1);
    CollectingSink sink = new CollectingSink();
    ExecutionContext context = newContext(settings, sink);

    // When
    Run run = run(context, sink, numbers(100), parallelFilter(89, 8));

    // Then: a single copy keeps arrival order
    assertEquals(
        LongStream.range(90, 100).boxed().collect(Collectors.toList()), column(run.rows, "x"));
  }
}
