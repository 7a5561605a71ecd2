/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.window;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.querypipe.expression.DSL.cumeDist;
import static org.querypipe.expression.DSL.denseRank;
import static org.querypipe.expression.DSL.firstValue;
import static org.querypipe.expression.DSL.lag;
import static org.querypipe.expression.DSL.lastValue;
import static org.querypipe.expression.DSL.lead;
import static org.querypipe.expression.DSL.literal;
import static org.querypipe.expression.DSL.nthValue;
import static org.querypipe.expression.DSL.ntile;
import static org.querypipe.expression.DSL.over;
import static org.querypipe.expression.DSL.percentRank;
import static org.querypipe.expression.DSL.rank;
import static org.querypipe.expression.DSL.ratioToReport;
import static org.querypipe.expression.DSL.ref;
import static org.querypipe.expression.DSL.rowNumber;
import static org.querypipe.expression.DSL.sum;

import com.google.common.util.concurrent.MoreExecutors;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.querypipe.common.exception.EvaluationException;
import org.querypipe.common.setting.DefaultSettings;
import org.querypipe.common.setting.RequestSettings;
import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.ResultSink;
import org.querypipe.execution.window.FrameRange;
import org.querypipe.execution.window.WindowPartition;
import org.querypipe.planner.physical.SortKey;
import org.querypipe.planner.physical.WindowFrame;
import org.querypipe.storage.InMemoryDatastore;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class WindowFunctionTest {

  private WindowPartition partition;

  @BeforeEach
  void setUp() {
    ExecutionContext context =
        new ExecutionContext(
            "window-functions",
            new RequestSettings(new DefaultSettings()),
            new InMemoryDatastore(),
            mock(ResultSink.class),
            MoreExecutors.newDirectExecutorService());
    List<Tuple> rows = new ArrayList<>();
    for (long x : new long[] {40, 20, 10, 20}) {
      rows.add(Tuple.of(Map.of("x", x)));
    }
    partition = WindowPartition.sorted(rows, List.of(SortKey.asc(ref("x"))), context);
  }

  // ===== RANKING =====

  @Test
  void ranking_functions_follow_peer_groups() {
    assertEquals(List.of(1L, 2L, 3L, 4L), evaluate(rowNumber()));
    assertEquals(List.of(1L, 2L, 2L, 4L), evaluate(rank()));
    assertEquals(List.of(1L, 2L, 2L, 3L), evaluate(denseRank()));
  }

  @Test
  void relative_ranks_are_fractions() {
    assertEquals(List.of(0.0, 1.0 / 3, 1.0 / 3, 1.0), evaluate(percentRank()));
    assertEquals(List.of(0.25, 0.75, 0.75, 1.0), evaluate(cumeDist()));
  }

  @Test
  void ntile_gives_extra_rows_to_first_buckets() {
    assertEquals(List.of(1L, 1L, 2L, 3L), evaluate(ntile(literal(3L))));
    assertEquals(List.of(1L, 2L, 3L, 4L), evaluate(ntile(literal(10L))));
  }

  @Test
  void ntile_requires_positive_buckets() {
    assertThrows(EvaluationException.class, () -> evaluate(ntile(literal(0L))));
  }

  // ===== OFFSETS =====

  @Test
  void lag_and_lead_fall_back_to_default() {
    assertEquals(List.of(-1L, 10L, 20L, 20L), evaluate(lag(ref("x"), literal(1L), literal(-1L))));
    assertEquals(
        List.of(20L, 40L, -1L, -1L), evaluate(lead(ref("x"), literal(2L), literal(-1L))));
  }

  @Test
  void negative_offset_is_rejected() {
    WindowFunction function = lag(ref("x"), literal(-1L), literal(null));

    assertThrows(EvaluationException.class, () -> evaluate(function));
  }

  // ===== FRAME VALUES =====

  @Test
  void first_and_last_value_read_the_frame() {
    assertEquals(List.of(10L, 10L, 10L, 10L), evaluate(firstValue(ref("x"))));
    assertEquals(List.of(10L, 20L, 20L, 40L), evaluate(lastValue(ref("x"))));
  }

  @Test
  void nth_value_counts_from_either_end() {
    WindowFrame whole = WindowFrame.wholePartition();

    assertEquals(20L, evaluateAt(nthValue(ref("x"), literal(2L), false), 0, whole));
    assertEquals(20L, evaluateAt(nthValue(ref("x"), literal(2L), true), 0, whole));
    assertEquals(40L, evaluateAt(nthValue(ref("x"), literal(1L), true), 0, whole));
    assertNull(evaluateAt(nthValue(ref("x"), literal(5L), false), 0, whole));
  }

  @Test
  void nth_value_requires_positive_position() {
    WindowFunction function = nthValue(ref("x"), literal(0L), false);

    assertThrows(
        EvaluationException.class,
        () -> evaluateAt(function, 0, WindowFrame.wholePartition()));
  }

  @Test
  void empty_frame_yields_null() {
    WindowFrame before =
        WindowFrame.of(
            WindowFrame.Unit.ROWS,
            WindowFrame.Bound.unboundedPreceding(),
            WindowFrame.Bound.preceding(1));

    assertNull(evaluateAt(firstValue(ref("x")), 0, before));
  }

  // ===== AGGREGATES =====

  @Test
  void aggregate_over_default_frame_is_a_running_total() {
    List<Object> totals = evaluate(over(sum(ref("x"))));

    assertEquals(
        List.of(10L, 50L, 50L, 90L),
        totals.stream().map(v -> ((Number) v).longValue()).collect(Collectors.toList()));
  }

  @Test
  void ratio_to_report_divides_by_frame_sum() {
    Object ratio = evaluateAt(ratioToReport(ref("x")), 3, WindowFrame.wholePartition());

    assertEquals(40.0 / 90, (Double) ratio, 1e-9);
  }

  @Test
  void only_frame_functions_use_frames() {
    assertTrue(over(sum(ref("x"))).usesFrame());
    assertTrue(firstValue(ref("x")).usesFrame());
    assertFalse(rank().usesFrame());
    assertFalse(lag(ref("x"), literal(1L), literal(null)).usesFrame());
  }

  private List<Object> evaluate(WindowFunction function) {
    return IntStream.range(0, partition.size())
        .mapToObj(row -> evaluateAt(function, row, WindowFrame.defaultOrdered()))
        .collect(Collectors.toList());
  }

  private Object evaluateAt(WindowFunction function, int row, WindowFrame frame) {
    FrameRange range = function.usesFrame() ? partition.frame(row, frame) : null;
    return function.evaluate(partition, row, range);
  }
}
