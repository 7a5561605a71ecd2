/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.Operator;
import org.querypipe.execution.Sequence;
import org.querypipe.execution.operator.Collect;
import org.querypipe.execution.operator.Fetch;
import org.querypipe.execution.operator.Filter;
import org.querypipe.execution.operator.HashJoin;
import org.querypipe.execution.operator.Order;
import org.querypipe.execution.operator.PrimaryScan;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExecutionAnalyzerTest {

  private static <T extends BaseOperator> T counted(Class<T> type, long in, long out) {
    T operator = mock(type);
    when(operator.getInDocs()).thenReturn(in);
    when(operator.getOutDocs()).thenReturn(out);
    return operator;
  }

  private static Operator tree(Operator... children) {
    Sequence root = mock(Sequence.class);
    when(root.getChildren()).thenReturn(List.of(children));
    return root;
  }

  @Test
  void quiet_tree_has_no_notes() {
    Operator root = tree(counted(PrimaryScan.class, 0, 100), counted(Filter.class, 100, 50));

    assertTrue(ExecutionAnalyzer.analyze(root).isEmpty());
  }

  @Test
  void large_counts_are_noted_per_operator_kind() {
    // Given
    Operator root =
        tree(
            counted(PrimaryScan.class, 0, 20_000),
            counted(Fetch.class, 20_000, 20_000),
            counted(Order.class, 20_000, 20_000),
            counted(Collect.class, 20_000, 0));

    // When
    List<String> notes = ExecutionAnalyzer.analyze(root);

    // Then: sorted
    assertEquals(
        List.of(
            "High fetch count", "High primary scan count", "Large sort", "Large sub-query result"),
        notes);
  }

  @Test
  void eliminating_operators_are_noted_once() {
    Operator root =
        tree(
            counted(Filter.class, 50_000, 10),
            counted(Filter.class, 30_000, 5),
            counted(HashJoin.class, 20_000, 1_000));

    assertEquals(
        List.of("Filter eliminating over 90%", "Hash join eliminating over 90%"),
        ExecutionAnalyzer.analyze(root));
  }

  @Test
  void small_inputs_are_never_noted_as_eliminating() {
    Operator root = tree(counted(Filter.class, 9_000, 0));

    assertTrue(ExecutionAnalyzer.analyze(root).isEmpty());
  }

  @Test
  void service_time_beyond_twice_execution_time_is_high_io() {
    Fetch fetch = counted(Fetch.class, 10, 10);
    when(fetch.getExecTime()).thenReturn(100L);
    when(fetch.getServTime()).thenReturn(500L);

    assertEquals(List.of("High IO time"), ExecutionAnalyzer.analyze(tree(fetch)));
  }

  @Test
  void channel_time_dwarfing_work_is_high_wait() {
    Filter filter = counted(Filter.class, 10, 10);
    when(filter.getExecTime()).thenReturn(100L);
    when(filter.getChanTime()).thenReturn(5_000L);

    assertEquals(List.of("High wait time"), ExecutionAnalyzer.analyze(tree(filter)));
  }

  @Test
  void profile_renders_as_indented_json_in_document_order() {
    Map<String, Object> profile = new LinkedHashMap<>();
    profile.put("#operator", "Filter");
    profile.put("#stats", Map.of("#itemsIn", 3));
    Operator operator = mock(Operator.class);
    when(operator.profile()).thenReturn(profile);

    String json = ProfileWriter.write(operator);

    assertTrue(json.indexOf("#operator") < json.indexOf("#stats"), json);
    assertTrue(json.contains("\"#itemsIn\" : 3"), json);
    assertTrue(json.contains("\n"), json);
  }
}
