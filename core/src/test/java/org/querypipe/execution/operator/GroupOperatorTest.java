/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.querypipe.expression.DSL.aggregate;
import static org.querypipe.expression.DSL.count;
import static org.querypipe.expression.DSL.named;
import static org.querypipe.expression.DSL.ref;
import static org.querypipe.expression.DSL.sum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.querypipe.common.exception.ErrorCode;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.expression.Expression;
import org.querypipe.expression.aggregation.Aggregator;
import org.querypipe.planner.physical.GroupPhysicalOperator;
import org.querypipe.planner.physical.ParallelPhysicalOperator;
import org.querypipe.planner.physical.ProjectionPhysicalOperator;
import org.querypipe.planner.physical.ValuesPhysicalOperator;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class GroupOperatorTest extends OperatorTestBase {

  private final Aggregator countAll = count(null);
  private final Aggregator total = sum(ref("v"));
  private final List<Expression> byKey = List.of(ref("k"));

  @Test
  void groups_are_counted_and_summed() {
    Run run =
        run(
            sales("a", 1L, "b", 2L, "a", 3L),
            GroupPhysicalOperator.initial(byKey, List.of(countAll, total)),
            GroupPhysicalOperator.intermediate(byKey, List.of(countAll, total)),
            GroupPhysicalOperator.finalGroup(byKey, List.of(countAll, total)),
            projection());

    Map<Object, Map<String, Object>> byGroup = index(run.rows);
    assertEquals(2, byGroup.size());
    assertEquals(2L, byGroup.get("a").get("cnt"));
    assertEquals(4L, ((Number) byGroup.get("a").get("total")).longValue());
    assertEquals(1L, byGroup.get("b").get("cnt"));
    assertEquals(2L, ((Number) byGroup.get("b").get("total")).longValue());
  }

  @Test
  void result_does_not_depend_on_input_order() {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      rows.add(row("k", "k" + (i % 7), "v", (long) i));
    }
    List<Map<String, Object>> reversed = new ArrayList<>(rows);
    Collections.reverse(reversed);

    Map<Object, Map<String, Object>> forward = index(grouped(new ValuesPhysicalOperator(rows)));
    Map<Object, Map<String, Object>> backward =
        index(grouped(new ValuesPhysicalOperator(reversed)));

    assertEquals(forward, backward);
    assertEquals(7, forward.size());
  }

  @Test
  void parallel_partial_groups_are_merged() {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (int i = 0; i < 1000; i++) {
      rows.add(row("k", i % 2 == 0 ? "even" : "odd", "v", 1L));
    }

    Run run =
        run(
            new ValuesPhysicalOperator(rows),
            new ParallelPhysicalOperator(
                GroupPhysicalOperator.initial(byKey, List.of(countAll, total)), 4),
            GroupPhysicalOperator.intermediate(byKey, List.of(countAll, total)),
            GroupPhysicalOperator.finalGroup(byKey, List.of(countAll, total)),
            projection());

    Map<Object, Map<String, Object>> byGroup = index(run.rows);
    assertEquals(500L, byGroup.get("even").get("cnt"));
    assertEquals(500L, byGroup.get("odd").get("cnt"));
  }

  @Test
  void empty_input_without_keys_yields_default_row() {
    Run run =
        run(
            new ValuesPhysicalOperator(List.of()),
            GroupPhysicalOperator.initial(List.of(), List.of(countAll, total)),
            GroupPhysicalOperator.finalGroup(List.of(), List.of(countAll, total)),
            projection());

    assertEquals(1, run.rows.size());
    assertEquals(0L, run.rows.get(0).get("cnt"));
    assertNull(run.rows.get(0).get("total"));
  }

  @Test
  void empty_input_with_keys_yields_nothing() {
    Run run =
        run(
            new ValuesPhysicalOperator(List.of()),
            GroupPhysicalOperator.initial(byKey, List.of(countAll)),
            GroupPhysicalOperator.finalGroup(byKey, List.of(countAll)));

    assertTrue(run.rows.isEmpty());
  }

  @Test
  void duplicate_final_group_fails_the_request() {
    // Given: two initial groups reach a final step that groups everything under one key
    Run run =
        run(
            sales("a", 1L, "b", 2L),
            GroupPhysicalOperator.initial(byKey, List.of(countAll)),
            GroupPhysicalOperator.finalGroup(List.of(), List.of(countAll)));

    // Then
    assertTrue(run.context.hasFatal());
    assertEquals(ErrorCode.DUPLICATE_FINAL_GROUP, run.context.getErrors().get(0).getCode());
  }

  @Test
  void spilled_groups_produce_the_same_result() {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (int i = 0; i < 300; i++) {
      rows.add(row("k", "k" + (i % 11), "v", 2L));
    }
    CollectingSink sink = new CollectingSink();
    ExecutionContext context = newContext(settings(), sink);
    context.setSpillDeciders(name -> (current, additional) -> current > 0);

    Run run =
        run(
            context,
            sink,
            new ValuesPhysicalOperator(rows),
            GroupPhysicalOperator.initial(byKey, List.of(countAll, total)),
            GroupPhysicalOperator.finalGroup(byKey, List.of(countAll, total)),
            projection());

    Map<Object, Map<String, Object>> byGroup = index(run.rows);
    assertEquals(11, byGroup.size());
    long counted = 0;
    for (Map<String, Object> group : byGroup.values()) {
      counted += (Long) group.get("cnt");
      assertEquals(2L * (Long) group.get("cnt"), ((Number) group.get("total")).longValue());
    }
    assertEquals(300L, counted);
  }

  private List<Map<String, Object>> grouped(ValuesPhysicalOperator input) {
    return run(
            input,
            GroupPhysicalOperator.initial(byKey, List.of(countAll, total)),
            GroupPhysicalOperator.finalGroup(byKey, List.of(countAll, total)),
            projection())
        .rows;
  }

  private ProjectionPhysicalOperator projection() {
    return new ProjectionPhysicalOperator(
        List.of(
            named("k", ref("k")),
            named("cnt", aggregate(countAll)),
            named("total", aggregate(total))),
        false);
  }

  private static ValuesPhysicalOperator sales(Object... keyAndValue) {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (int i = 0; i < keyAndValue.length; i += 2) {
      rows.add(row("k", keyAndValue[i], "v", keyAndValue[i + 1]));
    }
    return new ValuesPhysicalOperator(rows);
  }

  private static Map<Object, Map<String, Object>> index(List<Map<String, Object>> rows) {
    Map<Object, Map<String, Object>> result = new HashMap<>();
    for (Map<String, Object> row : rows) {
      result.put(row.get("k"), row);
    }
    return result;
  }
}
