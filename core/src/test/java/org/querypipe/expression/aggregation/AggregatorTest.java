/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.aggregation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.querypipe.expression.DSL.arrayAgg;
import static org.querypipe.expression.DSL.avg;
import static org.querypipe.expression.DSL.count;
import static org.querypipe.expression.DSL.countDistinct;
import static org.querypipe.expression.DSL.max;
import static org.querypipe.expression.DSL.min;
import static org.querypipe.expression.DSL.ref;
import static org.querypipe.expression.DSL.sum;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.querypipe.data.Tuple;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class AggregatorTest {

  private static final List<Object> VALUES = Arrays.asList(3L, null, 1.5, 3, "x");

  private static Object fold(Aggregator aggregator, List<Object> values) {
    Object cumulative = aggregator.defaultValue();
    for (Object value : values) {
      Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("v", value);
      cumulative = aggregator.cumulateInitial(Tuple.of(fields), cumulative, null);
    }
    return cumulative;
  }

  /** Folds each half separately, then merges the partial results. */
  private static Object twoPhase(Aggregator aggregator, List<Object> values) {
    int half = values.size() / 2;
    Object left = fold(aggregator, values.subList(0, half));
    Object right = fold(aggregator, values.subList(half, values.size()));
    return aggregator.computeFinal(aggregator.cumulateIntermediate(right, left));
  }

  @Test
  void count_skips_null_and_counts_everything_else() {
    Aggregator count = count(ref("v"));

    assertEquals(4L, count.computeFinal(fold(count, VALUES)));
    assertEquals(4L, twoPhase(count, VALUES));
  }

  @Test
  void count_star_counts_every_item() {
    Aggregator countAll = count(null);

    assertEquals("count(*)", countAll.getName());
    assertEquals(5L, countAll.computeFinal(fold(countAll, VALUES)));
  }

  @Test
  void sum_ignores_non_numbers() {
    Aggregator sum = sum(ref("v"));

    assertEquals(7.5, sum.computeFinal(fold(sum, VALUES)));
    assertEquals(7.5, twoPhase(sum, VALUES));
    assertNull(sum.computeFinal(fold(sum, List.of())));
  }

  @Test
  void avg_merges_sum_and_count() {
    Aggregator avg = avg(ref("v"));

    assertEquals(2.5, avg.computeFinal(fold(avg, VALUES)));
    assertEquals(2.5, twoPhase(avg, VALUES));
    assertNull(avg.computeFinal(avg.defaultValue()));
  }

  @Test
  void min_and_max_follow_collation() {
    assertEquals(1.5, min(ref("v")).computeFinal(fold(min(ref("v")), VALUES)));
    assertEquals("x", max(ref("v")).computeFinal(fold(max(ref("v")), VALUES)));
    assertEquals("x", twoPhase(max(ref("v")), VALUES));
  }

  @Test
  void count_distinct_treats_equal_numbers_as_one() {
    Aggregator distinct = countDistinct(ref("v"));

    assertEquals(3L, distinct.computeFinal(fold(distinct, VALUES)));
    assertEquals(3L, twoPhase(distinct, VALUES));
    assertEquals("count(distinct v)", distinct.getName());
  }

  @Test
  void array_agg_keeps_nulls_in_order() {
    Aggregator array = arrayAgg(ref("v"));

    assertEquals(VALUES, array.computeFinal(fold(array, VALUES)));
    assertEquals(new ArrayList<>(VALUES), twoPhase(array, VALUES));
  }
}
