/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.querypipe.expression.DSL.equal;
import static org.querypipe.expression.DSL.named;
import static org.querypipe.expression.DSL.ref;
import static org.querypipe.expression.DSL.subquery;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.querypipe.planner.physical.FilterPhysicalOperator;
import org.querypipe.planner.physical.PhysicalOperatorNode;
import org.querypipe.planner.physical.ProjectionPhysicalOperator;
import org.querypipe.planner.physical.SequencePhysicalOperator;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SubqueryTest extends OperatorTestBase {

  private static PhysicalOperatorNode inner() {
    return values(row("v", 1L), row("v", 2L), row("v", 3L));
  }

  @Test
  void correlated_subquery_reads_the_outer_item() {
    // Given: an inner plan filtering on the outer k
    PhysicalOperatorNode plan =
        SequencePhysicalOperator.of(
            inner(), new FilterPhysicalOperator(equal(ref("v"), ref("k"))));
    ProjectionPhysicalOperator projection =
        new ProjectionPhysicalOperator(List.of(named("matches", subquery(plan, true))), true);

    // When: the same operator tree is reopened for every outer item
    Run run = run(values(row("k", 1L), row("k", 3L), row("k", 5L)), projection);

    // Then
    assertEquals(
        List.of(List.of(Map.of("v", 1L)), List.of(Map.of("v", 3L)), List.of()),
        column(run.rows, "matches"));
  }

  @Test
  void uncorrelated_subquery_is_computed_once() {
    PhysicalOperatorNode plan = inner();
    ProjectionPhysicalOperator projection =
        new ProjectionPhysicalOperator(List.of(named("all", subquery(plan, false))), true);

    Run run = run(values(row("k", 1L), row("k", 2L)), projection);

    List<Object> results = column(run.rows, "all");
    assertEquals(3, ((List<?>) results.get(0)).size());
    assertEquals(results.get(0), results.get(1));
  }
}
