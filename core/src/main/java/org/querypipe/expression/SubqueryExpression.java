/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.planner.physical.PhysicalOperatorNode;

/**
 * A sub-query, evaluating to the array of values its plan produces. A correlated sub-query reads
 * the current item and runs again for every item; the results of any other are computed once per
 * request.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class SubqueryExpression implements Expression {

  private final PhysicalOperatorNode plan;
  private final boolean correlated;

  @Override
  public Object evaluate(Tuple item, ExecutionContext context) {
    return context.evaluateSubquery(plan, item, correlated);
  }

  @Override
  public String toString() {
    return "(" + plan.describe() + ")";
  }
}
