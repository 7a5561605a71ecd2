/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.data.Tuple;
import org.querypipe.data.Values;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.ExecutionPhase;
import org.querypipe.execution.Operator;
import org.querypipe.planner.physical.FilterPhysicalOperator;

/** Passes on the items for which the condition is TRUE. */
public class Filter extends BaseOperator {

  private final FilterPhysicalOperator filter;

  public Filter(FilterPhysicalOperator plan, ExecutionContext context) {
    super(plan, context, true, false);
    this.filter = plan;
  }

  private Filter(Filter other) {
    super(other);
    this.filter = other.filter;
  }

  @Override
  protected ExecutionPhase executionPhase() {
    return ExecutionPhase.FILTER;
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    Object result;
    try {
      result = filter.getCondition().evaluate(item, context);
    } catch (QueryEngineException e) {
      context.error(e);
      item.recycle();
      return true;
    }
    if (Values.truth(result)) {
      return sendItem(item);
    }
    item.recycle();
    return true;
  }

  @Override
  protected void afterItems(ExecutionContext context) {
    context.addPhaseCount(ExecutionPhase.FILTER, getInDocs());
  }

  @Override
  public Operator copy() {
    return new Filter(this);
  }
}
