/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import org.querypipe.data.Tuple;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.Operator;
import org.querypipe.planner.physical.LimitPhysicalOperator;

/** Passes on the first items and then stops its producer. */
public class Limit extends BaseOperator {

  private final long limit;
  private long count;

  public Limit(LimitPhysicalOperator plan, ExecutionContext context) {
    super(plan, context, true, false);
    this.limit = plan.getLimit();
  }

  private Limit(Limit other) {
    super(other);
    this.limit = other.limit;
  }

  @Override
  protected boolean beforeItems(ExecutionContext context, Tuple parent) {
    count = 0;
    return limit > 0;
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    if (count >= limit) {
      item.recycle();
      return false;
    }
    count++;
    return sendItem(item) && count < limit;
  }

  @Override
  public Operator copy() {
    return new Limit(this);
  }
}
