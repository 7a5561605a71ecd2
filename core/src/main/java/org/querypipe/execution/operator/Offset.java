/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import org.querypipe.data.Tuple;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.Operator;
import org.querypipe.planner.physical.OffsetPhysicalOperator;

/** Drops the first items. */
public class Offset extends BaseOperator {

  private final long offset;
  private long skipped;

  public Offset(OffsetPhysicalOperator plan, ExecutionContext context) {
    super(plan, context, true, false);
    this.offset = plan.getOffset();
  }

  private Offset(Offset other) {
    super(other);
    this.offset = other.offset;
  }

  @Override
  protected boolean beforeItems(ExecutionContext context, Tuple parent) {
    skipped = 0;
    return true;
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    if (skipped < offset) {
      skipped++;
      item.recycle();
      return true;
    }
    return sendItem(item);
  }

  @Override
  public Operator copy() {
    return new Offset(this);
  }
}
