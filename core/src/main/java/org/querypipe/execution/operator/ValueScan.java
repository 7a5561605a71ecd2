/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import java.util.Map;
import org.querypipe.data.Tuple;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.Operator;
import org.querypipe.planner.physical.ValuesPhysicalOperator;

/** Emits the literal rows of its plan. */
public class ValueScan extends BaseOperator {

  private final ValuesPhysicalOperator values;

  public ValueScan(ValuesPhysicalOperator plan, ExecutionContext context) {
    super(plan, context);
    this.values = plan;
  }

  private ValueScan(ValueScan other) {
    super(other);
    this.values = other.values;
  }

  @Override
  protected void runItems(ExecutionContext context, Tuple parent) {
    for (Map<String, Object> row : values.getRows()) {
      Tuple item = Tuple.of(row);
      item.setParent(parent);
      if (!sendItem(item)) {
        return;
      }
    }
  }

  @Override
  public Operator copy() {
    return new ValueScan(this);
  }
}
