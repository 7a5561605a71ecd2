/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import org.querypipe.data.Tuple;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.Operator;
import org.querypipe.planner.physical.StreamPhysicalOperator;

/** Delivers its input to the request's result sink. The root of a query. */
public class Stream extends BaseOperator {

  public Stream(StreamPhysicalOperator plan, ExecutionContext context) {
    super(plan, context);
  }

  private Stream(Stream other) {
    super(other);
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    return context.result(item);
  }

  @Override
  protected void afterItems(ExecutionContext context) {
    context.closeResults();
  }

  @Override
  public Operator copy() {
    return new Stream(this);
  }
}
