/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.querypipe.data.Tuple;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.Operator;
import org.querypipe.planner.physical.CollectPhysicalOperator;

/** Gathers the documents of its input for a sub-query. */
public class Collect extends BaseOperator {

  private List<Object> values = new ArrayList<>();

  public Collect(CollectPhysicalOperator plan, ExecutionContext context) {
    super(plan, context);
  }

  private Collect(Collect other) {
    super(other);
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    values.add(new LinkedHashMap<>(item.getFields()));
    item.recycle();
    return true;
  }

  /** Waits for the run to end and returns what was collected. */
  public List<Object> awaitValues() {
    waitRunEnded();
    return ImmutableList.copyOf(values);
  }

  @Override
  protected void resetState() {
    values = new ArrayList<>();
  }

  @Override
  public Operator copy() {
    return new Collect(this);
  }
}
