/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * Physical operator computing window functions. Input arrives ordered by the partition keys and
 * then by the longest ORDER BY of the calls; every call shares the same PARTITION BY.
 */
@Getter
public class WindowAggregatePhysicalOperator implements PhysicalOperatorNode {

  private final List<WindowCall> calls;

  public WindowAggregatePhysicalOperator(List<WindowCall> calls) {
    Preconditions.checkArgument(!calls.isEmpty(), "window operator without window functions");
    List<?> partition = calls.get(0).term().partitionBy();
    Preconditions.checkArgument(
        calls.stream().allMatch(c -> c.term().partitionBy().equals(partition)),
        "window functions of one operator must share PARTITION BY");
    this.calls = ImmutableList.copyOf(calls);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.WINDOW_AGGREGATE;
  }

  @Override
  public String describe() {
    return String.format("WindowAggregate(calls=%s)", calls);
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitWindowAggregate(this, context);
  }
}
