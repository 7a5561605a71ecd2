/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/** Physical operator chaining its children into one pipeline, first child upstream. */
@Getter
public class SequencePhysicalOperator implements PhysicalOperatorNode {

  private final List<PhysicalOperatorNode> children;

  public SequencePhysicalOperator(List<PhysicalOperatorNode> children) {
    Preconditions.checkArgument(!children.isEmpty(), "empty sequence");
    this.children = ImmutableList.copyOf(children);
  }

  public static SequencePhysicalOperator of(PhysicalOperatorNode... children) {
    return new SequencePhysicalOperator(List.of(children));
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.SEQUENCE;
  }

  @Override
  public String describe() {
    return children.stream()
        .map(PhysicalOperatorNode::describe)
        .collect(Collectors.joining(" -> ", "Sequence(", ")"));
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitSequence(this, context);
  }
}
