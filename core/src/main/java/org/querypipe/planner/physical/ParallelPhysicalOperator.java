/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Physical operator running several copies of its child and merging their outputs. */
@Getter
@RequiredArgsConstructor
public class ParallelPhysicalOperator implements PhysicalOperatorNode {

  private final PhysicalOperatorNode child;

  /** Upper bound on copies, 0 to use the request setting. */
  private final int maxParallelism;

  @Override
  public List<PhysicalOperatorNode> getChildren() {
    return List.of(child);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.PARALLEL;
  }

  @Override
  public String describe() {
    return String.format("Parallel(maxParallelism=%d, %s)", maxParallelism, child.describe());
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitParallel(this, context);
  }
}
