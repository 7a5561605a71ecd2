/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

/** Physical operator collecting its input into a list, the root of a sub-query. */
public class CollectPhysicalOperator implements PhysicalOperatorNode {

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.COLLECT;
  }

  @Override
  public String describe() {
    return "Collect()";
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitCollect(this, context);
  }
}
