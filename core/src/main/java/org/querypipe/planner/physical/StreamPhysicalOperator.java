/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

/** Physical operator delivering its input to the request's result sink. */
public class StreamPhysicalOperator implements PhysicalOperatorNode {

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.STREAM;
  }

  @Override
  public String describe() {
    return "Stream()";
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitStream(this, context);
  }
}
