/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Physical operator skipping the first rows. */
@Getter
@RequiredArgsConstructor
public class OffsetPhysicalOperator implements PhysicalOperatorNode {

  private final long offset;

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.OFFSET;
  }

  @Override
  public String describe() {
    return String.format("Offset(rows=%d)", offset);
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitOffset(this, context);
  }
}
