/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Physical operator representing a limit (row count restriction) operation. */
@Getter
@RequiredArgsConstructor
public class LimitPhysicalOperator implements PhysicalOperatorNode {

  /** Maximum number of rows to return. */
  private final long limit;

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.LIMIT;
  }

  @Override
  public String describe() {
    return String.format("Limit(rows=%d)", limit);
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitLimit(this, context);
  }
}
