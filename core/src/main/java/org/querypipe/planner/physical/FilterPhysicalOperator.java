/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.expression.Expression;

/** Physical operator representing a filter (WHERE clause) operation. */
@Getter
@RequiredArgsConstructor
public class FilterPhysicalOperator implements PhysicalOperatorNode {

  /** Filter condition, an item passes only when it evaluates to TRUE. */
  private final Expression condition;

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.FILTER;
  }

  @Override
  public String describe() {
    return String.format("Filter(condition=%s)", condition);
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitFilter(this, context);
  }
}
