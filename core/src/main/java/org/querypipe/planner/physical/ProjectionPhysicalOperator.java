/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import org.querypipe.expression.NamedExpression;

/**
 * Physical operator representing a projection. With {@code includeAll} the input fields are kept
 * ({@code SELECT *, ...}) and the projections are added to them.
 */
@Getter
public class ProjectionPhysicalOperator implements PhysicalOperatorNode {

  private final List<NamedExpression> projections;

  private final boolean includeAll;

  public ProjectionPhysicalOperator(List<NamedExpression> projections, boolean includeAll) {
    this.projections = ImmutableList.copyOf(projections);
    this.includeAll = includeAll;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.PROJECTION;
  }

  @Override
  public String describe() {
    return String.format(
        "InitialProject(%s%s)",
        includeAll ? "*, " : "",
        projections.stream()
            .map(NamedExpression::getNameOrAlias)
            .collect(Collectors.joining(", ")));
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitProjection(this, context);
  }
}
