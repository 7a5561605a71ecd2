/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import org.querypipe.expression.Expression;

/**
 * Physical operator for a hash join. The build child is run to completion into a hash table keyed
 * by the build expressions; the operator's input is then probed against it with the probe
 * expressions. Matching build items are nested into the probe item under the build alias.
 */
@Getter
public class HashJoinPhysicalOperator implements PhysicalOperatorNode {

  private final PhysicalOperatorNode buildChild;

  private final List<Expression> buildExpressions;

  private final List<Expression> probeExpressions;

  /** Field under which the matching build item is stored. */
  private final String buildAlias;

  /** LEFT OUTER join when true. */
  private final boolean outer;

  /** Residual ON clause evaluated on the joined item, may be null. */
  private final Expression onFilter;

  /** Bit filters built from the build items and published for probe side fetches. */
  private final List<BitFilterSpec> buildBitFilters;

  private final double estimatedBuildCardinality;

  @Builder
  public HashJoinPhysicalOperator(
      PhysicalOperatorNode buildChild,
      List<Expression> buildExpressions,
      List<Expression> probeExpressions,
      String buildAlias,
      boolean outer,
      Expression onFilter,
      List<BitFilterSpec> buildBitFilters,
      double estimatedBuildCardinality) {
    Preconditions.checkArgument(
        buildExpressions.size() == probeExpressions.size(),
        "build and probe expressions differ in number");
    this.buildChild = buildChild;
    this.buildExpressions = ImmutableList.copyOf(buildExpressions);
    this.probeExpressions = ImmutableList.copyOf(probeExpressions);
    this.buildAlias = buildAlias;
    this.outer = outer;
    this.onFilter = onFilter;
    this.buildBitFilters =
        buildBitFilters == null ? ImmutableList.of() : ImmutableList.copyOf(buildBitFilters);
    this.estimatedBuildCardinality = estimatedBuildCardinality;
  }

  @Override
  public List<PhysicalOperatorNode> getChildren() {
    return List.of(buildChild);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.HASH_JOIN;
  }

  @Override
  public String describe() {
    return String.format(
        "HashJoin(alias=%s, outer=%s, build=%s, probe=%s)",
        buildAlias, outer, buildExpressions, probeExpressions);
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitHashJoin(this, context);
  }
}
