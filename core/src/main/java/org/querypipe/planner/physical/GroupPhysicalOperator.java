/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.querypipe.expression.Expression;
import org.querypipe.expression.aggregation.Aggregator;

/**
 * Physical operator for one grouping stage. Grouping runs in up to three stages: the initial stage
 * folds input items into per group accumulators, intermediate stages merge partial accumulators
 * from parallel initial stages, and the final stage computes the visible aggregate values.
 */
@Getter
public class GroupPhysicalOperator implements PhysicalOperatorNode {

  /** Grouping stage. */
  public enum Stage {
    INITIAL,
    INTERMEDIATE,
    FINAL
  }

  private final Stage stage;

  /** GROUP BY keys, empty for a single implicit group. */
  private final List<Expression> keys;

  private final List<Aggregator> aggregates;

  /** Whether the group store may spill to disk under memory pressure. */
  private final boolean canSpill;

  public GroupPhysicalOperator(
      Stage stage, List<Expression> keys, List<Aggregator> aggregates, boolean canSpill) {
    this.stage = stage;
    this.keys = ImmutableList.copyOf(keys);
    this.aggregates = ImmutableList.copyOf(aggregates);
    this.canSpill = canSpill;
  }

  public static GroupPhysicalOperator initial(List<Expression> keys, List<Aggregator> aggregates) {
    return new GroupPhysicalOperator(Stage.INITIAL, keys, aggregates, true);
  }

  public static GroupPhysicalOperator intermediate(
      List<Expression> keys, List<Aggregator> aggregates) {
    return new GroupPhysicalOperator(Stage.INTERMEDIATE, keys, aggregates, true);
  }

  public static GroupPhysicalOperator finalGroup(
      List<Expression> keys, List<Aggregator> aggregates) {
    return new GroupPhysicalOperator(Stage.FINAL, keys, aggregates, false);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    switch (stage) {
      case INITIAL:
        return PhysicalOperatorType.INITIAL_GROUP;
      case INTERMEDIATE:
        return PhysicalOperatorType.INTERMEDIATE_GROUP;
      default:
        return PhysicalOperatorType.FINAL_GROUP;
    }
  }

  @Override
  public String describe() {
    return String.format(
        "%s(keys=%s, aggregates=%s)", getOperatorType().getDisplayName(), keys, aggregates);
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitGroup(this, context);
  }
}
