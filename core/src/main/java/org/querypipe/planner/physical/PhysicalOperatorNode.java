/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import java.util.List;

/**
 * Base interface for the nodes of an immutable physical plan.
 *
 * <p>A plan is produced by the planner and walked once by the execution builder, which creates one
 * execution operator per node. Nodes are shared by every parallel copy of the operator built from
 * them and must not be mutated.
 */
public interface PhysicalOperatorNode {

  /** Returns the type of this physical operator. */
  PhysicalOperatorType getOperatorType();

  /** Returns a string representation of this operator's configuration. */
  String describe();

  /** Child plan nodes, in execution order. */
  default List<PhysicalOperatorNode> getChildren() {
    return List.of();
  }

  <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context);
}
