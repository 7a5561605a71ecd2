/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/** Physical operator producing literal rows. */
@Getter
public class ValuesPhysicalOperator implements PhysicalOperatorNode {

  private final List<Map<String, Object>> rows;

  public ValuesPhysicalOperator(List<Map<String, Object>> rows) {
    this.rows = ImmutableList.copyOf(rows);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.VALUES;
  }

  @Override
  public String describe() {
    return String.format("ValueScan(rows=%d)", rows.size());
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitValues(this, context);
  }
}
