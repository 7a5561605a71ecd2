/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * Physical operator representing ORDER BY. When a limit is known the operator only keeps the
 * first {@code offset + limit} items. Clip fields, when given, are the only fields kept on the
 * buffered items.
 */
@Getter
public class OrderPhysicalOperator implements PhysicalOperatorNode {

  private final List<SortKey> terms;

  /** Items to skip, 0 for none. */
  private final long offset;

  /** Items to keep after the offset, -1 when unbounded. */
  private final long limit;

  private final List<String> clipFields;

  public OrderPhysicalOperator(List<SortKey> terms) {
    this(terms, 0, -1, List.of());
  }

  public OrderPhysicalOperator(
      List<SortKey> terms, long offset, long limit, List<String> clipFields) {
    this.terms = ImmutableList.copyOf(terms);
    this.offset = Math.max(0, offset);
    this.limit = limit;
    this.clipFields = ImmutableList.copyOf(clipFields);
  }

  public boolean hasLimit() {
    return limit >= 0;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.ORDER;
  }

  @Override
  public String describe() {
    return String.format("Order(terms=%s, offset=%d, limit=%d)", terms, offset, limit);
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitOrder(this, context);
  }
}
