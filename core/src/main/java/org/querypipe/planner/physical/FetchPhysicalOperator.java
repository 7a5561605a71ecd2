/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * Physical operator fetching the documents whose keys arrive from the input. Probe bit filters are
 * tested on each key before it is fetched; keys rejected by any filter are not fetched.
 */
@Getter
public class FetchPhysicalOperator implements PhysicalOperatorNode {

  private final String keyspace;

  /** Bit filters published by a hash join build side, tested before the fetch. */
  private final List<BitFilterSpec> probeBitFilters;

  public FetchPhysicalOperator(String keyspace) {
    this(keyspace, List.of());
  }

  public FetchPhysicalOperator(String keyspace, List<BitFilterSpec> probeBitFilters) {
    this.keyspace = keyspace;
    this.probeBitFilters = ImmutableList.copyOf(probeBitFilters);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.FETCH;
  }

  @Override
  public String describe() {
    return String.format(
        "Fetch(keyspace=%s, bitFilters=%d)", keyspace, probeBitFilters.size());
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitFetch(this, context);
  }
}
