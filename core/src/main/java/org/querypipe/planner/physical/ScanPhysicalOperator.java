/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.storage.ScanSpan;

/**
 * Physical operator representing a primary scan of a keyspace. The scan produces document keys
 * only; a following fetch retrieves the documents.
 */
@Getter
@RequiredArgsConstructor
public class ScanPhysicalOperator implements PhysicalOperatorNode {

  /** Keyspace to scan. */
  private final String keyspace;

  /** Key range, {@link ScanSpan#all()} for a full scan. */
  private final ScanSpan span;

  /** Maximum number of keys, 0 for no limit. */
  private final long limit;

  public ScanPhysicalOperator(String keyspace) {
    this(keyspace, ScanSpan.all(), 0);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.SCAN;
  }

  @Override
  public String describe() {
    return String.format("PrimaryScan(keyspace=%s, span=%s, limit=%d)", keyspace, span, limit);
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitScan(this, context);
  }
}
