/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.spill;

/** Decides whether an operator should move buffered state out of memory before growing it. */
@FunctionalInterface
public interface SpillDecider {

  /** Never spill. */
  SpillDecider NEVER = (current, additional) -> false;

  /**
   * @param currentSize bytes currently buffered by the operator
   * @param additionalSize bytes about to be added
   * @return true if the operator should spill first
   */
  boolean shouldSpill(long currentSize, long additionalSize);
}
