/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.window;

import org.querypipe.execution.window.FrameRange;
import org.querypipe.execution.window.WindowPartition;

/**
 * A function computed over the rows of a window partition. Its {@link #toString()} is the name its
 * results are attached under unless the window call names them.
 */
public interface WindowFunction {

  /**
   * Computes the value for one row.
   *
   * @param partition the partition in window order
   * @param row index of the current row in the partition
   * @param frame frame of the current row, or null when {@link #usesFrame()} is false
   * @throws org.querypipe.common.exception.EvaluationException if an argument cannot be evaluated
   */
  Object evaluate(WindowPartition partition, int row, FrameRange frame);

  /** Whether the function reads the frame. Ranking and offset functions do not. */
  default boolean usesFrame() {
    return false;
  }
}
