/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import java.util.List;
import org.querypipe.expression.Expression;

/**
 * OVER clause of a window function call.
 *
 * @param partitionBy partition keys, empty for one partition
 * @param orderBy order within a partition
 * @param frame explicit frame, or null for the default frame
 */
public record WindowTerm(List<Expression> partitionBy, List<SortKey> orderBy, WindowFrame frame) {

  public WindowTerm {
    partitionBy = List.copyOf(partitionBy);
    orderBy = List.copyOf(orderBy);
  }

  /** The explicit frame, or the default one for this term. */
  public WindowFrame effectiveFrame() {
    if (frame != null) {
      return frame;
    }
    return orderBy.isEmpty() ? WindowFrame.wholePartition() : WindowFrame.defaultOrdered();
  }
}
