/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.window;

import java.util.PrimitiveIterator;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.execution.window.FrameRange;
import org.querypipe.execution.window.WindowPartition;
import org.querypipe.expression.aggregation.Aggregator;

/** An aggregate computed over the frame of each row. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class AggregateWindowFunction implements WindowFunction {

  private final Aggregator aggregator;

  @Override
  public boolean usesFrame() {
    return true;
  }

  @Override
  public Object evaluate(WindowPartition partition, int row, FrameRange frame) {
    Object cumulative = aggregator.defaultValue();
    PrimitiveIterator.OfInt rows = frame.indexes().iterator();
    while (rows.hasNext()) {
      cumulative =
          aggregator.cumulateInitial(
              partition.row(rows.nextInt()), cumulative, partition.getContext());
    }
    return aggregator.computeFinal(cumulative);
  }

  @Override
  public String toString() {
    return aggregator.getName();
  }
}
