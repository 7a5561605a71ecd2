/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.window;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.window.FrameRange;
import org.querypipe.execution.window.WindowPartition;
import org.querypipe.expression.Expression;

/**
 * RATIO_TO_REPORT(expr): the row's value divided by the sum of the values in its frame. NULL when
 * the value is not a number or the sum is zero.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class RatioToReportFunction implements WindowFunction {

  private final Expression value;

  @Override
  public boolean usesFrame() {
    return true;
  }

  @Override
  public Object evaluate(WindowPartition partition, int row, FrameRange frame) {
    ExecutionContext context = partition.getContext();
    Object current = value.evaluate(partition.row(row), context);
    if (!(current instanceof Number)) {
      return null;
    }
    double sum =
        frame
            .indexes()
            .mapToObj(i -> value.evaluate(partition.row(i), context))
            .filter(Number.class::isInstance)
            .mapToDouble(v -> ((Number) v).doubleValue())
            .sum();
    if (sum == 0) {
      return null;
    }
    return ((Number) current).doubleValue() / sum;
  }

  @Override
  public String toString() {
    return String.format("ratio_to_report(%s)", value);
  }
}
