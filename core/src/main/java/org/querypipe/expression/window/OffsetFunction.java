/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.window;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.common.exception.EvaluationException;
import org.querypipe.execution.window.FrameRange;
import org.querypipe.execution.window.WindowPartition;
import org.querypipe.expression.Expression;

/** LAG and LEAD: the value of an expression on a row a given distance before or after. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class OffsetFunction implements WindowFunction {

  private final boolean lead;
  private final Expression value;
  private final Expression offset;
  private final Expression defaultValue;

  @Override
  public Object evaluate(WindowPartition partition, int row, FrameRange frame) {
    Object distance = offset.evaluate(partition.row(row), partition.getContext());
    if (!(distance instanceof Number) || ((Number) distance).longValue() < 0) {
      throw new EvaluationException(
          String.format("%s offset must be a non negative number, got %s", name(), distance));
    }
    long steps = ((Number) distance).longValue();
    long target = lead ? row + steps : row - steps;
    if (target < 0 || target >= partition.size()) {
      return defaultValue.evaluate(partition.row(row), partition.getContext());
    }
    return value.evaluate(partition.row((int) target), partition.getContext());
  }

  private String name() {
    return lead ? "lead" : "lag";
  }

  @Override
  public String toString() {
    return String.format("%s(%s, %s, %s)", name(), value, offset, defaultValue);
  }
}
