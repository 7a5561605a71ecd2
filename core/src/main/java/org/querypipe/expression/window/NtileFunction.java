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

/**
 * NTILE(n): splits the partition into n buckets as evenly as possible, the first buckets taking one
 * extra row each when the rows do not divide evenly.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class NtileFunction implements WindowFunction {

  private final Expression buckets;

  @Override
  public Object evaluate(WindowPartition partition, int row, FrameRange frame) {
    Object value = buckets.evaluate(partition.row(row), partition.getContext());
    if (!(value instanceof Number) || ((Number) value).longValue() <= 0) {
      throw new EvaluationException("NTILE requires a positive number of buckets, got " + value);
    }
    long n = ((Number) value).longValue();
    long size = partition.size();
    long small = size / n;
    long large = small + 1;
    long largeRows = (size % n) * large;
    if (row < largeRows) {
      return row / large + 1;
    }
    return (size % n) + (row - largeRows) / small + 1;
  }

  @Override
  public String toString() {
    return String.format("ntile(%s)", buckets);
  }
}
