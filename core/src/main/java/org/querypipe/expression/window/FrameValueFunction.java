/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.window;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.querypipe.common.exception.EvaluationException;
import org.querypipe.execution.window.FrameRange;
import org.querypipe.execution.window.WindowPartition;
import org.querypipe.expression.Expression;

/**
 * FIRST_VALUE, LAST_VALUE and NTH_VALUE: the value of an expression on one row of the frame, NULL
 * when the frame has no such row.
 */
@Getter
@EqualsAndHashCode
public class FrameValueFunction implements WindowFunction {

  /** Which frame row is read. */
  public enum Kind {
    FIRST_VALUE,
    LAST_VALUE,
    NTH_VALUE
  }

  private final Kind kind;
  private final Expression value;
  private final Expression position;
  private final boolean fromLast;

  public FrameValueFunction(Kind kind, Expression value) {
    this(kind, value, null, false);
  }

  /** NTH_VALUE, counting from the first row or, with {@code fromLast}, from the last. */
  public FrameValueFunction(Kind kind, Expression value, Expression position, boolean fromLast) {
    this.kind = kind;
    this.value = value;
    this.position = position;
    this.fromLast = fromLast;
  }

  @Override
  public boolean usesFrame() {
    return true;
  }

  @Override
  public Object evaluate(WindowPartition partition, int row, FrameRange frame) {
    int target;
    switch (kind) {
      case FIRST_VALUE:
        target = frame.first();
        break;
      case LAST_VALUE:
        target = frame.last();
        break;
      default:
        long n = nth(partition, row);
        if (n > frame.size()) {
          return null;
        }
        target = frame.get((int) (fromLast ? frame.size() - n : n - 1));
    }
    if (target < 0) {
      return null;
    }
    return value.evaluate(partition.row(target), partition.getContext());
  }

  private long nth(WindowPartition partition, int row) {
    Object n = position.evaluate(partition.row(row), partition.getContext());
    if (!(n instanceof Number) || ((Number) n).longValue() < 1) {
      throw new EvaluationException("NTH_VALUE position must be a positive number, got " + n);
    }
    return ((Number) n).longValue();
  }

  @Override
  public String toString() {
    if (kind == Kind.NTH_VALUE) {
      return String.format("nth_value(%s, %s)%s", value, position, fromLast ? " FROM LAST" : "");
    }
    return String.format("%s(%s)", kind.name().toLowerCase(), value);
  }
}
