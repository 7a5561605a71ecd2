/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.aggregation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.querypipe.data.Tuple;
import org.querypipe.data.Values;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.expression.Expression;

/**
 * An aggregate function in its two phase form: accumulators are built incrementally with {@link
 * #cumulateInitial}, partial accumulators are merged with {@link #cumulateIntermediate} and the
 * visible value is derived once with {@link #computeFinal}.
 *
 * <p>Accumulators are plain JSON representable values so they can be written to spill files. An
 * implementation may update an accumulator in place and return the same reference; callers rely on
 * reference equality to skip memory bookkeeping in that case.
 */
@Getter
@EqualsAndHashCode
public abstract class Aggregator {

  /** Function name, lower case. */
  private final String functionName;

  /** Operand, null for {@code COUNT(*)}. */
  private final Expression operand;

  protected Aggregator(String functionName, Expression operand) {
    this.functionName = functionName;
    this.operand = operand;
  }

  /** Accumulator of a group that has seen no value. */
  public abstract Object defaultValue();

  /** Folds one input item into an accumulator. */
  public Object cumulateInitial(Tuple item, Object cumulative, ExecutionContext context) {
    Object value = operand == null ? Boolean.TRUE : operand.evaluate(item, context);
    return cumulateValue(value, cumulative);
  }

  /** Folds one already evaluated operand value into an accumulator. */
  public abstract Object cumulateValue(Object value, Object cumulative);

  /** Merges a partial accumulator into a cumulative one. */
  public abstract Object cumulateIntermediate(Object part, Object cumulative);

  /** Derives the visible value from an accumulator. */
  public Object computeFinal(Object cumulative) {
    return cumulative;
  }

  /** Name under which the accumulator and result are kept in a group's attachments. */
  public String getName() {
    return toString();
  }

  protected static boolean isValue(Object value) {
    return !Values.isNullOrMissing(value);
  }

  @Override
  public String toString() {
    return String.format("%s(%s)", functionName, operand == null ? "*" : operand);
  }
}
