/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.aggregation;

import org.querypipe.expression.ArithmeticExpression;
import org.querypipe.expression.Expression;

/** SUM over numbers, NULL if no number was seen. */
public class SumAggregator extends Aggregator {

  public SumAggregator(Expression operand) {
    super("sum", operand);
  }

  @Override
  public Object defaultValue() {
    return null;
  }

  @Override
  public Object cumulateValue(Object value, Object cumulative) {
    if (!(value instanceof Number)) {
      return cumulative;
    }
    return add(cumulative, (Number) value);
  }

  @Override
  public Object cumulateIntermediate(Object part, Object cumulative) {
    if (!(part instanceof Number)) {
      return cumulative;
    }
    return add(cumulative, (Number) part);
  }

  static Object add(Object cumulative, Number value) {
    if (!(cumulative instanceof Number)) {
      return ArithmeticExpression.apply(ArithmeticExpression.Operator.ADD, 0L, value);
    }
    return ArithmeticExpression.apply(
        ArithmeticExpression.Operator.ADD, (Number) cumulative, value);
  }
}
