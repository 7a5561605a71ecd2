/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.aggregation;

import java.util.LinkedHashMap;
import java.util.Map;
import org.querypipe.expression.ArithmeticExpression;
import org.querypipe.expression.Expression;

/** AVG over numbers. The accumulator is an object {@code {"sum": s, "count": n}}. */
public class AvgAggregator extends Aggregator {

  static final String SUM = "sum";
  static final String COUNT = "count";

  public AvgAggregator(Expression operand) {
    super("avg", operand);
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
    return merge(cumulative, (Number) value, 1L);
  }

  @Override
  @SuppressWarnings("unchecked")
  public Object cumulateIntermediate(Object part, Object cumulative) {
    if (!(part instanceof Map)) {
      return cumulative;
    }
    Map<String, Object> partial = (Map<String, Object>) part;
    return merge(
        cumulative, (Number) partial.get(SUM), ((Number) partial.get(COUNT)).longValue());
  }

  @SuppressWarnings("unchecked")
  private static Object merge(Object cumulative, Number sum, long count) {
    Map<String, Object> result = new LinkedHashMap<>(4);
    if (cumulative instanceof Map) {
      Map<String, Object> previous = (Map<String, Object>) cumulative;
      result.put(SUM, SumAggregator.add(previous.get(SUM), sum));
      result.put(COUNT, ((Number) previous.get(COUNT)).longValue() + count);
    } else {
      result.put(SUM, SumAggregator.add(null, sum));
      result.put(COUNT, count);
    }
    return result;
  }

  @Override
  @SuppressWarnings("unchecked")
  public Object computeFinal(Object cumulative) {
    if (!(cumulative instanceof Map)) {
      return null;
    }
    Map<String, Object> partial = (Map<String, Object>) cumulative;
    return ArithmeticExpression.apply(
        ArithmeticExpression.Operator.DIVIDE,
        (Number) partial.get(SUM),
        (Number) partial.get(COUNT));
  }
}
