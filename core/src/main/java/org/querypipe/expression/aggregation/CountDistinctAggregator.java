/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.aggregation;

import java.util.LinkedHashMap;
import java.util.Map;
import org.querypipe.data.ValueMarshaller;
import org.querypipe.expression.Expression;

/**
 * COUNT(DISTINCT expr). The accumulator maps the canonical encoding of each distinct value to the
 * value, and is updated in place.
 */
public class CountDistinctAggregator extends Aggregator {

  public CountDistinctAggregator(Expression operand) {
    super("count_distinct", operand);
  }

  @Override
  public Object defaultValue() {
    return new LinkedHashMap<String, Object>();
  }

  @Override
  @SuppressWarnings("unchecked")
  public Object cumulateValue(Object value, Object cumulative) {
    if (!isValue(value)) {
      return cumulative;
    }
    Map<String, Object> seen = (Map<String, Object>) cumulative;
    seen.putIfAbsent(ValueMarshaller.marshalToString(value), value);
    return seen;
  }

  @Override
  @SuppressWarnings("unchecked")
  public Object cumulateIntermediate(Object part, Object cumulative) {
    Map<String, Object> seen = (Map<String, Object>) cumulative;
    ((Map<String, Object>) part).forEach(seen::putIfAbsent);
    return seen;
  }

  @Override
  public Object computeFinal(Object cumulative) {
    return (long) ((Map<?, ?>) cumulative).size();
  }

  @Override
  public String toString() {
    return String.format("count(distinct %s)", getOperand());
  }
}
