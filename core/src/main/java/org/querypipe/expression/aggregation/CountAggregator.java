/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.aggregation;

import org.querypipe.expression.Expression;

/** COUNT(expr) counts non NULL, non MISSING values; COUNT(*) counts items. */
public class CountAggregator extends Aggregator {

  public CountAggregator(Expression operand) {
    super("count", operand);
  }

  @Override
  public Object defaultValue() {
    return 0L;
  }

  @Override
  public Object cumulateValue(Object value, Object cumulative) {
    long count = ((Number) cumulative).longValue();
    return isValue(value) ? count + 1 : count;
  }

  @Override
  public Object cumulateIntermediate(Object part, Object cumulative) {
    return ((Number) cumulative).longValue() + ((Number) part).longValue();
  }
}
