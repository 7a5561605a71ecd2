/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.aggregation;

import org.querypipe.data.ValueCollation;
import org.querypipe.expression.Expression;

/** MIN and MAX under value collation, ignoring NULL and MISSING. */
public class MinMaxAggregator extends Aggregator {

  private final boolean max;

  private MinMaxAggregator(String name, Expression operand, boolean max) {
    super(name, operand);
    this.max = max;
  }

  public static MinMaxAggregator min(Expression operand) {
    return new MinMaxAggregator("min", operand, false);
  }

  public static MinMaxAggregator max(Expression operand) {
    return new MinMaxAggregator("max", operand, true);
  }

  @Override
  public Object defaultValue() {
    return null;
  }

  @Override
  public Object cumulateValue(Object value, Object cumulative) {
    if (!isValue(value)) {
      return cumulative;
    }
    if (cumulative == null) {
      return value;
    }
    int cmp = ValueCollation.INSTANCE.compare(value, cumulative);
    return (max ? cmp > 0 : cmp < 0) ? value : cumulative;
  }

  @Override
  public Object cumulateIntermediate(Object part, Object cumulative) {
    return cumulateValue(part, cumulative);
  }
}
