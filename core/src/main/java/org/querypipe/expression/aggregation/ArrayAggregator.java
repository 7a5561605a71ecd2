/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.aggregation;

import java.util.ArrayList;
import java.util.List;
import org.querypipe.data.Values;
import org.querypipe.expression.Expression;

/** ARRAY_AGG collects every non MISSING value, NULL if there is none. */
public class ArrayAggregator extends Aggregator {

  public ArrayAggregator(Expression operand) {
    super("array_agg", operand);
  }

  @Override
  public Object defaultValue() {
    return null;
  }

  @Override
  @SuppressWarnings("unchecked")
  public Object cumulateValue(Object value, Object cumulative) {
    if (Values.isMissing(value)) {
      return cumulative;
    }
    List<Object> values = cumulative == null ? new ArrayList<>() : (List<Object>) cumulative;
    values.add(value);
    return values;
  }

  @Override
  @SuppressWarnings("unchecked")
  public Object cumulateIntermediate(Object part, Object cumulative) {
    if (part == null) {
      return cumulative;
    }
    List<Object> values = cumulative == null ? new ArrayList<>() : (List<Object>) cumulative;
    values.addAll((List<Object>) part);
    return values;
  }
}
