/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression;

import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.data.Tuple;
import org.querypipe.data.Values;
import org.querypipe.execution.ExecutionContext;

/** Reads an aggregate or window function result from the item's aggregates attachment. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class AggregateReferenceExpression implements Expression {

  private final String name;

  @Override
  public Object evaluate(Tuple item, ExecutionContext context) {
    Map<String, Object> aggregates = item.getAggregates();
    if (aggregates == null || !aggregates.containsKey(name)) {
      return Values.MISSING;
    }
    return aggregates.get(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
