/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import java.util.LinkedHashMap;
import java.util.Map;
import org.querypipe.common.exception.DuplicateFinalGroupException;
import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.Operator;
import org.querypipe.expression.aggregation.Aggregator;
import org.querypipe.planner.physical.GroupPhysicalOperator;

/**
 * Computes the final aggregate values. Each key must arrive once: a second partial group with the
 * same key is an internal error. Without GROUP BY keys, an empty input still yields one group of
 * default values.
 */
public class FinalGroup extends GroupOperator {

  public FinalGroup(GroupPhysicalOperator plan, ExecutionContext context) {
    super(plan, context);
  }

  private FinalGroup(FinalGroup other) {
    super(other);
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    try {
      String key = groupKey(item, context);
      aggregatesOf(item);
      if (groups.get(key) != null) {
        throw new DuplicateFinalGroupException(key);
      }
      groups.put(key, item);
      return true;
    } catch (QueryEngineException e) {
      context.fatal(e);
      item.recycle();
      return false;
    }
  }

  @Override
  protected void afterItems(ExecutionContext context) {
    if (!isStopped() && groups.isEmpty() && group.getKeys().isEmpty()) {
      Tuple empty = new Tuple();
      Map<String, Object> aggregates = new LinkedHashMap<>();
      for (Aggregator aggregate : group.getAggregates()) {
        aggregates.put(aggregate.getName(), aggregate.defaultValue());
      }
      empty.setAttachment(Tuple.AGGREGATES, aggregates);
      if (!finish(empty, context)) {
        return;
      }
      sendItem(empty);
      return;
    }
    try {
      if (!isStopped()) {
        groups.forEach(item -> finish(item, context) && sendItem(item));
      }
    } catch (QueryEngineException e) {
      context.fatal(e);
    } finally {
      groups.release();
    }
  }

  private boolean finish(Tuple item, ExecutionContext context) {
    Map<String, Object> aggregates = aggregatesOf(item);
    try {
      for (Aggregator aggregate : group.getAggregates()) {
        String name = aggregate.getName();
        aggregates.put(name, aggregate.computeFinal(aggregates.get(name)));
      }
      return true;
    } catch (RuntimeException e) {
      context.fatal(groupUpdateError("Error computing final GROUP value.", e));
      return false;
    }
  }

  @Override
  public Operator copy() {
    return new FinalGroup(this);
  }
}
