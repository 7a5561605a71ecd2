/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import java.util.LinkedHashMap;
import java.util.Map;
import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.Operator;
import org.querypipe.expression.aggregation.Aggregator;
import org.querypipe.planner.physical.GroupPhysicalOperator;

/** Groups input items and folds them into partial aggregates. */
public class InitialGroup extends GroupOperator {

  public InitialGroup(GroupPhysicalOperator plan, ExecutionContext context) {
    super(plan, context);
  }

  private InitialGroup(InitialGroup other) {
    super(other);
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    String key;
    try {
      key = groupKey(item, context);
    } catch (QueryEngineException e) {
      context.fatal(e);
      item.recycle();
      return false;
    }

    Tuple target = groups.get(key);
    boolean recycle = target != null;
    if (target == null) {
      target = item;
      Map<String, Object> aggregates = new LinkedHashMap<>();
      for (Aggregator aggregate : group.getAggregates()) {
        aggregates.put(aggregate.getName(), aggregate.defaultValue());
      }
      target.setAttachment(Tuple.AGGREGATES, aggregates);
      try {
        groups.put(key, target);
      } catch (QueryEngineException e) {
        context.fatal(e);
        return false;
      }
    }

    Map<String, Object> cumulative = aggregatesOf(target);
    try {
      for (Aggregator aggregate : group.getAggregates()) {
        String name = aggregate.getName();
        Object current = cumulative.get(name);
        Object updated = aggregate.cumulateInitial(item, current, context);
        if (updated != current) {
          cumulative.put(name, updated);
        }
      }
    } catch (RuntimeException e) {
      context.fatal(groupUpdateError("Error updating initial GROUP value.", e));
      return false;
    } finally {
      if (recycle) {
        item.recycle();
      }
    }
    return true;
  }

  @Override
  protected void afterItems(ExecutionContext context) {
    sendGroups(context);
  }

  @Override
  public Operator copy() {
    return new InitialGroup(this);
  }
}
