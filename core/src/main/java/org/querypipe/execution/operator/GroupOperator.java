/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.querypipe.common.exception.ErrorCode;
import org.querypipe.common.exception.ExecutionInternalException;
import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.data.Tuple;
import org.querypipe.data.ValueMarshaller;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.ExecutionPhase;
import org.querypipe.execution.OperatorAction;
import org.querypipe.execution.group.GroupStore;
import org.querypipe.execution.spill.SpillDecider;
import org.querypipe.expression.Expression;
import org.querypipe.expression.aggregation.Aggregator;
import org.querypipe.planner.physical.GroupPhysicalOperator;

/**
 * Common part of the grouping operators: group keys, the group store and the merging of partial
 * aggregates.
 *
 * <p>A group is represented by the first item seen with its key; the accumulators of the group are
 * kept in the {@link Tuple#AGGREGATES} attachment of that item, by aggregate name.
 */
public abstract class GroupOperator extends BaseOperator {

  protected final GroupPhysicalOperator group;
  protected final GroupStore groups;

  protected GroupOperator(GroupPhysicalOperator plan, ExecutionContext context) {
    super(plan, context);
    this.group = plan;
    this.groups = newStore();
  }

  protected GroupOperator(GroupOperator other) {
    super(other);
    this.group = other.group;
    this.groups = newStore();
  }

  private GroupStore newStore() {
    String name = group.getOperatorType().getDisplayName();
    SpillDecider decider = group.isCanSpill() ? context.spillDecider(name) : SpillDecider.NEVER;
    return new GroupStore(name, context, decider, this::mergeGroups);
  }

  @Override
  protected ExecutionPhase executionPhase() {
    return ExecutionPhase.GROUP;
  }

  /** The string key of an item's group, empty when there are no GROUP BY keys. */
  protected String groupKey(Tuple item, ExecutionContext context) {
    List<Expression> keys = group.getKeys();
    if (keys.isEmpty()) {
      return "";
    }
    List<Object> values = new ArrayList<>(keys.size());
    for (Expression key : keys) {
      values.add(key.evaluate(item, context));
    }
    return ValueMarshaller.marshalToString(values);
  }

  /** The accumulators of a group or partial group. */
  protected static Map<String, Object> aggregatesOf(Tuple item) {
    Map<String, Object> aggregates = item.getAggregates();
    if (aggregates == null) {
      throw new ExecutionInternalException("Invalid aggregates: none attached to " + item);
    }
    return aggregates;
  }

  /** Folds the partial accumulators of {@code part} into {@code into}. */
  protected void cumulateIntermediate(Tuple part, Tuple into) {
    Map<String, Object> partial = aggregatesOf(part);
    Map<String, Object> cumulative = aggregatesOf(into);
    for (Aggregator aggregate : group.getAggregates()) {
      String name = aggregate.getName();
      Object current = cumulative.get(name);
      Object updated = aggregate.cumulateIntermediate(partial.get(name), current);
      if (updated != current) {
        cumulative.put(name, updated);
      }
    }
  }

  private Tuple mergeGroups(Tuple into, Tuple from) {
    cumulateIntermediate(from, into);
    from.recycle();
    return into;
  }

  protected static QueryEngineException groupUpdateError(String message, Throwable cause) {
    return new QueryEngineException(
        ErrorCode.GROUP_UPDATE, QueryEngineException.Severity.FATAL, message, cause);
  }

  /** Sends every group downstream, unless the operator was stopped. */
  protected void sendGroups(ExecutionContext context) {
    try {
      if (!isStopped()) {
        groups.forEach(this::sendItem);
      }
    } catch (QueryEngineException e) {
      context.fatal(e);
    } finally {
      groups.release();
    }
  }

  @Override
  protected long usedMemory() {
    return groups.getMemorySize();
  }

  @Override
  protected void resetState() {
    groups.release();
  }

  @Override
  public void sendAction(OperatorAction action) {
    baseSendAction(action);
    if (action == OperatorAction.STOP) {
      groups.stop();
    }
  }

  @Override
  public void done() {
    super.done();
    groups.release();
  }
}
