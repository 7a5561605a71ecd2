/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.querypipe.common.exception.EvaluationException;
import org.querypipe.common.exception.MemoryQuotaExceededException;
import org.querypipe.data.Tuple;
import org.querypipe.data.ValueMarshaller;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.ExecutionPhase;
import org.querypipe.execution.Operator;
import org.querypipe.execution.window.FrameRange;
import org.querypipe.execution.window.WindowPartition;
import org.querypipe.expression.Expression;
import org.querypipe.expression.window.WindowFunction;
import org.querypipe.planner.physical.WindowAggregatePhysicalOperator;
import org.querypipe.planner.physical.WindowCall;
import org.querypipe.planner.physical.WindowFrame;

/**
 * Computes window functions. The input arrives grouped by the shared PARTITION BY values; one
 * partition is buffered at a time and its items leave in arrival order, each with the results of
 * the window calls in its aggregates attachment.
 */
public class WindowAggregate extends BaseOperator {

  private final WindowAggregatePhysicalOperator window;
  private final List<Expression> partitionBy;

  private final List<Tuple> partition = new ArrayList<>();
  private String partitionKey;
  private long partitionSize;
  private long processed;

  public WindowAggregate(WindowAggregatePhysicalOperator plan, ExecutionContext context) {
    super(plan, context);
    this.window = plan;
    this.partitionBy = plan.getCalls().get(0).term().partitionBy();
  }

  private WindowAggregate(WindowAggregate other) {
    super(other);
    this.window = other.window;
    this.partitionBy = other.partitionBy;
  }

  @Override
  protected ExecutionPhase executionPhase() {
    return ExecutionPhase.WINDOW;
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    String key;
    try {
      key = partitionKey(item, context);
    } catch (EvaluationException e) {
      context.error(e);
      item.recycle();
      return false;
    }
    if (partitionKey != null && !partitionKey.equals(key) && !flushPartition(context)) {
      item.recycle();
      return false;
    }
    partitionKey = key;
    partition.add(item);
    long size = item.estimatedSize();
    partitionSize += size;
    if (context.useRequestQuota() && context.trackValueSize(size)) {
      context.fatal(
          new MemoryQuotaExceededException(context.getMemoryQuota(), context.getUsedMemory()));
      return false;
    }
    return true;
  }

  private String partitionKey(Tuple item, ExecutionContext context) {
    if (partitionBy.isEmpty()) {
      return "";
    }
    List<Object> values = new ArrayList<>(partitionBy.size());
    for (Expression expression : partitionBy) {
      values.add(expression.evaluate(item, context));
    }
    return ValueMarshaller.marshalToString(values);
  }

  private boolean flushPartition(ExecutionContext context) {
    try {
      for (WindowCall call : window.getCalls()) {
        evaluateCall(call, context);
      }
    } catch (EvaluationException e) {
      context.error(e);
      releasePartition();
      return false;
    }
    processed += partition.size();
    boolean ok = true;
    for (Tuple item : partition) {
      if (ok) {
        ok = sendItem(item);
      } else {
        item.recycle();
      }
    }
    partition.clear();
    releaseMemory();
    partitionKey = null;
    return ok;
  }

  private void evaluateCall(WindowCall call, ExecutionContext context) {
    WindowPartition rows = WindowPartition.sorted(partition, call.term().orderBy(), context);
    WindowFunction function = call.function();
    WindowFrame frame = call.term().effectiveFrame();
    for (int i = 0; i < rows.size(); i++) {
      FrameRange range = function.usesFrame() ? rows.frame(i, frame) : null;
      Object value = function.evaluate(rows, i, range);
      aggregatesOf(rows.row(i)).put(call.name(), value);
    }
  }

  private static Map<String, Object> aggregatesOf(Tuple item) {
    Map<String, Object> aggregates = item.getAggregates();
    if (aggregates == null) {
      aggregates = new LinkedHashMap<>();
      item.setAttachment(Tuple.AGGREGATES, aggregates);
    }
    return aggregates;
  }

  @Override
  protected void afterItems(ExecutionContext context) {
    if (!isStopped() && !partition.isEmpty()) {
      flushPartition(context);
    }
    context.addPhaseCount(ExecutionPhase.WINDOW, processed);
    releasePartition();
  }

  private void releasePartition() {
    partition.forEach(Tuple::recycle);
    partition.clear();
    releaseMemory();
    partitionKey = null;
  }

  private void releaseMemory() {
    if (context.useRequestQuota()) {
      context.releaseValueSize(partitionSize);
    }
    partitionSize = 0;
  }

  @Override
  protected long usedMemory() {
    return partitionSize;
  }

  @Override
  protected void resetState() {
    releasePartition();
    processed = 0;
  }

  @Override
  public Operator copy() {
    return new WindowAggregate(this);
  }
}
