/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.querypipe.data.Tuple;
import org.querypipe.execution.operator.Collect;
import org.querypipe.planner.physical.CollectPhysicalOperator;
import org.querypipe.planner.physical.PhysicalOperatorNode;
import org.querypipe.planner.physical.SequencePhysicalOperator;

/**
 * Sub-query executions of one request, keyed by plan node identity.
 *
 * <p>Results of a non-correlated sub-query are computed once. A correlated sub-query runs again
 * for each outer document; the operator tree of a finished run is reopened and reused rather than
 * rebuilt. Trees are checked out for the duration of a run so that concurrent workers never share
 * one.
 */
@Log4j2
public class SubqueryCache {

  private final ExecutionContext context;
  private final Map<PhysicalOperatorNode, List<Object>> results = new IdentityHashMap<>();
  private final Map<PhysicalOperatorNode, Deque<Execution>> idle = new IdentityHashMap<>();
  private final List<Execution> all = new ArrayList<>();

  public SubqueryCache(ExecutionContext context) {
    this.context = context;
  }

  /** Runs {@code plan} for the outer document {@code parent} and returns its values. */
  public List<Object> evaluate(PhysicalOperatorNode plan, Tuple parent, boolean correlated) {
    if (!correlated) {
      synchronized (this) {
        List<Object> cached = results.get(plan);
        if (cached != null) {
          return cached;
        }
      }
    }

    Execution execution = checkout(plan);
    try {
      execution.sequence.runOnce(context, parent);
      List<Object> values = execution.collect.awaitValues();
      if (!correlated) {
        synchronized (this) {
          results.putIfAbsent(plan, values);
        }
      }
      return values;
    } finally {
      checkin(plan, execution);
    }
  }

  private Execution checkout(PhysicalOperatorNode plan) {
    synchronized (this) {
      Deque<Execution> executions = idle.get(plan);
      while (executions != null && !executions.isEmpty()) {
        Execution execution = executions.pollFirst();
        if (execution.sequence.reopen(context)) {
          return execution;
        }
        execution.sequence.done();
        all.remove(execution);
      }
    }
    Execution execution = build(plan);
    synchronized (this) {
      all.add(execution);
    }
    return execution;
  }

  private synchronized void checkin(PhysicalOperatorNode plan, Execution execution) {
    idle.computeIfAbsent(plan, p -> new ArrayDeque<>()).addLast(execution);
  }

  private Execution build(PhysicalOperatorNode plan) {
    log.debug("[{}] building sub-query {}", context.getRequestId(), plan.describe());
    CollectPhysicalOperator collectPlan = new CollectPhysicalOperator();
    Operator pipeline = new ExecutionBuilder(context).build(plan);
    Collect collect = new Collect(collectPlan, context);
    Sequence sequence =
        new Sequence(
            SequencePhysicalOperator.of(plan, collectPlan), context, List.of(pipeline, collect));
    return new Execution(sequence, collect);
  }

  /** Releases every cached execution. */
  public void close() {
    List<Execution> executions;
    synchronized (this) {
      executions = new ArrayList<>(all);
      all.clear();
      idle.clear();
      results.clear();
    }
    for (Execution execution : executions) {
      execution.sequence.done();
    }
  }

  private record Execution(Sequence sequence, Collect collect) {}
}
