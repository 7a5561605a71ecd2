/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import java.util.List;
import java.util.Map;
import org.querypipe.data.Tuple;
import org.querypipe.planner.physical.PhysicalOperatorNode;

/**
 * One stage of a running query. An operator reads the items its input produces, writes items to
 * the exchange of its output, tells its stop operator when it wants no more input, and signals its
 * parent when it completes.
 */
public interface Operator {

  /**
   * Runs the operator. Only the first call after construction or {@link #reopen} does anything.
   * Never throws: failures are reported to the context.
   *
   * @param parent the outer document of a correlated sub-query, or null
   */
  void runOnce(ExecutionContext context, Tuple parent);

  /** The exchange that holds this operator's output items. */
  ValueExchange getValueExchange();

  Operator getInput();

  void setInput(Operator input);

  Operator getOutput();

  void setOutput(Operator output);

  Operator getStop();

  void setStop(Operator stop);

  Operator getParent();

  void setParent(Operator parent);

  /** The value this operator posts to its parent's child signals when it completes. */
  void setBit(int bit);

  /** Marks this operator as the root of the request. */
  void setRoot();

  /** True if this operator may run in its producer's worker instead of its own. */
  boolean isSerializable();

  /**
   * Makes {@code consumer} process this operator's output items directly in this worker.
   *
   * @return false if this operator cannot hand its items over directly
   */
  boolean serializeOutput(Operator consumer, ExecutionContext context);

  /** Asks the operator and its children to stop or pause. Never blocks. */
  void sendAction(OperatorAction action);

  /** A fresh, unstarted operator over the same plan, sharing the same links. */
  Operator copy();

  /**
   * Waits for the worker to exit and releases pooled resources. Safe to call more than once.
   */
  void done();

  /**
   * Waits for the worker to exit and returns the operator to its initial state so that it can run
   * again.
   *
   * @return false if the operator cannot be run again
   */
  boolean reopen(ExecutionContext context);

  OperatorState getState();

  /** The operator's statistics and those of its children, as a profile document. */
  Map<String, Object> profile();

  /** Adds the statistics of a copy of this operator to this operator's. */
  void accrueTimes(Operator copy);

  PhysicalOperatorNode getPlan();

  /** Operators this one runs itself, in plan order. */
  default List<Operator> getChildren() {
    return List.of();
  }
}
