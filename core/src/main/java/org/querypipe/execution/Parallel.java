/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.querypipe.data.Tuple;
import org.querypipe.planner.physical.ParallelPhysicalOperator;

/**
 * Runs copies of its child concurrently and merges their output into its output's queue: its own
 * when a consumer reads from it, the enclosing operator's otherwise. It completes only after every
 * copy has signalled completion, also when it is stopped early.
 */
@Log4j2
public class Parallel extends BaseOperator {

  private final Operator child;
  private volatile List<Operator> copies;

  public Parallel(ParallelPhysicalOperator plan, ExecutionContext context, Operator child) {
    super(plan, context);
    this.child = child;
  }

  private Parallel(Parallel other) {
    super(other);
    this.child = other.child.copy();
  }

  /** Number of copies to run: the plan's bound, capped by the request setting, at least one. */
  int parallelism(ExecutionContext context) {
    int planned = ((ParallelPhysicalOperator) getPlan()).getMaxParallelism();
    int allowed = context.getMaxParallelism();
    int n = planned > 0 ? Math.min(planned, allowed) : allowed;
    return Math.max(1, n);
  }

  @Override
  public void runOnce(ExecutionContext context, Tuple parent) {
    if (!claimRun()) {
      return;
    }
    try {
      if (!active()) {
        notifyStop();
        notifyParent();
        close(context);
        return;
      }
      switchPhase(Phase.EXEC);
      List<Operator> running = copies;
      if (running == null) {
        int n = parallelism(context);
        running = new ArrayList<>(n);
        running.add(child);
        for (int i = 1; i < n; i++) {
          running.add(child.copy());
        }
        copies = running;
      }
      log.debug(
          "[{}] running {} copies of {}",
          context.getRequestId(),
          running.size(),
          child.getPlan().getOperatorType().getDisplayName());

      Operator target = getOutput();
      for (int i = 0; i < running.size(); i++) {
        Operator copy = running.get(i);
        copy.setOutput(target);
        copy.setParent(this);
        copy.setBit(i);
        if (getInput() != null) {
          copy.setInput(getInput());
          copy.setStop(getStop());
        }
      }
      for (Operator copy : running) {
        fork(copy, context, parent);
      }

      int received = childrenWait(running.size());
      if (received < running.size()) {
        for (Operator copy : running) {
          copy.sendAction(OperatorAction.STOP);
        }
        childrenWaitNoStop(running.size() - received);
      }
      for (int i = 1; i < running.size(); i++) {
        child.accrueTimes(running.get(i));
      }

      notifyStop();
      notifyParent();
      close(context);
    } catch (Throwable t) {
      context.recover(this, t);
    } finally {
      switchPhase(Phase.NOTIME);
    }
  }

  @Override
  public boolean serializeOutput(Operator consumer, ExecutionContext context) {
    return false;
  }

  @Override
  public void sendAction(OperatorAction action) {
    baseSendAction(action);
    List<Operator> running = copies;
    if (running == null) {
      child.sendAction(action);
      return;
    }
    for (Operator copy : running) {
      copy.sendAction(action);
    }
  }

  @Override
  public Operator copy() {
    return new Parallel(this);
  }

  @Override
  public void done() {
    List<Operator> running = copies;
    if (running == null) {
      child.done();
    } else {
      running.forEach(Operator::done);
    }
    super.done();
  }

  @Override
  public boolean reopen(ExecutionContext context) {
    boolean reopened = super.reopen(context);
    List<Operator> running = copies;
    if (running != null) {
      // copies are made afresh on every run
      running.subList(1, running.size()).forEach(Operator::done);
      copies = null;
    }
    return child.reopen(context) && reopened;
  }

  /** The copies of the current run, or an empty list before it starts. */
  @VisibleForTesting
  public List<Operator> getCopies() {
    List<Operator> running = copies;
    return running == null ? List.of() : running;
  }

  @Override
  public List<Operator> getChildren() {
    return List.of(child);
  }

  @Override
  public Map<String, Object> profile() {
    Map<String, Object> doc = super.profile();
    doc.put("~child", child.profile());
    return doc;
  }
}
