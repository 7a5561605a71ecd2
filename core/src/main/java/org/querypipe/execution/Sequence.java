/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.querypipe.data.Tuple;
import org.querypipe.planner.physical.PhysicalOperatorNode;

/**
 * Runs its children as a pipeline. Each child reads the output of the one before it, or processes
 * it directly when it is serializable. Only the last child is forked; it forks its input in turn.
 * The sequence has no worker and no queue of its own: its output is that of the last child.
 */
public class Sequence extends BaseOperator {

  private final List<Operator> children;
  private volatile boolean wired;

  public Sequence(PhysicalOperatorNode plan, ExecutionContext context, List<Operator> children) {
    super(plan, context, false, true);
    Preconditions.checkArgument(!children.isEmpty(), "empty sequence");
    this.children = ImmutableList.copyOf(children);
  }

  private Sequence(Sequence other) {
    super(other);
    this.children =
        other.children.stream().map(Operator::copy).collect(ImmutableList.toImmutableList());
  }

  @Override
  public void runOnce(ExecutionContext context, Tuple parent) {
    if (!claimRun()) {
      return;
    }
    try {
      Operator last = children.get(children.size() - 1);
      if (!active()) {
        for (Operator child : children) {
          child.sendAction(OperatorAction.STOP);
        }
        last.getValueExchange().close();
        notifyParent();
        inactive();
        if (isRoot()) {
          context.closeResults();
        }
        return;
      }

      Operator first = children.get(0);
      if (getInput() != null) {
        first.setInput(getInput());
      }
      if (getStop() != null) {
        first.setStop(getStop());
      }
      for (int i = 1; i < children.size(); i++) {
        Operator curr = children.get(i - 1);
        Operator next = children.get(i);
        if (!next.isSerializable() || !curr.serializeOutput(next, context)) {
          curr.setOutput(curr);
          next.setInput(curr);
          next.setStop(curr);
        }
      }
      last.setParent(getParent());
      last.setBit(getBit());
      if (getOutput() != this) {
        last.setOutput(getOutput());
      }
      wired = true;

      fork(last, context, parent);
      inactive();
    } catch (Throwable t) {
      context.recover(this, t);
    }
  }

  @Override
  public boolean serializeOutput(Operator consumer, ExecutionContext context) {
    return false;
  }

  @Override
  public ValueExchange getValueExchange() {
    return children.get(children.size() - 1).getValueExchange();
  }

  @Override
  public OperatorState getState() {
    return wired ? children.get(children.size() - 1).getState() : super.getState();
  }

  @Override
  public void sendAction(OperatorAction action) {
    baseSendAction(action);
    for (Operator child : children) {
      child.sendAction(action);
    }
  }

  @Override
  public Operator copy() {
    return new Sequence(this);
  }

  @Override
  public void done() {
    for (Operator child : children) {
      child.done();
    }
    super.done();
  }

  @Override
  public boolean reopen(ExecutionContext context) {
    boolean reopened = super.reopen(context);
    for (Operator child : children) {
      reopened = child.reopen(context) && reopened;
    }
    wired = false;
    return reopened;
  }

  @Override
  public List<Operator> getChildren() {
    return children;
  }

  @Override
  public void accrueTimes(Operator copy) {
    super.accrueTimes(copy);
    List<Operator> others = copy.getChildren();
    for (int i = 0; i < children.size() && i < others.size(); i++) {
      children.get(i).accrueTimes(others.get(i));
    }
  }

  @Override
  public Map<String, Object> profile() {
    Map<String, Object> doc = super.profile();
    doc.remove("#stats");
    doc.put("~children", children.stream().map(Operator::profile).collect(Collectors.toList()));
    return doc;
  }
}
