/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.querypipe.common.exception.ExecutionInternalException;
import org.querypipe.execution.operator.Collect;
import org.querypipe.execution.operator.Fetch;
import org.querypipe.execution.operator.Filter;
import org.querypipe.execution.operator.FinalGroup;
import org.querypipe.execution.operator.HashJoin;
import org.querypipe.execution.operator.InitialGroup;
import org.querypipe.execution.operator.InitialProject;
import org.querypipe.execution.operator.IntermediateGroup;
import org.querypipe.execution.operator.Limit;
import org.querypipe.execution.operator.Offset;
import org.querypipe.execution.operator.Order;
import org.querypipe.execution.operator.PrimaryScan;
import org.querypipe.execution.operator.SendMutation;
import org.querypipe.execution.operator.Stream;
import org.querypipe.execution.operator.ValueScan;
import org.querypipe.execution.operator.WindowAggregate;
import org.querypipe.planner.physical.CollectPhysicalOperator;
import org.querypipe.planner.physical.FetchPhysicalOperator;
import org.querypipe.planner.physical.FilterPhysicalOperator;
import org.querypipe.planner.physical.GroupPhysicalOperator;
import org.querypipe.planner.physical.HashJoinPhysicalOperator;
import org.querypipe.planner.physical.LimitPhysicalOperator;
import org.querypipe.planner.physical.OffsetPhysicalOperator;
import org.querypipe.planner.physical.OrderPhysicalOperator;
import org.querypipe.planner.physical.ParallelPhysicalOperator;
import org.querypipe.planner.physical.PhysicalOperatorNode;
import org.querypipe.planner.physical.PhysicalPlanVisitor;
import org.querypipe.planner.physical.ProjectionPhysicalOperator;
import org.querypipe.planner.physical.ScanPhysicalOperator;
import org.querypipe.planner.physical.SendMutationPhysicalOperator;
import org.querypipe.planner.physical.SequencePhysicalOperator;
import org.querypipe.planner.physical.StreamPhysicalOperator;
import org.querypipe.planner.physical.ValuesPhysicalOperator;
import org.querypipe.planner.physical.WindowAggregatePhysicalOperator;

/** Walks a plan tree once and builds the matching operator tree for one request. */
@RequiredArgsConstructor
public class ExecutionBuilder extends PhysicalPlanVisitor<Operator, Void> {

  private final ExecutionContext context;

  /**
   * Builds the operator tree of a plan.
   *
   * @throws ExecutionInternalException if the plan holds a node no operator implements
   */
  public Operator build(PhysicalOperatorNode plan) {
    return plan.accept(this, null);
  }

  @Override
  protected Operator visitNode(PhysicalOperatorNode node, Void unused) {
    throw new ExecutionInternalException("No operator for plan node " + node.describe());
  }

  @Override
  public Operator visitScan(ScanPhysicalOperator node, Void unused) {
    return new PrimaryScan(node, context);
  }

  @Override
  public Operator visitValues(ValuesPhysicalOperator node, Void unused) {
    return new ValueScan(node, context);
  }

  @Override
  public Operator visitFetch(FetchPhysicalOperator node, Void unused) {
    return new Fetch(node, context);
  }

  @Override
  public Operator visitFilter(FilterPhysicalOperator node, Void unused) {
    return new Filter(node, context);
  }

  @Override
  public Operator visitProjection(ProjectionPhysicalOperator node, Void unused) {
    return new InitialProject(node, context);
  }

  @Override
  public Operator visitGroup(GroupPhysicalOperator node, Void unused) {
    switch (node.getStage()) {
      case INITIAL:
        return new InitialGroup(node, context);
      case INTERMEDIATE:
        return new IntermediateGroup(node, context);
      default:
        return new FinalGroup(node, context);
    }
  }

  @Override
  public Operator visitOrder(OrderPhysicalOperator node, Void unused) {
    return new Order(node, context);
  }

  @Override
  public Operator visitOffset(OffsetPhysicalOperator node, Void unused) {
    return new Offset(node, context);
  }

  @Override
  public Operator visitLimit(LimitPhysicalOperator node, Void unused) {
    return new Limit(node, context);
  }

  @Override
  public Operator visitWindowAggregate(WindowAggregatePhysicalOperator node, Void unused) {
    return new WindowAggregate(node, context);
  }

  @Override
  public Operator visitHashJoin(HashJoinPhysicalOperator node, Void unused) {
    return new HashJoin(node, context, build(node.getBuildChild()));
  }

  @Override
  public Operator visitSendMutation(SendMutationPhysicalOperator node, Void unused) {
    return new SendMutation(node, context);
  }

  @Override
  public Operator visitSequence(SequencePhysicalOperator node, Void unused) {
    List<Operator> children = new ArrayList<>(node.getChildren().size());
    for (PhysicalOperatorNode child : node.getChildren()) {
      children.add(build(child));
    }
    return new Sequence(node, context, children);
  }

  @Override
  public Operator visitParallel(ParallelPhysicalOperator node, Void unused) {
    return new Parallel(node, context, build(node.getChild()));
  }

  @Override
  public Operator visitCollect(CollectPhysicalOperator node, Void unused) {
    return new Collect(node, context);
  }

  @Override
  public Operator visitStream(StreamPhysicalOperator node, Void unused) {
    Stream stream = new Stream(node, context);
    stream.setRoot();
    return stream;
  }
}
