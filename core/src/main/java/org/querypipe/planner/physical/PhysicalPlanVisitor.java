/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

/**
 * Visitor over physical plan nodes. Every visit method defaults to {@link #visitNode}.
 *
 * @param <R> return type
 * @param <C> context type
 */
public abstract class PhysicalPlanVisitor<R, C> {

  protected R visitNode(PhysicalOperatorNode node, C context) {
    return null;
  }

  public R visitScan(ScanPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitValues(ValuesPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitFetch(FetchPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitFilter(FilterPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitProjection(ProjectionPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitGroup(GroupPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitOrder(OrderPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitOffset(OffsetPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitLimit(LimitPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitWindowAggregate(WindowAggregatePhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitHashJoin(HashJoinPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitSendMutation(SendMutationPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitSequence(SequencePhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitParallel(ParallelPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitCollect(CollectPhysicalOperator node, C context) {
    return visitNode(node, context);
  }

  public R visitStream(StreamPhysicalOperator node, C context) {
    return visitNode(node, context);
  }
}
