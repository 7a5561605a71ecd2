/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression;

import java.util.Arrays;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.querypipe.expression.aggregation.Aggregator;
import org.querypipe.expression.aggregation.ArrayAggregator;
import org.querypipe.expression.aggregation.AvgAggregator;
import org.querypipe.expression.aggregation.CountAggregator;
import org.querypipe.expression.aggregation.CountDistinctAggregator;
import org.querypipe.expression.aggregation.MinMaxAggregator;
import org.querypipe.expression.aggregation.SumAggregator;
import org.querypipe.expression.window.AggregateWindowFunction;
import org.querypipe.expression.window.FrameValueFunction;
import org.querypipe.expression.window.NtileFunction;
import org.querypipe.expression.window.OffsetFunction;
import org.querypipe.expression.window.RankingFunction;
import org.querypipe.expression.window.RatioToReportFunction;
import org.querypipe.expression.window.WindowFunction;
import org.querypipe.planner.physical.PhysicalOperatorNode;

/** Factory methods for expressions, aggregates and window functions. */
@UtilityClass
public class DSL {

  public static ReferenceExpression ref(String path) {
    return new ReferenceExpression(path);
  }

  public static DocumentIdExpression id() {
    return new DocumentIdExpression();
  }

  public static LiteralExpression literal(Object value) {
    return new LiteralExpression(value);
  }

  public static AggregateReferenceExpression aggregate(String name) {
    return new AggregateReferenceExpression(name);
  }

  public static AggregateReferenceExpression aggregate(Aggregator aggregator) {
    return new AggregateReferenceExpression(aggregator.getName());
  }

  public static NamedExpression named(String name, Expression expression) {
    return new NamedExpression(name, expression);
  }

  public static NamedExpression named(String name, Expression expression, String alias) {
    return new NamedExpression(name, expression, alias);
  }

  public static ArrayExpression array(Expression... elements) {
    return new ArrayExpression(List.of(elements));
  }

  public static SubqueryExpression subquery(PhysicalOperatorNode plan, boolean correlated) {
    return new SubqueryExpression(plan, correlated);
  }

  // comparison

  public static ComparisonExpression equal(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.EQ, left, right);
  }

  public static ComparisonExpression notEqual(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.NE, left, right);
  }

  public static ComparisonExpression less(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.LT, left, right);
  }

  public static ComparisonExpression lte(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.LE, left, right);
  }

  public static ComparisonExpression greater(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.GT, left, right);
  }

  public static ComparisonExpression gte(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.GE, left, right);
  }

  // logical

  public static LogicalExpression and(Expression... operands) {
    return new LogicalExpression(LogicalExpression.Kind.AND, Arrays.asList(operands));
  }

  public static LogicalExpression or(Expression... operands) {
    return new LogicalExpression(LogicalExpression.Kind.OR, Arrays.asList(operands));
  }

  public static LogicalExpression not(Expression operand) {
    return new LogicalExpression(LogicalExpression.Kind.NOT, List.of(operand));
  }

  // arithmetic

  public static ArithmeticExpression add(Expression left, Expression right) {
    return new ArithmeticExpression(ArithmeticExpression.Operator.ADD, left, right);
  }

  public static ArithmeticExpression subtract(Expression left, Expression right) {
    return new ArithmeticExpression(ArithmeticExpression.Operator.SUBTRACT, left, right);
  }

  public static ArithmeticExpression multiply(Expression left, Expression right) {
    return new ArithmeticExpression(ArithmeticExpression.Operator.MULTIPLY, left, right);
  }

  public static ArithmeticExpression divide(Expression left, Expression right) {
    return new ArithmeticExpression(ArithmeticExpression.Operator.DIVIDE, left, right);
  }

  // aggregates

  /** COUNT(*) when {@code operand} is null. */
  public static CountAggregator count(Expression operand) {
    return new CountAggregator(operand);
  }

  public static CountDistinctAggregator countDistinct(Expression operand) {
    return new CountDistinctAggregator(operand);
  }

  public static SumAggregator sum(Expression operand) {
    return new SumAggregator(operand);
  }

  public static AvgAggregator avg(Expression operand) {
    return new AvgAggregator(operand);
  }

  public static MinMaxAggregator min(Expression operand) {
    return MinMaxAggregator.min(operand);
  }

  public static MinMaxAggregator max(Expression operand) {
    return MinMaxAggregator.max(operand);
  }

  public static ArrayAggregator arrayAgg(Expression operand) {
    return new ArrayAggregator(operand);
  }

  // window functions

  public static WindowFunction rowNumber() {
    return new RankingFunction(RankingFunction.Kind.ROW_NUMBER);
  }

  public static WindowFunction rank() {
    return new RankingFunction(RankingFunction.Kind.RANK);
  }

  public static WindowFunction denseRank() {
    return new RankingFunction(RankingFunction.Kind.DENSE_RANK);
  }

  public static WindowFunction percentRank() {
    return new RankingFunction(RankingFunction.Kind.PERCENT_RANK);
  }

  public static WindowFunction cumeDist() {
    return new RankingFunction(RankingFunction.Kind.CUME_DIST);
  }

  public static WindowFunction ntile(Expression buckets) {
    return new NtileFunction(buckets);
  }

  public static WindowFunction lag(Expression value, Expression offset, Expression defaultValue) {
    return new OffsetFunction(false, value, offset, defaultValue);
  }

  public static WindowFunction lead(Expression value, Expression offset, Expression defaultValue) {
    return new OffsetFunction(true, value, offset, defaultValue);
  }

  public static WindowFunction firstValue(Expression value) {
    return new FrameValueFunction(FrameValueFunction.Kind.FIRST_VALUE, value);
  }

  public static WindowFunction lastValue(Expression value) {
    return new FrameValueFunction(FrameValueFunction.Kind.LAST_VALUE, value);
  }

  public static WindowFunction nthValue(Expression value, Expression n, boolean fromLast) {
    return new FrameValueFunction(FrameValueFunction.Kind.NTH_VALUE, value, n, fromLast);
  }

  public static WindowFunction ratioToReport(Expression value) {
    return new RatioToReportFunction(value);
  }

  public static WindowFunction over(Aggregator aggregator) {
    return new AggregateWindowFunction(aggregator);
  }
}
