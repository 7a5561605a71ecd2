/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.data.Tuple;
import org.querypipe.data.ValueCollation;
import org.querypipe.data.Values;
import org.querypipe.execution.ExecutionContext;

/**
 * Binary comparison. A MISSING operand yields MISSING and a NULL operand yields NULL; values of
 * different types compare by collation.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ComparisonExpression implements Expression {

  /** Comparison operators. */
  @Getter
  @RequiredArgsConstructor
  public enum Operator {
    EQ("="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;
  }

  private final Operator operator;
  private final Expression left;
  private final Expression right;

  @Override
  public Object evaluate(Tuple item, ExecutionContext context) {
    Object l = left.evaluate(item, context);
    Object r = right.evaluate(item, context);
    if (Values.isMissing(l) || Values.isMissing(r)) {
      return Values.MISSING;
    }
    if (l == null || r == null) {
      return null;
    }
    int c = ValueCollation.INSTANCE.compare(l, r);
    switch (operator) {
      case EQ:
        return c == 0;
      case NE:
        return c != 0;
      case LT:
        return c < 0;
      case LE:
        return c <= 0;
      case GT:
        return c > 0;
      default:
        return c >= 0;
    }
  }

  @Override
  public String toString() {
    return String.format("(%s %s %s)", left, operator.getSymbol(), right);
  }
}
