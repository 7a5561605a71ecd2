/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.data.Tuple;
import org.querypipe.data.Values;
import org.querypipe.execution.ExecutionContext;

/**
 * Binary arithmetic over numbers. Non numeric operands yield NULL, MISSING operands MISSING.
 * Division always yields a fractional result and division by zero yields NULL.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ArithmeticExpression implements Expression {

  /** Arithmetic operators. */
  @Getter
  @RequiredArgsConstructor
  public enum Operator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

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
    if (!(l instanceof Number) || !(r instanceof Number)) {
      return null;
    }
    return apply(operator, (Number) l, (Number) r);
  }

  /** Applies an operator to two numbers, keeping integral results integral where exact. */
  public static Object apply(Operator operator, Number l, Number r) {
    Object cl = Values.canonical(l);
    Object cr = Values.canonical(r);
    if (operator != Operator.DIVIDE && cl instanceof Long && cr instanceof Long) {
      Long exact = applyExact(operator, (Long) cl, (Long) cr);
      if (exact != null) {
        return exact;
      }
    }
    double a = l.doubleValue();
    double b = r.doubleValue();
    switch (operator) {
      case ADD:
        return Values.canonical(a + b);
      case SUBTRACT:
        return Values.canonical(a - b);
      case MULTIPLY:
        return Values.canonical(a * b);
      default:
        return b == 0.0 ? null : a / b;
    }
  }

  /** Integral result, or null on overflow. */
  private static Long applyExact(Operator operator, long a, long b) {
    try {
      switch (operator) {
        case ADD:
          return Math.addExact(a, b);
        case SUBTRACT:
          return Math.subtractExact(a, b);
        default:
          return Math.multiplyExact(a, b);
      }
    } catch (ArithmeticException overflow) {
      return null;
    }
  }

  @Override
  public String toString() {
    return String.format("(%s %s %s)", left, operator.getSymbol(), right);
  }
}
