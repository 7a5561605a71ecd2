/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression;

import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.data.Tuple;
import org.querypipe.data.Values;
import org.querypipe.execution.ExecutionContext;

/** AND, OR and NOT under three valued logic. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class LogicalExpression implements Expression {

  /** Logical connectives. */
  public enum Kind {
    AND,
    OR,
    NOT
  }

  private final Kind kind;
  private final List<Expression> operands;

  @Override
  public Object evaluate(Tuple item, ExecutionContext context) {
    switch (kind) {
      case NOT:
        Object v = operands.get(0).evaluate(item, context);
        return v instanceof Boolean ? !((Boolean) v) : (Values.isMissing(v) ? v : null);
      case AND:
        return fold(item, context, Boolean.FALSE);
      default:
        return fold(item, context, Boolean.TRUE);
    }
  }

  /** The dominant value if any operand yields it, NULL if any was unknown, else its opposite. */
  private Object fold(Tuple item, ExecutionContext context, Boolean dominant) {
    boolean unknown = false;
    for (Expression operand : operands) {
      Object v = operand.evaluate(item, context);
      if (dominant.equals(v)) {
        return dominant;
      }
      if (!(v instanceof Boolean)) {
        unknown = true;
      }
    }
    return unknown ? null : !dominant;
  }

  @Override
  public String toString() {
    if (kind == Kind.NOT) {
      return "(not " + operands.get(0) + ")";
    }
    return operands.stream()
        .map(Object::toString)
        .collect(Collectors.joining(" " + kind.name().toLowerCase() + " ", "(", ")"));
  }
}
