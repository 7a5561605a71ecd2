/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression;

import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionContext;

/** Builds an array from its elements. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ArrayExpression implements Expression {

  private final List<Expression> elements;

  @Override
  public Object evaluate(Tuple item, ExecutionContext context) {
    List<Object> values = new ArrayList<>(elements.size());
    for (Expression element : elements) {
      values.add(element.evaluate(item, context));
    }
    return values;
  }

  @Override
  public String toString() {
    return elements.toString();
  }
}
