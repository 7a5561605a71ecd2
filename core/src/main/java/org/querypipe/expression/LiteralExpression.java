/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.querypipe.data.Tuple;
import org.querypipe.data.ValueMarshaller;
import org.querypipe.data.Values;
import org.querypipe.execution.ExecutionContext;

/** A constant. */
@Getter
@EqualsAndHashCode
public class LiteralExpression implements Expression {

  private final Object value;

  public LiteralExpression(Object value) {
    this.value = Values.canonical(value);
  }

  @Override
  public Object evaluate(Tuple item, ExecutionContext context) {
    return value;
  }

  @Override
  public String toString() {
    return value == Values.MISSING ? "MISSING" : ValueMarshaller.marshalToString(value);
  }
}
