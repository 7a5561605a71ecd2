/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression;

import lombok.EqualsAndHashCode;
import org.querypipe.data.Tuple;
import org.querypipe.data.Values;
import org.querypipe.execution.ExecutionContext;

/** The document key of the current item, {@code META().id}. */
@EqualsAndHashCode
public class DocumentIdExpression implements Expression {

  @Override
  public Object evaluate(Tuple item, ExecutionContext context) {
    return item.getId() == null ? Values.MISSING : item.getId();
  }

  @Override
  public String toString() {
    return "meta().id";
  }
}
