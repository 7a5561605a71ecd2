/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionContext;

/** Reads a field, possibly nested ({@code a.b.c}), of the current item. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ReferenceExpression implements Expression {

  private final String path;

  @Override
  public Object evaluate(Tuple item, ExecutionContext context) {
    return item.getField(path);
  }

  /** The top level field this reference starts from. */
  public String rootField() {
    int dot = path.indexOf('.');
    return dot < 0 ? path : path.substring(0, dot);
  }

  @Override
  public String toString() {
    return path;
  }
}
