/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression;

import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionContext;

/** A scalar expression evaluated against one item. */
public interface Expression {

  /**
   * Evaluates this expression.
   *
   * @param item the current item
   * @param context the request the item belongs to
   * @return the value, possibly {@code null} or {@link org.querypipe.data.Values#MISSING}
   * @throws org.querypipe.common.exception.EvaluationException if evaluation fails
   */
  Object evaluate(Tuple item, ExecutionContext context);
}
