/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import org.querypipe.data.ValueCollation;
import org.querypipe.data.Values;
import org.querypipe.expression.Expression;

/** Represents a sort term with its expression, direction, and null ordering. */
public record SortKey(Expression expression, boolean descending, boolean nullsLast) {

  public static SortKey asc(Expression expression) {
    return new SortKey(expression, false, false);
  }

  public static SortKey desc(Expression expression) {
    return new SortKey(expression, true, true);
  }

  /**
   * Compares two values of this key in output order. NULL and MISSING go first or last as declared,
   * whatever the direction.
   */
  public int compare(Object left, Object right) {
    boolean leftNull = Values.isNullOrMissing(left);
    boolean rightNull = Values.isNullOrMissing(right);
    if (leftNull != rightNull) {
      return leftNull == nullsLast ? 1 : -1;
    }
    int result = ValueCollation.INSTANCE.compare(left, right);
    return descending ? -result : result;
  }

  @Override
  public String toString() {
    return expression
        + (descending ? " DESC" : " ASC")
        + (nullsLast ? " NULLS LAST" : " NULLS FIRST");
  }
}
