/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression;

import com.google.common.base.Strings;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionContext;

/** Expression that carries the name of the field it produces. */
@AllArgsConstructor
@EqualsAndHashCode
@Getter
@RequiredArgsConstructor
public class NamedExpression implements Expression {

  /** Expression name. */
  private final String name;

  /** Expression that being named. */
  private final Expression delegated;

  /** Optional alias. */
  private String alias;

  @Override
  public Object evaluate(Tuple item, ExecutionContext context) {
    return delegated.evaluate(item, context);
  }

  /**
   * Get expression name using name or its alias (if it's present).
   *
   * @return expression name
   */
  public String getNameOrAlias() {
    return Strings.isNullOrEmpty(alias) ? name : alias;
  }

  @Override
  public String toString() {
    return getNameOrAlias();
  }
}
