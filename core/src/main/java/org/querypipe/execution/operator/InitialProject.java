/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.data.Tuple;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.Operator;
import org.querypipe.expression.NamedExpression;
import org.querypipe.planner.physical.ProjectionPhysicalOperator;

/**
 * Builds the projected item: the input fields when the projection includes {@code *}, then each
 * projection under its alias. Attachments, id and parent scope carry over.
 */
public class InitialProject extends BaseOperator {

  private final ProjectionPhysicalOperator projection;

  public InitialProject(ProjectionPhysicalOperator plan, ExecutionContext context) {
    super(plan, context, true, false);
    this.projection = plan;
  }

  private InitialProject(InitialProject other) {
    super(other);
    this.projection = other.projection;
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    Tuple projected = new Tuple();
    if (projection.isIncludeAll()) {
      item.getFields().forEach(projected::setField);
    }
    try {
      for (NamedExpression expression : projection.getProjections()) {
        projected.setField(expression.getNameOrAlias(), expression.evaluate(item, context));
      }
    } catch (QueryEngineException e) {
      context.error(e);
      item.recycle();
      return true;
    }
    projected.setId(item.getId());
    projected.setParent(item.getParent());
    item.getAttachments().forEach(projected::setAttachment);
    item.recycle();
    return sendItem(projected);
  }

  @Override
  public Operator copy() {
    return new InitialProject(this);
  }
}
