/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.expression.Expression;
import org.querypipe.storage.MutationKind;

/**
 * Physical operator sending mutations to a keyspace in batches. The key expression yields the
 * document key; the value expression yields the new document for INSERT, UPSERT and UPDATE.
 */
@Getter
@RequiredArgsConstructor
public class SendMutationPhysicalOperator implements PhysicalOperatorNode {

  private final String keyspace;

  private final MutationKind kind;

  private final Expression keyExpression;

  /** Document expression, unused for DELETE. */
  private final Expression valueExpression;

  /** Maximum number of mutations, 0 for no limit. */
  private final long limit;

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.SEND_MUTATION;
  }

  @Override
  public String describe() {
    return String.format("SendMutation(%s %s, key=%s)", kind, keyspace, keyExpression);
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitSendMutation(this, context);
  }
}
