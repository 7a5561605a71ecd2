/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.querypipe.common.exception.ErrorCode;
import org.querypipe.common.exception.EvaluationException;
import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.data.Tuple;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.ExecutionPhase;
import org.querypipe.execution.Operator;
import org.querypipe.execution.Phase;
import org.querypipe.planner.physical.SendMutationPhysicalOperator;
import org.querypipe.storage.KeyValuePair;
import org.querypipe.storage.Keyspace;
import org.querypipe.storage.MutationResult;

/**
 * Writes its input to a keyspace a batch at a time and sends on the documents that were written.
 * An item whose key or document cannot be formed is reported and skipped; the other items of its
 * batch are still written.
 */
public class SendMutation extends BaseOperator {

  private final SendMutationPhysicalOperator mutation;
  private final ExecutionPhase phase;
  private Keyspace keyspace;
  private long remaining;
  private long mutated;

  public SendMutation(SendMutationPhysicalOperator plan, ExecutionContext context) {
    super(plan, context);
    this.mutation = plan;
    this.phase = ExecutionPhase.valueOf(plan.getKind().name());
  }

  private SendMutation(SendMutation other) {
    super(other);
    this.mutation = other.mutation;
    this.phase = other.phase;
  }

  @Override
  protected ExecutionPhase executionPhase() {
    return phase;
  }

  @Override
  protected boolean beforeItems(ExecutionContext context, Tuple parent) {
    try {
      keyspace = context.getDatastore().keyspace(mutation.getKeyspace());
    } catch (QueryEngineException e) {
      context.fatal(e);
      return false;
    }
    remaining = mutation.getLimit() > 0 ? mutation.getLimit() : -1;
    return true;
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    if (remaining == 0) {
      item.recycle();
      return false;
    }
    if (remaining > 0) {
      remaining--;
    }
    return enbatch(item, context);
  }

  @Override
  protected boolean flushBatch(ExecutionContext context) {
    if (batch == null || batch.isEmpty()) {
      return true;
    }
    List<KeyValuePair> pairs = new ArrayList<>(batch.size());
    for (Tuple item : batch) {
      KeyValuePair pair = pair(item, context);
      if (pair != null) {
        pairs.add(pair);
      }
      item.recycle();
    }
    batch.clear();
    if (pairs.isEmpty()) {
      return true;
    }

    switchPhase(Phase.SERV);
    MutationResult result;
    try {
      result = keyspace.mutate(mutation.getKind(), pairs);
    } catch (QueryEngineException e) {
      context.fatal(e);
      return false;
    } finally {
      switchPhase(Phase.EXEC);
    }
    result.errors().forEach(context::error);
    context.addMutationCount(result.mutated().size());
    mutated += result.mutated().size();

    for (KeyValuePair written : result.mutated()) {
      Tuple document = Tuple.of(written.value() == null ? Map.of() : written.value());
      document.setId(written.key());
      if (!sendItem(document)) {
        return false;
      }
    }
    return true;
  }

  /** The key and document of an item, or null after reporting why there are none. */
  private KeyValuePair pair(Tuple item, ExecutionContext context) {
    Object key;
    Object value;
    try {
      key = mutation.getKeyExpression().evaluate(item, context);
      value =
          mutation.getValueExpression() == null
              ? item.getFields()
              : mutation.getValueExpression().evaluate(item, context);
    } catch (EvaluationException e) {
      context.error(e);
      return null;
    }
    if (!(key instanceof String)) {
      context.error(
          new QueryEngineException(
              ErrorCode.MUTATION_KEY,
              QueryEngineException.Severity.ERROR,
              String.format("%s key must be a string, got %s", mutation.getKind(), key)));
      return null;
    }
    if (!(value instanceof Map)) {
      context.error(
          new EvaluationException(
              String.format(
                  "%s value for key %s is not an object: %s", mutation.getKind(), key, value)));
      return null;
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> document = new LinkedHashMap<>((Map<String, Object>) value);
    return new KeyValuePair((String) key, document);
  }

  @Override
  protected void afterItems(ExecutionContext context) {
    if (!isStopped()) {
      flushBatch(context);
    }
    context.addPhaseCount(phase, mutated);
  }

  @Override
  protected void resetState() {
    remaining = -1;
    mutated = 0;
  }

  @Override
  public Operator copy() {
    return new SendMutation(this);
  }
}
