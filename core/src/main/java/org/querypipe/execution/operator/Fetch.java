/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.querypipe.common.exception.DatastoreException;
import org.querypipe.common.exception.EvaluationException;
import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.data.Tuple;
import org.querypipe.data.ValueMarshaller;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.ExecutionPhase;
import org.querypipe.execution.Operator;
import org.querypipe.execution.Phase;
import org.querypipe.execution.bitfilter.BloomFilter;
import org.querypipe.expression.Expression;
import org.querypipe.planner.physical.BitFilterSpec;
import org.querypipe.planner.physical.FetchPhysicalOperator;
import org.querypipe.storage.Keyspace;

/**
 * Loads the documents of the keys it receives, a batch at a time. Keys rejected by a probe bit
 * filter are dropped before the fetch. Keys without a document are reported as warnings.
 */
public class Fetch extends BaseOperator {

  private final FetchPhysicalOperator fetch;
  private Keyspace keyspace;
  private final List<Probe> probes = new ArrayList<>();
  private long fetched;
  private long filtered;

  public Fetch(FetchPhysicalOperator plan, ExecutionContext context) {
    super(plan, context);
    this.fetch = plan;
  }

  private Fetch(Fetch other) {
    super(other);
    this.fetch = other.fetch;
  }

  @Override
  protected ExecutionPhase executionPhase() {
    return ExecutionPhase.FETCH;
  }

  @Override
  protected boolean beforeItems(ExecutionContext context, Tuple parent) {
    try {
      keyspace = context.getDatastore().keyspace(fetch.getKeyspace());
    } catch (QueryEngineException e) {
      context.fatal(e);
      return false;
    }
    try {
      for (BitFilterSpec spec : fetch.getProbeBitFilters()) {
        BloomFilter filter = context.getBitFilters().getBitFilter(spec.alias(), spec.indexId());
        if (filter != null) {
          probes.add(new Probe(spec, filter));
        }
      }
    } catch (QueryEngineException e) {
      context.fatal(e);
      releaseProbes(context);
      return false;
    }
    return true;
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    if (item.getId() == null) {
      context.error(new EvaluationException("Fetch item has no document key: " + item));
      item.recycle();
      return true;
    }
    try {
      for (Probe probe : probes) {
        if (!probe.test(item, context)) {
          filtered++;
          item.recycle();
          return true;
        }
      }
    } catch (EvaluationException e) {
      context.error(e);
      item.recycle();
      return false;
    }
    return enbatch(item, context);
  }

  @Override
  protected boolean flushBatch(ExecutionContext context) {
    if (batch == null || batch.isEmpty()) {
      return true;
    }
    List<String> keys = new ArrayList<>(batch.size());
    for (Tuple item : batch) {
      keys.add(item.getId());
    }
    List<QueryEngineException> errors = new ArrayList<>();
    switchPhase(Phase.SERV);
    Map<String, Map<String, Object>> documents;
    try {
      documents = keyspace.fetch(keys, errors);
    } finally {
      switchPhase(Phase.EXEC);
    }
    errors.forEach(context::error);

    boolean ok = true;
    for (Tuple item : batch) {
      Map<String, Object> document = ok ? documents.get(item.getId()) : null;
      if (document == null) {
        if (ok) {
          context.warning(DatastoreException.documentNotFound(item.getId()));
        }
        item.recycle();
        continue;
      }
      Tuple loaded = new Tuple(document);
      loaded.setId(item.getId());
      loaded.setParent(item.getParent());
      item.getAttachments().forEach(loaded::setAttachment);
      item.recycle();
      fetched++;
      ok = sendItem(loaded);
    }
    batch.clear();
    return ok;
  }

  @Override
  protected void afterItems(ExecutionContext context) {
    if (!isStopped()) {
      flushBatch(context);
    }
    releaseProbes(context);
    context.addPhaseCount(ExecutionPhase.FETCH, fetched);
  }

  private void releaseProbes(ExecutionContext context) {
    for (Probe probe : probes) {
      context.getBitFilters().clearBitFilter(probe.spec.alias(), probe.spec.indexId());
    }
    probes.clear();
  }

  @Override
  protected void resetState() {
    probes.clear();
    fetched = 0;
    filtered = 0;
  }

  /** Items dropped by probe bit filters. */
  public long getFiltered() {
    return filtered;
  }

  @Override
  public Operator copy() {
    return new Fetch(this);
  }

  private static final class Probe {
    private final BitFilterSpec spec;
    private final BloomFilter filter;

    private Probe(BitFilterSpec spec, BloomFilter filter) {
      this.spec = spec;
      this.filter = filter;
    }

    private boolean test(Tuple item, ExecutionContext context) {
      List<Object> values = new ArrayList<>(spec.expressions().size());
      for (Expression expression : spec.expressions()) {
        values.add(expression.evaluate(item, context));
      }
      return filter.test(ValueMarshaller.marshalKey(values));
    }
  }
}
