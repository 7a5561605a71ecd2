/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.querypipe.common.exception.EvaluationException;
import org.querypipe.common.exception.MemoryQuotaExceededException;
import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.data.Tuple;
import org.querypipe.data.ValueMarshaller;
import org.querypipe.data.Values;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.ExecutionPhase;
import org.querypipe.execution.Operator;
import org.querypipe.execution.OperatorAction;
import org.querypipe.execution.bitfilter.BloomFilter;
import org.querypipe.execution.hash.HashTable;
import org.querypipe.expression.Expression;
import org.querypipe.planner.physical.BitFilterSpec;
import org.querypipe.planner.physical.HashJoinPhysicalOperator;

/**
 * Hash join. Before reading its input, the operator runs its build child to the end, loading every
 * build item into a hash table by its build key and filling the bloom filters the plan publishes
 * for probe side fetches. Each input item then probes the table with its probe key; every build
 * item that matches and passes the ON filter yields a joined item carrying the build fields under
 * the build alias. A LEFT OUTER join sends unmatched input items unchanged.
 */
@Log4j2
public class HashJoin extends BaseOperator {

  private final HashJoinPhysicalOperator join;
  private final Operator child;
  private HashTable<Tuple> table;
  private long buildSize;
  private long joined;

  public HashJoin(HashJoinPhysicalOperator plan, ExecutionContext context, Operator child) {
    super(plan, context);
    this.join = plan;
    this.child = child;
  }

  private HashJoin(HashJoin other) {
    super(other);
    this.join = other.join;
    this.child = other.child.copy();
  }

  @Override
  protected ExecutionPhase executionPhase() {
    return ExecutionPhase.HASH_JOIN;
  }

  @Override
  protected boolean beforeItems(ExecutionContext context, Tuple parent) {
    table = new HashTable<>(join.getEstimatedBuildCardinality());
    child.setOutput(child);
    child.setInput(null);
    child.setStop(null);
    child.setParent(this);
    fork(child, context, parent);

    boolean ok = buildTable(context);
    if (!ok) {
      child.sendAction(OperatorAction.STOP);
    }
    childrenWaitNoStop(1);
    if (!ok) {
      return false;
    }
    // an inner join with nothing to match produces nothing
    return join.isOuter() || !table.isEmpty();
  }

  private boolean buildTable(ExecutionContext context) {
    List<Builder> filters = new ArrayList<>(join.getBuildBitFilters().size());
    for (BitFilterSpec spec : join.getBuildBitFilters()) {
      filters.add(new Builder(spec));
    }
    while (true) {
      Tuple item = getItem(child.getValueExchange());
      if (item == null) {
        break;
      }
      try {
        Object key = key(join.getBuildExpressions(), item, context);
        for (Builder filter : filters) {
          filter.add(item, context);
        }
        table.put(key, item);
      } catch (EvaluationException e) {
        context.error(e);
        item.recycle();
        return false;
      } catch (QueryEngineException e) {
        context.fatal(e);
        item.recycle();
        return false;
      }
      long size = item.estimatedSize();
      buildSize += size;
      if (context.useRequestQuota() && context.trackValueSize(size)) {
        context.fatal(
            new MemoryQuotaExceededException(context.getMemoryQuota(), context.getUsedMemory()));
        return false;
      }
    }
    if (isStopped()) {
      return false;
    }
    try {
      for (Builder filter : filters) {
        filter.publish(context);
      }
    } catch (QueryEngineException e) {
      context.fatal(e);
      return false;
    }
    log.debug("Hash join built {} items under {} keys", table.numPayloads(), table.numKeys());
    return true;
  }

  private static Object key(List<Expression> expressions, Tuple item, ExecutionContext context) {
    List<Object> values = new ArrayList<>(expressions.size());
    for (Expression expression : expressions) {
      values.add(expression.evaluate(item, context));
    }
    return values.size() == 1 ? values.get(0) : values;
  }

  private static boolean matchable(Object key) {
    if (key instanceof List) {
      return ((List<?>) key).stream().noneMatch(Values::isNullOrMissing);
    }
    return !Values.isNullOrMissing(key);
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    Object key;
    try {
      key = key(join.getProbeExpressions(), item, context);
    } catch (EvaluationException e) {
      context.error(e);
      item.recycle();
      return false;
    }

    boolean matched = false;
    if (matchable(key)) {
      for (Tuple build = table.get(key); build != null; build = table.getNext()) {
        Tuple result = item.copy();
        result.setField(join.getBuildAlias(), new LinkedHashMap<>(build.getFields()));
        if (!passesOnFilter(result, context)) {
          result.recycle();
          continue;
        }
        matched = true;
        joined++;
        if (!sendItem(result)) {
          item.recycle();
          return false;
        }
      }
    }
    if (matched || !join.isOuter()) {
      item.recycle();
      return true;
    }
    return sendItem(item);
  }

  private boolean passesOnFilter(Tuple result, ExecutionContext context) {
    if (join.getOnFilter() == null) {
      return true;
    }
    try {
      return Values.truth(join.getOnFilter().evaluate(result, context));
    } catch (EvaluationException e) {
      context.error(e);
      return false;
    }
  }

  @Override
  protected void afterItems(ExecutionContext context) {
    context.addPhaseCount(ExecutionPhase.HASH_JOIN, joined);
    dropTable();
  }

  private void dropTable() {
    if (table == null) {
      return;
    }
    if (!table.isEmpty()) {
      table.iterate((key, item) -> item.recycle());
    }
    table.drop();
    table = null;
    if (context.useRequestQuota()) {
      context.releaseValueSize(buildSize);
    }
    buildSize = 0;
  }

  @Override
  protected long usedMemory() {
    return buildSize;
  }

  @Override
  public List<Operator> getChildren() {
    return List.of(child);
  }

  @Override
  public void sendAction(OperatorAction action) {
    if (baseSendAction(action)) {
      child.sendAction(action);
    }
  }

  @Override
  public void done() {
    super.done();
    dropTable();
    child.done();
  }

  @Override
  public boolean reopen(ExecutionContext context) {
    boolean ok = super.reopen(context);
    return child.reopen(context) && ok;
  }

  @Override
  protected void resetState() {
    dropTable();
    joined = 0;
  }

  /** Items joined with at least one build item. */
  public long getJoined() {
    return joined;
  }

  @Override
  public Map<String, Object> profile() {
    Map<String, Object> profile = super.profile();
    profile.put("~child", child.profile());
    return profile;
  }

  @Override
  public Operator copy() {
    return new HashJoin(this);
  }

  /** A bloom filter being filled from the build items. */
  private final class Builder {
    private final BitFilterSpec spec;
    private final BloomFilter filter;

    private Builder(BitFilterSpec spec) {
      this.spec = spec;
      this.filter = BloomFilter.create(Math.max(1, spec.estimatedCardinality()));
    }

    private void add(Tuple item, ExecutionContext context) {
      List<Object> values = new ArrayList<>(spec.expressions().size());
      for (Expression expression : spec.expressions()) {
        values.add(expression.evaluate(item, context));
      }
      filter.add(ValueMarshaller.marshalKey(values));
    }

    private void publish(ExecutionContext context) {
      int indexes =
          (int)
              join.getBuildBitFilters().stream()
                  .filter(other -> other.alias().equals(spec.alias()))
                  .count();
      // parallel copies build from the same input, so the filter being probed has these keys
      if (!context.getBitFilters().setBitFilter(spec.alias(), spec.indexId(), indexes, filter)) {
        log.debug("Bit filter {}/{} already probed, build dropped", spec.alias(), spec.indexId());
      }
    }
  }
}
