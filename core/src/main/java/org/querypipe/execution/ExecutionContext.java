/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;
import org.querypipe.common.exception.ExecutionPanicException;
import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.common.setting.RequestSettings;
import org.querypipe.data.Tuple;
import org.querypipe.execution.bitfilter.BitFilterRegistry;
import org.querypipe.execution.spill.MemorySpillDecider;
import org.querypipe.execution.spill.SpillDecider;
import org.querypipe.planner.physical.PhysicalOperatorNode;
import org.querypipe.storage.Datastore;

/**
 * State shared by every operator of one request: settings, memory quota accounting, published bit
 * filters, cached sub-query executions, the worker pool, the result sink and the errors reported
 * by operators.
 *
 * <p>Operators never throw across a worker boundary; they report here. A fatal error stops the
 * root operator, which propagates the stop to the whole operator tree.
 */
@Log4j2
public class ExecutionContext {

  @Getter private final String requestId;

  @Getter private final RequestSettings settings;

  @Getter private final Datastore datastore;

  @Getter private final ExecutorService executor;

  @Getter private final BitFilterRegistry bitFilters = new BitFilterRegistry();

  @Getter private final ExecutionPools pools;

  @Getter private final SubqueryCache subqueries;

  private final ResultSink sink;
  private final long memoryQuota;
  private final AtomicLong inUseMemory = new AtomicLong();
  private final AtomicLong maxInUseMemory = new AtomicLong();
  private final AtomicLong mutationCount = new AtomicLong();
  private final List<QueryEngineException> errors =
      Collections.synchronizedList(new ArrayList<>());
  private final List<QueryEngineException> warnings =
      Collections.synchronizedList(new ArrayList<>());
  private final AtomicBoolean fatal = new AtomicBoolean();
  private final AtomicBoolean resultsClosed = new AtomicBoolean();
  private final CountDownLatch resultsDone = new CountDownLatch(1);
  private final Map<ExecutionPhase, PhaseStats> phases = new EnumMap<>(ExecutionPhase.class);

  /** Root of the operator tree, the target of request wide stops. */
  @Getter @Setter private volatile Operator root;

  @Setter private Function<String, SpillDecider> spillDeciders;

  public ExecutionContext(
      String requestId,
      RequestSettings settings,
      Datastore datastore,
      ResultSink sink,
      ExecutorService executor) {
    this.requestId = requestId;
    this.settings = settings;
    this.datastore = datastore;
    this.sink = sink;
    this.executor = executor;
    this.memoryQuota = settings.getMemoryQuotaBytes();
    this.pools = new ExecutionPools(settings.getPipelineBatch(), settings.getPipelineCap());
    this.subqueries = new SubqueryCache(this);
    for (ExecutionPhase phase : ExecutionPhase.values()) {
      phases.put(phase, new PhaseStats());
    }
    this.spillDeciders =
        name -> settings.isSpillEnabled() ? new MemorySpillDecider(this, name) : SpillDecider.NEVER;
  }

  public int getPipelineCap() {
    return settings.getPipelineCap();
  }

  public int getPipelineBatch() {
    return settings.getPipelineBatch();
  }

  public int getScanCap() {
    return settings.getScanCap();
  }

  public int getMaxParallelism() {
    return settings.getMaxParallelism();
  }

  public int getOrderFallbackNum() {
    return settings.getOrderFallbackNum();
  }

  /** The spill decision for a new buffering operator. */
  public SpillDecider spillDecider(String operatorName) {
    return spillDeciders.apply(operatorName);
  }

  // memory quota

  public boolean useRequestQuota() {
    return memoryQuota > 0;
  }

  public long getMemoryQuota() {
    return memoryQuota;
  }

  /** Bytes a producer may queue ahead of its consumer before it yields. */
  public long producerThrottleQuota() {
    return memoryQuota / 10;
  }

  /**
   * Adds to the memory in use.
   *
   * @return true if the quota is now exceeded
   */
  public boolean trackValueSize(long size) {
    long used = inUseMemory.addAndGet(size);
    maxInUseMemory.accumulateAndGet(used, Math::max);
    return useRequestQuota() && used > memoryQuota;
  }

  public void releaseValueSize(long size) {
    inUseMemory.addAndGet(-size);
  }

  /** Share of the quota in use, 0 without a quota. */
  public double currentQuotaUsage() {
    return useRequestQuota() ? (double) inUseMemory.get() / memoryQuota : 0.0;
  }

  public long getUsedMemory() {
    return inUseMemory.get();
  }

  public long getMaxUsedMemory() {
    return maxInUseMemory.get();
  }

  // results

  /**
   * Delivers a result.
   *
   * @return false if results are no longer wanted
   */
  public boolean result(Tuple item) {
    if (fatal.get() || resultsClosed.get()) {
      return false;
    }
    return sink.result(item);
  }

  /** Ends the result stream. Only the first call has an effect. */
  public void closeResults() {
    if (resultsClosed.compareAndSet(false, true)) {
      try {
        sink.close();
      } finally {
        resultsDone.countDown();
      }
    }
  }

  public boolean isResultsClosed() {
    return resultsClosed.get();
  }

  /**
   * Waits for the result stream to end.
   *
   * @return false on timeout
   */
  public boolean awaitResults(long timeout, TimeUnit unit) throws InterruptedException {
    return resultsDone.await(timeout, unit);
  }

  // errors

  /** Reports an error. Fatal errors abort the request, others are accumulated. */
  public void error(QueryEngineException error) {
    if (error.isFatal()) {
      fatal(error);
      return;
    }
    log.debug("[{}] {}", requestId, error.toString());
    errors.add(error);
  }

  public void warning(QueryEngineException warning) {
    warnings.add(warning);
  }

  /** Records a fatal error and stops the request. */
  public void fatal(QueryEngineException error) {
    log.warn("[{}] request failed: {}", requestId, error.toString());
    errors.add(error);
    fatal.set(true);
    stopRoot();
  }

  /** Aborts the request after an internal failure. */
  public void abort(QueryEngineException error) {
    fatal(error);
  }

  /**
   * Handles a failure that escaped an operator: logs it with the plan and the stack, aborts the
   * request and force releases the operator so that nothing waits on it.
   */
  public void recover(BaseOperator operator, Throwable failure) {
    String plan = operator == null ? "" : operator.getPlan().describe();
    log.error("[{}] panic in operator, plan: {}", requestId, plan, failure);
    abort(new ExecutionPanicException(failure, "Panic: " + failure));
    if (operator != null) {
      operator.release(this);
    }
  }

  private void stopRoot() {
    Operator operator = root;
    if (operator != null) {
      operator.sendAction(OperatorAction.STOP);
    }
  }

  public boolean hasFatal() {
    return fatal.get();
  }

  public List<QueryEngineException> getErrors() {
    synchronized (errors) {
      return ImmutableList.copyOf(errors);
    }
  }

  public List<QueryEngineException> getWarnings() {
    synchronized (warnings) {
      return ImmutableList.copyOf(warnings);
    }
  }

  // mutations

  public void addMutationCount(long count) {
    mutationCount.addAndGet(count);
  }

  public long getMutationCount() {
    return mutationCount.get();
  }

  // phases

  public void addPhaseOperator(ExecutionPhase phase) {
    phases.get(phase).operators.incrementAndGet();
  }

  public void addPhaseCount(ExecutionPhase phase, long count) {
    phases.get(phase).count.addAndGet(count);
  }

  public void addPhaseTime(ExecutionPhase phase, long nanos) {
    phases.get(phase).nanos.addAndGet(nanos);
  }

  public long getPhaseCount(ExecutionPhase phase) {
    return phases.get(phase).count.get();
  }

  /** Counts and times of the phases that ran, by phase name. */
  public Map<String, Object> phaseSummary() {
    Map<String, Object> counts = new LinkedHashMap<>();
    Map<String, Object> operators = new LinkedHashMap<>();
    Map<String, Object> times = new LinkedHashMap<>();
    phases.forEach(
        (phase, stats) -> {
          if (stats.operators.get() > 0) {
            operators.put(phase.getDisplayName(), stats.operators.get());
          }
          if (stats.count.get() > 0) {
            counts.put(phase.getDisplayName(), stats.count.get());
          }
          if (stats.nanos.get() > 0) {
            times.put(phase.getDisplayName(), Operators.formatDuration(stats.nanos.get()));
          }
        });
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("phaseCounts", counts);
    summary.put("phaseOperators", operators);
    summary.put("phaseTimes", times);
    return summary;
  }

  // sub-queries

  /** Runs, or returns the cached results of, a sub-query plan. */
  public List<Object> evaluateSubquery(
      PhysicalOperatorNode plan, Tuple parent, boolean correlated) {
    return subqueries.evaluate(plan, parent, correlated);
  }

  private static final class PhaseStats {
    private final AtomicLong operators = new AtomicLong();
    private final AtomicLong count = new AtomicLong();
    private final AtomicLong nanos = new AtomicLong();
  }
}
