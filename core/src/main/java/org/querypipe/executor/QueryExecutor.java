/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.executor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;
import org.querypipe.common.exception.ErrorCode;
import org.querypipe.common.exception.ExecutionInternalException;
import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.common.setting.RequestSettings;
import org.querypipe.common.setting.Settings;
import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionBuilder;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.Operator;
import org.querypipe.execution.OperatorAction;
import org.querypipe.execution.ResultSink;
import org.querypipe.execution.Sequence;
import org.querypipe.execution.operator.Stream;
import org.querypipe.execution.profile.ExecutionAnalyzer;
import org.querypipe.planner.physical.PhysicalOperatorNode;
import org.querypipe.planner.physical.PhysicalOperatorType;
import org.querypipe.planner.physical.SequencePhysicalOperator;
import org.querypipe.planner.physical.StreamPhysicalOperator;
import org.querypipe.storage.Datastore;

/**
 * Runs plans against a datastore. Operator workers of all requests share one pool of daemon
 * threads.
 */
@Log4j2
public class QueryExecutor implements Closeable {

  private final Datastore datastore;
  private final Settings settings;
  private final ExecutorService workers;

  public QueryExecutor(Datastore datastore, Settings settings) {
    this.datastore = datastore;
    this.settings = settings;
    this.workers =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                .setNameFormat("querypipe-worker-%d")
                .setDaemon(true)
                .build());
  }

  public QueryResponse execute(PhysicalOperatorNode plan) {
    return execute(plan, new RequestSettings(settings));
  }

  /**
   * Runs a plan to completion. A plan that does not end in a stream gets one appended, so its
   * output is returned as rows.
   */
  public QueryResponse execute(PhysicalOperatorNode plan, RequestSettings requestSettings) {
    String requestId = UUID.randomUUID().toString();
    RowSink sink = new RowSink();
    ExecutionContext context =
        new ExecutionContext(requestId, requestSettings, datastore, sink, workers);

    Operator root;
    try {
      root = buildRoot(plan, context);
    } catch (QueryEngineException e) {
      log.warn("[{}] unable to build plan {}", requestId, plan.describe(), e);
      return QueryResponse.builder().requestId(requestId).error(e).build();
    }
    root.setRoot();
    context.setRoot(root);

    log.debug("[{}] executing {}", requestId, plan.describe());
    root.runOnce(context, null);
    awaitResults(context, root, requestSettings.getTimeoutMillis());
    root.done();
    context.getSubqueries().close();

    QueryResponse.QueryResponseBuilder response =
        QueryResponse.builder()
            .requestId(requestId)
            .errors(context.getErrors())
            .warnings(context.getWarnings())
            .mutationCount(context.getMutationCount())
            .profile(root.profile())
            .metrics(metrics(context))
            .notes(ExecutionAnalyzer.analyze(root));
    if (!context.hasFatal()) {
      response.rows(sink.getRows());
    }
    return response.build();
  }

  private static Operator buildRoot(PhysicalOperatorNode plan, ExecutionContext context) {
    ExecutionBuilder builder = new ExecutionBuilder(context);
    if (endsInStream(plan)) {
      return builder.build(plan);
    }
    StreamPhysicalOperator streamPlan = new StreamPhysicalOperator();
    Stream stream = (Stream) builder.build(streamPlan);
    return new Sequence(
        SequencePhysicalOperator.of(plan, streamPlan),
        context,
        List.of(builder.build(plan), stream));
  }

  private static boolean endsInStream(PhysicalOperatorNode plan) {
    if (plan.getOperatorType() == PhysicalOperatorType.STREAM) {
      return true;
    }
    if (plan.getOperatorType() != PhysicalOperatorType.SEQUENCE) {
      return false;
    }
    List<PhysicalOperatorNode> children = plan.getChildren();
    return endsInStream(children.get(children.size() - 1));
  }

  private static void awaitResults(ExecutionContext context, Operator root, long timeoutMillis) {
    try {
      long timeout = timeoutMillis > 0 ? timeoutMillis : Long.MAX_VALUE;
      if (!context.awaitResults(timeout, TimeUnit.MILLISECONDS)) {
        context.fatal(
            new QueryEngineException(
                ErrorCode.REQUEST_TIMEOUT,
                QueryEngineException.Severity.FATAL,
                String.format("Request timed out after %d ms", timeoutMillis)));
        root.sendAction(OperatorAction.STOP);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      context.fatal(new ExecutionInternalException("Request interrupted", e));
      root.sendAction(OperatorAction.STOP);
    }
  }

  private static Map<String, Object> metrics(ExecutionContext context) {
    Map<String, Object> metrics = new LinkedHashMap<>(context.phaseSummary());
    metrics.put("usedMemory", context.getMaxUsedMemory());
    metrics.put("mutationCount", context.getMutationCount());
    return metrics;
  }

  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warn("Operator workers did not terminate, interrupting");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
  }

  /** Keeps the fields of every result. */
  private static final class RowSink implements ResultSink {
    private final List<Map<String, Object>> rows = Collections.synchronizedList(new ArrayList<>());

    @Override
    public boolean result(Tuple item) {
      rows.add(new LinkedHashMap<>(item.getFields()));
      item.recycle();
      return true;
    }

    @Override
    public void close() {}

    List<Map<String, Object>> getRows() {
      synchronized (rows) {
        return new ArrayList<>(rows);
      }
    }
  }
}
