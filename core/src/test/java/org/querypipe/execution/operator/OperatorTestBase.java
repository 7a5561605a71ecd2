/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.querypipe.common.setting.DefaultSettings;
import org.querypipe.common.setting.RequestSettings;
import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionBuilder;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.Operator;
import org.querypipe.execution.ResultSink;
import org.querypipe.planner.physical.PhysicalOperatorNode;
import org.querypipe.planner.physical.SequencePhysicalOperator;
import org.querypipe.planner.physical.StreamPhysicalOperator;
import org.querypipe.planner.physical.ValuesPhysicalOperator;
import org.querypipe.storage.InMemoryDatastore;

/** Runs operator pipelines over an in-memory datastore and collects what they stream. */
abstract class OperatorTestBase {

  protected final InMemoryDatastore datastore = new InMemoryDatastore();

  protected ExecutorService workers;

  @BeforeEach
  void startWorkers() {
    workers =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("operator-test-%d").setDaemon(true).build());
  }

  @AfterEach
  void stopWorkers() {
    workers.shutdownNow();
  }

  protected RequestSettings settings() {
    return new RequestSettings(new DefaultSettings());
  }

  protected ExecutionContext newContext(RequestSettings settings, CollectingSink sink) {
    return new ExecutionContext("test", settings, datastore, sink, workers);
  }

  protected Run run(PhysicalOperatorNode... pipeline) {
    CollectingSink sink = new CollectingSink();
    return run(newContext(settings(), sink), sink, pipeline);
  }

  /** Runs the pipeline followed by a stream and waits for the results. */
  protected Run run(
      ExecutionContext context, CollectingSink sink, PhysicalOperatorNode... pipeline) {
    List<PhysicalOperatorNode> nodes = new ArrayList<>(Arrays.asList(pipeline));
    nodes.add(new StreamPhysicalOperator());
    Operator root = new ExecutionBuilder(context).build(new SequencePhysicalOperator(nodes));
    root.setRoot();
    context.setRoot(root);
    root.runOnce(context, null);
    try {
      assertTrue(context.awaitResults(30, TimeUnit.SECONDS), "results did not complete");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AssertionError(e);
    }
    root.done();
    return new Run(root, context, sink.rows());
  }

  @SafeVarargs
  protected static ValuesPhysicalOperator values(Map<String, Object>... rows) {
    return new ValuesPhysicalOperator(Arrays.asList(rows));
  }

  /** A row from alternating names and values. */
  protected static Map<String, Object> row(Object... nameAndValue) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (int i = 0; i < nameAndValue.length; i += 2) {
      row.put((String) nameAndValue[i], nameAndValue[i + 1]);
    }
    return row;
  }

  protected static List<Object> column(List<Map<String, Object>> rows, String name) {
    List<Object> values = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      values.add(row.get(name));
    }
    return values;
  }

  /** The outcome of a pipeline run. */
  protected static final class Run {
    final Operator root;
    final ExecutionContext context;
    final List<Map<String, Object>> rows;

    Run(Operator root, ExecutionContext context, List<Map<String, Object>> rows) {
      this.root = root;
      this.context = context;
      this.rows = rows;
    }
  }

  /** Keeps the fields of every result. */
  protected static final class CollectingSink implements ResultSink {
    private final List<Map<String, Object>> rows = Collections.synchronizedList(new ArrayList<>());

    @Override
    public boolean result(Tuple item) {
      rows.add(new LinkedHashMap<>(item.getFields()));
      item.recycle();
      return true;
    }

    @Override
    public void close() {}

    List<Map<String, Object>> rows() {
      synchronized (rows) {
        return new ArrayList<>(rows);
      }
    }
  }
}
