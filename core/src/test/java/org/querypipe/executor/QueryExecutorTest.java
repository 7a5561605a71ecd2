/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.querypipe.expression.DSL.greater;
import static org.querypipe.expression.DSL.less;
import static org.querypipe.expression.DSL.literal;
import static org.querypipe.expression.DSL.named;
import static org.querypipe.expression.DSL.ref;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.querypipe.common.exception.ErrorCode;
import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.common.setting.DefaultSettings;
import org.querypipe.common.setting.RequestSettings;
import org.querypipe.common.setting.Settings.Key;
import org.querypipe.planner.physical.FetchPhysicalOperator;
import org.querypipe.planner.physical.FilterPhysicalOperator;
import org.querypipe.planner.physical.PhysicalOperatorNode;
import org.querypipe.planner.physical.PhysicalOperatorType;
import org.querypipe.planner.physical.ProjectionPhysicalOperator;
import org.querypipe.planner.physical.ScanPhysicalOperator;
import org.querypipe.planner.physical.SendMutationPhysicalOperator;
import org.querypipe.planner.physical.SequencePhysicalOperator;
import org.querypipe.planner.physical.StreamPhysicalOperator;
import org.querypipe.planner.physical.ValuesPhysicalOperator;
import org.querypipe.storage.Datastore;
import org.querypipe.storage.InMemoryDatastore;
import org.querypipe.storage.IndexEntry;
import org.querypipe.storage.KeyValuePair;
import org.querypipe.storage.Keyspace;
import org.querypipe.storage.MutationKind;
import org.querypipe.storage.MutationResult;
import org.querypipe.storage.ScanSpan;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryExecutorTest {

  private InMemoryDatastore datastore;
  private QueryExecutor executor;

  @BeforeEach
  void setUp() {
    datastore = new InMemoryDatastore();
    datastore
        .createKeyspace("users")
        .put("u1", Map.of("name", "ann", "age", 25L))
        .put("u2", Map.of("name", "bob", "age", 35L))
        .put("u3", Map.of("name", "cid", "age", 45L));
    executor = new QueryExecutor(datastore, new DefaultSettings());
  }

  @AfterEach
  void tearDown() {
    executor.close();
  }

  private static PhysicalOperatorNode olderThan(long age) {
    return SequencePhysicalOperator.of(
        new ScanPhysicalOperator("users"),
        new FetchPhysicalOperator("users"),
        new FilterPhysicalOperator(greater(ref("age"), literal(age))),
        new ProjectionPhysicalOperator(List.of(named("name", ref("name"))), false));
  }

  // ===== RESULTS =====

  @Test
  void plan_without_stream_gets_one_appended() {
    // When
    QueryResponse response = executor.execute(olderThan(30));

    // Then
    assertTrue(response.isSuccess());
    assertEquals(List.of(Map.of("name", "bob"), Map.of("name", "cid")), response.getRows());
    assertEquals(
        PhysicalOperatorType.SEQUENCE.getDisplayName(), response.getProfile().get("#operator"));
  }

  @Test
  void plan_ending_in_stream_runs_as_given() {
    PhysicalOperatorNode plan =
        SequencePhysicalOperator.of(
            new ValuesPhysicalOperator(List.of(Map.of("x", 1L), Map.of("x", 2L))),
            new StreamPhysicalOperator());

    QueryResponse response = executor.execute(plan);

    assertEquals(2, response.getRows().size());
  }

  @Test
  void metrics_carry_phase_counts() {
    QueryResponse response = executor.execute(olderThan(30));

    Map<?, ?> counts = (Map<?, ?>) response.getMetrics().get("phaseCounts");
    assertEquals(3L, counts.get("primaryScan"));
    assertEquals(3L, counts.get("fetch"));
    assertEquals(0L, response.getMetrics().get("mutationCount"));
  }

  @Test
  void mutations_are_counted() {
    PhysicalOperatorNode plan =
        SequencePhysicalOperator.of(
            new ValuesPhysicalOperator(List.of(Map.of("id", "u4", "name", "dee"))),
            new SendMutationPhysicalOperator("users", MutationKind.INSERT, ref("id"), null, 0));

    QueryResponse response = executor.execute(plan);

    assertEquals(1L, response.getMutationCount());
    assertEquals(1L, response.getMetrics().get("mutationCount"));
    assertEquals("dee", response.getRows().get(0).get("name"));
  }

  @Test
  void analyzer_notes_are_attached() {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (long i = 0; i < 20_000; i++) {
      rows.add(Map.of("x", i));
    }
    PhysicalOperatorNode plan =
        SequencePhysicalOperator.of(
            new ValuesPhysicalOperator(rows),
            new FilterPhysicalOperator(less(ref("x"), literal(10L))));

    QueryResponse response = executor.execute(plan);

    assertEquals(10, response.getRows().size());
    assertTrue(response.getNotes().contains("Filter eliminating over 90%"));
  }

  // ===== FAILURES =====

  @Test
  void fatal_error_fails_the_request_without_rows() {
    PhysicalOperatorNode plan = new ScanPhysicalOperator("missing");

    QueryResponse response = executor.execute(plan);

    assertFalse(response.isSuccess());
    assertTrue(response.getRows().isEmpty());
    assertEquals(ErrorCode.KEYSPACE_NOT_FOUND, response.getErrors().get(0).getCode());
  }

  @Test
  void non_fatal_errors_keep_the_rows() {
    datastore.createKeyspace("users").put("u9", Map.of("name", "eve"));
    PhysicalOperatorNode plan =
        SequencePhysicalOperator.of(
            new ValuesPhysicalOperator(
                List.of(Map.of("id", "u9", "name", "x"), Map.of("id", "u8", "name", "y"))),
            new SendMutationPhysicalOperator("users", MutationKind.INSERT, ref("id"), null, 0));

    QueryResponse response = executor.execute(plan);

    assertTrue(response.isSuccess());
    assertEquals(1, response.getRows().size());
    assertEquals(1, response.getErrorsAndWarnings().size());
  }

  @Test
  void request_timeout_stops_the_plan() {
    // Given: a keyspace whose scan never ends
    executor.close();
    executor = new QueryExecutor(new EndlessDatastore(), new DefaultSettings());
    RequestSettings settings =
        new RequestSettings(new DefaultSettings()).with(Key.TIMEOUT, 200).with(Key.SCAN_CAP, 1);

    // When
    QueryResponse response = executor.execute(new ScanPhysicalOperator("endless"), settings);

    // Then
    assertFalse(response.isSuccess());
    QueryEngineException error = response.getErrors().get(0);
    assertEquals(ErrorCode.REQUEST_TIMEOUT, error.getCode());
    assertTrue(response.getRows().isEmpty());
  }

  /** A datastore whose only keyspace yields index entries slowly and forever. */
  private static final class EndlessDatastore implements Datastore {
    private final Keyspace keyspace = new EndlessKeyspace();

    @Override
    public Keyspace keyspace(String name) {
      return keyspace;
    }
  }

  private static final class EndlessKeyspace implements Keyspace {
    @Override
    public String getName() {
      return "endless";
    }

    @Override
    public Map<String, Map<String, Object>> fetch(
        Collection<String> keys, List<QueryEngineException> errors) {
      return Map.of();
    }

    @Override
    public Iterator<IndexEntry> scan(ScanSpan span, long limit) {
      return new Iterator<>() {
        private long next;

        @Override
        public boolean hasNext() {
          try {
            Thread.sleep(20);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
          }
          return true;
        }

        @Override
        public IndexEntry next() {
          return new IndexEntry("k" + next++);
        }
      };
    }

    @Override
    public MutationResult mutate(MutationKind kind, List<KeyValuePair> pairs) {
      return new MutationResult(List.of(), List.of());
    }

    @Override
    public long count() {
      return Long.MAX_VALUE;
    }
  }
}
