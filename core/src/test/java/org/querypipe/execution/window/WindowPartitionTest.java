/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.window;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.querypipe.expression.DSL.ref;

import com.google.common.util.concurrent.MoreExecutors;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.querypipe.common.exception.EvaluationException;
import org.querypipe.common.setting.DefaultSettings;
import org.querypipe.common.setting.RequestSettings;
import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.ResultSink;
import org.querypipe.planner.physical.SortKey;
import org.querypipe.planner.physical.WindowFrame;
import org.querypipe.planner.physical.WindowFrame.Bound;
import org.querypipe.planner.physical.WindowFrame.Exclusion;
import org.querypipe.planner.physical.WindowFrame.Unit;
import org.querypipe.storage.InMemoryDatastore;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class WindowPartitionTest {

  private final ExecutionContext context =
      new ExecutionContext(
          "window-test",
          new RequestSettings(new DefaultSettings()),
          new InMemoryDatastore(),
          mock(ResultSink.class),
          MoreExecutors.newDirectExecutorService());

  // ===== ORDERING AND PEERS =====

  @Test
  void rows_are_sorted_stably() {
    List<Tuple> rows = rows("b", 2L, "a", 1L, "c", 2L);

    WindowPartition partition =
        WindowPartition.sorted(rows, List.of(SortKey.asc(ref("x"))), context);

    assertEquals("a", partition.row(0).getField("name"));
    assertEquals("b", partition.row(1).getField("name"));
    assertEquals("c", partition.row(2).getField("name"));
  }

  @Test
  void peers_share_a_group() {
    WindowPartition partition = ascending(1L, 2L, 2L, 3L, 5L);

    assertEquals(1, partition.peerStart(2));
    assertEquals(3, partition.peerEnd(1));
    assertEquals(1, partition.peerGroup(2));
    assertEquals(4, partition.peerGroupCount());
  }

  @Test
  void nulls_sort_first_unless_declared_last() {
    WindowPartition first = ascending(3L, null, 1L);
    WindowPartition last =
        WindowPartition.sorted(
            values(3L, null, 1L), List.of(new SortKey(ref("x"), false, true)), context);

    assertEquals(null, first.row(0).getField("x"));
    assertEquals(null, last.row(2).getField("x"));
  }

  // ===== FRAMES =====

  @Test
  void rows_frame_counts_rows() {
    WindowPartition partition = ascending(1L, 2L, 2L, 3L, 5L);
    WindowFrame frame = WindowFrame.of(Unit.ROWS, Bound.preceding(1), Bound.following(1));

    assertArrayEquals(new int[] {0, 1}, indexes(partition.frame(0, frame)));
    assertArrayEquals(new int[] {1, 2, 3}, indexes(partition.frame(2, frame)));
    assertArrayEquals(new int[] {3, 4}, indexes(partition.frame(4, frame)));
  }

  @Test
  void range_frame_uses_value_distance() {
    WindowPartition partition = ascending(1L, 2L, 2L, 3L, 5L);

    FrameRange preceding =
        partition.frame(3, WindowFrame.of(Unit.RANGE, Bound.preceding(1), Bound.currentRow()));
    FrameRange around =
        partition.frame(4, WindowFrame.of(Unit.RANGE, Bound.preceding(2), Bound.following(2)));

    assertArrayEquals(new int[] {1, 2, 3}, indexes(preceding));
    assertArrayEquals(new int[] {3, 4}, indexes(around));
  }

  @Test
  void range_frame_follows_descending_order() {
    List<Tuple> rows = values(1L, 2L, 2L, 3L, 5L);
    WindowPartition partition =
        WindowPartition.sorted(rows, List.of(SortKey.desc(ref("x"))), context);

    FrameRange frame =
        partition.frame(1, WindowFrame.of(Unit.RANGE, Bound.preceding(1), Bound.following(1)));

    assertArrayEquals(new int[] {1, 2, 3}, indexes(frame));
  }

  @Test
  void default_ordered_frame_ends_with_the_last_peer() {
    WindowPartition partition = ascending(1L, 2L, 2L, 3L);

    FrameRange frame = partition.frame(1, WindowFrame.defaultOrdered());

    assertArrayEquals(new int[] {0, 1, 2}, indexes(frame));
  }

  @Test
  void range_offset_over_null_value_covers_its_peers() {
    WindowPartition partition = ascending(null, null, 1L, 2L);

    FrameRange frame =
        partition.frame(0, WindowFrame.of(Unit.RANGE, Bound.preceding(5), Bound.following(5)));

    assertArrayEquals(new int[] {0, 1}, indexes(frame));
  }

  @Test
  void range_offset_needs_numeric_value() {
    WindowPartition partition =
        WindowPartition.sorted(rows("a", "x", "b", "y"), List.of(SortKey.asc(ref("x"))), context);
    WindowFrame frame = WindowFrame.of(Unit.RANGE, Bound.preceding(1), Bound.currentRow());

    assertThrows(EvaluationException.class, () -> partition.frame(0, frame));
  }

  @Test
  void groups_frame_counts_peer_groups() {
    WindowPartition partition = ascending(1L, 2L, 2L, 3L, 5L);

    FrameRange frame =
        partition.frame(3, WindowFrame.of(Unit.GROUPS, Bound.preceding(1), Bound.currentRow()));

    assertArrayEquals(new int[] {1, 2, 3}, indexes(frame));
  }

  @Test
  void exclusions_remove_current_row_group_or_ties() {
    WindowPartition partition = ascending(1L, 2L, 2L, 3L, 5L);
    Bound start = Bound.unboundedPreceding();
    Bound end = Bound.unboundedFollowing();

    FrameRange current =
        partition.frame(0, new WindowFrame(Unit.ROWS, start, end, Exclusion.CURRENT_ROW));
    FrameRange group = partition.frame(1, new WindowFrame(Unit.ROWS, start, end, Exclusion.GROUP));
    FrameRange ties = partition.frame(1, new WindowFrame(Unit.ROWS, start, end, Exclusion.TIES));

    assertArrayEquals(new int[] {1, 2, 3, 4}, indexes(current));
    assertArrayEquals(new int[] {0, 3, 4}, indexes(group));
    assertArrayEquals(new int[] {0, 1, 3, 4}, indexes(ties));
  }

  @Test
  void frame_range_skips_excluded_segments() {
    FrameRange range = FrameRange.of(0, 10, new int[] {2, 4}, new int[] {6, 7});

    assertEquals(7, range.size());
    assertEquals(4, range.get(2));
    assertEquals(-1, range.get(7));
    assertEquals(0, range.first());
    assertEquals(9, range.last());
    assertTrue(FrameRange.of(3, 3).isEmpty());
    assertTrue(FrameRange.of(0, 2, new int[] {0, 2}).isEmpty());
  }

  private WindowPartition ascending(Long... values) {
    return WindowPartition.sorted(values(values), List.of(SortKey.asc(ref("x"))), context);
  }

  private static List<Tuple> values(Long... values) {
    List<Tuple> rows = new ArrayList<>();
    for (Long value : values) {
      Map<String, Object> fields = new HashMap<>();
      fields.put("x", value);
      rows.add(Tuple.of(fields));
    }
    return rows;
  }

  private static List<Tuple> rows(Object... nameAndValue) {
    List<Tuple> rows = new ArrayList<>();
    for (int i = 0; i < nameAndValue.length; i += 2) {
      Map<String, Object> fields = new HashMap<>();
      fields.put("name", nameAndValue[i]);
      fields.put("x", nameAndValue[i + 1]);
      rows.add(Tuple.of(fields));
    }
    return rows;
  }

  private static int[] indexes(FrameRange range) {
    return range.indexes().toArray();
  }
}
