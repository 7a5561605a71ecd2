/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.window;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.Getter;
import org.querypipe.common.exception.EvaluationException;
import org.querypipe.data.Tuple;
import org.querypipe.data.Values;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.planner.physical.SortKey;
import org.querypipe.planner.physical.WindowFrame;

/**
 * One window partition, with its rows in window ORDER BY order and their peer groups. Rows with
 * equal ORDER BY values are peers; without ORDER BY every row of the partition is a peer of every
 * other.
 */
public class WindowPartition {

  private final List<Tuple> rows;
  private final List<SortKey> orderBy;
  private final List<List<Object>> orderValues;
  @Getter private final ExecutionContext context;

  private final int[] peerGroups;
  private final List<Integer> groupStarts = new ArrayList<>();

  private WindowPartition(
      List<Tuple> rows,
      List<SortKey> orderBy,
      List<List<Object>> orderValues,
      ExecutionContext context) {
    this.rows = rows;
    this.orderBy = orderBy;
    this.orderValues = orderValues;
    this.context = context;
    this.peerGroups = new int[rows.size()];
    for (int i = 0; i < rows.size(); i++) {
      if (i == 0 || !samePeers(i - 1, i)) {
        groupStarts.add(i);
      }
      peerGroups[i] = groupStarts.size() - 1;
    }
  }

  /**
   * Orders the rows of a partition by {@code orderBy}. Rows that compare equal keep their arrival
   * order.
   *
   * @throws EvaluationException if an ORDER BY expression fails
   */
  public static WindowPartition sorted(
      List<Tuple> rows, List<SortKey> orderBy, ExecutionContext context) {
    List<List<Object>> values = new ArrayList<>(rows.size());
    for (Tuple row : rows) {
      List<Object> keys = new ArrayList<>(orderBy.size());
      for (SortKey term : orderBy) {
        keys.add(term.expression().evaluate(row, context));
      }
      values.add(keys);
    }
    List<Integer> order = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      order.add(i);
    }
    Comparator<Integer> byKeys =
        (left, right) -> compareKeys(orderBy, values.get(left), values.get(right));
    order.sort(byKeys);

    ImmutableList.Builder<Tuple> sortedRows = ImmutableList.builderWithExpectedSize(rows.size());
    List<List<Object>> sortedValues = new ArrayList<>(rows.size());
    for (int index : order) {
      sortedRows.add(rows.get(index));
      sortedValues.add(values.get(index));
    }
    return new WindowPartition(sortedRows.build(), orderBy, sortedValues, context);
  }

  private static int compareKeys(List<SortKey> orderBy, List<Object> left, List<Object> right) {
    for (int i = 0; i < orderBy.size(); i++) {
      int result = orderBy.get(i).compare(left.get(i), right.get(i));
      if (result != 0) {
        return result;
      }
    }
    return 0;
  }

  private boolean samePeers(int left, int right) {
    return compareKeys(orderBy, orderValues.get(left), orderValues.get(right)) == 0;
  }

  public int size() {
    return rows.size();
  }

  public Tuple row(int index) {
    return rows.get(index);
  }

  /** Index of the first peer of a row. */
  public int peerStart(int index) {
    return groupStarts.get(peerGroups[index]);
  }

  /** Index after the last peer of a row. */
  public int peerEnd(int index) {
    int group = peerGroups[index] + 1;
    return group < groupStarts.size() ? groupStarts.get(group) : rows.size();
  }

  /** Position of a row's peer group, counting from 0. */
  public int peerGroup(int index) {
    return peerGroups[index];
  }

  public int peerGroupCount() {
    return groupStarts.size();
  }

  /**
   * The frame of a row.
   *
   * @throws EvaluationException if a RANGE offset cannot be applied to the ORDER BY value
   */
  public FrameRange frame(int index, WindowFrame frame) {
    int start;
    int end;
    switch (frame.unit()) {
      case ROWS:
        start = rowsBound(index, frame.start(), true);
        end = rowsBound(index, frame.end(), false);
        break;
      case GROUPS:
        start = groupsBound(index, frame.start(), true);
        end = groupsBound(index, frame.end(), false);
        break;
      default:
        start = rangeBound(index, frame.start(), true);
        end = rangeBound(index, frame.end(), false);
    }
    switch (frame.exclusion()) {
      case CURRENT_ROW:
        return FrameRange.of(start, end, new int[] {index, index + 1});
      case GROUP:
        return FrameRange.of(start, end, new int[] {peerStart(index), peerEnd(index)});
      case TIES:
        return FrameRange.of(
            start,
            end,
            new int[] {peerStart(index), index},
            new int[] {index + 1, peerEnd(index)});
      default:
        return FrameRange.of(start, end);
    }
  }

  // Bounds are returned as frame start indexes, or as the index after the frame's last row.

  private int rowsBound(int index, WindowFrame.Bound bound, boolean isStart) {
    switch (bound.type()) {
      case UNBOUNDED_PRECEDING:
        return 0;
      case UNBOUNDED_FOLLOWING:
        return rows.size();
      case CURRENT_ROW:
        return isStart ? index : index + 1;
      case PRECEDING:
        return clamp(index - bound.offset().longValue() + (isStart ? 0 : 1));
      default:
        return clamp(index + bound.offset().longValue() + (isStart ? 0 : 1));
    }
  }

  private int groupsBound(int index, WindowFrame.Bound bound, boolean isStart) {
    long group;
    switch (bound.type()) {
      case UNBOUNDED_PRECEDING:
        return 0;
      case UNBOUNDED_FOLLOWING:
        return rows.size();
      case CURRENT_ROW:
        return isStart ? peerStart(index) : peerEnd(index);
      case PRECEDING:
        group = peerGroups[index] - bound.offset().longValue();
        break;
      default:
        group = peerGroups[index] + bound.offset().longValue();
    }
    if (group < 0) {
      return 0;
    }
    if (group >= groupStarts.size()) {
      return rows.size();
    }
    int first = groupStarts.get((int) group);
    return isStart ? first : peerEnd(first);
  }

  private int rangeBound(int index, WindowFrame.Bound bound, boolean isStart) {
    switch (bound.type()) {
      case UNBOUNDED_PRECEDING:
        return 0;
      case UNBOUNDED_FOLLOWING:
        return rows.size();
      case CURRENT_ROW:
        return isStart ? peerStart(index) : peerEnd(index);
      default:
        break;
    }
    if (orderBy.size() != 1) {
      throw new EvaluationException("RANGE offsets require exactly one ORDER BY term");
    }
    Object current = orderValues.get(index).get(0);
    if (Values.isNullOrMissing(current)) {
      return isStart ? peerStart(index) : peerEnd(index);
    }
    SortKey term = orderBy.get(0);
    double offset = bound.offset().doubleValue();
    boolean preceding = bound.type() == WindowFrame.BoundType.PRECEDING;
    double target = position(term, current) + (preceding ? -offset : offset);

    // non null values are contiguous and ascending by position
    int low = 0;
    int high = rows.size();
    while (low < high && Values.isNullOrMissing(orderValues.get(low).get(0))) {
      low++;
    }
    while (high > low && Values.isNullOrMissing(orderValues.get(high - 1).get(0))) {
      high--;
    }
    if (isStart) {
      // first row at or after the target
      while (low < high) {
        int mid = (low + high) >>> 1;
        if (position(term, orderValues.get(mid).get(0)) < target) {
          low = mid + 1;
        } else {
          high = mid;
        }
      }
    } else {
      // after the last row at or before the target
      while (low < high) {
        int mid = (low + high) >>> 1;
        if (position(term, orderValues.get(mid).get(0)) <= target) {
          low = mid + 1;
        } else {
          high = mid;
        }
      }
    }
    return low;
  }

  private static double position(SortKey term, Object value) {
    if (!(value instanceof Number)) {
      throw new EvaluationException("RANGE offsets require a numeric ORDER BY value, got " + value);
    }
    double number = ((Number) value).doubleValue();
    return term.descending() ? -number : number;
  }

  private int clamp(long index) {
    return (int) Math.max(0, Math.min(rows.size(), index));
  }
}
