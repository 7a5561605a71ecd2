/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.window;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import lombok.EqualsAndHashCode;

/**
 * Rows of a window frame, as partition indexes: the interval {@code [start, end)} minus the rows an
 * EXCLUDE clause removed.
 */
@EqualsAndHashCode
public final class FrameRange {

  public static final FrameRange EMPTY = new FrameRange(List.of());

  /** Disjoint ascending intervals, each {start, end}. */
  private final List<int[]> segments;

  private FrameRange(List<int[]> segments) {
    this.segments = segments;
  }

  /** The rows {@code [start, end)} without the {@code excluded} intervals. */
  public static FrameRange of(int start, int end, int[]... excluded) {
    if (start >= end) {
      return EMPTY;
    }
    List<int[]> segments = new ArrayList<>(3);
    segments.add(new int[] {start, end});
    for (int[] cut : excluded) {
      if (cut[0] >= cut[1]) {
        continue;
      }
      List<int[]> next = new ArrayList<>(segments.size() + 1);
      for (int[] segment : segments) {
        if (cut[1] <= segment[0] || cut[0] >= segment[1]) {
          next.add(segment);
          continue;
        }
        if (segment[0] < cut[0]) {
          next.add(new int[] {segment[0], cut[0]});
        }
        if (cut[1] < segment[1]) {
          next.add(new int[] {cut[1], segment[1]});
        }
      }
      segments = next;
    }
    return segments.isEmpty() ? EMPTY : new FrameRange(segments);
  }

  public int size() {
    int size = 0;
    for (int[] segment : segments) {
      size += segment[1] - segment[0];
    }
    return size;
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }

  /** Partition index of the n-th row of the frame, counting from 0, or -1. */
  public int get(int n) {
    if (n < 0) {
      return -1;
    }
    int remaining = n;
    for (int[] segment : segments) {
      int length = segment[1] - segment[0];
      if (remaining < length) {
        return segment[0] + remaining;
      }
      remaining -= length;
    }
    return -1;
  }

  public int first() {
    return isEmpty() ? -1 : segments.get(0)[0];
  }

  public int last() {
    return isEmpty() ? -1 : segments.get(segments.size() - 1)[1] - 1;
  }

  /** Partition indexes of the frame rows in order. */
  public IntStream indexes() {
    return segments.stream().flatMapToInt(segment -> IntStream.range(segment[0], segment[1]));
  }

  @Override
  public String toString() {
    StringBuilder text = new StringBuilder("[");
    for (int[] segment : segments) {
      if (text.length() > 1) {
        text.append(", ");
      }
      text.append(segment[0]).append("..").append(segment[1]);
    }
    return text.append(']').toString();
  }
}
