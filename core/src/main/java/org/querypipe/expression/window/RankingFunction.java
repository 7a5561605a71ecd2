/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.expression.window;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.querypipe.execution.window.FrameRange;
import org.querypipe.execution.window.WindowPartition;

/** Numbering and ranking functions. They depend on the ORDER BY peers only. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class RankingFunction implements WindowFunction {

  /** Ranking kinds. */
  public enum Kind {
    ROW_NUMBER,
    RANK,
    DENSE_RANK,
    PERCENT_RANK,
    CUME_DIST
  }

  private final Kind kind;

  @Override
  public Object evaluate(WindowPartition partition, int row, FrameRange frame) {
    switch (kind) {
      case ROW_NUMBER:
        return (long) row + 1;
      case RANK:
        return (long) partition.peerStart(row) + 1;
      case DENSE_RANK:
        return (long) partition.peerGroup(row) + 1;
      case PERCENT_RANK:
        if (partition.size() <= 1) {
          return 0.0;
        }
        return (double) partition.peerStart(row) / (partition.size() - 1);
      default:
        return (double) partition.peerEnd(row) / partition.size();
    }
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase() + "()";
  }
}
