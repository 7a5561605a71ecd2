/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import com.google.common.base.Preconditions;

/**
 * Frame clause of a window term.
 *
 * @param unit how offsets are measured
 * @param start start bound
 * @param end end bound
 * @param exclusion rows removed from the frame
 */
public record WindowFrame(Unit unit, Bound start, Bound end, Exclusion exclusion) {

  /** Frame units. */
  public enum Unit {
    /** Offsets count rows. */
    ROWS,
    /** Offsets are differences of the single ORDER BY value. */
    RANGE,
    /** Offsets count peer groups. */
    GROUPS
  }

  /** EXCLUDE clause. */
  public enum Exclusion {
    NO_OTHERS,
    CURRENT_ROW,
    GROUP,
    TIES
  }

  /** Kinds of frame bounds. */
  public enum BoundType {
    UNBOUNDED_PRECEDING,
    PRECEDING,
    CURRENT_ROW,
    FOLLOWING,
    UNBOUNDED_FOLLOWING
  }

  /** A frame bound, with its offset for PRECEDING and FOLLOWING. */
  public record Bound(BoundType type, Number offset) {

    public Bound {
      Preconditions.checkArgument(
          (type != BoundType.PRECEDING && type != BoundType.FOLLOWING)
              || (offset != null && offset.doubleValue() >= 0),
          "%s bound requires a non negative offset",
          type);
    }

    public static Bound unboundedPreceding() {
      return new Bound(BoundType.UNBOUNDED_PRECEDING, null);
    }

    public static Bound unboundedFollowing() {
      return new Bound(BoundType.UNBOUNDED_FOLLOWING, null);
    }

    public static Bound currentRow() {
      return new Bound(BoundType.CURRENT_ROW, null);
    }

    public static Bound preceding(Number offset) {
      return new Bound(BoundType.PRECEDING, offset);
    }

    public static Bound following(Number offset) {
      return new Bound(BoundType.FOLLOWING, offset);
    }
  }

  public WindowFrame {
    Preconditions.checkNotNull(unit, "unit");
    Preconditions.checkArgument(
        start.type() != BoundType.UNBOUNDED_FOLLOWING, "frame cannot start at UNBOUNDED FOLLOWING");
    Preconditions.checkArgument(
        end.type() != BoundType.UNBOUNDED_PRECEDING, "frame cannot end at UNBOUNDED PRECEDING");
    exclusion = exclusion == null ? Exclusion.NO_OTHERS : exclusion;
  }

  public static WindowFrame of(Unit unit, Bound start, Bound end) {
    return new WindowFrame(unit, start, end, Exclusion.NO_OTHERS);
  }

  /** RANGE BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW, the frame used with ORDER BY. */
  public static WindowFrame defaultOrdered() {
    return of(Unit.RANGE, Bound.unboundedPreceding(), Bound.currentRow());
  }

  /** The whole partition, the frame used without ORDER BY. */
  public static WindowFrame wholePartition() {
    return of(Unit.ROWS, Bound.unboundedPreceding(), Bound.unboundedFollowing());
  }
}
