/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.experimental.UtilityClass;

/** Helpers shared by operators and their profiles. */
@UtilityClass
public class Operators {

  private static final long MICRO = 1_000L;
  private static final long MILLI = 1_000_000L;
  private static final long SECOND = 1_000_000_000L;
  private static final long MINUTE = 60 * SECOND;
  private static final long HOUR = 60 * MINUTE;

  /**
   * Renders a duration the way profiles show it: the largest fitting unit with a trimmed fraction,
   * hours and minutes spelled out, for example {@code 0s}, {@code 850ns}, {@code 1.25ms},
   * {@code 2m3.5s}.
   */
  public static String formatDuration(long nanos) {
    if (nanos == 0) {
      return "0s";
    }
    if (nanos < 0) {
      return "-" + formatDuration(-nanos);
    }
    if (nanos < MICRO) {
      return nanos + "ns";
    }
    if (nanos < MILLI) {
      return fraction(nanos, MICRO) + "µs";
    }
    if (nanos < SECOND) {
      return fraction(nanos, MILLI) + "ms";
    }
    StringBuilder out = new StringBuilder();
    long rest = nanos;
    if (rest >= HOUR) {
      out.append(rest / HOUR).append('h');
      rest %= HOUR;
    }
    if (out.length() > 0 || rest >= MINUTE) {
      out.append(rest / MINUTE).append('m');
      rest %= MINUTE;
    }
    return out.append(fraction(rest, SECOND)).append('s').toString();
  }

  private static String fraction(long value, long unit) {
    return BigDecimal.valueOf(value)
        .divide(BigDecimal.valueOf(unit), 9, RoundingMode.DOWN)
        .stripTrailingZeros()
        .toPlainString();
  }
}
