/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.storage;

/**
 * Key range of a primary scan. A null bound is open.
 *
 * @param low lower bound
 * @param high upper bound
 * @param inclusive whether the upper bound is included; the lower bound always is
 */
public record ScanSpan(String low, String high, boolean inclusive) {

  private static final ScanSpan ALL = new ScanSpan(null, null, true);

  public static ScanSpan all() {
    return ALL;
  }

  public boolean contains(String key) {
    if (low != null && key.compareTo(low) < 0) {
      return false;
    }
    if (high == null) {
      return true;
    }
    int cmp = key.compareTo(high);
    return inclusive ? cmp <= 0 : cmp < 0;
  }

  @Override
  public String toString() {
    return String.format(
        "[%s, %s%s", low == null ? "" : low, high == null ? "" : high, inclusive ? "]" : ")");
  }
}
