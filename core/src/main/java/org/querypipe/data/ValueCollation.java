/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.data;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Total order over document values: MISSING, NULL, FALSE, TRUE, numbers, strings, arrays and
 * objects. Arrays compare element by element, objects by size, then by sorted keys, then by the
 * values under those keys.
 */
public final class ValueCollation implements Comparator<Object> {

  public static final ValueCollation INSTANCE = new ValueCollation();

  private ValueCollation() {}

  @Override
  public int compare(Object left, Object right) {
    if (left == right) {
      return 0;
    }
    int leftRank = rank(left);
    int rightRank = rank(right);
    if (leftRank != rightRank) {
      return Integer.compare(leftRank, rightRank);
    }
    switch (leftRank) {
      case 2:
        return Boolean.compare((Boolean) left, (Boolean) right);
      case 3:
        return compareNumbers((Number) left, (Number) right);
      case 4:
        return ((String) left).compareTo((String) right);
      case 5:
        return compareLists((List<?>) left, (List<?>) right);
      case 6:
        return compareMaps((Map<?, ?>) left, (Map<?, ?>) right);
      case 7:
        return String.valueOf(left).compareTo(String.valueOf(right));
      default:
        return 0;
    }
  }

  private static int rank(Object value) {
    if (value == Values.MISSING) {
      return 0;
    }
    if (value == null) {
      return 1;
    }
    if (value instanceof Boolean) {
      return 2;
    }
    if (value instanceof Number) {
      return 3;
    }
    if (value instanceof String) {
      return 4;
    }
    if (value instanceof List) {
      return 5;
    }
    if (value instanceof Map) {
      return 6;
    }
    return 7;
  }

  static int compareNumbers(Number left, Number right) {
    Number l = Values.canonicalNumber(left);
    Number r = Values.canonicalNumber(right);
    if (l instanceof Long && r instanceof Long) {
      return Long.compare(l.longValue(), r.longValue());
    }
    return Double.compare(l.doubleValue(), r.doubleValue());
  }

  private int compareLists(List<?> left, List<?> right) {
    Iterator<?> l = left.iterator();
    Iterator<?> r = right.iterator();
    while (l.hasNext() && r.hasNext()) {
      int c = compare(l.next(), r.next());
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(left.size(), right.size());
  }

  private int compareMaps(Map<?, ?> left, Map<?, ?> right) {
    if (left.size() != right.size()) {
      return Integer.compare(left.size(), right.size());
    }
    List<String> leftKeys = sortedKeys(left);
    List<String> rightKeys = sortedKeys(right);
    for (int i = 0; i < leftKeys.size(); i++) {
      int c = leftKeys.get(i).compareTo(rightKeys.get(i));
      if (c != 0) {
        return c;
      }
    }
    for (String key : leftKeys) {
      int c = compare(left.get(key), right.get(key));
      if (c != 0) {
        return c;
      }
    }
    return 0;
  }

  private static List<String> sortedKeys(Map<?, ?> map) {
    List<String> keys = new ArrayList<>(map.size());
    map.keySet().forEach(k -> keys.add(String.valueOf(k)));
    keys.sort(Comparator.naturalOrder());
    return keys;
  }
}
