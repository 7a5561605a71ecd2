/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Helpers over the plain Java objects used as document values. */
public final class Values {

  /** The value of a field that does not exist. */
  public static final Object MISSING = Missing.INSTANCE;

  private Values() {}

  /** Marker type of {@link #MISSING}. */
  public enum Missing {
    INSTANCE;

    @Override
    public String toString() {
      return "MISSING";
    }
  }

  public static boolean isMissing(Object value) {
    return value == MISSING;
  }

  /** NULL or MISSING. */
  public static boolean isNullOrMissing(Object value) {
    return value == null || value == MISSING;
  }

  /**
   * Canonical form of a value: integral numbers become {@code Long}, fractional numbers {@code
   * Double}, and doubles with an exact long value become {@code Long}. Lists and maps are converted
   * recursively.
   */
  public static Object canonical(Object value) {
    if (value instanceof Number) {
      return canonicalNumber((Number) value);
    }
    if (value instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) value;
      Map<String, Object> result = new LinkedHashMap<>(map.size());
      map.forEach((k, v) -> result.put(String.valueOf(k), canonical(v)));
      return result;
    }
    if (value instanceof Collection) {
      Collection<?> list = (Collection<?>) value;
      List<Object> result = new ArrayList<>(list.size());
      list.forEach(v -> result.add(canonical(v)));
      return result;
    }
    return value;
  }

  static Number canonicalNumber(Number number) {
    if (number instanceof Long) {
      return number;
    }
    if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
      return number.longValue();
    }
    double d = number.doubleValue();
    if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 0x1p63) {
      return (long) d;
    }
    return d;
  }

  /** Value equality under collation, numbers compared by value. */
  public static boolean equal(Object left, Object right) {
    return ValueCollation.INSTANCE.compare(left, right) == 0;
  }

  /** Truthiness used by filters: only boolean TRUE passes. */
  public static boolean truth(Object value) {
    return Boolean.TRUE.equals(value);
  }

  static Map<String, Object> deepCopyMap(Map<String, Object> map) {
    Map<String, Object> copy = new LinkedHashMap<>(Math.max(4, map.size() * 2));
    map.forEach((k, v) -> copy.put(k, deepCopy(v)));
    return copy;
  }

  @SuppressWarnings("unchecked")
  static Object deepCopy(Object value) {
    if (value instanceof Map) {
      return deepCopyMap((Map<String, Object>) value);
    }
    if (value instanceof List) {
      List<Object> copy = new ArrayList<>(((List<Object>) value).size());
      ((List<Object>) value).forEach(v -> copy.add(deepCopy(v)));
      return copy;
    }
    return value;
  }

  /** Rough heap footprint of a value. */
  public static long estimateSize(Object value) {
    if (value == null || value == MISSING || value instanceof Boolean) {
      return 8;
    }
    if (value instanceof Number) {
      return 24;
    }
    if (value instanceof CharSequence) {
      return 40 + 2L * ((CharSequence) value).length();
    }
    if (value instanceof Map) {
      long size = 64;
      for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
        size += 32 + estimateSize(e.getKey()) + estimateSize(e.getValue());
      }
      return size;
    }
    if (value instanceof Collection) {
      long size = 40;
      for (Object v : (Collection<?>) value) {
        size += 8 + estimateSize(v);
      }
      return size;
    }
    return 64;
  }
}
