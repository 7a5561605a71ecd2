/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Execution engine settings. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Capacity, in items, of every operator output queue. */
    PIPELINE_CAP("querypipe.pipeline.cap", 512L),

    /** Number of items accumulated before a batching operator flushes. */
    PIPELINE_BATCH("querypipe.pipeline.batch", 64L),

    /** Per request memory quota in MB. Zero disables quota accounting. */
    MEMORY_QUOTA("querypipe.memory.quota", 0L),

    /** Number of index entries buffered by a scan between service calls. */
    SCAN_CAP("querypipe.scan.cap", 512L),

    /** Largest offset + limit an ORDER BY serves from a bounded heap. */
    ORDER_FALLBACK_NUM("querypipe.order.fallback", 65536L),

    /** Number of copies a parallel operator starts. */
    MAX_PARALLELISM(
        "querypipe.max.parallelism", (long) Runtime.getRuntime().availableProcessors()),

    /** Request timeout in milliseconds. Zero waits for the results without limit. */
    TIMEOUT("querypipe.request.timeout", 0L),

    /** Whether grouping and ordering may spill accumulated state to disk. */
    SPILL_ENABLED("querypipe.spill.enabled", Boolean.TRUE);

    @Getter private final String keyValue;

    @Getter private final Object defaultValue;

    private static final Map<String, Key> ALL_KEYS =
        Arrays.stream(Key.values())
            .collect(ImmutableMap.toImmutableMap(Key::getKeyValue, Function.identity()));

    public static Optional<Key> of(String keyValue) {
      return Optional.ofNullable(ALL_KEYS.get(keyValue));
    }

    /** Returns true for keys whose values are counts or sizes. */
    public boolean isNumeric() {
      return defaultValue instanceof Long;
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);

  /** Convenience accessor for numeric settings. */
  public long getLong(Key key) {
    Object value = getSettingValue(key);
    return ((Number) value).longValue();
  }

  /** Convenience accessor for boolean settings. */
  public boolean getBoolean(Key key) {
    return (Boolean) getSettingValue(key);
  }
}
