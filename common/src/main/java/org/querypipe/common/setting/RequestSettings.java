/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.setting;

import com.google.common.math.LongMath;
import com.google.common.primitives.Ints;
import java.util.EnumMap;
import java.util.Map;
import lombok.NonNull;

/**
 * Settings of a single request. A numeric value set here wins over the process-wide value only when
 * it is greater than zero; a boolean wins whenever it was set.
 */
public class RequestSettings extends Settings {

  private static final long MB = 1024L * 1024L;

  private final Settings global;
  private final Map<Key, Object> values = new EnumMap<>(Key.class);

  public RequestSettings(@NonNull Settings global) {
    this.global = global;
  }

  /** Sets a per-request value. */
  public RequestSettings with(Key key, Object value) {
    values.put(key, DefaultSettings.validate(key, value));
    return this;
  }

  @Override
  public <T> T getSettingValue(Key key) {
    Object value = values.get(key);
    if (value == null || (key.isNumeric() && ((Long) value) <= 0)) {
      return global.getSettingValue(key);
    }
    @SuppressWarnings("unchecked")
    T result = (T) value;
    return result;
  }

  public int getPipelineCap() {
    return Ints.saturatedCast(getLong(Key.PIPELINE_CAP));
  }

  public int getPipelineBatch() {
    return Ints.saturatedCast(getLong(Key.PIPELINE_BATCH));
  }

  public int getScanCap() {
    return Ints.saturatedCast(getLong(Key.SCAN_CAP));
  }

  public int getOrderFallbackNum() {
    return Ints.saturatedCast(getLong(Key.ORDER_FALLBACK_NUM));
  }

  public int getMaxParallelism() {
    return Math.max(1, Ints.saturatedCast(getLong(Key.MAX_PARALLELISM)));
  }

  /** The memory quota in bytes, zero when quota accounting is off. */
  public long getMemoryQuotaBytes() {
    return LongMath.saturatedMultiply(getLong(Key.MEMORY_QUOTA), MB);
  }

  /** The request timeout in milliseconds, zero for none. */
  public long getTimeoutMillis() {
    return getLong(Key.TIMEOUT);
  }

  public boolean isSpillEnabled() {
    return getBoolean(Key.SPILL_ENABLED);
  }
}
