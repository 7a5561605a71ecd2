/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.querypipe.common.setting.Settings.Key;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RequestSettingsTest {

  private final DefaultSettings global = new DefaultSettings();

  @Test
  void request_value_wins_when_set() {
    RequestSettings settings = new RequestSettings(global).with(Key.PIPELINE_CAP, 8);

    assertEquals(8, settings.getPipelineCap());
  }

  @Test
  void zero_request_value_falls_back_to_global() {
    global.update(Key.PIPELINE_BATCH, 32);
    RequestSettings settings = new RequestSettings(global).with(Key.PIPELINE_BATCH, 0);

    assertEquals(32, settings.getPipelineBatch());
  }

  @Test
  void memory_quota_is_configured_in_megabytes() {
    RequestSettings settings = new RequestSettings(global).with(Key.MEMORY_QUOTA, 2);

    assertEquals(2L * 1024 * 1024, settings.getMemoryQuotaBytes());
  }

  @Test
  void values_beyond_int_range_saturate() {
    RequestSettings settings =
        new RequestSettings(global)
            .with(Key.SCAN_CAP, 1L << 32)
            .with(Key.ORDER_FALLBACK_NUM, Long.MAX_VALUE)
            .with(Key.MAX_PARALLELISM, 3_000_000_000L)
            .with(Key.MEMORY_QUOTA, Long.MAX_VALUE);

    assertEquals(Integer.MAX_VALUE, settings.getScanCap());
    assertEquals(Integer.MAX_VALUE, settings.getOrderFallbackNum());
    assertEquals(Integer.MAX_VALUE, settings.getMaxParallelism());
    assertEquals(Long.MAX_VALUE, settings.getMemoryQuotaBytes());
  }

  @Test
  void boolean_request_value_wins_even_when_false() {
    RequestSettings settings = new RequestSettings(global).with(Key.SPILL_ENABLED, false);

    assertFalse(settings.isSpillEnabled());
  }

  @Test
  void timeout_defaults_to_no_limit() {
    RequestSettings settings = new RequestSettings(global);

    assertEquals(0L, settings.getTimeoutMillis());
  }

  @Test
  void request_timeout_overrides_global() {
    global.update(Key.TIMEOUT, 5000);
    RequestSettings settings = new RequestSettings(global).with(Key.TIMEOUT, 250);

    assertEquals(250L, settings.getTimeoutMillis());
  }
}
