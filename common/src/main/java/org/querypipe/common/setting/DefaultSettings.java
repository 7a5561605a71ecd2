/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.setting;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.querypipe.common.exception.InvalidSettingException;

/**
 * Process-wide settings. Values start at each key's default and may be overridden from a JSON
 * document of the form {@code {"querypipe.pipeline.cap": 1024}}, by default the classpath
 * resource {@value #SETTINGS_RESOURCE}.
 */
public class DefaultSettings extends Settings {

  public static final String SETTINGS_RESOURCE = "querypipe-settings.json";

  private static final Logger LOG = LogManager.getLogger();

  private final Map<Key, Object> values = new EnumMap<>(Key.class);

  public DefaultSettings() {
    for (Key key : Key.values()) {
      values.put(key, key.getDefaultValue());
    }
  }

  /** Creates settings from the defaults plus the overrides found in {@value #SETTINGS_RESOURCE}. */
  public static DefaultSettings load() {
    DefaultSettings settings = new DefaultSettings();
    try (InputStream inputStream =
        DefaultSettings.class.getClassLoader().getResourceAsStream(SETTINGS_RESOURCE)) {
      if (inputStream != null) {
        settings.loadOverrides(inputStream);
      }
    } catch (IOException e) {
      throw new InvalidSettingException("Unable to read " + SETTINGS_RESOURCE, e);
    }
    return settings;
  }

  /**
   * Applies overrides read from a JSON object. Unknown keys are ignored with a warning.
   *
   * @param inputStream JSON document
   */
  public void loadOverrides(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    Map<String, Object> overrides;
    try {
      overrides = objectMapper.readValue(inputStream, new TypeReference<>() {});
    } catch (IOException e) {
      LOG.error("Settings file is malformed. Verify and reload.");
      throw new InvalidSettingException("Malformed settings json: " + e.getMessage(), e);
    }
    if (overrides == null) {
      return;
    }
    overrides.forEach(
        (name, value) ->
            Key.of(name)
                .ifPresentOrElse(
                    key -> update(key, value),
                    () -> LOG.warn("Ignoring unknown setting {}", name)));
    LOG.info("Loaded {} setting override(s)", overrides.size());
  }

  /** Replaces the value of a setting after validating its type and range. */
  public void update(Key key, Object value) {
    values.put(key, validate(key, value));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  static Object validate(Key key, Object value) {
    if (key.isNumeric()) {
      if (!(value instanceof Number)) {
        throw new InvalidSettingException(
            String.format("Setting %s must be numeric, got %s", key.getKeyValue(), value));
      }
      long longValue = ((Number) value).longValue();
      if (longValue < 0) {
        throw new InvalidSettingException(
            String.format("Setting %s must not be negative, got %d", key.getKeyValue(), longValue));
      }
      return longValue;
    }
    if (!(value instanceof Boolean)) {
      throw new InvalidSettingException(
          String.format("Setting %s must be a boolean, got %s", key.getKeyValue(), value));
    }
    return value;
  }
}
