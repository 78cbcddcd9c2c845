/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.common.setting;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import lombok.ToString;
import lombok.extern.log4j.Log4j2;

/**
 * {@link Settings} backed by an immutable map of overrides. Keys that are not overridden resolve
 * to their default value.
 */
@Log4j2
@ToString
public class MapSettings extends Settings {

  private final Map<Key, Object> values;

  public MapSettings(Map<Key, ?> overrides) {
    overrides.forEach(
        (key, value) ->
            checkArgument(
                key.getDefaultValue().getClass().isInstance(value),
                "Setting %s expects a value of type %s but got %s",
                key.getKeyValue(),
                key.getDefaultValue().getClass().getSimpleName(),
                value));
    this.values = ImmutableMap.copyOf(overrides);
  }

  /** Settings with every key at its default value. */
  public static MapSettings defaults() {
    return new MapSettings(ImmutableMap.of());
  }

  /**
   * Builds settings from string properties. Unknown property names are ignored; values that
   * cannot be parsed to the key's type fail with {@link IllegalArgumentException}.
   */
  public static MapSettings fromProperties(Properties properties) {
    Map<Key, Object> overrides = new EnumMap<>(Key.class);
    for (String name : properties.stringPropertyNames()) {
      Optional<Key> key = Key.of(name);
      if (key.isEmpty()) {
        log.debug("Ignoring unknown setting {}", name);
        continue;
      }
      overrides.put(key.get(), parse(key.get(), properties.getProperty(name).trim()));
    }
    return new MapSettings(overrides);
  }

  /**
   * Loads settings from a properties file on the classpath. A missing resource yields the
   * defaults.
   */
  public static MapSettings fromClasspath(String resourceName) {
    try (InputStream in =
        MapSettings.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (in == null) {
        log.debug("Settings resource {} not found, using defaults", resourceName);
        return defaults();
      }
      Properties properties = new Properties();
      properties.load(in);
      return fromProperties(properties);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load settings from " + resourceName, e);
    }
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.getOrDefault(key, key.getDefaultValue());
  }

  private static Object parse(Key key, String value) {
    Object defaultValue = key.getDefaultValue();
    try {
      if (defaultValue instanceof Integer) {
        return Integer.valueOf(value);
      } else if (defaultValue instanceof Long) {
        return Long.valueOf(value);
      } else if (defaultValue instanceof Boolean) {
        return Boolean.valueOf(value);
      }
      return value;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid value [" + value + "] for setting " + key.getKeyValue(), e);
    }
  }
}
