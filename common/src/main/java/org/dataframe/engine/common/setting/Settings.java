/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Engine settings. Every setting is identified by a {@link Key} that carries its default. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Number of worker threads the local runner executes partition tasks on. */
    EXECUTOR_PARALLELISM("dataframe.executor.parallelism", 4),

    /** Rows sampled from every input partition to compute range boundaries for a sort. */
    SORT_SAMPLE_SIZE("dataframe.sort.sample_size", 20),

    /** Seed of the random fanout used by a RANDOM repartition. */
    REPARTITION_RANDOM_SEED("dataframe.repartition.random_seed", 0L);

    @Getter private final String keyValue;

    @Getter private final Object defaultValue;

    private static final Map<String, Key> ALL_KEYS =
        Arrays.stream(Key.values())
            .collect(ImmutableMap.toImmutableMap(Key::getKeyValue, Function.identity()));

    /** Resolves a key by its dotted name. */
    public static Optional<Key> of(String keyValue) {
      return Optional.ofNullable(ALL_KEYS.get(keyValue));
    }
  }

  /** Get the value of a setting, falling back to the key's default when it is not set. */
  public abstract <T> T getSettingValue(Key key);

  public int getIntValue(Key key) {
    return this.<Number>getSettingValue(key).intValue();
  }

  public long getLongValue(Key key) {
    return this.<Number>getSettingValue(key).longValue();
  }
}
