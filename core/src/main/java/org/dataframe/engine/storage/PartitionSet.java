/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.storage;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.dataframe.engine.data.page.Page;

/**
 * Named, ordered collection of materialized partitions, typically the cached result of an earlier
 * query. In-memory scans resolve their input by the set's key.
 */
@Getter
@EqualsAndHashCode
public class PartitionSet {

  private final String key;

  private final List<Page> partitions;

  public PartitionSet(String key, List<Page> partitions) {
    this.key = key;
    this.partitions = ImmutableList.copyOf(partitions);
  }

  public static PartitionSet of(String key, Page... partitions) {
    return new PartitionSet(key, Arrays.asList(partitions));
  }

  /** Indexes partition sets by key. */
  public static Map<String, PartitionSet> index(PartitionSet... partitionSets) {
    return Arrays.stream(partitionSets)
        .collect(ImmutableMap.toImmutableMap(PartitionSet::getKey, Function.identity()));
  }

  public int size() {
    return partitions.size();
  }

  @Override
  public String toString() {
    return "PartitionSet{key='" + key + "', partitions=" + partitions.size() + '}';
  }
}
