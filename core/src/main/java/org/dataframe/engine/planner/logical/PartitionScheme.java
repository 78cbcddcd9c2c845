/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

/** How rows are assigned to partitions by a repartition. */
public enum PartitionScheme {
  UNKNOWN,
  RANDOM,
  HASH,
  RANGE
}
