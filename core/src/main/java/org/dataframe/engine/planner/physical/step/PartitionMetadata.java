/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.step;

import org.dataframe.engine.data.page.Page;

/**
 * What is known about a partition. Before materialization some facts may be unknown (null); after
 * materialization both are exact.
 *
 * @param numRows row count, or null when unknown
 * @param sizeBytes retained size, or null when unknown
 */
public record PartitionMetadata(Long numRows, Long sizeBytes) {

  private static final PartitionMetadata UNKNOWN = new PartitionMetadata(null, null);

  public static PartitionMetadata unknown() {
    return UNKNOWN;
  }

  /** Exact metadata of a materialized page. */
  public static PartitionMetadata from(Page page) {
    return new PartitionMetadata((long) page.getPositionCount(), page.getRetainedSizeBytes());
  }

  public boolean hasNumRows() {
    return numRows != null;
  }

  /** Keeps the row count but drops the size, for instructions that preserve rows only. */
  public PartitionMetadata withUnknownSize() {
    return new PartitionMetadata(numRows, null);
  }
}
