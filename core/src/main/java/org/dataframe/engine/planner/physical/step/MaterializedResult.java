/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.step;

import org.dataframe.engine.data.page.Page;

/** A computed partition with its exact metadata. */
public record MaterializedResult(Page partition, PartitionMetadata metadata) {

  public static MaterializedResult of(Page partition) {
    return new MaterializedResult(partition, PartitionMetadata.from(partition));
  }
}
