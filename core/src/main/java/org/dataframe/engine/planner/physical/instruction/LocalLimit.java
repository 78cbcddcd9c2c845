/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import static com.google.common.base.Preconditions.checkArgument;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;

/** Keeps the first {@code limit} rows of the partition. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class LocalLimit extends SingleInputInstruction {

  private final long limit;

  public LocalLimit(long limit) {
    checkArgument(limit >= 0, "limit must be non-negative: %s", limit);
    this.limit = limit;
  }

  @Override
  protected Page run(Page input) {
    if (input.getPositionCount() <= limit) {
      return input;
    }
    return input.getRegion(0, (int) limit);
  }

  @Override
  protected PartitionMetadata runPartialMetadata(PartitionMetadata input) {
    if (!input.hasNumRows()) {
      return PartitionMetadata.unknown();
    }
    return new PartitionMetadata(Math.min(limit, input.numRows()), null);
  }
}
