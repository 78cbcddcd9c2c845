/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import static com.google.common.base.Preconditions.checkArgument;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.planner.ResourceRequest;

/** Merges contiguous partitions to reduce the partition count without a shuffle. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalCoalesce extends LogicalUnaryPlan {

  private final int numPartitions;

  public LogicalCoalesce(LogicalPlan child, int numPartitions) {
    super(child, ResourceRequest.none());
    checkArgument(numPartitions > 0, "numPartitions must be positive: %s", numPartitions);
    checkArgument(
        numPartitions <= child.getNumPartitions(),
        "Cannot coalesce %s partitions into %s",
        child.getNumPartitions(),
        numPartitions);
    this.numPartitions = numPartitions;
  }

  @Override
  public int getNumPartitions() {
    return numPartitions;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitCoalesce(this, context);
  }
}
