/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.expression.Expression;
import org.dataframe.engine.planner.ResourceRequest;

/** Redistributes rows into {@code numPartitions} partitions by a partition scheme. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalRepartition extends LogicalUnaryPlan {

  private final int numPartitions;

  /** Keys of a hash or range scheme. Empty for a random scheme. */
  private final List<Expression> partitionBy;

  private final PartitionScheme scheme;

  public LogicalRepartition(
      LogicalPlan child,
      int numPartitions,
      List<Expression> partitionBy,
      PartitionScheme scheme,
      ResourceRequest resourceRequest) {
    super(child, resourceRequest);
    checkArgument(numPartitions > 0, "numPartitions must be positive: %s", numPartitions);
    this.numPartitions = numPartitions;
    this.partitionBy = ImmutableList.copyOf(partitionBy);
    this.scheme = scheme;
  }

  @Override
  public int getNumPartitions() {
    return numPartitions;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitRepartition(this, context);
  }
}
