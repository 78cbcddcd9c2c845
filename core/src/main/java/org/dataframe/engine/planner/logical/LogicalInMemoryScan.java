/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.planner.ResourceRequest;

/** Scan of a cached partition set, looked up by its key. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalInMemoryScan extends LogicalPlan {

  private final String cacheKey;

  private final int numPartitions;

  public LogicalInMemoryScan(String cacheKey, int numPartitions) {
    super(ImmutableList.of(), ResourceRequest.none());
    checkArgument(!Strings.isNullOrEmpty(cacheKey), "cacheKey must not be empty");
    checkArgument(numPartitions >= 0, "numPartitions must be non-negative: %s", numPartitions);
    this.cacheKey = cacheKey;
    this.numPartitions = numPartitions;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitInMemoryScan(this, context);
  }
}
