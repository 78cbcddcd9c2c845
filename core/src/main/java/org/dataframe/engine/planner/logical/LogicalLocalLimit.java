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

/** Keeps at most {@code limit} rows of every partition. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalLocalLimit extends LogicalUnaryPlan {

  private final long limit;

  public LogicalLocalLimit(LogicalPlan child, long limit) {
    super(child, ResourceRequest.none());
    checkArgument(limit >= 0, "limit must be non-negative: %s", limit);
    this.limit = limit;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitLocalLimit(this, context);
  }
}
