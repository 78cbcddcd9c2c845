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

/**
 * Partition-wise equi-join: partition {@code i} of the left input is joined with partition {@code
 * i} of the right input. Both inputs are expected to be partitioned alike on the join keys.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalJoin extends LogicalBinaryPlan {

  private final List<Expression> leftOn;

  private final List<Expression> rightOn;

  private final JoinType joinType;

  public LogicalJoin(
      LogicalPlan left,
      LogicalPlan right,
      List<Expression> leftOn,
      List<Expression> rightOn,
      JoinType joinType,
      ResourceRequest resourceRequest) {
    super(left, right, resourceRequest);
    checkArgument(
        leftOn.size() == rightOn.size(),
        "Join key count mismatch: left %s, right %s",
        leftOn.size(),
        rightOn.size());
    this.leftOn = ImmutableList.copyOf(leftOn);
    this.rightOn = ImmutableList.copyOf(rightOn);
    this.joinType = joinType;
  }

  @Override
  public int getNumPartitions() {
    return getLeft().getNumPartitions();
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitJoin(this, context);
  }
}
