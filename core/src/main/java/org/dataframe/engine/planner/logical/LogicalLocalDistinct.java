/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.expression.Expression;
import org.dataframe.engine.planner.ResourceRequest;

/** Distinct rows over the group-by expressions, within each partition. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalLocalDistinct extends LogicalUnaryPlan {

  private final List<Expression> groupByList;

  public LogicalLocalDistinct(
      LogicalPlan child, List<Expression> groupByList, ResourceRequest resourceRequest) {
    super(child, resourceRequest);
    this.groupByList = ImmutableList.copyOf(groupByList);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitLocalDistinct(this, context);
  }
}
