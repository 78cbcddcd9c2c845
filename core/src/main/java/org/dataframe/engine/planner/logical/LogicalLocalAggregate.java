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
import org.dataframe.engine.expression.aggregation.NamedAggregator;
import org.dataframe.engine.planner.ResourceRequest;

/** Aggregation within each partition. Rows of one group in different partitions are not merged. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalLocalAggregate extends LogicalUnaryPlan {

  private final List<NamedAggregator> aggregatorList;

  private final List<Expression> groupByList;

  public LogicalLocalAggregate(
      LogicalPlan child,
      List<NamedAggregator> aggregatorList,
      List<Expression> groupByList,
      ResourceRequest resourceRequest) {
    super(child, resourceRequest);
    this.aggregatorList = ImmutableList.copyOf(aggregatorList);
    this.groupByList = ImmutableList.copyOf(groupByList);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitLocalAggregate(this, context);
  }
}
