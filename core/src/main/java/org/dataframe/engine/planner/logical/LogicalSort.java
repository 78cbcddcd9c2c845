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
import org.dataframe.engine.expression.SortKey;
import org.dataframe.engine.planner.ResourceRequest;

/** Globally sorts the rows. Output partitions hold consecutive ranges of the order. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalSort extends LogicalUnaryPlan {

  private final List<SortKey> sortList;

  public LogicalSort(LogicalPlan child, List<SortKey> sortList, ResourceRequest resourceRequest) {
    super(child, resourceRequest);
    checkArgument(!sortList.isEmpty(), "sortList must not be empty");
    this.sortList = ImmutableList.copyOf(sortList);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitSort(this, context);
  }
}
