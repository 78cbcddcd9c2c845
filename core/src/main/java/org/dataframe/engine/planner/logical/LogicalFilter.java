/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.expression.Expression;
import org.dataframe.engine.planner.ResourceRequest;

/** Keeps the rows matching the condition. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalFilter extends LogicalUnaryPlan {

  private final Expression condition;

  public LogicalFilter(LogicalPlan child, Expression condition, ResourceRequest resourceRequest) {
    super(child, resourceRequest);
    this.condition = condition;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFilter(this, context);
  }
}
