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
import org.dataframe.engine.expression.NamedExpression;
import org.dataframe.engine.planner.ResourceRequest;

/** Evaluates one output column per named expression. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalProjection extends LogicalUnaryPlan {

  private final List<NamedExpression> projectList;

  public LogicalProjection(
      LogicalPlan child, List<NamedExpression> projectList, ResourceRequest resourceRequest) {
    super(child, resourceRequest);
    this.projectList = ImmutableList.copyOf(projectList);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitProjection(this, context);
  }
}
