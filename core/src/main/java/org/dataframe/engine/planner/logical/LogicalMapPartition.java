/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.expression.function.MapPartitionFunction;
import org.dataframe.engine.planner.ResourceRequest;

/** Applies a user function to every partition. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalMapPartition extends LogicalUnaryPlan {

  private final MapPartitionFunction function;

  public LogicalMapPartition(
      LogicalPlan child, MapPartitionFunction function, ResourceRequest resourceRequest) {
    super(child, resourceRequest);
    this.function = function;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitMapPartition(this, context);
  }
}
