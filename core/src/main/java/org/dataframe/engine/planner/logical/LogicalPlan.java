/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.dataframe.engine.planner.ResourceRequest;

/** The base class for all logical plan nodes. Nodes are immutable. */
@Getter
@EqualsAndHashCode
public abstract class LogicalPlan {

  /** Child plans, zero, one or two of them. */
  private final List<LogicalPlan> child;

  /** Resources the node's instructions ask for. */
  private final ResourceRequest resourceRequest;

  protected LogicalPlan(List<LogicalPlan> child, ResourceRequest resourceRequest) {
    this.child = ImmutableList.copyOf(child);
    this.resourceRequest = resourceRequest;
  }

  /** Number of partitions the node produces. */
  public abstract int getNumPartitions();

  /**
   * Accept the {@link LogicalPlanNodeVisitor}.
   *
   * @param visitor visitor.
   * @param context visitor context.
   * @param <R> returned object type.
   * @param <C> context type.
   * @return returned object.
   */
  public abstract <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context);
}
