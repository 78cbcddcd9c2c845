/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

/**
 * The visitor of {@link LogicalPlan}. Every node type has an abstract visit method, so adding a
 * node type forces every visitor to handle it. {@link #visitNode} is reached only by plan types
 * outside this package.
 *
 * @param <R> return type
 * @param <C> context type
 */
public abstract class LogicalPlanNodeVisitor<R, C> {

  public R visitNode(LogicalPlan plan, C context) {
    return null;
  }

  public abstract R visitInMemoryScan(LogicalInMemoryScan plan, C context);

  public abstract R visitTabularFilesScan(LogicalTabularFilesScan plan, C context);

  public abstract R visitFilter(LogicalFilter plan, C context);

  public abstract R visitProjection(LogicalProjection plan, C context);

  public abstract R visitMapPartition(LogicalMapPartition plan, C context);

  public abstract R visitLocalAggregate(LogicalLocalAggregate plan, C context);

  public abstract R visitLocalDistinct(LogicalLocalDistinct plan, C context);

  public abstract R visitFileWrite(LogicalFileWrite plan, C context);

  public abstract R visitLocalLimit(LogicalLocalLimit plan, C context);

  public abstract R visitGlobalLimit(LogicalGlobalLimit plan, C context);

  public abstract R visitRepartition(LogicalRepartition plan, C context);

  public abstract R visitSort(LogicalSort plan, C context);

  public abstract R visitCoalesce(LogicalCoalesce plan, C context);

  public abstract R visitJoin(LogicalJoin plan, C context);
}
