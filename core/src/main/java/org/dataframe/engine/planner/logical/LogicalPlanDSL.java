/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import java.util.Arrays;
import java.util.List;
import org.dataframe.engine.expression.Expression;
import org.dataframe.engine.expression.NamedExpression;
import org.dataframe.engine.expression.SortKey;
import org.dataframe.engine.expression.aggregation.NamedAggregator;
import org.dataframe.engine.expression.function.MapPartitionFunction;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.storage.FileScanInfo;
import org.dataframe.engine.storage.FileWriteInfo;

/** Logical plan DSL. Nodes built here ask for no particular resources. */
public final class LogicalPlanDSL {

  private LogicalPlanDSL() {}

  public static LogicalPlan inMemoryScan(String cacheKey, int numPartitions) {
    return new LogicalInMemoryScan(cacheKey, numPartitions);
  }

  public static LogicalPlan tabularFilesScan(
      LogicalPlan fileListing, FileScanInfo scanInfo, int numPartitions) {
    return new LogicalTabularFilesScan(fileListing, scanInfo, numPartitions);
  }

  public static LogicalPlan filter(LogicalPlan input, Expression condition) {
    return filter(input, condition, ResourceRequest.none());
  }

  public static LogicalPlan filter(
      LogicalPlan input, Expression condition, ResourceRequest resourceRequest) {
    return new LogicalFilter(input, condition, resourceRequest);
  }

  public static LogicalPlan project(LogicalPlan input, NamedExpression... fields) {
    return new LogicalProjection(input, Arrays.asList(fields), ResourceRequest.none());
  }

  public static LogicalPlan mapPartition(LogicalPlan input, MapPartitionFunction function) {
    return new LogicalMapPartition(input, function, ResourceRequest.none());
  }

  public static LogicalPlan localAggregate(
      LogicalPlan input, List<NamedAggregator> aggregatorList, List<Expression> groupByList) {
    return new LogicalLocalAggregate(input, aggregatorList, groupByList, ResourceRequest.none());
  }

  public static LogicalPlan localDistinct(LogicalPlan input, Expression... groupByList) {
    return new LogicalLocalDistinct(input, Arrays.asList(groupByList), ResourceRequest.none());
  }

  public static LogicalPlan fileWrite(LogicalPlan input, FileWriteInfo writeInfo) {
    return new LogicalFileWrite(input, writeInfo, ResourceRequest.none());
  }

  public static LogicalPlan localLimit(LogicalPlan input, long limit) {
    return new LogicalLocalLimit(input, limit);
  }

  public static LogicalPlan globalLimit(LogicalPlan input, long limit) {
    return new LogicalGlobalLimit(input, limit);
  }

  public static LogicalPlan repartition(
      LogicalPlan input, int numPartitions, PartitionScheme scheme, Expression... partitionBy) {
    return new LogicalRepartition(
        input, numPartitions, Arrays.asList(partitionBy), scheme, ResourceRequest.none());
  }

  public static LogicalPlan sort(LogicalPlan input, SortKey... sortList) {
    return new LogicalSort(input, Arrays.asList(sortList), ResourceRequest.none());
  }

  public static LogicalPlan coalesce(LogicalPlan input, int numPartitions) {
    return new LogicalCoalesce(input, numPartitions);
  }

  public static LogicalPlan join(
      LogicalPlan left,
      LogicalPlan right,
      List<Expression> leftOn,
      List<Expression> rightOn,
      JoinType joinType) {
    return new LogicalJoin(left, right, leftOn, rightOn, joinType, ResourceRequest.none());
  }
}
