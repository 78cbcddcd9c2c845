/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import static com.google.common.base.Preconditions.checkArgument;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.storage.FileScanInfo;

/**
 * Scan of tabular files. The input produces file listing partitions (see {@link
 * org.dataframe.engine.storage.FileInfos}); every listed file becomes one output partition.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalTabularFilesScan extends LogicalUnaryPlan {

  private final FileScanInfo scanInfo;

  private final int numPartitions;

  public LogicalTabularFilesScan(
      LogicalPlan fileListing, FileScanInfo scanInfo, int numPartitions) {
    super(fileListing, ResourceRequest.none());
    checkArgument(numPartitions >= 0, "numPartitions must be non-negative: %s", numPartitions);
    this.scanInfo = scanInfo;
    this.numPartitions = numPartitions;
  }

  @Override
  public int getNumPartitions() {
    return numPartitions;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitTabularFilesScan(this, context);
  }
}
