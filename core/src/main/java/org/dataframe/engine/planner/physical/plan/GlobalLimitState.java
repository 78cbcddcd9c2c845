/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayDeque;
import java.util.Deque;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;

/** Running state of a global limit. */
@Getter
@ToString
public class GlobalLimitState {

  /** Rows still allowed through. */
  private long remainingRows;

  /** Output partitions still owed downstream. */
  private int remainingPartitions;

  /** Partitions being materialized, in emission order. */
  private final Deque<PartitionTask> inFlight = new ArrayDeque<>();

  /** Step to derive empty partitions from once the limit is reached. */
  @Setter private PartitionTaskBuilder emptyPartitionBase;

  /** Materialization of a pipelined base, requested at most once. */
  @Setter private PartitionTask emptyPartitionTask;

  public GlobalLimitState(long limit, int numPartitions) {
    checkArgument(limit >= 0, "limit must be non-negative: %s", limit);
    this.remainingRows = limit;
    this.remainingPartitions = numPartitions;
  }

  /** Deducts the rows of the next output partition and returns how many of them to keep. */
  public long take(long numRows) {
    long taken = Math.min(remainingRows, numRows);
    remainingRows -= taken;
    remainingPartitions--;
    return taken;
  }

  /** Accounts for one empty output partition. */
  public void takeEmpty() {
    remainingPartitions--;
  }

  public boolean isLimitReached() {
    return remainingRows == 0;
  }

  /** Cancels the materializations whose output is no longer needed. */
  public int cancelInFlight() {
    int cancelled = inFlight.size();
    inFlight.forEach(PartitionTask::cancel);
    inFlight.clear();
    return cancelled;
  }
}
