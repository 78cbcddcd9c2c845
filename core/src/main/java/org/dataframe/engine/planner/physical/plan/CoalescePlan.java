/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.ReduceMerge;
import org.dataframe.engine.planner.physical.step.ExecutionStep;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;

/**
 * Merges contiguous runs of the child's partitions into fewer partitions. Group sizes differ by at
 * most one; the larger groups come first.
 */
@Log4j2
public class CoalescePlan extends AbstractPhysicalPlan {

  private final PhysicalPlan child;

  /** Number of child partitions merged into each output partition still to emit. */
  @Getter private final Deque<Integer> groupSizes;

  private final Deque<PartitionTask> materializations = new ArrayDeque<>();

  private boolean childFinished;

  public CoalescePlan(PhysicalPlan child, int fromPartitions, int toPartitions) {
    checkArgument(toPartitions > 0, "toPartitions must be positive: %s", toPartitions);
    checkArgument(
        fromPartitions >= toPartitions,
        "Cannot coalesce %s partitions into %s",
        fromPartitions,
        toPartitions);
    this.child = child;
    this.groupSizes = new ArrayDeque<>(groupSizes(fromPartitions, toPartitions));
  }

  /** Splits {@code from} partitions into {@code to} contiguous groups, larger groups first. */
  static List<Integer> groupSizes(int from, int to) {
    List<Integer> sizes = new ArrayList<>(to);
    int base = from / to;
    int larger = from % to;
    for (int i = 0; i < to; i++) {
      sizes.add(i < larger ? base + 1 : base);
    }
    return sizes;
  }

  @Override
  protected ExecutionStep computeNext() {
    while (true) {
      if (!groupSizes.isEmpty() && readyToMerge(groupSizes.peek())) {
        return merge(groupSizes.poll());
      }
      if (childFinished) {
        if (materializations.isEmpty()) {
          return finish();
        }
        if (groupSizes.isEmpty()) {
          throw new IllegalStateException(
              "Coalesce received " + materializations.size() + " more partitions than expected");
        }
        if (materializations.stream().allMatch(PartitionTask::isDone)) {
          groupSizes.poll();
          return merge(materializations.size());
        }
        return null;
      }

      ExecutionStep step = child.poll();
      if (step == null) {
        if (!child.isFinished()) {
          return null;
        }
        childFinished = true;
        continue;
      }
      if (step instanceof PartitionTaskBuilder) {
        PartitionTask task = ((PartitionTaskBuilder) step).finalizePartitionTask();
        materializations.add(task);
        return task;
      }
      return step;
    }
  }

  private boolean readyToMerge(int groupSize) {
    if (materializations.size() < groupSize) {
      return false;
    }
    return materializations.stream().limit(groupSize).allMatch(PartitionTask::isDone);
  }

  private ExecutionStep merge(int groupSize) {
    List<Page> inputs = new ArrayList<>(groupSize);
    List<PartitionMetadata> metadatas = new ArrayList<>(groupSize);
    for (int i = 0; i < groupSize; i++) {
      PartitionTask task = materializations.poll();
      inputs.add(task.getPartition());
      metadatas.add(task.getPartitionMetadata());
    }
    log.debug("Coalescing {} partitions", groupSize);
    return new PartitionTaskBuilder(inputs, metadatas)
        .addInstruction(new ReduceMerge(), ResourceRequest.none());
  }
}
