/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import java.util.ArrayDeque;
import java.util.Deque;
import org.dataframe.engine.planner.physical.step.ExecutionStep;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;

/**
 * Top of a plan: turns every step into a materialization request. Requests for the plan's own
 * output partitions are tracked, and their results are handed back in plan order through {@link
 * #pollResult()}. Requests made by operators inside the plan pass through untracked.
 */
public class MaterializingPhysicalPlan implements PhysicalPlan {

  private final PhysicalPlan child;

  private final Deque<PartitionTask> outputs = new ArrayDeque<>();

  public MaterializingPhysicalPlan(PhysicalPlan child) {
    this.child = child;
  }

  @Override
  public PartitionTask poll() {
    ExecutionStep step = child.poll();
    if (step == null) {
      return null;
    }
    if (step instanceof PartitionTaskBuilder) {
      PartitionTask output = ((PartitionTaskBuilder) step).finalizePartitionTask();
      outputs.add(output);
      return output;
    }
    return (PartitionTask) step;
  }

  @Override
  public boolean isFinished() {
    return child.isFinished();
  }

  /** Returns the next output partition's request once it is done, or null. */
  public PartitionTask pollResult() {
    if (!outputs.isEmpty() && outputs.peek().isDone()) {
      return outputs.poll();
    }
    return null;
  }

  /** Returns true while some output partition has not been handed back. */
  public boolean hasPendingResults() {
    return !outputs.isEmpty();
  }
}
