/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.Instruction;
import org.dataframe.engine.planner.physical.step.ExecutionStep;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;

/**
 * Pairwise join of two plans with the same number of partitions. Partitions of both sides are
 * materialized, pulling first from the side with fewer pending materializations. A join step is
 * emitted for left partition {@code i} and right partition {@code i} once both are done.
 */
@Log4j2
public class JoinPlan extends AbstractPhysicalPlan {

  private final Side left;

  private final Side right;

  private final Instruction joinInstruction;

  private final ResourceRequest resourceRequest;

  public JoinPlan(
      PhysicalPlan left,
      PhysicalPlan right,
      Instruction joinInstruction,
      ResourceRequest resourceRequest) {
    this.left = new Side("left", left);
    this.right = new Side("right", right);
    this.joinInstruction = joinInstruction;
    this.resourceRequest = resourceRequest;
  }

  @Override
  protected ExecutionStep computeNext() {
    while (true) {
      if (left.isHeadDone() && right.isHeadDone()) {
        PartitionTask leftTask = left.pending.poll();
        PartitionTask rightTask = right.pending.poll();
        return new PartitionTaskBuilder(
                List.of(leftTask.getPartition(), rightTask.getPartition()),
                List.of(leftTask.getPartitionMetadata(), rightTask.getPartitionMetadata()))
            .addInstruction(joinInstruction, resourceRequest);
      }
      if (left.finished && right.finished) {
        if (left.emitted != right.emitted) {
          throw new IllegalStateException(
              "Join sides have different partition counts: left "
                  + left.emitted
                  + ", right "
                  + right.emitted);
        }
        return left.pending.isEmpty() ? finish() : null;
      }

      Side first =
          right.finished || (!left.finished && left.pending.size() <= right.pending.size())
              ? left
              : right;
      Side second = first == left ? right : left;
      boolean progressed = false;
      for (Side side : List.of(first, second)) {
        if (side.finished) {
          continue;
        }
        ExecutionStep step = side.plan.poll();
        if (step == null) {
          if (side.plan.isFinished()) {
            side.finished = true;
            progressed = true;
            log.debug("Join {} side exhausted after {} partitions", side.name, side.emitted);
          }
          continue;
        }
        if (step instanceof PartitionTaskBuilder) {
          PartitionTask task = ((PartitionTaskBuilder) step).finalizePartitionTask();
          side.pending.add(task);
          side.emitted++;
          return task;
        }
        return step;
      }
      if (!progressed) {
        return null;
      }
    }
  }

  @RequiredArgsConstructor
  private static class Side {
    private final String name;
    private final PhysicalPlan plan;
    private final Deque<PartitionTask> pending = new ArrayDeque<>();
    private boolean finished;
    private int emitted;

    boolean isHeadDone() {
      return !pending.isEmpty() && pending.peek().isDone();
    }
  }
}
