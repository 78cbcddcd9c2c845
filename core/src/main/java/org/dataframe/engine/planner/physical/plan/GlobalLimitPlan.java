/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.LocalLimit;
import org.dataframe.engine.planner.physical.step.ExecutionStep;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;

/**
 * Limits the whole stream to a number of rows, adaptively. The child is expected to carry a local
 * limit already, see {@link PhysicalPlans#globalLimit}.
 *
 * <p>Partitions are handled in order. A partition whose row count is known before materialization
 * is limited directly when nothing is waiting ahead of it; any other partition is materialized
 * first. Once the limit is reached, pending materializations are cancelled, the child is no longer
 * pulled, and the partitions still owed are emitted as empty partitions. Those are derived from a
 * materialized partition, materializing an empty one first when the last step was pipelined.
 */
@Log4j2
public class GlobalLimitPlan extends AbstractPhysicalPlan {

  private final PhysicalPlan child;

  @Getter private final GlobalLimitState state;

  private boolean childFinished;

  public GlobalLimitPlan(PhysicalPlan child, long limit, int numPartitions) {
    this.child = child;
    this.state = new GlobalLimitState(limit, numPartitions);
  }

  @Override
  protected ExecutionStep computeNext() {
    while (true) {
      if (state.getRemainingPartitions() <= 0) {
        cancelInFlight();
        return finish();
      }
      if (!state.getInFlight().isEmpty() && state.getInFlight().peek().isDone()) {
        PartitionTask done = state.getInFlight().poll();
        PartitionMetadata metadata = done.getPartitionMetadata();
        return limit(PartitionTaskBuilder.of(done.getPartition(), metadata), metadata.numRows());
      }
      if (state.isLimitReached()) {
        cancelInFlight();
        if (state.getEmptyPartitionBase() != null) {
          PartitionTaskBuilder base = state.getEmptyPartitionBase();
          if (base.getInstructions().isEmpty()) {
            state.takeEmpty();
            return base.addInstruction(new LocalLimit(0), ResourceRequest.none());
          }
          // Materialize a pipelined base once so the empty outputs do not re-run its upstream.
          PartitionTask emptyTask = state.getEmptyPartitionTask();
          if (emptyTask == null) {
            emptyTask =
                base.addInstruction(new LocalLimit(0), ResourceRequest.none())
                    .finalizePartitionTask();
            state.setEmptyPartitionTask(emptyTask);
            return emptyTask;
          }
          if (!emptyTask.isDone()) {
            return null;
          }
          state.setEmptyPartitionBase(
              PartitionTaskBuilder.of(emptyTask.getPartition(), emptyTask.getPartitionMetadata()));
          continue;
        }
      }
      if (childFinished) {
        return state.getInFlight().isEmpty() ? finish() : null;
      }

      ExecutionStep step = child.poll();
      if (step == null) {
        if (!child.isFinished()) {
          return null;
        }
        childFinished = true;
        continue;
      }
      if (!(step instanceof PartitionTaskBuilder)) {
        return step;
      }
      PartitionTaskBuilder builder = (PartitionTaskBuilder) step;
      if (state.isLimitReached()) {
        // Limit of zero: the first partition only serves as the base of empty partitions.
        state.setEmptyPartitionBase(builder);
        continue;
      }
      PartitionMetadata metadata = builder.getOutputMetadata();
      if (state.getInFlight().isEmpty() && metadata.hasNumRows()) {
        return limit(builder, metadata.numRows());
      }
      PartitionTask task = builder.finalizePartitionTask();
      state.getInFlight().add(task);
      return task;
    }
  }

  private ExecutionStep limit(PartitionTaskBuilder builder, long numRows) {
    long taken = state.take(numRows);
    if (state.isLimitReached() && state.getEmptyPartitionBase() == null) {
      state.setEmptyPartitionBase(builder);
    }
    log.debug("Global limit takes {} of {} rows, state {}", taken, numRows, state);
    return builder.addInstruction(new LocalLimit(taken), ResourceRequest.none());
  }

  private void cancelInFlight() {
    int cancelled = state.cancelInFlight();
    if (cancelled > 0) {
      log.debug("Global limit reached, cancelled {} pending materializations", cancelled);
    }
  }
}
