/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.Instruction;
import org.dataframe.engine.planner.physical.step.ExecutionStep;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;

/**
 * All-to-all exchange. Every pipeable step of the child must end in a fanout with {@code
 * numOutputs} outputs; each is materialized. Once all fanouts are done, reduce step {@code i} takes
 * output {@code i} of every fanout, in fanout order, and runs the reduce instruction over them.
 */
@Log4j2
public class ReducePlan extends AbstractPhysicalPlan {

  private final PhysicalPlan fanoutPlan;

  private final int numOutputs;

  private final Instruction reduceInstruction;

  private final ResourceRequest resourceRequest;

  private final List<PartitionTask> fanouts = new ArrayList<>();

  private boolean fanoutsEmitted;

  private int nextReduce;

  public ReducePlan(
      PhysicalPlan fanoutPlan,
      int numOutputs,
      Instruction reduceInstruction,
      ResourceRequest resourceRequest) {
    checkArgument(numOutputs >= 0, "numOutputs must be non-negative: %s", numOutputs);
    this.fanoutPlan = fanoutPlan;
    this.numOutputs = numOutputs;
    this.reduceInstruction = reduceInstruction;
    this.resourceRequest = resourceRequest;
  }

  @Override
  protected ExecutionStep computeNext() {
    while (!fanoutsEmitted) {
      ExecutionStep step = fanoutPlan.poll();
      if (step == null) {
        if (!fanoutPlan.isFinished()) {
          return null;
        }
        fanoutsEmitted = true;
        log.debug("Reduce into {} partitions waits for {} fanouts", numOutputs, fanouts.size());
        continue;
      }
      if (step instanceof PartitionTaskBuilder) {
        PartitionTask fanout = ((PartitionTaskBuilder) step).finalizePartitionTask(numOutputs);
        fanouts.add(fanout);
        return fanout;
      }
      return step;
    }

    if (!fanouts.stream().allMatch(PartitionTask::isDone)) {
      return null;
    }
    if (nextReduce == numOutputs) {
      return finish();
    }
    return reduceStep(nextReduce++);
  }

  private ExecutionStep reduceStep(int index) {
    List<Page> inputs = new ArrayList<>(fanouts.size());
    List<PartitionMetadata> metadatas = new ArrayList<>(fanouts.size());
    for (PartitionTask fanout : fanouts) {
      inputs.add(fanout.getPartitions().get(index));
      metadatas.add(fanout.getPartitionMetadatas().get(index));
    }
    return new PartitionTaskBuilder(inputs, metadatas)
        .addInstruction(reduceInstruction, resourceRequest);
  }
}
