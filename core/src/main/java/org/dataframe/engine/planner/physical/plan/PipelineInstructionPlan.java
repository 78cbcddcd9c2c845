/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import java.util.function.IntFunction;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.Instruction;
import org.dataframe.engine.planner.physical.step.ExecutionStep;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;

/**
 * Appends an instruction to every pipeable step of the child. Materialization requests of the
 * child pass through unchanged. The instruction factory gets the index of the step among the
 * pipeable ones, in emission order.
 */
public class PipelineInstructionPlan extends AbstractPhysicalPlan {

  private final PhysicalPlan child;

  private final IntFunction<Instruction> instructionFactory;

  private final ResourceRequest resourceRequest;

  private int partitionIndex;

  public PipelineInstructionPlan(
      PhysicalPlan child,
      IntFunction<Instruction> instructionFactory,
      ResourceRequest resourceRequest) {
    this.child = child;
    this.instructionFactory = instructionFactory;
    this.resourceRequest = resourceRequest;
  }

  @Override
  protected ExecutionStep computeNext() {
    ExecutionStep step = child.poll();
    if (step == null) {
      return child.isFinished() ? finish() : null;
    }
    if (step instanceof PartitionTaskBuilder) {
      return ((PartitionTaskBuilder) step)
          .addInstruction(instructionFactory.apply(partitionIndex++), resourceRequest);
    }
    return step;
  }
}
