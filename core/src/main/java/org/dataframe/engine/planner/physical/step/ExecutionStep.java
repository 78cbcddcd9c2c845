/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.step;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.Instruction;

/**
 * A unit of per-partition work: input partitions and the instructions to run over them, in order.
 * A step is either a {@link PartitionTaskBuilder}, which downstream operators may still pipeline
 * instructions onto, or a {@link PartitionTask}, a request to materialize its outputs.
 */
@Getter
public abstract class ExecutionStep {

  private final List<Page> inputs;

  /**
   * Metadata of the step's outputs as far as known. A step without instructions outputs its
   * inputs, so this starts as one entry per input and is advanced by every appended instruction.
   */
  private final List<PartitionMetadata> partialMetadatas;

  private final List<PipelinedInstruction> instructions;

  protected ExecutionStep(
      List<Page> inputs,
      List<PartitionMetadata> partialMetadatas,
      List<PipelinedInstruction> instructions) {
    this.inputs = ImmutableList.copyOf(inputs);
    this.partialMetadatas = ImmutableList.copyOf(partialMetadatas);
    this.instructions = ImmutableList.copyOf(instructions);
  }

  /** The resources to run every instruction of this step: the field-wise max of their requests. */
  public ResourceRequest getResourceRequest() {
    return instructions.stream()
        .map(PipelinedInstruction::resourceRequest)
        .reduce(ResourceRequest.none(), ResourceRequest::max);
  }

  /** Returns the instructions without their resource requests. */
  public List<Instruction> getInstructionList() {
    return instructions.stream()
        .map(PipelinedInstruction::instruction)
        .collect(Collectors.toList());
  }

  protected String describe() {
    return "inputs="
        + inputs.size()
        + ", instructions="
        + getInstructionList()
        + ", resources="
        + getResourceRequest();
  }
}
