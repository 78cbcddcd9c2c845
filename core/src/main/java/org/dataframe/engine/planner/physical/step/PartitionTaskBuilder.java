/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.step;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.Instruction;

/**
 * A pipeable step. Builders are immutable: {@link #addInstruction} returns a new builder, so a
 * step handed downstream is never changed behind its consumer's back.
 */
public class PartitionTaskBuilder extends ExecutionStep {

  /**
   * Starts a step over the given inputs.
   *
   * @param inputs input partitions
   * @param partialMetadatas metadata per input, or null when nothing is known about them
   */
  public PartitionTaskBuilder(List<Page> inputs, List<PartitionMetadata> partialMetadatas) {
    this(
        inputs,
        partialMetadatas == null
            ? Collections.nCopies(inputs.size(), PartitionMetadata.unknown())
            : partialMetadatas,
        ImmutableList.of());
  }

  private PartitionTaskBuilder(
      List<Page> inputs,
      List<PartitionMetadata> partialMetadatas,
      List<PipelinedInstruction> instructions) {
    super(inputs, partialMetadatas, instructions);
  }

  /** Starts a step over one materialized partition. */
  public static PartitionTaskBuilder of(Page input, PartitionMetadata metadata) {
    return new PartitionTaskBuilder(List.of(input), List.of(metadata));
  }

  /**
   * Appends an instruction. The metadata known about the step's outputs is advanced through the
   * instruction.
   */
  public PartitionTaskBuilder addInstruction(
      Instruction instruction, ResourceRequest resourceRequest) {
    List<PipelinedInstruction> instructions =
        ImmutableList.<PipelinedInstruction>builder()
            .addAll(getInstructions())
            .add(new PipelinedInstruction(instruction, resourceRequest))
            .build();
    return new PartitionTaskBuilder(
        getInputs(), instruction.runPartialMetadata(getPartialMetadatas()), instructions);
  }

  /** Returns the output metadata of a step with exactly one output. */
  public PartitionMetadata getOutputMetadata() {
    List<PartitionMetadata> metadatas = getPartialMetadatas();
    checkArgument(metadatas.size() == 1, "Step has %s outputs, expected 1", metadatas.size());
    return metadatas.get(0);
  }

  /** Turns this step into a request to materialize its single output. */
  public PartitionTask finalizePartitionTask() {
    return finalizePartitionTask(1);
  }

  /** Turns this step into a request to materialize {@code numResults} outputs. */
  public PartitionTask finalizePartitionTask(int numResults) {
    checkArgument(numResults > 0, "numResults must be positive: %s", numResults);
    return new PartitionTask(getInputs(), getPartialMetadatas(), getInstructions(), numResults);
  }

  @Override
  public String toString() {
    return "PartitionTaskBuilder{" + describe() + '}';
  }
}
