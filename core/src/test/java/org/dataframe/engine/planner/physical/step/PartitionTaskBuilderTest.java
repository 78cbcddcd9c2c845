/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.step;

import static org.dataframe.engine.expression.DSL.greater;
import static org.dataframe.engine.expression.DSL.literal;
import static org.dataframe.engine.expression.DSL.ref;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.RowPage;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.Filter;
import org.dataframe.engine.planner.physical.instruction.LocalLimit;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PartitionTaskBuilderTest {

  private final Page partition =
      RowPage.of(1, new Object[] {1}, new Object[] {2}, new Object[] {3}, new Object[] {4});

  @Test
  void should_start_without_instructions() {
    PartitionTaskBuilder builder =
        PartitionTaskBuilder.of(partition, PartitionMetadata.from(partition));

    assertEquals(List.of(partition), builder.getInputs());
    assertTrue(builder.getInstructions().isEmpty());
    assertEquals(new PartitionMetadata(4L, 32L), builder.getOutputMetadata());
    assertEquals(ResourceRequest.none(), builder.getResourceRequest());
  }

  @Test
  void should_return_new_builder_when_adding_instruction() {
    PartitionTaskBuilder builder =
        PartitionTaskBuilder.of(partition, PartitionMetadata.from(partition));

    PartitionTaskBuilder limited =
        builder.addInstruction(new LocalLimit(2), ResourceRequest.none());

    assertNotSame(builder, limited);
    assertTrue(builder.getInstructions().isEmpty());
    assertEquals(List.of(new LocalLimit(2)), limited.getInstructionList());
  }

  @Test
  void should_advance_partial_metadata_through_instructions() {
    PartitionTaskBuilder builder =
        PartitionTaskBuilder.of(partition, PartitionMetadata.from(partition));

    PartitionTaskBuilder limited =
        builder.addInstruction(new LocalLimit(2), ResourceRequest.none());
    PartitionTaskBuilder filtered =
        limited.addInstruction(
            new Filter(greater(ref(0, "v"), literal(1))), ResourceRequest.none());

    assertEquals(new PartitionMetadata(2L, null), limited.getOutputMetadata());
    assertEquals(PartitionMetadata.unknown(), filtered.getOutputMetadata());
  }

  @Test
  void should_request_maximum_of_instruction_resources() {
    PartitionTaskBuilder builder =
        PartitionTaskBuilder.of(partition, PartitionMetadata.from(partition))
            .addInstruction(new LocalLimit(3), ResourceRequest.ofCpus(2))
            .addInstruction(new LocalLimit(2), ResourceRequest.ofMemory(1024));

    assertEquals(new ResourceRequest(2.0, null, 1024L), builder.getResourceRequest());
  }

  @Test
  void should_treat_missing_metadata_as_unknown() {
    PartitionTaskBuilder builder = new PartitionTaskBuilder(List.of(partition, partition), null);

    assertEquals(
        List.of(PartitionMetadata.unknown(), PartitionMetadata.unknown()),
        builder.getPartialMetadatas());
    assertThrows(IllegalArgumentException.class, builder::getOutputMetadata);
  }

  @Test
  void should_finalize_into_materialization_request() {
    PartitionTaskBuilder builder =
        PartitionTaskBuilder.of(partition, PartitionMetadata.from(partition))
            .addInstruction(new LocalLimit(1), ResourceRequest.ofCpus(1));

    PartitionTask task = builder.finalizePartitionTask();

    assertEquals(builder.getInputs(), task.getInputs());
    assertEquals(builder.getInstructions(), task.getInstructions());
    assertEquals(1, task.getNumResults());
    assertThrows(IllegalArgumentException.class, () -> builder.finalizePartitionTask(0));
  }
}
