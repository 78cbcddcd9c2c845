/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import static org.dataframe.engine.expression.DSL.greater;
import static org.dataframe.engine.expression.DSL.literal;
import static org.dataframe.engine.expression.DSL.ref;
import static org.dataframe.engine.planner.physical.plan.PlanDriver.sequence;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.Filter;
import org.dataframe.engine.planner.physical.instruction.LocalLimit;
import org.dataframe.engine.planner.physical.instruction.WriteFile;
import org.dataframe.engine.planner.physical.step.ExecutionStep;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;
import org.dataframe.engine.storage.FileFormat;
import org.dataframe.engine.storage.FileWriteInfo;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PipelineInstructionPlanTest {

  private final PlanDriver driver = new PlanDriver();

  @Test
  void should_read_partitions_in_order_without_instructions() {
    Page first = sequence(1, 2);
    Page second = sequence(3, 5);

    List<PartitionTaskBuilder> steps =
        driver.drain(PhysicalPlans.partitionRead(List.of(first, second)));

    assertEquals(2, steps.size());
    assertEquals(List.of(first), steps.get(0).getInputs());
    assertEquals(List.of(second), steps.get(1).getInputs());
    assertTrue(steps.get(0).getInstructions().isEmpty());
    assertEquals(PartitionMetadata.from(second), steps.get(1).getOutputMetadata());
  }

  @Test
  void should_append_instruction_with_resource_request() {
    Filter filter = new Filter(greater(ref(0, "v"), literal(2)));
    PhysicalPlan plan =
        PhysicalPlans.pipelineInstruction(
            PhysicalPlans.partitionRead(List.of(sequence(1, 3), sequence(4, 4))),
            filter,
            ResourceRequest.ofCpus(2));

    List<PartitionTaskBuilder> steps = driver.drain(plan);

    assertEquals(2, steps.size());
    for (PartitionTaskBuilder step : steps) {
      assertEquals(List.of(filter), step.getInstructionList());
      assertEquals(ResourceRequest.ofCpus(2), step.getResourceRequest());
    }
    assertEquals(sequence(3, 3), PlanDriver.execute(steps.get(0)));
  }

  @Test
  void should_pass_materialization_requests_through() {
    PartitionTask upstream =
        PartitionTaskBuilder.of(sequence(1, 1), PartitionMetadata.unknown())
            .finalizePartitionTask();
    PartitionTaskBuilder pipeable =
        PartitionTaskBuilder.of(sequence(1, 4), PartitionMetadata.unknown());
    PhysicalPlan plan =
        PhysicalPlans.localLimit(
            new StepIteratorPlan(List.<ExecutionStep>of(upstream, pipeable).iterator()), 2);

    assertSame(upstream, plan.poll());
    ExecutionStep limited = plan.poll();
    assertEquals(List.of(new LocalLimit(2)), limited.getInstructionList());
    assertNull(plan.poll());
    assertTrue(plan.isFinished());
  }

  @Test
  void should_number_written_partitions_in_emission_order() {
    FileWriteInfo writeInfo =
        new FileWriteInfo(FileFormat.CSV, (page, info, index) -> "f" + index, "out");
    PhysicalPlan plan =
        PhysicalPlans.fileWrite(
            PhysicalPlans.partitionRead(List.of(sequence(1, 1), sequence(2, 2), sequence(3, 3))),
            writeInfo,
            ResourceRequest.none());

    List<PartitionTaskBuilder> steps = driver.drain(plan);

    for (int i = 0; i < steps.size(); i++) {
      assertEquals(List.of(new WriteFile(i, writeInfo)), steps.get(i).getInstructionList());
    }
    assertEquals(3, steps.size());
  }
}
