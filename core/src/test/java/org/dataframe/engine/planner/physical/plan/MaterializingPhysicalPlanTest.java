/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import static org.dataframe.engine.planner.physical.plan.PlanDriver.sequence;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.dataframe.engine.planner.physical.step.ExecutionStep;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class MaterializingPhysicalPlanTest {

  @Test
  void should_hand_back_outputs_in_order_once_done() {
    MaterializingPhysicalPlan plan =
        PhysicalPlans.materialize(
            PhysicalPlans.partitionRead(List.of(sequence(1, 2), sequence(3, 3))));

    PartitionTask first = plan.poll();
    PartitionTask second = plan.poll();
    assertNull(plan.poll());
    assertTrue(plan.isFinished());
    assertTrue(plan.hasPendingResults());

    PlanDriver.materialize(second);
    assertNull(plan.pollResult());
    PlanDriver.materialize(first);
    assertSame(first, plan.pollResult());
    assertSame(second, plan.pollResult());
    assertFalse(plan.hasPendingResults());
    assertEquals(sequence(3, 3), second.getPartition());
  }

  @Test
  void should_pass_upstream_materializations_through() {
    PartitionTask upstream =
        PartitionTaskBuilder.of(sequence(1, 1), PartitionMetadata.unknown())
            .finalizePartitionTask();
    MaterializingPhysicalPlan plan =
        PhysicalPlans.materialize(
            new StepIteratorPlan(List.<ExecutionStep>of(upstream).iterator()));

    assertSame(upstream, plan.poll());
    assertNull(plan.poll());
    assertFalse(plan.hasPendingResults());
  }
}
