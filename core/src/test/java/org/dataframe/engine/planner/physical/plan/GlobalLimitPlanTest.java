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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.Filter;
import org.dataframe.engine.planner.physical.instruction.LocalLimit;
import org.dataframe.engine.planner.physical.step.ExecutionStep;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class GlobalLimitPlanTest {

  private final PlanDriver driver = new PlanDriver();

  @Test
  void should_limit_partitions_with_known_row_counts_without_materializing_them() {
    PlanDriver.CountingPlan source =
        new PlanDriver.CountingPlan(
            PhysicalPlans.partitionRead(
                List.of(sequence(1, 5), sequence(6, 10), sequence(11, 15))));

    List<Page> partitions = driver.run(PhysicalPlans.globalLimit(source, 7, 3));

    assertEquals(List.of(5, 2, 0), rowCounts(partitions));
    assertEquals(sequence(6, 7), partitions.get(1));
    assertEquals(2, source.getPulled());
    // Only the base of the empty third partition is materialized.
    assertEquals(1, driver.getRequests().size());
    assertEquals(new LocalLimit(0), last(driver.getRequests().get(0)));
  }

  @Test
  void should_materialize_pipelined_empty_partition_base_once() {
    PhysicalPlan source =
        PhysicalPlans.partitionRead(List.of(sequence(1, 5), sequence(6, 10), sequence(11, 15)));
    PhysicalPlan plan = PhysicalPlans.globalLimit(source, 3, 4);

    ExecutionStep limited = plan.poll();
    assertEquals(new LocalLimit(3), last(limited));
    PartitionTask emptyBase = assertInstanceOf(PartitionTask.class, plan.poll());
    assertEquals(limited.getInputs(), emptyBase.getInputs());
    assertNull(plan.poll());
    assertFalse(plan.isFinished());

    PlanDriver.materialize(emptyBase);
    for (int i = 0; i < 3; i++) {
      ExecutionStep empty = plan.poll();
      assertEquals(List.of(new LocalLimit(0)), empty.getInstructionList());
      assertEquals(List.of(emptyBase.getPartition()), empty.getInputs());
    }
    assertNull(plan.poll());
    assertTrue(plan.isFinished());
  }

  @Test
  void should_materialize_partitions_with_unknown_row_counts() {
    PhysicalPlan filtered =
        PhysicalPlans.pipelineInstruction(
            PhysicalPlans.partitionRead(
                List.of(sequence(1, 5), sequence(6, 10), sequence(11, 15))),
            new Filter(greater(ref(0, "v"), literal(0))),
            ResourceRequest.none());

    List<Page> partitions = driver.run(PhysicalPlans.globalLimit(filtered, 7, 3));

    assertEquals(List.of(5, 2, 0), rowCounts(partitions));
    assertEquals(2, driver.getRequests().size());
  }

  @Test
  void should_cancel_in_flight_materializations_once_limit_is_reached() {
    PhysicalPlan filtered =
        PhysicalPlans.pipelineInstruction(
            PhysicalPlans.partitionRead(
                List.of(sequence(1, 5), sequence(6, 10), sequence(11, 15))),
            new Filter(greater(ref(0, "v"), literal(0))),
            ResourceRequest.none());
    PhysicalPlan plan = PhysicalPlans.globalLimit(filtered, 3, 3);

    PartitionTask first = assertInstanceOf(PartitionTask.class, plan.poll());
    PartitionTask second = assertInstanceOf(PartitionTask.class, plan.poll());
    PartitionTask third = assertInstanceOf(PartitionTask.class, plan.poll());
    assertNull(plan.poll());
    assertFalse(plan.isFinished());

    PlanDriver.materialize(first);
    ExecutionStep limited = plan.poll();
    assertInstanceOf(PartitionTaskBuilder.class, limited);
    assertEquals(new LocalLimit(3), last(limited));
    assertEquals(List.of(first.getPartition()), limited.getInputs());

    assertEquals(new LocalLimit(0), last(plan.poll()));
    assertTrue(second.isCancelled());
    assertTrue(third.isCancelled());
    assertFalse(first.isCancelled());
    assertEquals(new LocalLimit(0), last(plan.poll()));
    assertNull(plan.poll());
    assertTrue(plan.isFinished());
  }

  @Test
  void should_emit_empty_partitions_for_limit_zero() {
    PlanDriver.CountingPlan source =
        new PlanDriver.CountingPlan(
            PhysicalPlans.partitionRead(List.of(sequence(1, 5), sequence(6, 10))));

    List<Page> partitions = driver.run(PhysicalPlans.globalLimit(source, 0, 2));

    assertEquals(List.of(0, 0), rowCounts(partitions));
    assertEquals(1, source.getPulled());
  }

  @Test
  void should_pass_all_rows_when_limit_exceeds_input() {
    List<Page> partitions =
        driver.run(
            PhysicalPlans.globalLimit(
                PhysicalPlans.partitionRead(List.of(sequence(1, 2), sequence(3, 5))), 10, 2));

    assertEquals(List.of(sequence(1, 2), sequence(3, 5)), partitions);
  }

  @Test
  void should_track_remaining_rows_and_partitions() {
    GlobalLimitState state = new GlobalLimitState(4, 3);

    assertEquals(3, state.take(3));
    assertEquals(1, state.take(5));
    assertTrue(state.isLimitReached());
    state.takeEmpty();
    assertEquals(0, state.getRemainingPartitions());
  }

  private static List<Integer> rowCounts(List<Page> partitions) {
    return partitions.stream().map(Page::getPositionCount).collect(Collectors.toList());
  }

  private static Object last(ExecutionStep step) {
    List<?> instructions = step.getInstructionList();
    return instructions.get(instructions.size() - 1);
  }
}
