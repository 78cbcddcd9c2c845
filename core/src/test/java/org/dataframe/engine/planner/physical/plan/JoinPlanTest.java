/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import static org.dataframe.engine.expression.DSL.ref;
import static org.dataframe.engine.planner.physical.plan.PlanDriver.sequence;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.RowPage;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.logical.JoinType;
import org.dataframe.engine.planner.physical.instruction.Join;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class JoinPlanTest {

  private static final Join JOIN =
      new Join(List.of(ref(0, "k")), List.of(ref(0, "k")), JoinType.INNER);

  private final PlanDriver driver = new PlanDriver();

  @Test
  void should_join_partitions_pairwise() {
    List<Page> left = List.of(sequence(1, 3), sequence(4, 6));
    List<Page> right = List.of(sequence(2, 5), sequence(6, 6));

    List<Page> partitions =
        driver.run(
            PhysicalPlans.join(
                PhysicalPlans.partitionRead(left),
                PhysicalPlans.partitionRead(right),
                JOIN,
                ResourceRequest.none()));

    assertEquals(
        List.of(
            RowPage.of(2, new Object[] {2, 2}, new Object[] {3, 3}),
            RowPage.of(2, new Object[] {6, 6})),
        partitions);
  }

  @Test
  void should_alternate_between_sides() {
    List<Page> left = List.of(sequence(1, 1), sequence(2, 2));
    List<Page> right = List.of(sequence(3, 3), sequence(4, 4));

    List<PartitionTaskBuilder> steps =
        driver.drain(
            PhysicalPlans.join(
                PhysicalPlans.partitionRead(left),
                PhysicalPlans.partitionRead(right),
                JOIN,
                ResourceRequest.ofCpus(1)));

    assertEquals(
        List.of(left.get(0), right.get(0), left.get(1), right.get(1)),
        driver.getRequests().stream()
            .map(task -> task.getInputs().get(0))
            .collect(Collectors.toList()));
    assertEquals(List.of(left.get(1), right.get(1)), steps.get(1).getInputs());
    assertEquals(ResourceRequest.ofCpus(1), steps.get(1).getResourceRequest());
  }

  @Test
  void should_fail_on_partition_count_mismatch() {
    IllegalStateException exception =
        assertThrows(
            IllegalStateException.class,
            () ->
                driver.run(
                    PhysicalPlans.join(
                        PhysicalPlans.partitionRead(List.of(sequence(1, 1), sequence(2, 2))),
                        PhysicalPlans.partitionRead(List.of(sequence(1, 1))),
                        JOIN,
                        ResourceRequest.none())));

    assertEquals(
        "Join sides have different partition counts: left 2, right 1", exception.getMessage());
  }
}
