/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import static org.dataframe.engine.expression.DSL.count;
import static org.dataframe.engine.expression.DSL.greater;
import static org.dataframe.engine.expression.DSL.literal;
import static org.dataframe.engine.expression.DSL.named;
import static org.dataframe.engine.expression.DSL.ref;
import static org.dataframe.engine.expression.DSL.sum;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.RowPage;
import org.dataframe.engine.expression.function.MapPartitionFunction;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SingleInputInstructionTest {

  private final Page employees =
      RowPage.of(
          2,
          new Object[] {"eng", 10},
          new Object[] {"ops", 20},
          new Object[] {"eng", 30},
          new Object[] {"hr", null});

  @Mock private MapPartitionFunction function;

  @Test
  void should_keep_rows_matching_predicate() {
    Filter filter = new Filter(greater(ref(1, "salary"), literal(15)));

    List<Page> output = filter.run(List.of(employees));

    assertEquals(
        List.of(RowPage.of(2, new Object[] {"ops", 20}, new Object[] {"eng", 30})), output);
  }

  @Test
  void should_project_one_channel_per_expression() {
    Project project =
        new Project(List.of(named("salary", ref(1, "salary")), named("dept", ref(0, "dept"))));

    Page output = project.run(List.of(employees.getRegion(0, 2))).get(0);

    assertEquals(RowPage.of(2, new Object[] {10, "eng"}, new Object[] {20, "ops"}), output);
    assertEquals(
        List.of(new PartitionMetadata(2L, null)),
        project.runPartialMetadata(List.of(PartitionMetadata.from(employees.getRegion(0, 2)))));
  }

  @Test
  void should_apply_user_function() {
    Page transformed = RowPage.of(1, new Object[] {"done"});
    when(function.apply(employees)).thenReturn(transformed);

    List<Page> output = new MapPartition(function).run(List.of(employees));

    assertEquals(List.of(transformed), output);
    verify(function).apply(employees);
  }

  @Test
  void should_aggregate_groups_in_order_of_first_occurrence() {
    Aggregate aggregate =
        new Aggregate(
            List.of(sum("total", ref(1, "salary")), count("n", ref(1, "salary"))),
            List.of(ref(0, "dept")));

    Page output = aggregate.run(List.of(employees)).get(0);

    assertEquals(
        RowPage.of(
            3,
            new Object[] {"eng", 40L, 2L},
            new Object[] {"ops", 20L, 1L},
            new Object[] {"hr", null, 0L}),
        output);
  }

  @Test
  void should_aggregate_whole_partition_without_group_by() {
    Aggregate aggregate = new Aggregate(List.of(count("n", ref(1, "salary"))), List.of());

    assertEquals(
        RowPage.of(1, new Object[] {3L}), aggregate.run(List.of(employees)).get(0));
    assertEquals(
        RowPage.of(1, new Object[] {0L}), aggregate.run(List.of(Page.empty(2))).get(0));
  }

  @Test
  void should_emit_distinct_keys_without_aggregators() {
    Aggregate distinct = new Aggregate(List.of(), List.of(ref(0, "dept")));

    Page output = distinct.run(List.of(employees)).get(0);

    assertEquals(
        RowPage.of(1, new Object[] {"eng"}, new Object[] {"ops"}, new Object[] {"hr"}), output);
  }

  @Test
  void should_keep_first_rows_up_to_limit() {
    LocalLimit limit = new LocalLimit(2);

    assertEquals(List.of(employees.getRegion(0, 2)), limit.run(List.of(employees)));
    assertEquals(List.of(Page.empty(2)), new LocalLimit(0).run(List.of(employees)));
    assertEquals(
        List.of(new PartitionMetadata(2L, null)),
        limit.runPartialMetadata(List.of(PartitionMetadata.from(employees))));
    assertEquals(
        List.of(PartitionMetadata.unknown()),
        limit.runPartialMetadata(List.of(PartitionMetadata.unknown())));
  }

  @Test
  void should_reject_negative_limit() {
    assertThrows(IllegalArgumentException.class, () -> new LocalLimit(-1));
  }

  @Test
  void should_reject_more_than_one_input() {
    LocalLimit limit = new LocalLimit(1);

    assertThrows(IllegalArgumentException.class, () -> limit.run(List.of(employees, employees)));
  }
}
