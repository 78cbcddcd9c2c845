/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import static org.dataframe.engine.expression.DSL.asc;
import static org.dataframe.engine.expression.DSL.desc;
import static org.dataframe.engine.expression.DSL.ref;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.RowPage;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ReduceInstructionTest {

  @Test
  void should_merge_inputs_in_order() {
    Page first = RowPage.of(1, new Object[] {"a"}, new Object[] {"b"});
    Page second = RowPage.of(1, new Object[] {"c"});

    List<Page> merged = new ReduceMerge().run(List.of(first, Page.empty(1), second));

    assertEquals(
        List.of(RowPage.of(1, new Object[] {"a"}, new Object[] {"b"}, new Object[] {"c"})),
        merged);
  }

  @Test
  void should_add_up_known_metadata_when_merging() {
    ReduceMerge merge = new ReduceMerge();

    assertEquals(
        List.of(new PartitionMetadata(5L, 40L)),
        merge.runPartialMetadata(
            List.of(new PartitionMetadata(2L, 16L), new PartitionMetadata(3L, 24L))));
    assertEquals(
        List.of(PartitionMetadata.unknown()),
        merge.runPartialMetadata(
            List.of(new PartitionMetadata(2L, 16L), new PartitionMetadata(3L, null))));
  }

  @Test
  void should_merge_and_sort_inputs() {
    ReduceMergeAndSort mergeAndSort = new ReduceMergeAndSort(List.of(desc(ref(0, "v"))));

    Page sorted =
        mergeAndSort
            .run(
                List.of(
                    RowPage.of(2, new Object[] {1, "x"}, new Object[] {5, "y"}),
                    RowPage.of(2, new Object[] {3, "z"}, new Object[] {5, "w"})))
            .get(0);

    assertEquals(
        RowPage.of(
            2,
            new Object[] {5, "y"},
            new Object[] {5, "w"},
            new Object[] {3, "z"},
            new Object[] {1, "x"}),
        sorted);
  }

  @Test
  void should_sample_evenly_spaced_sort_keys() {
    Sample sample = new Sample(List.of(asc(ref(1, "v"))), 2);
    Page input =
        RowPage.of(
            2,
            new Object[] {"a", 40},
            new Object[] {"b", 10},
            new Object[] {"c", 30},
            new Object[] {"d", 20});

    assertEquals(
        RowPage.of(1, new Object[] {40}, new Object[] {30}), sample.run(List.of(input)).get(0));
  }

  @Test
  void should_sample_every_row_of_small_partition() {
    Sample sample = new Sample(List.of(asc(ref(0, "v"))), 20);
    Page input = RowPage.of(1, new Object[] {2}, new Object[] {1});

    assertEquals(input, sample.run(List.of(input)).get(0));
  }

  @Test
  void should_reduce_samples_to_quantile_boundaries() {
    ReduceToQuantiles quantiles = new ReduceToQuantiles(3, List.of(asc(ref(0, "v"))));

    Page boundaries =
        quantiles
            .run(
                List.of(
                    RowPage.of(1, new Object[] {5}, new Object[] {1}, new Object[] {9}),
                    RowPage.of(1, new Object[] {3}, new Object[] {7}, new Object[] {2})))
            .get(0);

    assertEquals(RowPage.of(1, new Object[] {3}, new Object[] {7}), boundaries);
  }

  @Test
  void should_produce_no_boundaries_without_samples() {
    ReduceToQuantiles quantiles = new ReduceToQuantiles(4, List.of(asc(ref(0, "v"))));

    assertEquals(List.of(Page.empty(1)), quantiles.run(List.of(Page.empty(1))));
  }
}
