/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.PageBuilder;
import org.dataframe.engine.data.page.Pages;
import org.dataframe.engine.expression.SortKey;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;

/** Concatenates all inputs and sorts the result. The sort is stable. */
@Getter
@ToString
@EqualsAndHashCode
public class ReduceMergeAndSort implements Instruction {

  private final List<SortKey> sortBy;

  public ReduceMergeAndSort(List<SortKey> sortBy) {
    this.sortBy = ImmutableList.copyOf(sortBy);
  }

  @Override
  public List<Page> run(List<Page> inputs) {
    Page merged = Pages.concat(inputs);
    List<Integer> positions = new ArrayList<>(merged.getPositionCount());
    List<Object[]> keys = new ArrayList<>(merged.getPositionCount());
    for (int position = 0; position < merged.getPositionCount(); position++) {
      positions.add(position);
      keys.add(Keys.extractSortKey(sortBy, merged, position));
    }
    Comparator<Object[]> comparator = Keys.comparator(sortBy);
    positions.sort((left, right) -> comparator.compare(keys.get(left), keys.get(right)));

    PageBuilder builder = new PageBuilder(merged.getChannelCount());
    positions.forEach(position -> builder.appendRow(merged, position));
    return List.of(builder.build());
  }

  @Override
  public List<PartitionMetadata> runPartialMetadata(List<PartitionMetadata> inputs) {
    return new ReduceMerge().runPartialMetadata(inputs);
  }
}
