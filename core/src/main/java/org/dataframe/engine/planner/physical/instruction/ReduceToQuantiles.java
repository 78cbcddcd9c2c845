/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.PageBuilder;
import org.dataframe.engine.expression.SortKey;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;

/**
 * Merges sort key samples (as produced by {@link Sample}) and picks the {@code numQuantiles - 1}
 * boundaries that split them into equally sized ranges. Fewer boundaries are produced when there
 * are fewer samples.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ReduceToQuantiles implements Instruction {

  private final int numQuantiles;

  private final List<SortKey> sortBy;

  public ReduceToQuantiles(int numQuantiles, List<SortKey> sortBy) {
    checkArgument(numQuantiles > 0, "numQuantiles must be positive: %s", numQuantiles);
    this.numQuantiles = numQuantiles;
    this.sortBy = ImmutableList.copyOf(sortBy);
  }

  @Override
  public List<Page> run(List<Page> inputs) {
    List<Object[]> samples = new ArrayList<>();
    for (Page input : inputs) {
      for (int position = 0; position < input.getPositionCount(); position++) {
        samples.add(input.getRow(position));
      }
    }
    samples.sort(Keys.comparator(sortBy));

    PageBuilder builder = new PageBuilder(sortBy.size());
    if (!samples.isEmpty()) {
      for (int i = 1; i < numQuantiles; i++) {
        builder.appendRow(samples.get((int) ((long) i * samples.size() / numQuantiles)));
      }
    }
    return List.of(builder.build());
  }

  @Override
  public List<PartitionMetadata> runPartialMetadata(List<PartitionMetadata> inputs) {
    return List.of(PartitionMetadata.unknown());
  }
}
