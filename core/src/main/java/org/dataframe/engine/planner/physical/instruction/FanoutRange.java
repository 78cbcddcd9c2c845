/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.expression.SortKey;

/**
 * Routes rows into sort ranges. Takes two inputs: the boundaries computed by {@link
 * ReduceToQuantiles} and the partition to split. A row goes to the range of the number of
 * boundaries it sorts after.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class FanoutRange extends FanoutInstruction {

  private final List<SortKey> sortBy;

  public FanoutRange(int numOutputs, List<SortKey> sortBy) {
    super(numOutputs);
    this.sortBy = ImmutableList.copyOf(sortBy);
  }

  @Override
  public List<Page> run(List<Page> inputs) {
    checkArgument(inputs.size() == 2, "FanoutRange expects boundaries and source inputs");
    Page boundaries = inputs.get(0);
    Page source = inputs.get(1);
    Comparator<Object[]> comparator = Keys.comparator(sortBy);
    return split(
        source,
        position -> {
          Object[] key = Keys.extractSortKey(sortBy, source, position);
          int range = 0;
          while (range < boundaries.getPositionCount()
              && range < getNumOutputs() - 1
              && comparator.compare(key, boundaries.getRow(range)) > 0) {
            range++;
          }
          return range;
        });
  }
}
