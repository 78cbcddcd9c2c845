/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.PageBuilder;
import org.dataframe.engine.expression.SortKey;

/**
 * Takes up to {@code size} evenly spaced rows of the partition and outputs their sort key values,
 * one channel per sort key.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class Sample extends SingleInputInstruction {

  private final List<SortKey> sortBy;

  private final int size;

  public Sample(List<SortKey> sortBy, int size) {
    checkArgument(size > 0, "sample size must be positive: %s", size);
    this.sortBy = ImmutableList.copyOf(sortBy);
    this.size = size;
  }

  @Override
  protected Page run(Page input) {
    int rows = input.getPositionCount();
    int taken = Math.min(size, rows);
    PageBuilder builder = new PageBuilder(sortBy.size());
    for (int i = 0; i < taken; i++) {
      int position = (int) ((long) i * rows / taken);
      builder.appendRow(Keys.extractSortKey(sortBy, input, position));
    }
    return builder.build();
  }
}
