/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.log4j.Log4j2;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.PageBuilder;
import org.dataframe.engine.expression.Expression;
import org.dataframe.engine.planner.logical.JoinType;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;

/**
 * Hash join of a left and a right partition. Builds a hash table on the right side and probes it
 * with the left side. Output rows are the left channels followed by the right channels. NULL keys
 * never match.
 */
@Log4j2
@Getter
@ToString
@EqualsAndHashCode
public class Join implements Instruction {

  private final List<Expression> leftOn;

  private final List<Expression> rightOn;

  private final JoinType joinType;

  public Join(List<Expression> leftOn, List<Expression> rightOn, JoinType joinType) {
    checkArgument(
        leftOn.size() == rightOn.size(),
        "Join key count mismatch: left %s, right %s",
        leftOn.size(),
        rightOn.size());
    this.leftOn = ImmutableList.copyOf(leftOn);
    this.rightOn = ImmutableList.copyOf(rightOn);
    this.joinType = joinType;
  }

  @Override
  public List<Page> run(List<Page> inputs) {
    checkArgument(inputs.size() == 2, "Join expects two inputs but got %s", inputs.size());
    Page left = inputs.get(0);
    Page right = inputs.get(1);

    Map<List<Object>, List<Integer>> hashTable = buildHashTable(right);
    int leftChannels = left.getChannelCount();
    int rightChannels = right.getChannelCount();
    PageBuilder builder = new PageBuilder(leftChannels + rightChannels);
    for (int position = 0; position < left.getPositionCount(); position++) {
      List<Object> key = Keys.extract(leftOn, left, position);
      List<Integer> matches = Keys.hasNull(key) ? null : hashTable.get(key);
      if (matches != null) {
        for (int match : matches) {
          builder.appendRow(combine(left.getRow(position), right.getRow(match)));
        }
      } else if (joinType == JoinType.LEFT) {
        builder.appendRow(combine(left.getRow(position), new Object[rightChannels]));
      }
    }
    Page output = builder.build();
    log.debug(
        "{} join of {} and {} rows produced {} rows",
        joinType,
        left.getPositionCount(),
        right.getPositionCount(),
        output.getPositionCount());
    return List.of(output);
  }

  @Override
  public List<PartitionMetadata> runPartialMetadata(List<PartitionMetadata> inputs) {
    return List.of(PartitionMetadata.unknown());
  }

  /** Right rows by join key. Rows with a null key are left out. */
  private Map<List<Object>, List<Integer>> buildHashTable(Page right) {
    Map<List<Object>, List<Integer>> hashTable = new HashMap<>();
    for (int position = 0; position < right.getPositionCount(); position++) {
      List<Object> key = Keys.extract(rightOn, right, position);
      if (!Keys.hasNull(key)) {
        hashTable.computeIfAbsent(key, k -> new ArrayList<>()).add(position);
      }
    }
    return hashTable;
  }

  private static Object[] combine(Object[] leftRow, Object[] rightRow) {
    Object[] combined = new Object[leftRow.length + rightRow.length];
    System.arraycopy(leftRow, 0, combined, 0, leftRow.length);
    System.arraycopy(rightRow, 0, combined, leftRow.length, rightRow.length);
    return combined;
  }
}
