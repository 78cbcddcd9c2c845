/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.PageBuilder;
import org.dataframe.engine.expression.Expression;
import org.dataframe.engine.expression.aggregation.Accumulator;
import org.dataframe.engine.expression.aggregation.NamedAggregator;

/**
 * Groups the partition by the group-by expressions and evaluates the aggregators per group. The
 * output holds the group-by columns followed by one column per aggregator, groups in order of
 * first occurrence. Without group-by expressions the whole partition is one group; without
 * aggregators the output is the distinct group keys.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class Aggregate extends SingleInputInstruction {

  private final List<NamedAggregator> aggregatorList;

  private final List<Expression> groupByList;

  public Aggregate(List<NamedAggregator> aggregatorList, List<Expression> groupByList) {
    this.aggregatorList = ImmutableList.copyOf(aggregatorList);
    this.groupByList = ImmutableList.copyOf(groupByList);
  }

  @Override
  protected Page run(Page input) {
    Map<List<Object>, List<Accumulator>> groups = new LinkedHashMap<>();
    if (groupByList.isEmpty()) {
      groups.put(List.of(), newAccumulators());
    }
    for (int position = 0; position < input.getPositionCount(); position++) {
      List<Object> key = Keys.extract(groupByList, input, position);
      List<Accumulator> accumulators = groups.computeIfAbsent(key, k -> newAccumulators());
      for (int i = 0; i < aggregatorList.size(); i++) {
        accumulators.get(i).add(aggregatorList.get(i).getInput().valueOf(input, position));
      }
    }

    PageBuilder builder = new PageBuilder(groupByList.size() + aggregatorList.size());
    groups.forEach(
        (key, accumulators) -> {
          List<Object> row = new ArrayList<>(key);
          accumulators.forEach(accumulator -> row.add(accumulator.result()));
          builder.appendRow(row.toArray());
        });
    return builder.build();
  }

  private List<Accumulator> newAccumulators() {
    List<Accumulator> accumulators = new ArrayList<>(aggregatorList.size());
    aggregatorList.forEach(aggregator -> accumulators.add(aggregator.createAccumulator()));
    return accumulators;
  }
}
