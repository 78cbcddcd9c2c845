/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.PageBuilder;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;

/**
 * Splits a partition into exactly {@code numOutputs} shards. Shard {@code i} of every input is
 * destined for output partition {@code i} of the following reduce.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class FanoutInstruction implements Instruction {

  private final int numOutputs;

  protected FanoutInstruction(int numOutputs) {
    checkArgument(numOutputs > 0, "numOutputs must be positive: %s", numOutputs);
    this.numOutputs = numOutputs;
  }

  @Override
  public List<PartitionMetadata> runPartialMetadata(List<PartitionMetadata> inputs) {
    return Collections.nCopies(numOutputs, PartitionMetadata.unknown());
  }

  /** Routes every row of {@code source} to the shard chosen by {@code router}. */
  protected List<Page> split(Page source, IntUnaryOperator router) {
    List<PageBuilder> shards = new ArrayList<>(numOutputs);
    for (int i = 0; i < numOutputs; i++) {
      shards.add(new PageBuilder(source.getChannelCount()));
    }
    for (int position = 0; position < source.getPositionCount(); position++) {
      shards.get(router.applyAsInt(position)).appendRow(source, position);
    }
    List<Page> outputs = new ArrayList<>(numOutputs);
    shards.forEach(shard -> outputs.add(shard.build()));
    return outputs;
  }
}
