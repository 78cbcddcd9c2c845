/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.hash.Hashing;
import java.util.List;
import java.util.Random;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;

/**
 * Distributes rows uniformly at random. The random stream of a partition is derived from the seed
 * and the partition index, so the split is reproducible and differs between partitions.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class FanoutRandom extends FanoutInstruction {

  private final long seed;

  private final int partitionIndex;

  public FanoutRandom(int numOutputs, long seed, int partitionIndex) {
    super(numOutputs);
    this.seed = seed;
    this.partitionIndex = partitionIndex;
  }

  @Override
  public List<Page> run(List<Page> inputs) {
    checkArgument(inputs.size() == 1, "FanoutRandom expects one input but got %s", inputs.size());
    Random random =
        new Random(
            Hashing.murmur3_128().newHasher().putLong(seed).putInt(partitionIndex).hash().asLong());
    return split(inputs.get(0), position -> random.nextInt(getNumOutputs()));
  }
}
