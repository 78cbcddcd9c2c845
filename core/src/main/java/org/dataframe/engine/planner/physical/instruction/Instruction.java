/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import java.util.List;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;

/**
 * An atomic partition operation. Instructions are pure: the same inputs always produce the same
 * outputs, and the inputs are never modified.
 */
public interface Instruction {

  /**
   * Runs the instruction.
   *
   * @param inputs input partitions
   * @return output partitions
   */
  List<Page> run(List<Page> inputs);

  /**
   * Derives what can be known about the outputs from what is known about the inputs, without
   * running the instruction.
   *
   * @param inputs metadata per input partition
   * @return metadata per output partition
   */
  List<PartitionMetadata> runPartialMetadata(List<PartitionMetadata> inputs);
}
