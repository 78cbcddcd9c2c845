/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;

/** Base class of instructions that map one partition to one partition. */
public abstract class SingleInputInstruction implements Instruction {

  @Override
  public final List<Page> run(List<Page> inputs) {
    checkArgument(inputs.size() == 1, "%s expects one input but got %s", this, inputs.size());
    return List.of(run(inputs.get(0)));
  }

  @Override
  public final List<PartitionMetadata> runPartialMetadata(List<PartitionMetadata> inputs) {
    checkArgument(inputs.size() == 1, "%s expects one input but got %s", this, inputs.size());
    return List.of(runPartialMetadata(inputs.get(0)));
  }

  protected abstract Page run(Page input);

  /** By default nothing is known about the output. */
  protected PartitionMetadata runPartialMetadata(PartitionMetadata input) {
    return PartitionMetadata.unknown();
  }
}
