/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.Pages;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;

/** Concatenates all inputs, in input order, into one partition. */
@ToString
@EqualsAndHashCode
public class ReduceMerge implements Instruction {

  @Override
  public List<Page> run(List<Page> inputs) {
    return List.of(Pages.concat(inputs));
  }

  @Override
  public List<PartitionMetadata> runPartialMetadata(List<PartitionMetadata> inputs) {
    long numRows = 0;
    long sizeBytes = 0;
    for (PartitionMetadata input : inputs) {
      if (!input.hasNumRows() || input.sizeBytes() == null) {
        return List.of(PartitionMetadata.unknown());
      }
      numRows += input.numRows();
      sizeBytes += input.sizeBytes();
    }
    return List.of(new PartitionMetadata(numRows, sizeBytes));
  }
}
