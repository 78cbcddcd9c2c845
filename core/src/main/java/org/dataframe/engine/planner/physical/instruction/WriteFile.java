/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.log4j.Log4j2;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.PageBuilder;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;
import org.dataframe.engine.storage.FileWriteInfo;

/** Writes the partition and outputs a single row holding the written file's path. */
@Log4j2
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class WriteFile extends SingleInputInstruction {

  private final int partitionIndex;

  private final FileWriteInfo writeInfo;

  public WriteFile(int partitionIndex, FileWriteInfo writeInfo) {
    this.partitionIndex = partitionIndex;
    this.writeInfo = writeInfo;
  }

  @Override
  protected Page run(Page input) {
    String path = writeInfo.getWriter().write(input, writeInfo, partitionIndex);
    log.debug("Wrote partition {} ({} rows) to {}", partitionIndex, input.getPositionCount(), path);
    return new PageBuilder(1).appendRow(path).build();
  }

  @Override
  protected PartitionMetadata runPartialMetadata(PartitionMetadata input) {
    return new PartitionMetadata(1L, null);
  }
}
