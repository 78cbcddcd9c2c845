/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;
import org.dataframe.engine.storage.FileInfos;
import org.dataframe.engine.storage.FileScanInfo;

/** Reads the file described by row {@code index} of a file listing partition. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class ReadFile extends SingleInputInstruction {

  private final int index;

  /** Row count of the file when the listing knows it, otherwise null. */
  private final Long fileRows;

  private final FileScanInfo scanInfo;

  public ReadFile(int index, Long fileRows, FileScanInfo scanInfo) {
    this.index = index;
    this.fileRows = fileRows;
    this.scanInfo = scanInfo;
  }

  @Override
  protected Page run(Page listing) {
    String path = FileInfos.get(listing, index).path();
    Page table = scanInfo.getReader().read(path, scanInfo);
    Long limitRows = scanInfo.getLimitRows();
    if (limitRows != null && table.getPositionCount() > limitRows) {
      return table.getRegion(0, limitRows.intValue());
    }
    return table;
  }

  @Override
  protected PartitionMetadata runPartialMetadata(PartitionMetadata input) {
    Long limitRows = scanInfo.getLimitRows();
    if (fileRows == null) {
      return PartitionMetadata.unknown();
    }
    long numRows = limitRows == null ? fileRows : Math.min(fileRows, limitRows);
    return new PartitionMetadata(numRows, null);
  }
}
