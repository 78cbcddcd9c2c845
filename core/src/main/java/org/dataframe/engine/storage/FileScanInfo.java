/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.storage;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Options of a tabular file scan. */
@Getter
@ToString(exclude = "reader")
@RequiredArgsConstructor
public class FileScanInfo {

  private final FileFormat format;

  private final TabularFileReader reader;

  /** Maximum rows to read from each file, or null for no limit. */
  private final Long limitRows;

  public FileScanInfo(FileFormat format, TabularFileReader reader) {
    this(format, reader, null);
  }
}
