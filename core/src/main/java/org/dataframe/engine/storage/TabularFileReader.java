/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.storage;

import org.dataframe.engine.data.page.Page;

/** Decodes a tabular file into a partition. */
@FunctionalInterface
public interface TabularFileReader {

  /**
   * Reads one file.
   *
   * @param path file path from the listing
   * @param scanInfo scan options, including the optional row limit
   * @return the file's rows, at most {@code scanInfo.getLimitRows()} when a limit is set
   */
  Page read(String path, FileScanInfo scanInfo);
}
