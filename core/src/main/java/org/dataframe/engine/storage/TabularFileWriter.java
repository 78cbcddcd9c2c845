/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.storage;

import org.dataframe.engine.data.page.Page;

/** Encodes a partition as a tabular file. */
@FunctionalInterface
public interface TabularFileWriter {

  /**
   * Writes one partition.
   *
   * @param partition rows to write
   * @param writeInfo write options
   * @param partitionIndex index of the partition in the written output
   * @return path of the written file
   */
  String write(Page partition, FileWriteInfo writeInfo, int partitionIndex);
}
