/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.storage;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Options of a tabular file write. */
@Getter
@ToString(exclude = "writer")
@RequiredArgsConstructor
public class FileWriteInfo {

  private final FileFormat format;

  private final TabularFileWriter writer;

  private final String rootDir;
}
