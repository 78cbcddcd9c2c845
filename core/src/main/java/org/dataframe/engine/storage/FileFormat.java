/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.storage;

/** Tabular file formats a scan or write may target. Encoding is left to the reader and writer. */
public enum FileFormat {
  CSV,
  JSON,
  PARQUET
}
