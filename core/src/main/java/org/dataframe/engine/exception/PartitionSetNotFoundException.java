/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.exception;

import lombok.Getter;

/** An in-memory scan references a partition set that was not supplied to the planner. */
public class PartitionSetNotFoundException extends QueryEngineException {

  @Getter private final String key;

  public PartitionSetNotFoundException(String key) {
    super("Partition set [" + key + "] not found");
    this.key = key;
  }
}
