/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.exception;

/**
 * A logical plan node, or a variant of one (such as a partitioning scheme), has no physical
 * translation.
 */
public class UnsupportedPlanException extends QueryEngineException {

  public UnsupportedPlanException(String message) {
    super(message);
  }
}
