/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

public enum JoinType {
  INNER,
  LEFT
}
