/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression.aggregation;

/** Supported aggregation functions. */
public enum AggregationType {
  /** Number of non-null input values. */
  COUNT,
  /** Sum of numeric input values; Long when every value is integral, Double otherwise. */
  SUM,
  MIN,
  MAX
}
