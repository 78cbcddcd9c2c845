/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression;

/** A sort expression with its direction. Nulls sort first ascending and last descending. */
public record SortKey(Expression expression, boolean descending) {

  @Override
  public String toString() {
    return expression + (descending ? " DESC" : " ASC");
  }
}
