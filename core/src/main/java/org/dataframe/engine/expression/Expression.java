/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression;

import org.dataframe.engine.data.page.Page;

/** A row-level expression evaluated against one position of a {@link Page}. */
public interface Expression {

  /**
   * Evaluates this expression for a single row.
   *
   * @param page the page holding the row
   * @param position the row index
   * @return the value, possibly null
   */
  Object valueOf(Page page, int position);
}
