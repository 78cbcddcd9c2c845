/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.dataframe.engine.data.page.Page;

/** Reference to a column of the input page by channel. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ReferenceExpression implements Expression {

  private final int channel;

  private final String name;

  @Override
  public Object valueOf(Page page, int position) {
    return page.getValue(position, channel);
  }

  @Override
  public String toString() {
    return name;
  }
}
