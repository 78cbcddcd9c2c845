/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.dataframe.engine.data.page.Page;

/** Constant value. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class LiteralExpression implements Expression {

  private final Object value;

  @Override
  public Object valueOf(Page page, int position) {
    return value;
  }

  @Override
  public String toString() {
    return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
  }
}
