/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression;

import com.google.common.base.Strings;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.dataframe.engine.data.page.Page;

/** Named expression that represents an output column of a projection. */
@AllArgsConstructor
@EqualsAndHashCode
@Getter
@RequiredArgsConstructor
public class NamedExpression implements Expression {

  /** Expression name. */
  private final String name;

  /** Expression that being named. */
  private final Expression delegated;

  /** Optional alias. */
  private String alias;

  @Override
  public Object valueOf(Page page, int position) {
    return delegated.valueOf(page, position);
  }

  /**
   * Get expression name using name or its alias (if it's present).
   *
   * @return expression name
   */
  public String getNameOrAlias() {
    return Strings.isNullOrEmpty(alias) ? name : alias;
  }

  @Override
  public String toString() {
    return getNameOrAlias();
  }
}
