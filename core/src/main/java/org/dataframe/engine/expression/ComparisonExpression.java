/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.dataframe.engine.data.page.Page;

/** Binary comparison. Comparing against null yields false. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ComparisonExpression implements Expression {

  /** Comparison operators. */
  @RequiredArgsConstructor
  public enum Operator {
    EQUAL("="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    GREATER_OR_EQUAL(">=");

    @Getter private final String symbol;
  }

  private final Operator operator;

  private final Expression left;

  private final Expression right;

  @Override
  public Object valueOf(Page page, int position) {
    Object leftValue = left.valueOf(page, position);
    Object rightValue = right.valueOf(page, position);
    if (leftValue == null || rightValue == null) {
      return Boolean.FALSE;
    }
    int cmp = ValueComparator.INSTANCE.compare(leftValue, rightValue);
    switch (operator) {
      case EQUAL:
        return cmp == 0;
      case NOT_EQUAL:
        return cmp != 0;
      case LESS:
        return cmp < 0;
      case LESS_OR_EQUAL:
        return cmp <= 0;
      case GREATER:
        return cmp > 0;
      case GREATER_OR_EQUAL:
        return cmp >= 0;
      default:
        throw new IllegalStateException("Unknown comparison operator " + operator);
    }
  }

  @Override
  public String toString() {
    return left + " " + operator.getSymbol() + " " + right;
  }
}
