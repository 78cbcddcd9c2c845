/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.dataframe.engine.data.page.Page;

/** Boolean connective over predicate expressions. A null operand counts as false. */
@Getter
@EqualsAndHashCode
public class LogicalExpression implements Expression {

  /** Boolean connectives. */
  public enum Operator {
    AND,
    OR,
    NOT
  }

  private final Operator operator;

  private final List<Expression> operands;

  public LogicalExpression(Operator operator, List<Expression> operands) {
    if (operator == Operator.NOT && operands.size() != 1) {
      throw new IllegalArgumentException("NOT takes exactly one operand");
    }
    this.operator = operator;
    this.operands = ImmutableList.copyOf(operands);
  }

  @Override
  public Object valueOf(Page page, int position) {
    switch (operator) {
      case AND:
        return operands.stream().allMatch(operand -> isTrue(operand, page, position));
      case OR:
        return operands.stream().anyMatch(operand -> isTrue(operand, page, position));
      case NOT:
        return !isTrue(operands.get(0), page, position);
      default:
        throw new IllegalStateException("Unknown logical operator " + operator);
    }
  }

  private static boolean isTrue(Expression operand, Page page, int position) {
    return Boolean.TRUE.equals(operand.valueOf(page, position));
  }

  @Override
  public String toString() {
    if (operator == Operator.NOT) {
      return "NOT(" + operands.get(0) + ")";
    }
    return operands.stream()
        .map(Object::toString)
        .collect(Collectors.joining(" " + operator + " ", "(", ")"));
  }
}
