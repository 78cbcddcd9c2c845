/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression;

import java.util.Arrays;
import org.dataframe.engine.expression.aggregation.AggregationType;
import org.dataframe.engine.expression.aggregation.NamedAggregator;

/** Static factory for expressions. */
public final class DSL {

  private DSL() {}

  public static ReferenceExpression ref(int channel, String name) {
    return new ReferenceExpression(channel, name);
  }

  public static LiteralExpression literal(Object value) {
    return new LiteralExpression(value);
  }

  public static NamedExpression named(String name, Expression expression) {
    return new NamedExpression(name, expression);
  }

  public static NamedExpression named(String name, Expression expression, String alias) {
    return new NamedExpression(name, expression, alias);
  }

  public static ComparisonExpression equal(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.EQUAL, left, right);
  }

  public static ComparisonExpression notEqual(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.NOT_EQUAL, left, right);
  }

  public static ComparisonExpression less(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.LESS, left, right);
  }

  public static ComparisonExpression lte(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.LESS_OR_EQUAL, left, right);
  }

  public static ComparisonExpression greater(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.GREATER, left, right);
  }

  public static ComparisonExpression gte(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.GREATER_OR_EQUAL, left, right);
  }

  public static LogicalExpression and(Expression... operands) {
    return new LogicalExpression(LogicalExpression.Operator.AND, Arrays.asList(operands));
  }

  public static LogicalExpression or(Expression... operands) {
    return new LogicalExpression(LogicalExpression.Operator.OR, Arrays.asList(operands));
  }

  public static LogicalExpression not(Expression operand) {
    return new LogicalExpression(LogicalExpression.Operator.NOT, Arrays.asList(operand));
  }

  public static NamedAggregator count(String name, Expression input) {
    return new NamedAggregator(name, AggregationType.COUNT, input);
  }

  public static NamedAggregator sum(String name, Expression input) {
    return new NamedAggregator(name, AggregationType.SUM, input);
  }

  public static NamedAggregator min(String name, Expression input) {
    return new NamedAggregator(name, AggregationType.MIN, input);
  }

  public static NamedAggregator max(String name, Expression input) {
    return new NamedAggregator(name, AggregationType.MAX, input);
  }

  public static SortKey asc(Expression expression) {
    return new SortKey(expression, false);
  }

  public static SortKey desc(Expression expression) {
    return new SortKey(expression, true);
  }
}
