/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression;

import java.util.Comparator;

/**
 * Total order over column values. Nulls sort first; numbers compare by value regardless of their
 * boxed type; other values must be mutually {@link Comparable}.
 */
public final class ValueComparator implements Comparator<Object> {

  public static final ValueComparator INSTANCE = new ValueComparator();

  private ValueComparator() {}

  @Override
  @SuppressWarnings({"unchecked", "rawtypes"})
  public int compare(Object left, Object right) {
    if (left == null || right == null) {
      return left == null ? (right == null ? 0 : -1) : 1;
    }
    if (left instanceof Number && right instanceof Number) {
      return compareNumbers((Number) left, (Number) right);
    }
    if (left instanceof Comparable && left.getClass().isInstance(right)) {
      return ((Comparable) left).compareTo(right);
    }
    throw new IllegalArgumentException(
        "Cannot compare "
            + left.getClass().getSimpleName()
            + " with "
            + right.getClass().getSimpleName());
  }

  private static int compareNumbers(Number left, Number right) {
    if (isIntegral(left) && isIntegral(right)) {
      return Long.compare(left.longValue(), right.longValue());
    }
    return Double.compare(left.doubleValue(), right.doubleValue());
  }

  static boolean isIntegral(Number number) {
    return number instanceof Long
        || number instanceof Integer
        || number instanceof Short
        || number instanceof Byte;
  }
}
