/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.expression.Expression;
import org.dataframe.engine.expression.SortKey;
import org.dataframe.engine.expression.ValueComparator;

/** Key extraction and ordering shared by the grouping, hashing, and sorting instructions. */
final class Keys {

  private Keys() {}

  /**
   * Evaluates key expressions for one row. Integral numbers are widened to Long and floats to
   * Double, so equal values of different boxed types hash alike.
   */
  static List<Object> extract(List<Expression> expressions, Page page, int position) {
    List<Object> key = new ArrayList<>(expressions.size());
    for (Expression expression : expressions) {
      key.add(normalize(expression.valueOf(page, position)));
    }
    return key;
  }

  static Object[] extractSortKey(List<SortKey> sortKeys, Page page, int position) {
    Object[] key = new Object[sortKeys.size()];
    for (int i = 0; i < key.length; i++) {
      key[i] = sortKeys.get(i).expression().valueOf(page, position);
    }
    return key;
  }

  /** Orders sort key tuples by each key's direction. */
  static Comparator<Object[]> comparator(List<SortKey> sortKeys) {
    return (left, right) -> {
      for (int i = 0; i < sortKeys.size(); i++) {
        int cmp = ValueComparator.INSTANCE.compare(left[i], right[i]);
        if (cmp != 0) {
          return sortKeys.get(i).descending() ? -cmp : cmp;
        }
      }
      return 0;
    };
  }

  static boolean hasNull(List<Object> key) {
    return key.stream().anyMatch(value -> value == null);
  }

  private static Object normalize(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float) {
      return ((Float) value).doubleValue();
    }
    return value;
  }
}
