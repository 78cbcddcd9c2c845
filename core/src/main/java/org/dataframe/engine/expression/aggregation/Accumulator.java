/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression.aggregation;

import org.dataframe.engine.expression.ValueComparator;

/** Mutable state of one aggregation over one group. Nulls are ignored. */
public class Accumulator {

  private final AggregationType type;
  private long count;
  private long longSum;
  private double doubleSum;
  private boolean integral = true;
  private Object extreme;

  Accumulator(AggregationType type) {
    this.type = type;
  }

  public void add(Object value) {
    if (value == null) {
      return;
    }
    count++;
    switch (type) {
      case COUNT:
        break;
      case SUM:
        addToSum(value);
        break;
      case MIN:
        if (extreme == null || ValueComparator.INSTANCE.compare(value, extreme) < 0) {
          extreme = value;
        }
        break;
      case MAX:
        if (extreme == null || ValueComparator.INSTANCE.compare(value, extreme) > 0) {
          extreme = value;
        }
        break;
      default:
        throw new IllegalStateException("Unknown aggregation " + type);
    }
  }

  public Object result() {
    switch (type) {
      case COUNT:
        return count;
      case SUM:
        if (count == 0) {
          return null;
        }
        return integral ? (Object) longSum : (Object) (doubleSum + longSum);
      case MIN:
      case MAX:
        return extreme;
      default:
        throw new IllegalStateException("Unknown aggregation " + type);
    }
  }

  private void addToSum(Object value) {
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException("SUM expects numeric values but got " + value);
    }
    Number number = (Number) value;
    if (number instanceof Long
        || number instanceof Integer
        || number instanceof Short
        || number instanceof Byte) {
      longSum += number.longValue();
    } else {
      integral = false;
      doubleSum += number.doubleValue();
    }
  }
}
