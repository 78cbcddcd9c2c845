/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression.aggregation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.dataframe.engine.expression.Expression;

/** Aggregation function over an input expression, named for the output column. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class NamedAggregator {

  private final String name;

  private final AggregationType type;

  private final Expression input;

  /** Creates fresh state for one group. */
  public Accumulator createAccumulator() {
    return new Accumulator(type);
  }

  @Override
  public String toString() {
    return name + "=" + type.name().toLowerCase() + "(" + input + ")";
  }
}
