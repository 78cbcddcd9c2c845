/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.expression.function.MapPartitionFunction;

/** Applies a user function to the whole partition. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public class MapPartition extends SingleInputInstruction {

  private final MapPartitionFunction function;

  @Override
  protected Page run(Page input) {
    return function.apply(input);
  }
}
