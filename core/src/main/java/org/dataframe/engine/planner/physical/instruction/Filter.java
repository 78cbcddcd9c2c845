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
import org.dataframe.engine.data.page.PageBuilder;
import org.dataframe.engine.expression.Expression;

/** Keeps the rows for which the predicate evaluates to true. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public class Filter extends SingleInputInstruction {

  private final Expression predicate;

  @Override
  protected Page run(Page input) {
    PageBuilder builder = new PageBuilder(input.getChannelCount());
    for (int position = 0; position < input.getPositionCount(); position++) {
      if (Boolean.TRUE.equals(predicate.valueOf(input, position))) {
        builder.appendRow(input, position);
      }
    }
    return builder.build();
  }
}
