/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.expression.Expression;

/** Routes each row by the hash of its partition-by values, so equal keys meet in one shard. */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class FanoutHash extends FanoutInstruction {

  private final List<Expression> partitionBy;

  public FanoutHash(int numOutputs, List<Expression> partitionBy) {
    super(numOutputs);
    checkArgument(!partitionBy.isEmpty(), "FanoutHash needs at least one partition-by expression");
    this.partitionBy = ImmutableList.copyOf(partitionBy);
  }

  @Override
  public List<Page> run(List<Page> inputs) {
    checkArgument(inputs.size() == 1, "FanoutHash expects one input but got %s", inputs.size());
    Page source = inputs.get(0);
    return split(
        source,
        position ->
            Math.floorMod(Keys.extract(partitionBy, source, position).hashCode(), getNumOutputs()));
  }
}
