/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import org.dataframe.engine.planner.ResourceRequest;

/** A node with one input. It produces as many partitions as its input unless it says otherwise. */
@EqualsAndHashCode(callSuper = true)
public abstract class LogicalUnaryPlan extends LogicalPlan {

  protected LogicalUnaryPlan(LogicalPlan input, ResourceRequest resourceRequest) {
    super(ImmutableList.of(input), resourceRequest);
  }

  public LogicalPlan getInput() {
    return getChild().get(0);
  }

  @Override
  public int getNumPartitions() {
    return getInput().getNumPartitions();
  }
}
