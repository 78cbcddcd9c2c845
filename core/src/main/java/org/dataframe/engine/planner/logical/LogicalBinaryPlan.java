/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import org.dataframe.engine.planner.ResourceRequest;

/** A node with a left and a right input. */
@EqualsAndHashCode(callSuper = true)
public abstract class LogicalBinaryPlan extends LogicalPlan {

  protected LogicalBinaryPlan(
      LogicalPlan left, LogicalPlan right, ResourceRequest resourceRequest) {
    super(ImmutableList.of(left, right), resourceRequest);
  }

  public LogicalPlan getLeft() {
    return getChild().get(0);
  }

  public LogicalPlan getRight() {
    return getChild().get(1);
  }
}
