/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.storage.FileWriteInfo;

/** Writes every partition as a file. Each output partition holds the written file's path. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalFileWrite extends LogicalUnaryPlan {

  private final FileWriteInfo writeInfo;

  public LogicalFileWrite(
      LogicalPlan child, FileWriteInfo writeInfo, ResourceRequest resourceRequest) {
    super(child, resourceRequest);
    this.writeInfo = writeInfo;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFileWrite(this, context);
  }
}
