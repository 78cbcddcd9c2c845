/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.instruction;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.PageBuilder;
import org.dataframe.engine.expression.NamedExpression;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;

/** Evaluates one output column per projected expression. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class Project extends SingleInputInstruction {

  private final List<NamedExpression> projectList;

  public Project(List<NamedExpression> projectList) {
    this.projectList = ImmutableList.copyOf(projectList);
  }

  @Override
  protected Page run(Page input) {
    PageBuilder builder = new PageBuilder(projectList.size());
    for (int position = 0; position < input.getPositionCount(); position++) {
      builder.beginRow();
      for (int channel = 0; channel < projectList.size(); channel++) {
        builder.setValue(channel, projectList.get(channel).valueOf(input, position));
      }
      builder.endRow();
    }
    return builder.build();
  }

  @Override
  protected PartitionMetadata runPartialMetadata(PartitionMetadata input) {
    return input.withUnknownSize();
  }
}
