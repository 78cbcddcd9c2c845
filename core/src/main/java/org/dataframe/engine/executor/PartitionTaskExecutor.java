/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.executor;

import static com.google.common.base.Preconditions.checkState;

import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.physical.instruction.Instruction;
import org.dataframe.engine.planner.physical.step.MaterializedResult;
import org.dataframe.engine.planner.physical.step.PartitionTask;

/** Runs the instructions of a partition task over its inputs. Thread safe. */
@Log4j2
public class PartitionTaskExecutor {

  /**
   * Executes a task.
   *
   * @return one result per task output, with exact metadata
   * @throws IllegalStateException if the instructions produce a different number of outputs than
   *     the task expects
   */
  public List<MaterializedResult> execute(PartitionTask task) {
    List<Page> partitions = task.getInputs();
    for (Instruction instruction : task.getInstructionList()) {
      partitions = instruction.run(partitions);
    }
    checkState(
        partitions.size() == task.getNumResults(),
        "Task %s produced %s partitions, expected %s",
        task.getTaskId(),
        partitions.size(),
        task.getNumResults());
    log.debug("Executed {}", task);
    return partitions.stream().map(MaterializedResult::of).collect(Collectors.toList());
  }
}
