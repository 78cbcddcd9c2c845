/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.PageBuilder;
import org.dataframe.engine.executor.PartitionTaskExecutor;
import org.dataframe.engine.planner.physical.step.ExecutionStep;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;

/**
 * Drives a plan on the test thread. Every materialization request is executed as soon as it is
 * emitted, so a plan under test is never left waiting.
 */
class PlanDriver {

  private static final PartitionTaskExecutor EXECUTOR = new PartitionTaskExecutor();

  /** Materialization requests in emission order. */
  @Getter private final List<PartitionTask> requests = new ArrayList<>();

  /** Polls the plan until it finishes and returns its pipeable output steps. */
  List<PartitionTaskBuilder> drain(PhysicalPlan plan) {
    List<PartitionTaskBuilder> outputs = new ArrayList<>();
    while (true) {
      ExecutionStep step = plan.poll();
      if (step == null) {
        assertTrue(plan.isFinished(), "plan waits although every request is materialized");
        return outputs;
      }
      if (step instanceof PartitionTask) {
        PartitionTask request = (PartitionTask) step;
        materialize(request);
        requests.add(request);
      } else {
        outputs.add((PartitionTaskBuilder) step);
      }
    }
  }

  /** Drains the plan and executes its output steps. */
  List<Page> run(PhysicalPlan plan) {
    List<Page> partitions = new ArrayList<>();
    drain(plan).forEach(step -> partitions.add(execute(step)));
    return partitions;
  }

  static void materialize(PartitionTask task) {
    task.setResults(EXECUTOR.execute(task));
  }

  static Page execute(PartitionTaskBuilder step) {
    PartitionTask task = step.finalizePartitionTask();
    materialize(task);
    return task.getPartition();
  }

  /** A one-channel partition holding the integers {@code from} to {@code to}. */
  static Page sequence(int from, int to) {
    PageBuilder builder = new PageBuilder(1);
    for (int value = from; value <= to; value++) {
      builder.appendRow(value);
    }
    return builder.build();
  }

  /** Plan wrapper that counts the pipeable steps pulled from its child. */
  static class CountingPlan implements PhysicalPlan {

    private final PhysicalPlan child;

    @Getter private int pulled;

    CountingPlan(PhysicalPlan child) {
      this.child = child;
    }

    @Override
    public ExecutionStep poll() {
      ExecutionStep step = child.poll();
      if (step instanceof PartitionTaskBuilder) {
        pulled++;
      }
      return step;
    }

    @Override
    public boolean isFinished() {
      return child.isFinished();
    }
  }
}
