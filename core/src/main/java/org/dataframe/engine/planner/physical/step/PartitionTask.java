/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.step;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import lombok.Getter;
import org.dataframe.engine.data.page.Page;

/**
 * A materialization request: a finalized step whose outputs must be computed before the operator
 * that emitted it can continue. The runner fills in the results; operators poll {@link #isDone()}.
 *
 * <p>Results are written and read on the thread that drives the plan.
 */
public class PartitionTask extends ExecutionStep {

  private static final AtomicLong ID_GENERATOR = new AtomicLong();

  @Getter private final String taskId;

  @Getter private final int numResults;

  private List<MaterializedResult> results;

  @Getter private boolean cancelled;

  PartitionTask(
      List<Page> inputs,
      List<PartitionMetadata> partialMetadatas,
      List<PipelinedInstruction> instructions,
      int numResults) {
    super(inputs, partialMetadatas, instructions);
    this.taskId = "task-" + ID_GENERATOR.incrementAndGet();
    this.numResults = numResults;
  }

  public boolean isDone() {
    return results != null;
  }

  /** Records the computed outputs. Called once by the runner. */
  public void setResults(List<MaterializedResult> results) {
    checkState(this.results == null, "Results of %s are already set", taskId);
    checkArgument(
        results.size() == numResults,
        "Task %s expects %s results but got %s",
        taskId,
        numResults,
        results.size());
    this.results = ImmutableList.copyOf(results);
  }

  /** Tells the runner the outputs are no longer needed. */
  public void cancel() {
    this.cancelled = true;
  }

  public List<MaterializedResult> getResults() {
    checkState(isDone(), "Task %s is not done", taskId);
    return results;
  }

  /** Returns the only result of a single-output task. */
  public MaterializedResult getResult() {
    checkState(numResults == 1, "Task %s has %s results", taskId, numResults);
    return getResults().get(0);
  }

  public Page getPartition() {
    return getResult().partition();
  }

  public PartitionMetadata getPartitionMetadata() {
    return getResult().metadata();
  }

  public List<Page> getPartitions() {
    return getResults().stream().map(MaterializedResult::partition).collect(Collectors.toList());
  }

  public List<PartitionMetadata> getPartitionMetadatas() {
    return getResults().stream().map(MaterializedResult::metadata).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return "PartitionTask{id=" + taskId + ", " + describe() + ", done=" + isDone() + '}';
  }
}
