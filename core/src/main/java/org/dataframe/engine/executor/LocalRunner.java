/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.executor;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;
import org.dataframe.engine.common.setting.Settings;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.PhysicalPlanner;
import org.dataframe.engine.planner.logical.LogicalPlan;
import org.dataframe.engine.planner.physical.plan.MaterializingPhysicalPlan;
import org.dataframe.engine.planner.physical.step.MaterializedResult;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.storage.PartitionSet;

/**
 * Runs physical plans on a local thread pool. The calling thread drives the plan: it polls
 * materialization requests, submits them to the pool, and records finished results. Plans are
 * therefore only touched by the driving thread.
 */
@Log4j2
public class LocalRunner implements AutoCloseable {

  private final PhysicalPlanner planner;

  private final PartitionTaskExecutor taskExecutor;

  private final ExecutorService executorService;

  public LocalRunner(Settings settings, PhysicalPlanner planner) {
    this(
        planner,
        new PartitionTaskExecutor(),
        settings.getIntValue(Settings.Key.EXECUTOR_PARALLELISM));
  }

  LocalRunner(PhysicalPlanner planner, PartitionTaskExecutor taskExecutor, int parallelism) {
    this.planner = planner;
    this.taskExecutor = taskExecutor;
    this.executorService = Executors.newFixedThreadPool(parallelism);
  }

  /** Translates and runs a logical plan, returning its output partitions in order. */
  public List<Page> run(LogicalPlan plan, Map<String, PartitionSet> partitionSets) {
    return run(planner.translateMaterialized(plan, partitionSets));
  }

  /** Runs a plan to completion, returning its output partitions in order. */
  public List<Page> run(MaterializingPhysicalPlan plan) {
    Map<PartitionTask, CompletableFuture<List<MaterializedResult>>> inFlight =
        new LinkedHashMap<>();
    ImmutableList.Builder<Page> outputs = ImmutableList.builder();
    int numTasks = 0;
    try {
      while (true) {
        collectOutputs(plan, outputs);

        PartitionTask task = plan.poll();
        if (task != null) {
          inFlight.put(task, submit(task));
          numTasks++;
          continue;
        }
        if (harvestCompleted(inFlight)) {
          continue;
        }
        if (inFlight.isEmpty()) {
          if (plan.isFinished()) {
            break;
          }
          throw new IllegalStateException("Plan is not ready but has no task in flight");
        }
        awaitOldest(inFlight);
      }
    } finally {
      inFlight.values().forEach(future -> future.cancel(true));
    }

    collectOutputs(plan, outputs);
    if (plan.hasPendingResults()) {
      throw new IllegalStateException("Plan finished with output partitions still pending");
    }
    List<Page> result = outputs.build();
    log.info("Plan finished after {} tasks with {} output partitions", numTasks, result.size());
    return result;
  }

  private CompletableFuture<List<MaterializedResult>> submit(PartitionTask task) {
    log.debug("Submitting {}", task);
    return CompletableFuture.supplyAsync(() -> taskExecutor.execute(task), executorService);
  }

  /**
   * Records the results of finished tasks and drops cancelled ones.
   *
   * @return true if some result was recorded
   */
  private boolean harvestCompleted(
      Map<PartitionTask, CompletableFuture<List<MaterializedResult>>> inFlight) {
    Iterator<Map.Entry<PartitionTask, CompletableFuture<List<MaterializedResult>>>> it =
        inFlight.entrySet().iterator();
    boolean recorded = false;
    while (it.hasNext()) {
      Map.Entry<PartitionTask, CompletableFuture<List<MaterializedResult>>> entry = it.next();
      PartitionTask task = entry.getKey();
      if (task.isCancelled()) {
        log.warn("Task {} was cancelled while in flight", task.getTaskId());
        entry.getValue().cancel(true);
        it.remove();
      } else if (entry.getValue().isDone()) {
        record(task, entry.getValue());
        it.remove();
        recorded = true;
      }
    }
    return recorded;
  }

  private void awaitOldest(
      Map<PartitionTask, CompletableFuture<List<MaterializedResult>>> inFlight) {
    Map.Entry<PartitionTask, CompletableFuture<List<MaterializedResult>>> oldest =
        inFlight.entrySet().iterator().next();
    inFlight.remove(oldest.getKey());
    record(oldest.getKey(), oldest.getValue());
  }

  private void record(PartitionTask task, CompletableFuture<List<MaterializedResult>> future) {
    try {
      task.setResults(future.get());
    } catch (ExecutionException e) {
      throw new TaskExecutionException(task.getTaskId(), e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TaskExecutionException(task.getTaskId(), e);
    }
  }

  private void collectOutputs(MaterializingPhysicalPlan plan, ImmutableList.Builder<Page> outputs) {
    PartitionTask output;
    while ((output = plan.pollResult()) != null) {
      outputs.add(output.getPartition());
    }
  }

  @Override
  public void close() {
    executorService.shutdown();
    try {
      if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
        executorService.shutdownNow();
      }
    } catch (InterruptedException e) {
      executorService.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
