/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.expression.SortKey;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.FanoutRange;
import org.dataframe.engine.planner.physical.instruction.ReduceMergeAndSort;
import org.dataframe.engine.planner.physical.instruction.ReduceToQuantiles;
import org.dataframe.engine.planner.physical.instruction.Sample;
import org.dataframe.engine.planner.physical.step.ExecutionStep;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;

/**
 * Distributed sort into {@code numPartitions} ranges. The child's partitions are materialized and
 * sampled, the samples are reduced to range boundaries, then every partition is split by range and
 * each range is merged and sorted.
 */
@Log4j2
public class SortPlan extends AbstractPhysicalPlan {

  private enum Phase {
    SAMPLE,
    QUANTILES,
    RANGE_FANOUT,
    REDUCE
  }

  private final PhysicalPlan child;

  private final List<SortKey> sortBy;

  private final int numPartitions;

  private final int sampleSize;

  private final ResourceRequest resourceRequest;

  private final List<PartitionTask> sources = new ArrayList<>();

  private final List<PartitionTask> samples = new ArrayList<>();

  private Phase phase = Phase.SAMPLE;

  private boolean childFinished;

  private PartitionTask boundaries;

  private PhysicalPlan reducePlan;

  public SortPlan(
      PhysicalPlan child,
      List<SortKey> sortBy,
      int numPartitions,
      int sampleSize,
      ResourceRequest resourceRequest) {
    this.child = child;
    this.sortBy = ImmutableList.copyOf(sortBy);
    this.numPartitions = numPartitions;
    this.sampleSize = sampleSize;
    this.resourceRequest = resourceRequest;
  }

  @Override
  protected ExecutionStep computeNext() {
    while (true) {
      switch (phase) {
        case SAMPLE:
          ExecutionStep step = nextSampleStep();
          if (step != null || phase == Phase.SAMPLE) {
            return step;
          }
          break;
        case QUANTILES:
          if (sources.isEmpty()) {
            startReduce(List.of());
            break;
          }
          if (!samples.stream().allMatch(PartitionTask::isDone)) {
            return null;
          }
          boundaries = quantilesStep();
          phase = Phase.RANGE_FANOUT;
          return boundaries;
        case RANGE_FANOUT:
          if (!boundaries.isDone()) {
            return null;
          }
          log.debug("Sort boundaries computed by {}", boundaries.getTaskId());
          startReduce(rangeFanoutSteps());
          break;
        case REDUCE:
          ExecutionStep reduceStep = reducePlan.poll();
          if (reduceStep == null && reducePlan.isFinished()) {
            return finish();
          }
          return reduceStep;
        default:
          throw new IllegalStateException("Unknown sort phase " + phase);
      }
    }
  }

  /** Materializes the child's partitions and samples each once it is done, in order. */
  private ExecutionStep nextSampleStep() {
    while (true) {
      if (samples.size() < sources.size() && sources.get(samples.size()).isDone()) {
        PartitionTask source = sources.get(samples.size());
        PartitionTask sample =
            PartitionTaskBuilder.of(source.getPartition(), source.getPartitionMetadata())
                .addInstruction(new Sample(sortBy, sampleSize), ResourceRequest.none())
                .finalizePartitionTask();
        samples.add(sample);
        return sample;
      }
      if (childFinished) {
        if (samples.size() == sources.size()) {
          phase = Phase.QUANTILES;
        }
        return null;
      }
      ExecutionStep step = child.poll();
      if (step == null) {
        if (!child.isFinished()) {
          return null;
        }
        childFinished = true;
        continue;
      }
      if (step instanceof PartitionTaskBuilder) {
        PartitionTask source = ((PartitionTaskBuilder) step).finalizePartitionTask();
        sources.add(source);
        return source;
      }
      return step;
    }
  }

  private void startReduce(List<ExecutionStep> fanoutSteps) {
    reducePlan =
        new ReducePlan(
            new StepIteratorPlan(fanoutSteps.iterator()),
            numPartitions,
            new ReduceMergeAndSort(sortBy),
            ResourceRequest.none());
    phase = Phase.REDUCE;
  }

  private PartitionTask quantilesStep() {
    List<Page> inputs = new ArrayList<>();
    List<PartitionMetadata> metadatas = new ArrayList<>();
    for (PartitionTask sample : samples) {
      inputs.add(sample.getPartition());
      metadatas.add(sample.getPartitionMetadata());
    }
    return new PartitionTaskBuilder(inputs, metadatas)
        .addInstruction(new ReduceToQuantiles(numPartitions, sortBy), resourceRequest)
        .finalizePartitionTask();
  }

  private List<ExecutionStep> rangeFanoutSteps() {
    ImmutableList.Builder<ExecutionStep> steps = ImmutableList.builder();
    for (PartitionTask source : sources) {
      steps.add(
          new PartitionTaskBuilder(
                  List.of(boundaries.getPartition(), source.getPartition()),
                  List.of(boundaries.getPartitionMetadata(), source.getPartitionMetadata()))
              .addInstruction(new FanoutRange(numPartitions, sortBy), resourceRequest));
    }
    return steps.build();
  }
}
