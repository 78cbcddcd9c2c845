/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import com.google.common.collect.Iterators;
import java.util.List;
import java.util.function.IntFunction;
import lombok.experimental.UtilityClass;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.expression.SortKey;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.Instruction;
import org.dataframe.engine.planner.physical.instruction.LocalLimit;
import org.dataframe.engine.planner.physical.instruction.WriteFile;
import org.dataframe.engine.planner.physical.step.PartitionMetadata;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;
import org.dataframe.engine.storage.FileScanInfo;
import org.dataframe.engine.storage.FileWriteInfo;

/** Factory of physical plan combinators. Every call returns a new plan owning its children. */
@UtilityClass
public class PhysicalPlans {

  /** One step per partition, in order, with no instruction attached. */
  public static PhysicalPlan partitionRead(List<Page> partitions) {
    return new StepIteratorPlan(
        Iterators.transform(
            partitions.iterator(),
            partition -> PartitionTaskBuilder.of(partition, PartitionMetadata.from(partition))));
  }

  public static PhysicalPlan fileRead(PhysicalPlan child, FileScanInfo scanInfo) {
    return new FileReadPlan(child, scanInfo);
  }

  /** Writes every partition; partitions are numbered in emission order. */
  public static PhysicalPlan fileWrite(
      PhysicalPlan child, FileWriteInfo writeInfo, ResourceRequest resourceRequest) {
    return new PipelineInstructionPlan(
        child, partitionIndex -> new WriteFile(partitionIndex, writeInfo), resourceRequest);
  }

  public static PhysicalPlan pipelineInstruction(
      PhysicalPlan child, Instruction instruction, ResourceRequest resourceRequest) {
    return new PipelineInstructionPlan(child, partitionIndex -> instruction, resourceRequest);
  }

  /** Appends a per-partition instruction; partitions are numbered in emission order. */
  public static PhysicalPlan pipelineInstruction(
      PhysicalPlan child,
      IntFunction<Instruction> instructionFactory,
      ResourceRequest resourceRequest) {
    return new PipelineInstructionPlan(child, instructionFactory, resourceRequest);
  }

  public static PhysicalPlan localLimit(PhysicalPlan child, long limit) {
    LocalLimit localLimit = new LocalLimit(limit);
    return new PipelineInstructionPlan(
        child, partitionIndex -> localLimit, ResourceRequest.none());
  }

  /** A limit over all partitions. Each partition is limited locally first. */
  public static PhysicalPlan globalLimit(PhysicalPlan child, long limit, int numPartitions) {
    return new GlobalLimitPlan(localLimit(child, limit), limit, numPartitions);
  }

  public static PhysicalPlan reduce(
      PhysicalPlan fanoutPlan, int numOutputs, Instruction reduceInstruction) {
    return new ReducePlan(fanoutPlan, numOutputs, reduceInstruction, ResourceRequest.none());
  }

  public static PhysicalPlan sort(
      PhysicalPlan child,
      List<SortKey> sortBy,
      int numPartitions,
      int sampleSize,
      ResourceRequest resourceRequest) {
    return new SortPlan(child, sortBy, numPartitions, sampleSize, resourceRequest);
  }

  public static PhysicalPlan coalesce(PhysicalPlan child, int fromPartitions, int toPartitions) {
    return new CoalescePlan(child, fromPartitions, toPartitions);
  }

  public static PhysicalPlan join(
      PhysicalPlan left,
      PhysicalPlan right,
      Instruction joinInstruction,
      ResourceRequest resourceRequest) {
    return new JoinPlan(left, right, joinInstruction, resourceRequest);
  }

  public static MaterializingPhysicalPlan materialize(PhysicalPlan plan) {
    return new MaterializingPhysicalPlan(plan);
  }
}
