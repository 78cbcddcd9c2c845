/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.dataframe.engine.common.setting.Settings;
import org.dataframe.engine.exception.PartitionSetNotFoundException;
import org.dataframe.engine.exception.UnsupportedPlanException;
import org.dataframe.engine.planner.logical.LogicalCoalesce;
import org.dataframe.engine.planner.logical.LogicalFileWrite;
import org.dataframe.engine.planner.logical.LogicalFilter;
import org.dataframe.engine.planner.logical.LogicalGlobalLimit;
import org.dataframe.engine.planner.logical.LogicalInMemoryScan;
import org.dataframe.engine.planner.logical.LogicalJoin;
import org.dataframe.engine.planner.logical.LogicalLocalAggregate;
import org.dataframe.engine.planner.logical.LogicalLocalDistinct;
import org.dataframe.engine.planner.logical.LogicalLocalLimit;
import org.dataframe.engine.planner.logical.LogicalMapPartition;
import org.dataframe.engine.planner.logical.LogicalPlan;
import org.dataframe.engine.planner.logical.LogicalPlanNodeVisitor;
import org.dataframe.engine.planner.logical.LogicalProjection;
import org.dataframe.engine.planner.logical.LogicalRepartition;
import org.dataframe.engine.planner.logical.LogicalSort;
import org.dataframe.engine.planner.logical.LogicalTabularFilesScan;
import org.dataframe.engine.planner.physical.instruction.Aggregate;
import org.dataframe.engine.planner.physical.instruction.FanoutHash;
import org.dataframe.engine.planner.physical.instruction.FanoutRandom;
import org.dataframe.engine.planner.physical.instruction.Filter;
import org.dataframe.engine.planner.physical.instruction.Instruction;
import org.dataframe.engine.planner.physical.instruction.Join;
import org.dataframe.engine.planner.physical.instruction.MapPartition;
import org.dataframe.engine.planner.physical.instruction.Project;
import org.dataframe.engine.planner.physical.instruction.ReduceMerge;
import org.dataframe.engine.planner.physical.plan.PhysicalPlan;
import org.dataframe.engine.planner.physical.plan.PhysicalPlans;
import org.dataframe.engine.storage.PartitionSet;

/**
 * Default {@link PhysicalPlanner}. Walks the logical tree bottom up: every node translates its
 * children first, then wraps their plans in the combinator that implements the node. Translation
 * either returns a complete plan or throws before any step is produced.
 */
@Log4j2
@RequiredArgsConstructor
public class PhysicalPlanTranslator
    extends LogicalPlanNodeVisitor<PhysicalPlan, Map<String, PartitionSet>>
    implements PhysicalPlanner {

  private final Settings settings;

  @Override
  public PhysicalPlan translate(LogicalPlan plan, Map<String, PartitionSet> partitionSets) {
    log.info("Translating logical plan {}", plan);
    return plan.accept(this, partitionSets);
  }

  @Override
  public PhysicalPlan visitNode(LogicalPlan plan, Map<String, PartitionSet> partitionSets) {
    throw new UnsupportedPlanException("Unsupported plan type " + plan);
  }

  @Override
  public PhysicalPlan visitInMemoryScan(
      LogicalInMemoryScan node, Map<String, PartitionSet> partitionSets) {
    PartitionSet partitionSet = partitionSets.get(node.getCacheKey());
    if (partitionSet == null) {
      throw new PartitionSetNotFoundException(node.getCacheKey());
    }
    checkArgument(
        partitionSet.getPartitions().size() == node.getNumPartitions(),
        "Scan of [%s] declares %s partitions but the partition set has %s",
        node.getCacheKey(),
        node.getNumPartitions(),
        partitionSet.getPartitions().size());
    log.debug("Scanning {}", partitionSet);
    return PhysicalPlans.partitionRead(partitionSet.getPartitions());
  }

  @Override
  public PhysicalPlan visitTabularFilesScan(
      LogicalTabularFilesScan node, Map<String, PartitionSet> partitionSets) {
    return PhysicalPlans.fileRead(visitInput(node.getInput(), partitionSets), node.getScanInfo());
  }

  @Override
  public PhysicalPlan visitFilter(LogicalFilter node, Map<String, PartitionSet> partitionSets) {
    return pipeline(node, new Filter(node.getCondition()), partitionSets);
  }

  @Override
  public PhysicalPlan visitProjection(
      LogicalProjection node, Map<String, PartitionSet> partitionSets) {
    return pipeline(node, new Project(node.getProjectList()), partitionSets);
  }

  @Override
  public PhysicalPlan visitMapPartition(
      LogicalMapPartition node, Map<String, PartitionSet> partitionSets) {
    return pipeline(node, new MapPartition(node.getFunction()), partitionSets);
  }

  @Override
  public PhysicalPlan visitLocalAggregate(
      LogicalLocalAggregate node, Map<String, PartitionSet> partitionSets) {
    return pipeline(
        node, new Aggregate(node.getAggregatorList(), node.getGroupByList()), partitionSets);
  }

  @Override
  public PhysicalPlan visitLocalDistinct(
      LogicalLocalDistinct node, Map<String, PartitionSet> partitionSets) {
    return pipeline(node, new Aggregate(List.of(), node.getGroupByList()), partitionSets);
  }

  @Override
  public PhysicalPlan visitFileWrite(
      LogicalFileWrite node, Map<String, PartitionSet> partitionSets) {
    return PhysicalPlans.fileWrite(
        visitInput(node.getInput(), partitionSets),
        node.getWriteInfo(),
        node.getResourceRequest());
  }

  @Override
  public PhysicalPlan visitLocalLimit(
      LogicalLocalLimit node, Map<String, PartitionSet> partitionSets) {
    return PhysicalPlans.localLimit(visitInput(node.getInput(), partitionSets), node.getLimit());
  }

  @Override
  public PhysicalPlan visitGlobalLimit(
      LogicalGlobalLimit node, Map<String, PartitionSet> partitionSets) {
    return PhysicalPlans.globalLimit(
        visitInput(node.getInput(), partitionSets), node.getLimit(), node.getNumPartitions());
  }

  @Override
  public PhysicalPlan visitRepartition(
      LogicalRepartition node, Map<String, PartitionSet> partitionSets) {
    IntFunction<Instruction> fanout;
    switch (node.getScheme()) {
      case RANDOM:
        long seed = settings.getLongValue(Settings.Key.REPARTITION_RANDOM_SEED);
        fanout = partitionIndex -> new FanoutRandom(node.getNumPartitions(), seed, partitionIndex);
        break;
      case HASH:
        FanoutHash fanoutHash = new FanoutHash(node.getNumPartitions(), node.getPartitionBy());
        fanout = partitionIndex -> fanoutHash;
        break;
      default:
        throw new UnsupportedPlanException(
            "Unimplemented partitioning scheme " + node.getScheme());
    }
    PhysicalPlan fanoutPlan =
        PhysicalPlans.pipelineInstruction(
            visitInput(node.getInput(), partitionSets), fanout, node.getResourceRequest());
    return PhysicalPlans.reduce(fanoutPlan, node.getNumPartitions(), new ReduceMerge());
  }

  @Override
  public PhysicalPlan visitSort(LogicalSort node, Map<String, PartitionSet> partitionSets) {
    return PhysicalPlans.sort(
        visitInput(node.getInput(), partitionSets),
        node.getSortList(),
        node.getNumPartitions(),
        settings.getIntValue(Settings.Key.SORT_SAMPLE_SIZE),
        node.getResourceRequest());
  }

  @Override
  public PhysicalPlan visitCoalesce(
      LogicalCoalesce node, Map<String, PartitionSet> partitionSets) {
    return PhysicalPlans.coalesce(
        visitInput(node.getInput(), partitionSets),
        node.getInput().getNumPartitions(),
        node.getNumPartitions());
  }

  @Override
  public PhysicalPlan visitJoin(LogicalJoin node, Map<String, PartitionSet> partitionSets) {
    PhysicalPlan left = visitInput(node.getLeft(), Collections.unmodifiableMap(partitionSets));
    PhysicalPlan right = visitInput(node.getRight(), Collections.unmodifiableMap(partitionSets));
    return PhysicalPlans.join(
        left,
        right,
        new Join(node.getLeftOn(), node.getRightOn(), node.getJoinType()),
        node.getResourceRequest());
  }

  private PhysicalPlan pipeline(
      LogicalPlan node, Instruction instruction, Map<String, PartitionSet> partitionSets) {
    return PhysicalPlans.pipelineInstruction(
        visitInput(node.getChild().get(0), partitionSets),
        instruction,
        node.getResourceRequest());
  }

  private PhysicalPlan visitInput(LogicalPlan input, Map<String, PartitionSet> partitionSets) {
    return input.accept(this, partitionSets);
  }
}
