/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner;

import java.util.Map;
import org.dataframe.engine.planner.logical.LogicalPlan;
import org.dataframe.engine.planner.physical.plan.MaterializingPhysicalPlan;
import org.dataframe.engine.planner.physical.plan.PhysicalPlan;
import org.dataframe.engine.planner.physical.plan.PhysicalPlans;
import org.dataframe.engine.storage.PartitionSet;

/**
 * Lowers a logical plan into a physical plan: a lazily produced sequence of per-partition
 * execution steps.
 */
public interface PhysicalPlanner {

  /**
   * Translates a logical plan tree.
   *
   * @param plan root of the logical plan
   * @param partitionSets cached partition sets by key, read by in-memory scans
   * @return a new physical plan; translating the same tree twice yields independent plans
   */
  PhysicalPlan translate(LogicalPlan plan, Map<String, PartitionSet> partitionSets);

  /** Translates a logical plan and requests materialization of every output partition. */
  default MaterializingPhysicalPlan translateMaterialized(
      LogicalPlan plan, Map<String, PartitionSet> partitionSets) {
    return PhysicalPlans.materialize(translate(plan, partitionSets));
  }
}
