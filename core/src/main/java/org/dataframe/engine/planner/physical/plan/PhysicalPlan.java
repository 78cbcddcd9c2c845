/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import org.dataframe.engine.planner.physical.step.ExecutionStep;

/**
 * A lazily produced sequence of execution steps. Plans are pulled by a single consumer, usually a
 * scheduler that dispatches the steps to workers.
 *
 * <p>Lifecycle:
 *
 * <ol>
 *   <li>The consumer calls {@link #poll()} to get the next step
 *   <li>A null return with {@link #isFinished()} false means not ready: the plan waits for
 *       materialization requests it emitted earlier, and the consumer polls again once some of them
 *       are done
 *   <li>A null return with {@link #isFinished()} true means the plan is exhausted
 * </ol>
 */
public interface PhysicalPlan {

  /**
   * Returns the next step, or null if no step can be produced now. A null return does not mean the
   * plan is finished, call {@link #isFinished()} to check.
   */
  ExecutionStep poll();

  /** Returns true once the plan has produced all its steps. A finished plan polls null. */
  boolean isFinished();
}
