/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import java.util.Iterator;
import org.dataframe.engine.planner.physical.step.ExecutionStep;

/** Emits precomputed steps. Never waits. */
public class StepIteratorPlan extends AbstractPhysicalPlan {

  private final Iterator<? extends ExecutionStep> steps;

  public StepIteratorPlan(Iterator<? extends ExecutionStep> steps) {
    this.steps = steps;
  }

  @Override
  protected ExecutionStep computeNext() {
    return steps.hasNext() ? steps.next() : finish();
  }
}
