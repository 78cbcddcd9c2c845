/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import org.dataframe.engine.planner.physical.step.ExecutionStep;

/** Base class of plans. Subclasses compute the next step and call {@link #finish()} when done. */
public abstract class AbstractPhysicalPlan implements PhysicalPlan {

  private boolean finished;

  @Override
  public final ExecutionStep poll() {
    if (finished) {
      return null;
    }
    return computeNext();
  }

  @Override
  public final boolean isFinished() {
    return finished;
  }

  /** Returns the next step, or null if not ready. Only called while the plan is not finished. */
  protected abstract ExecutionStep computeNext();

  /** Marks the plan as exhausted. Returns null so callers can {@code return finish();}. */
  protected ExecutionStep finish() {
    finished = true;
    return null;
  }
}
