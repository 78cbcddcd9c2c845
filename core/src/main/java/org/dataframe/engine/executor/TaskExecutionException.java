/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.executor;

import lombok.Getter;
import org.dataframe.engine.exception.QueryEngineException;

/** A partition task failed while it was executed. */
public class TaskExecutionException extends QueryEngineException {

  @Getter private final String taskId;

  public TaskExecutionException(String taskId, Throwable cause) {
    super("Task " + taskId + " failed: " + cause.getMessage(), cause);
    this.taskId = taskId;
  }
}
