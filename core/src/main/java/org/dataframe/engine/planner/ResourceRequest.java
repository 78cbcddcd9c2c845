/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Compute resources a step asks the scheduler for. Every hint is optional; a null hint means the
 * scheduler's default applies.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class ResourceRequest {

  private static final ResourceRequest NONE = new ResourceRequest(null, null, null);

  private final Double numCpus;

  private final Double numGpus;

  private final Long memoryBytes;

  /** A request without any hint. */
  public static ResourceRequest none() {
    return NONE;
  }

  public static ResourceRequest ofCpus(double numCpus) {
    return new ResourceRequest(numCpus, null, null);
  }

  public static ResourceRequest ofGpus(double numGpus) {
    return new ResourceRequest(null, numGpus, null);
  }

  public static ResourceRequest ofMemory(long memoryBytes) {
    return new ResourceRequest(null, null, memoryBytes);
  }

  /** Field-wise maximum of two requests; a hint present on only one side is kept. */
  public static ResourceRequest max(ResourceRequest left, ResourceRequest right) {
    return new ResourceRequest(
        maxOf(left.numCpus, right.numCpus),
        maxOf(left.numGpus, right.numGpus),
        maxOf(left.memoryBytes, right.memoryBytes));
  }

  private static <T extends Comparable<T>> T maxOf(T left, T right) {
    if (left == null) {
      return right;
    }
    if (right == null) {
      return left;
    }
    return left.compareTo(right) >= 0 ? left : right;
  }
}
