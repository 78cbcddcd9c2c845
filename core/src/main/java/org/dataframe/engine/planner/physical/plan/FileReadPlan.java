/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.plan;

import java.util.ArrayDeque;
import java.util.Deque;
import lombok.extern.log4j.Log4j2;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.ReadFile;
import org.dataframe.engine.planner.physical.step.ExecutionStep;
import org.dataframe.engine.planner.physical.step.PartitionTask;
import org.dataframe.engine.planner.physical.step.PartitionTaskBuilder;
import org.dataframe.engine.storage.FileInfos;
import org.dataframe.engine.storage.FileInfos.FileInfo;
import org.dataframe.engine.storage.FileScanInfo;

/**
 * Reads tabular files. The child produces file listing partitions; each is materialized, then
 * every file it lists becomes one read step asking for as much memory as the file's size.
 */
@Log4j2
public class FileReadPlan extends AbstractPhysicalPlan {

  private final PhysicalPlan child;

  private final FileScanInfo scanInfo;

  private final Deque<PartitionTask> listings = new ArrayDeque<>();

  private final Deque<ExecutionStep> readSteps = new ArrayDeque<>();

  private boolean childFinished;

  public FileReadPlan(PhysicalPlan child, FileScanInfo scanInfo) {
    this.child = child;
    this.scanInfo = scanInfo;
  }

  @Override
  protected ExecutionStep computeNext() {
    while (true) {
      while (readSteps.isEmpty() && !listings.isEmpty() && listings.peek().isDone()) {
        expand(listings.poll());
      }
      if (!readSteps.isEmpty()) {
        return readSteps.poll();
      }
      if (childFinished) {
        return listings.isEmpty() ? finish() : null;
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
        PartitionTask listing = ((PartitionTaskBuilder) step).finalizePartitionTask();
        listings.add(listing);
        return listing;
      }
      return step;
    }
  }

  private void expand(PartitionTask listing) {
    Page files = listing.getPartition();
    log.debug("Listing {} resolved to {} files", listing.getTaskId(), files.getPositionCount());
    for (int index = 0; index < files.getPositionCount(); index++) {
      FileInfo file = FileInfos.get(files, index);
      readSteps.add(
          PartitionTaskBuilder.of(files, listing.getPartitionMetadata())
              .addInstruction(
                  new ReadFile(index, file.numRows(), scanInfo),
                  ResourceRequest.ofMemory(file.sizeBytes())));
    }
  }
}
