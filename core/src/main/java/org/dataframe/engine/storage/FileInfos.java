/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.storage;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.dataframe.engine.data.page.Page;
import org.dataframe.engine.data.page.PageBuilder;

/**
 * Layout of a file listing partition. Each row describes one file: its path, its size in bytes,
 * and its row count when known (null otherwise).
 */
public final class FileInfos {

  public static final int PATH_CHANNEL = 0;
  public static final int SIZE_BYTES_CHANNEL = 1;
  public static final int NUM_ROWS_CHANNEL = 2;
  public static final int CHANNEL_COUNT = 3;

  private FileInfos() {}

  /** One file of a listing. */
  public record FileInfo(String path, long sizeBytes, Long numRows) {}

  public static Page of(List<FileInfo> files) {
    PageBuilder builder = new PageBuilder(CHANNEL_COUNT);
    for (FileInfo file : files) {
      builder.appendRow(file.path(), file.sizeBytes(), file.numRows());
    }
    return builder.build();
  }

  public static Page of(FileInfo... files) {
    return of(List.of(files));
  }

  public static FileInfo get(Page listing, int position) {
    Object numRows = listing.getValue(position, NUM_ROWS_CHANNEL);
    return new FileInfo(
        (String) listing.getValue(position, PATH_CHANNEL),
        ((Number) listing.getValue(position, SIZE_BYTES_CHANNEL)).longValue(),
        numRows == null ? null : ((Number) numRows).longValue());
  }

  public static List<FileInfo> read(Page listing) {
    ImmutableList.Builder<FileInfo> files = ImmutableList.builder();
    for (int position = 0; position < listing.getPositionCount(); position++) {
      files.add(get(listing, position));
    }
    return files.build();
  }
}
