/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.data.page;

import java.util.List;

/** Static helpers over {@link Page}s. */
public final class Pages {

  private Pages() {}

  /**
   * Concatenates pages in order. Pages with no rows are skipped, so an empty page of another
   * width does not conflict with the others.
   *
   * @throws IllegalArgumentException if non-empty pages disagree on the channel count
   */
  public static Page concat(List<Page> pages) {
    int channelCount = -1;
    for (Page page : pages) {
      if (page.getPositionCount() == 0) {
        continue;
      }
      if (channelCount == -1) {
        channelCount = page.getChannelCount();
      } else if (channelCount != page.getChannelCount()) {
        throw new IllegalArgumentException(
            "Cannot concat pages with " + channelCount + " and " + page.getChannelCount()
                + " channels");
      }
    }
    if (channelCount == -1) {
      return pages.isEmpty() ? Page.empty(0) : Page.empty(pages.get(0).getChannelCount());
    }
    PageBuilder builder = new PageBuilder(channelCount);
    for (Page page : pages) {
      for (int position = 0; position < page.getPositionCount(); position++) {
        builder.appendRow(page, position);
      }
    }
    return builder.build();
  }
}
