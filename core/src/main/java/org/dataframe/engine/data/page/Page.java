/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.data.page;

/**
 * A partition of rows. The planner treats pages as opaque handles: it only moves them between
 * steps, while instructions read and build them. Values are addressed by row position and column
 * channel.
 */
public interface Page {

  /** Returns the number of rows in this page. */
  int getPositionCount();

  /** Returns the number of columns in this page. */
  int getChannelCount();

  /**
   * Returns the value at the given row and column position.
   *
   * @param position the row index (0-based)
   * @param channel the column index (0-based)
   * @return the value, or null if the cell is null
   */
  Object getValue(int position, int channel);

  /**
   * Returns a sub-region of this page.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new Page representing the sub-region
   */
  Page getRegion(int positionOffset, int length);

  /** Returns a copy of the row at the given position. */
  default Object[] getRow(int position) {
    Object[] row = new Object[getChannelCount()];
    for (int channel = 0; channel < row.length; channel++) {
      row[channel] = getValue(position, channel);
    }
    return row;
  }

  /**
   * Returns the estimated memory retained by this page in bytes. Default implementation estimates
   * based on position count, channel count, and 8 bytes per value.
   */
  default long getRetainedSizeBytes() {
    return (long) getPositionCount() * getChannelCount() * 8L;
  }

  /** Returns an empty page with zero rows and the given number of columns. */
  static Page empty(int channelCount) {
    return new RowPage(new Object[0][channelCount], channelCount);
  }
}
