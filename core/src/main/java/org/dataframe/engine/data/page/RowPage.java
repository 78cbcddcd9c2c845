/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.data.page;

import java.util.Arrays;

/**
 * Row-based {@link Page}. Each row is an Object array where the index corresponds to the column
 * (channel) position. Two row pages are equal when they hold equal rows.
 */
public class RowPage implements Page {

  private final Object[][] rows;
  private final int channelCount;

  /**
   * Creates a RowPage from pre-built row data.
   *
   * @param rows 2D array where rows[i][j] is the value at row i, column j
   * @param channelCount the number of columns
   */
  public RowPage(Object[][] rows, int channelCount) {
    this.rows = rows;
    this.channelCount = channelCount;
  }

  /** Creates a page from the given rows. All rows must have the same width. */
  public static RowPage of(int channelCount, Object[]... rows) {
    for (Object[] row : rows) {
      if (row.length != channelCount) {
        throw new IllegalArgumentException(
            "Row " + Arrays.toString(row) + " does not have " + channelCount + " channels");
      }
    }
    return new RowPage(rows.clone(), channelCount);
  }

  @Override
  public int getPositionCount() {
    return rows.length;
  }

  @Override
  public int getChannelCount() {
    return channelCount;
  }

  @Override
  public Object getValue(int position, int channel) {
    if (position < 0 || position >= rows.length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + rows.length + ")");
    }
    if (channel < 0 || channel >= channelCount) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + channelCount + ")");
    }
    return rows[position][channel];
  }

  @Override
  public Page getRegion(int positionOffset, int length) {
    if (positionOffset < 0 || length < 0 || positionOffset + length > rows.length) {
      throw new IndexOutOfBoundsException(
          "Region ["
              + positionOffset
              + ", "
              + (positionOffset + length)
              + ") out of range [0, "
              + rows.length
              + ")");
    }
    Object[][] region = Arrays.copyOfRange(rows, positionOffset, positionOffset + length);
    return new RowPage(region, channelCount);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RowPage)) {
      return false;
    }
    RowPage other = (RowPage) o;
    return channelCount == other.channelCount && Arrays.deepEquals(rows, other.rows);
  }

  @Override
  public int hashCode() {
    return 31 * channelCount + Arrays.deepHashCode(rows);
  }

  @Override
  public String toString() {
    return "RowPage{rows=" + rows.length + ", channels=" + channelCount + '}';
  }
}
