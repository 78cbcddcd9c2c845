/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.data.page;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PageBuilderTest {

  @Test
  void should_build_partition_cell_by_cell() {
    PageBuilder builder = new PageBuilder(2);

    builder.beginRow();
    builder.setValue(0, "s3://bucket/file-0.csv");
    builder.setValue(1, 1024L);
    builder.endRow();

    Page page = builder.build();
    assertEquals(1, page.getPositionCount());
    assertEquals(1024L, page.getValue(0, 1));
  }

  @Test
  void should_append_whole_rows() {
    Page source = RowPage.of(2, new Object[] {"a", 1}, new Object[] {"b", 2});
    PageBuilder builder = new PageBuilder(2);

    builder.appendRow("z", 0).appendRow(source, 1);

    assertEquals(RowPage.of(2, new Object[] {"z", 0}, new Object[] {"b", 2}), builder.build());
  }

  @Test
  void should_reset_after_build() {
    PageBuilder builder = new PageBuilder(1);
    builder.appendRow("test");

    assertEquals(1, builder.build().getPositionCount());
    assertTrue(builder.isEmpty());
    assertEquals(0, builder.getRowCount());
  }

  @Test
  void should_reject_row_of_wrong_width() {
    PageBuilder builder = new PageBuilder(2);

    assertThrows(IllegalArgumentException.class, () -> builder.appendRow("only-one"));
  }

  @Test
  void should_reject_append_during_row() {
    PageBuilder builder = new PageBuilder(1);
    builder.beginRow();

    assertThrows(IllegalStateException.class, () -> builder.appendRow("value"));
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void should_throw_on_set_before_begin() {
    PageBuilder builder = new PageBuilder(2);
    assertThrows(IllegalStateException.class, () -> builder.setValue(0, "value"));
  }

  @Test
  void should_throw_on_invalid_channel() {
    PageBuilder builder = new PageBuilder(2);
    builder.beginRow();
    assertThrows(IndexOutOfBoundsException.class, () -> builder.setValue(2, "value"));
  }
}
