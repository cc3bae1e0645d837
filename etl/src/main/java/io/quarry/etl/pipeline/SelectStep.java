/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.quarry.etl.pipeline;

import io.quarry.etl.table.ColumnarTable;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Keeps selected columns and rows of a TABLE container.
 *
 * <p>Rows are filtered before columns are selected, so the filter sees every
 * column of the input.
 */
public class SelectStep implements PipelineStep {

  private final @Nullable List<String> columns;
  private final @Nullable Predicate<Map<String, Object>> rowFilter;

  /**
   * Creates a select step.
   *
   * @param columns Columns to keep in order, or null to keep all
   * @param rowFilter Rows to keep, or null to keep all
   */
  public SelectStep(@Nullable List<String> columns,
      @Nullable Predicate<Map<String, Object>> rowFilter) {
    this.columns = columns == null
        ? null : Collections.unmodifiableList(new ArrayList<String>(columns));
    this.rowFilter = rowFilter;
  }

  public static SelectStep columns(List<String> columns) {
    return new SelectStep(columns, null);
  }

  public static SelectStep rows(Predicate<Map<String, Object>> rowFilter) {
    return new SelectStep(null, rowFilter);
  }

  public @Nullable List<String> getColumns() {
    return columns;
  }

  @Override public DataContainer execute(DataContainer input, boolean forceRecompute) {
    if (!input.isTable()) {
      throw new IllegalArgumentException("Select step requires a TABLE container, got "
          + input.getKind());
    }
    ColumnarTable table = input.getTable();
    if (rowFilter != null) {
      boolean[] mask = new boolean[table.getRowCount()];
      for (int i = 0; i < mask.length; i++) {
        mask[i] = rowFilter.test(table.getRow(i));
      }
      table = table.selectRows(mask);
    }
    if (columns != null) {
      table = table.selectColumns(columns);
    }
    return DataContainer.ofTable(table);
  }

  @Override public String getName() {
    return "select";
  }
}
