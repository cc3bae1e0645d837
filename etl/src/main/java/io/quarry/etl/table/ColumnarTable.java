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
package io.quarry.etl.table;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable in-memory table made of named, typed columns of equal length.
 *
 * <p>Supports column selection by name and row selection by an index list
 * or a boolean mask. Selection returns a new table; the receiver is never
 * modified.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * ColumnarTable table = ColumnarTable.builder()
 *     .column("id", ColumnType.LONG)
 *     .column("name", ColumnType.STRING)
 *     .row(1L, "Alice")
 *     .row(2L, "Bob")
 *     .build();
 *
 * ColumnarTable names = table.selectColumns(Collections.singletonList("name"));
 * ColumnarTable first = table.selectRows(new int[] {0});
 * }</pre>
 */
public final class ColumnarTable {

  private static final ColumnarTable EMPTY =
      new ColumnarTable(Collections.<Column>emptyList());

  private final List<Column> columns;
  private final Map<String, Column> columnsByName;
  private final int rowCount;

  public ColumnarTable(List<Column> columns) {
    Map<String, Column> byName = new LinkedHashMap<String, Column>();
    int rows = -1;
    for (Column column : columns) {
      if (byName.put(column.getName(), column) != null) {
        throw new IllegalArgumentException("Duplicate column: " + column.getName());
      }
      if (rows < 0) {
        rows = column.size();
      } else if (rows != column.size()) {
        throw new IllegalArgumentException("Column '" + column.getName() + "' has "
            + column.size() + " rows, expected " + rows);
      }
    }
    this.columns = Collections.unmodifiableList(new ArrayList<Column>(columns));
    this.columnsByName = Collections.unmodifiableMap(byName);
    this.rowCount = Math.max(rows, 0);
  }

  public static ColumnarTable empty() {
    return EMPTY;
  }

  public int getRowCount() {
    return rowCount;
  }

  public int getColumnCount() {
    return columns.size();
  }

  public List<Column> getColumns() {
    return columns;
  }

  public List<String> getColumnNames() {
    return new ArrayList<String>(columnsByName.keySet());
  }

  public boolean hasColumn(String name) {
    return columnsByName.containsKey(name);
  }

  /**
   * Returns the column with the given name.
   *
   * @throws IllegalArgumentException if there is no such column
   */
  public Column getColumn(String name) {
    Column column = columnsByName.get(name);
    if (column == null) {
      throw new IllegalArgumentException("Unknown column '" + name + "'; available: "
          + columnsByName.keySet());
    }
    return column;
  }

  /**
   * Returns one row as an ordered map of column name to value.
   */
  public Map<String, @Nullable Object> getRow(int row) {
    if (row < 0 || row >= rowCount) {
      throw new IndexOutOfBoundsException("Row " + row + " out of range [0, " + rowCount + ")");
    }
    Map<String, @Nullable Object> values = new LinkedHashMap<String, @Nullable Object>();
    for (Column column : columns) {
      values.put(column.getName(), column.get(row));
    }
    return values;
  }

  /**
   * Returns a table with only the named columns, in the requested order.
   */
  public ColumnarTable selectColumns(List<String> names) {
    List<Column> selected = new ArrayList<Column>(names.size());
    for (String name : names) {
      selected.add(getColumn(name));
    }
    return new ColumnarTable(selected);
  }

  /**
   * Returns a table without the named columns. Names that do not exist are ignored.
   */
  public ColumnarTable dropColumns(Collection<String> names) {
    Set<String> drop = new HashSet<String>(names);
    List<Column> kept = new ArrayList<Column>();
    for (Column column : columns) {
      if (!drop.contains(column.getName())) {
        kept.add(column);
      }
    }
    return new ColumnarTable(kept);
  }

  /**
   * Returns a table with the rows at the given indices, in the given order.
   */
  public ColumnarTable selectRows(int[] indices) {
    for (int index : indices) {
      if (index < 0 || index >= rowCount) {
        throw new IndexOutOfBoundsException("Row " + index + " out of range [0, "
            + rowCount + ")");
      }
    }
    List<Column> selected = new ArrayList<Column>(columns.size());
    for (Column column : columns) {
      List<@Nullable Object> values = new ArrayList<@Nullable Object>(indices.length);
      for (int index : indices) {
        values.add(column.get(index));
      }
      selected.add(new Column(column.getName(), column.getType(), values));
    }
    return new ColumnarTable(selected);
  }

  /**
   * Returns a table with the rows whose mask entry is true.
   *
   * @throws IllegalArgumentException if the mask length differs from the row count
   */
  public ColumnarTable selectRows(boolean[] mask) {
    if (mask.length != rowCount) {
      throw new IllegalArgumentException("Mask length " + mask.length
          + " does not match row count " + rowCount);
    }
    int count = 0;
    for (boolean keep : mask) {
      if (keep) {
        count++;
      }
    }
    int[] indices = new int[count];
    int next = 0;
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        indices[next++] = i;
      }
    }
    return selectRows(indices);
  }

  /**
   * Concatenates tables row-wise.
   *
   * <p>Columns appear in order of first appearance. A table lacking a column
   * contributes nulls for it. Columns whose types differ between tables are
   * widened with {@link ColumnType#widen}.
   */
  public static ColumnarTable union(List<ColumnarTable> tables) {
    if (tables.isEmpty()) {
      return EMPTY;
    }
    if (tables.size() == 1) {
      return tables.get(0);
    }
    Map<String, ColumnType> types = new LinkedHashMap<String, ColumnType>();
    for (ColumnarTable table : tables) {
      for (Column column : table.columns) {
        ColumnType existing = types.get(column.getName());
        types.put(column.getName(),
            existing == null ? column.getType() : ColumnType.widen(existing, column.getType()));
      }
    }
    List<Column> merged = new ArrayList<Column>(types.size());
    for (Map.Entry<String, ColumnType> entry : types.entrySet()) {
      List<@Nullable Object> values = new ArrayList<@Nullable Object>();
      for (ColumnarTable table : tables) {
        Column column = table.columnsByName.get(entry.getKey());
        if (column == null) {
          for (int i = 0; i < table.rowCount; i++) {
            values.add(null);
          }
        } else {
          values.addAll(column.widenTo(entry.getValue()).getValues());
        }
      }
      merged.add(new Column(entry.getKey(), entry.getValue(), values));
    }
    return new ColumnarTable(merged);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnarTable)) {
      return false;
    }
    return columns.equals(((ColumnarTable) o).columns);
  }

  @Override public int hashCode() {
    return columns.hashCode();
  }

  @Override public String toString() {
    return "ColumnarTable{rows=" + rowCount + ", columns=" + columnsByName.keySet() + "}";
  }

  /**
   * Row-wise builder for small tables.
   */
  public static class Builder {
    private final List<String> names = new ArrayList<String>();
    private final List<ColumnType> types = new ArrayList<ColumnType>();
    private final List<List<@Nullable Object>> values = new ArrayList<List<@Nullable Object>>();

    public Builder column(String name, ColumnType type) {
      names.add(name);
      types.add(type);
      values.add(new ArrayList<@Nullable Object>());
      return this;
    }

    public Builder row(@Nullable Object... row) {
      if (row.length != names.size()) {
        throw new IllegalArgumentException("Row has " + row.length + " values, expected "
            + names.size());
      }
      for (int i = 0; i < row.length; i++) {
        values.get(i).add(row[i]);
      }
      return this;
    }

    public ColumnarTable build() {
      List<Column> columns = new ArrayList<Column>(names.size());
      for (int i = 0; i < names.size(); i++) {
        columns.add(new Column(names.get(i), types.get(i), values.get(i)));
      }
      return new ColumnarTable(columns);
    }
  }
}
