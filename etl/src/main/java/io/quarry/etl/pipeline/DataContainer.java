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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Data passed between pipeline steps.
 *
 * <p>A container holds exactly one of: a list of file paths, a
 * {@link ColumnarTable}, or nothing. Accessing a payload that is not held
 * is an {@link IllegalStateException}. Use {@link #accept(Visitor)} to
 * handle all kinds.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * String summary = container.accept(new DataContainer.Visitor<String>() {
 *   public String visitPaths(List<Path> paths) { return paths.size() + " files"; }
 *   public String visitTable(ColumnarTable table) { return table.getRowCount() + " rows"; }
 *   public String visitEmpty() { return "nothing"; }
 * });
 * }</pre>
 */
public final class DataContainer {

  private static final DataContainer EMPTY = new DataContainer(Kind.EMPTY, null, null);
  private static final int MAX_LISTED_PATHS = 5;

  /**
   * Kind of payload a container holds.
   */
  public enum Kind {
    PATHS,
    TABLE,
    EMPTY
  }

  private final Kind kind;
  private final List<Path> paths;
  private final ColumnarTable table;

  private DataContainer(Kind kind, List<Path> paths, ColumnarTable table) {
    this.kind = kind;
    this.paths = paths;
    this.table = table;
  }

  public static DataContainer ofPaths(List<Path> paths) {
    Objects.requireNonNull(paths, "paths");
    for (Path path : paths) {
      Objects.requireNonNull(path, "paths cannot contain null");
    }
    return new DataContainer(Kind.PATHS,
        Collections.unmodifiableList(new ArrayList<Path>(paths)), null);
  }

  public static DataContainer ofTable(ColumnarTable table) {
    return new DataContainer(Kind.TABLE, null, Objects.requireNonNull(table, "table"));
  }

  public static DataContainer empty() {
    return EMPTY;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isPaths() {
    return kind == Kind.PATHS;
  }

  public boolean isTable() {
    return kind == Kind.TABLE;
  }

  public boolean isEmpty() {
    return kind == Kind.EMPTY;
  }

  /**
   * Returns the paths.
   *
   * @throws IllegalStateException If this container does not hold paths
   */
  public List<Path> getPaths() {
    if (kind != Kind.PATHS) {
      throw new IllegalStateException("Container holds " + kind + ", not PATHS");
    }
    return paths;
  }

  /**
   * Returns the table.
   *
   * @throws IllegalStateException If this container does not hold a table
   */
  public ColumnarTable getTable() {
    if (kind != Kind.TABLE) {
      throw new IllegalStateException("Container holds " + kind + ", not TABLE");
    }
    return table;
  }

  public <R> R accept(Visitor<R> visitor) {
    switch (kind) {
      case PATHS:
        return visitor.visitPaths(paths);
      case TABLE:
        return visitor.visitTable(table);
      case EMPTY:
        return visitor.visitEmpty();
      default:
        throw new AssertionError(kind);
    }
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DataContainer)) {
      return false;
    }
    DataContainer that = (DataContainer) o;
    return kind == that.kind
        && Objects.equals(paths, that.paths)
        && Objects.equals(table, that.table);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, paths, table);
  }

  @Override public String toString() {
    switch (kind) {
      case PATHS:
        StringBuilder sb = new StringBuilder("DataContainer{kind=PATHS, paths=")
            .append(paths.size()).append(" [");
        for (int i = 0; i < Math.min(MAX_LISTED_PATHS, paths.size()); i++) {
          Path fileName = paths.get(i).getFileName();
          if (i > 0) {
            sb.append(", ");
          }
          sb.append(fileName == null ? paths.get(i) : fileName);
        }
        if (paths.size() > MAX_LISTED_PATHS) {
          sb.append(", ... ").append(paths.size() - MAX_LISTED_PATHS).append(" more");
        }
        return sb.append("]}").toString();
      case TABLE:
        return "DataContainer{kind=TABLE, rows=" + table.getRowCount() + ", columns="
            + table.getColumnNames() + "}";
      default:
        return "DataContainer{kind=EMPTY}";
    }
  }

  /**
   * Handles each kind of container.
   *
   * @param <R> Result type
   */
  public interface Visitor<R> {
    R visitPaths(List<Path> paths);

    R visitTable(ColumnarTable table);

    R visitEmpty();
  }
}
