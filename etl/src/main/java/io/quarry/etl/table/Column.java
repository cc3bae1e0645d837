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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, typed column of a {@link ColumnarTable}.
 *
 * <p>Values are held in an unmodifiable list. Null marks a missing value.
 */
public final class Column {

  private final String name;
  private final ColumnType type;
  private final List<@Nullable Object> values;

  public Column(String name, ColumnType type, List<? extends @Nullable Object> values) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Column name cannot be null or empty");
    }
    this.name = name;
    this.type = Objects.requireNonNull(type, "type");
    List<@Nullable Object> copy = new ArrayList<@Nullable Object>(values.size());
    for (Object value : values) {
      if (value != null && !type.getJavaType().isInstance(value)) {
        throw new IllegalArgumentException("Column '" + name + "' of type " + type
            + " cannot hold value of " + value.getClass().getSimpleName() + ": " + value);
      }
      copy.add(value);
    }
    this.values = Collections.unmodifiableList(copy);
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public List<@Nullable Object> getValues() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public @Nullable Object get(int row) {
    return values.get(row);
  }

  /**
   * Returns this column converted to a wider type.
   */
  Column widenTo(ColumnType target) {
    if (target == type) {
      return this;
    }
    List<@Nullable Object> converted = new ArrayList<@Nullable Object>(values.size());
    for (Object value : values) {
      if (value == null) {
        converted.add(null);
      } else if (target == ColumnType.DOUBLE && value instanceof Long) {
        converted.add(((Long) value).doubleValue());
      } else if (target == ColumnType.STRING) {
        converted.add(value.toString());
      } else {
        throw new IllegalArgumentException("Cannot widen column '" + name + "' from "
            + type + " to " + target);
      }
    }
    return new Column(name, target, converted);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Column)) {
      return false;
    }
    Column that = (Column) o;
    return name.equals(that.name) && type == that.type && values.equals(that.values);
  }

  @Override public int hashCode() {
    return Objects.hash(name, type, values);
  }

  @Override public String toString() {
    return "Column{name=" + name + ", type=" + type + ", size=" + values.size() + "}";
  }
}
