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
package io.quarry.etl.convert;

import io.quarry.etl.config.ConfigValues;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for {@link CsvToTableConverter}.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * convert:
 *   type: csv
 *   output: data/converted
 *   forcedNumericalColumns: [amount]
 *   forcedCategoricalColumns: [zip_code]
 *   forcedBooleanColumns: [active]
 *   forcedTimestampColumns: [created_at]
 *   dropColumns: [tmp]
 *   naValues: ["", "N/A"]        # replaces the defaults
 *   trueValues: ["yes"]
 *   falseValues: ["no"]
 *   delimiter: ";"                # default: comma, tab for .tsv
 *   maxCacheEntries: 1
 *   lockDirectory: false
 * }</pre>
 */
public class CsvConverterConfig {

  /** Tokens read as missing values unless configured otherwise. */
  public static final Set<String> DEFAULT_NA_VALUES = unmodifiable(Arrays.asList(
      "-9998", "-9998.0", "-9999", "-9999.0", "-99", "-99.0", "nan", "none", "non", "Nan",
      "None", "Non", "", "N/A", "N/a", "unknown", "missing"));

  public static final Set<String> DEFAULT_TRUE_VALUES =
      unmodifiable(Arrays.asList("t", "True", "true", "1"));

  public static final Set<String> DEFAULT_FALSE_VALUES =
      unmodifiable(Arrays.asList("f", "False", "false", "0"));

  private final Set<String> forcedNumericalColumns;
  private final Set<String> forcedCategoricalColumns;
  private final Set<String> forcedBooleanColumns;
  private final Set<String> forcedTimestampColumns;
  private final Set<String> dropColumns;
  private final Set<String> naValues;
  private final Set<String> trueValues;
  private final Set<String> falseValues;
  private final @Nullable Character delimiter;
  private final int maxCacheEntries;
  private final boolean lockDirectory;

  private CsvConverterConfig(Builder builder) {
    this.forcedNumericalColumns = unmodifiable(builder.forcedNumericalColumns);
    this.forcedCategoricalColumns = unmodifiable(builder.forcedCategoricalColumns);
    this.forcedBooleanColumns = unmodifiable(builder.forcedBooleanColumns);
    this.forcedTimestampColumns = unmodifiable(builder.forcedTimestampColumns);
    this.dropColumns = unmodifiable(builder.dropColumns);
    this.naValues = unmodifiable(builder.naValues);
    this.trueValues = unmodifiable(builder.trueValues);
    this.falseValues = unmodifiable(builder.falseValues);
    this.delimiter = builder.delimiter;
    this.maxCacheEntries = builder.maxCacheEntries;
    this.lockDirectory = builder.lockDirectory;
  }

  public Set<String> getForcedNumericalColumns() {
    return forcedNumericalColumns;
  }

  public Set<String> getForcedCategoricalColumns() {
    return forcedCategoricalColumns;
  }

  public Set<String> getForcedBooleanColumns() {
    return forcedBooleanColumns;
  }

  public Set<String> getForcedTimestampColumns() {
    return forcedTimestampColumns;
  }

  public Set<String> getDropColumns() {
    return dropColumns;
  }

  public Set<String> getNaValues() {
    return naValues;
  }

  public Set<String> getTrueValues() {
    return trueValues;
  }

  public Set<String> getFalseValues() {
    return falseValues;
  }

  /**
   * Returns the field delimiter, or null to choose by file extension.
   */
  public @Nullable Character getDelimiter() {
    return delimiter;
  }

  public int getMaxCacheEntries() {
    return maxCacheEntries;
  }

  public boolean isLockDirectory() {
    return lockDirectory;
  }

  public static CsvConverterConfig defaults() {
    return builder().build();
  }

  public static CsvConverterConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    if (map.containsKey("forcedNumericalColumns")) {
      builder.forcedNumericalColumns(ConfigValues.getStringList(map, "forcedNumericalColumns"));
    }
    if (map.containsKey("forcedCategoricalColumns")) {
      builder.forcedCategoricalColumns(
          ConfigValues.getStringList(map, "forcedCategoricalColumns"));
    }
    if (map.containsKey("forcedBooleanColumns")) {
      builder.forcedBooleanColumns(ConfigValues.getStringList(map, "forcedBooleanColumns"));
    }
    if (map.containsKey("forcedTimestampColumns")) {
      builder.forcedTimestampColumns(ConfigValues.getStringList(map, "forcedTimestampColumns"));
    }
    if (map.containsKey("dropColumns")) {
      builder.dropColumns(ConfigValues.getStringList(map, "dropColumns"));
    }
    if (map.containsKey("naValues")) {
      builder.naValues(ConfigValues.getStringList(map, "naValues"));
    }
    if (map.containsKey("trueValues")) {
      builder.trueValues(ConfigValues.getStringList(map, "trueValues"));
    }
    if (map.containsKey("falseValues")) {
      builder.falseValues(ConfigValues.getStringList(map, "falseValues"));
    }
    String delimiter = ConfigValues.getString(map, "delimiter");
    if (delimiter != null) {
      if (delimiter.length() != 1) {
        throw new IllegalArgumentException("'delimiter' must be a single character, got: '"
            + delimiter + "'");
      }
      builder.delimiter(delimiter.charAt(0));
    }
    Integer maxCacheEntries = ConfigValues.getInteger(map, "maxCacheEntries");
    if (maxCacheEntries != null) {
      builder.maxCacheEntries(maxCacheEntries);
    }
    Boolean lockDirectory = ConfigValues.getBoolean(map, "lockDirectory");
    if (lockDirectory != null) {
      builder.lockDirectory(lockDirectory);
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  private static Set<String> unmodifiable(Collection<String> values) {
    return Collections.unmodifiableSet(new LinkedHashSet<String>(values));
  }

  public static class Builder {
    private Collection<String> forcedNumericalColumns = Collections.emptySet();
    private Collection<String> forcedCategoricalColumns = Collections.emptySet();
    private Collection<String> forcedBooleanColumns = Collections.emptySet();
    private Collection<String> forcedTimestampColumns = Collections.emptySet();
    private Collection<String> dropColumns = Collections.emptySet();
    private Collection<String> naValues = DEFAULT_NA_VALUES;
    private Collection<String> trueValues = DEFAULT_TRUE_VALUES;
    private Collection<String> falseValues = DEFAULT_FALSE_VALUES;
    private @Nullable Character delimiter;
    private int maxCacheEntries = 1;
    private boolean lockDirectory;

    public Builder forcedNumericalColumns(Collection<String> columns) {
      this.forcedNumericalColumns = columns;
      return this;
    }

    public Builder forcedCategoricalColumns(Collection<String> columns) {
      this.forcedCategoricalColumns = columns;
      return this;
    }

    public Builder forcedBooleanColumns(Collection<String> columns) {
      this.forcedBooleanColumns = columns;
      return this;
    }

    public Builder forcedTimestampColumns(Collection<String> columns) {
      this.forcedTimestampColumns = columns;
      return this;
    }

    public Builder dropColumns(Collection<String> columns) {
      this.dropColumns = columns;
      return this;
    }

    public Builder naValues(Collection<String> naValues) {
      this.naValues = naValues;
      return this;
    }

    public Builder trueValues(Collection<String> trueValues) {
      this.trueValues = trueValues;
      return this;
    }

    public Builder falseValues(Collection<String> falseValues) {
      this.falseValues = falseValues;
      return this;
    }

    public Builder delimiter(@Nullable Character delimiter) {
      this.delimiter = delimiter;
      return this;
    }

    public Builder maxCacheEntries(int maxCacheEntries) {
      this.maxCacheEntries = maxCacheEntries;
      return this;
    }

    public Builder lockDirectory(boolean lockDirectory) {
      this.lockDirectory = lockDirectory;
      return this;
    }

    public CsvConverterConfig build() {
      if (forcedNumericalColumns == null || forcedCategoricalColumns == null
          || forcedBooleanColumns == null || forcedTimestampColumns == null
          || dropColumns == null || naValues == null || trueValues == null
          || falseValues == null) {
        throw new IllegalArgumentException("Column and value lists cannot be null");
      }
      if (maxCacheEntries < 1) {
        throw new IllegalArgumentException("maxCacheEntries must be at least 1, got: "
            + maxCacheEntries);
      }
      Set<String> forced = new HashSet<String>();
      for (Collection<String> group : Arrays.asList(forcedNumericalColumns,
          forcedCategoricalColumns, forcedBooleanColumns, forcedTimestampColumns)) {
        for (String column : new LinkedHashSet<String>(group)) {
          if (!forced.add(column)) {
            throw new IllegalArgumentException("Column '" + column
                + "' is forced to more than one type");
          }
        }
      }
      for (String value : trueValues) {
        if (falseValues.contains(value)) {
          throw new IllegalArgumentException("'" + value + "' is both a true and a false value");
        }
      }
      return new CsvConverterConfig(this);
    }
  }
}
