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

import io.quarry.etl.ConversionException;
import io.quarry.etl.UnsupportedFormatException;
import io.quarry.etl.cache.CacheKey;
import io.quarry.etl.table.Column;
import io.quarry.etl.table.ColumnType;
import io.quarry.etl.table.ColumnarTable;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Converts delimited text files into a {@link ColumnarTable}.
 *
 * <p>Accepted inputs are {@code .csv}, {@code .tsv} and their gzip
 * compressed variants. All inputs are read into one table; columns missing
 * from a file are null for its rows.
 *
 * <p>Values listed as NA values become null. Column types are taken from
 * the forced column settings or inferred from the values: LONG, DOUBLE,
 * BOOLEAN and TIMESTAMP are tried in that order and STRING is the fallback.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * CsvToTableConverter converter = new CsvToTableConverter(
 *     CsvConverterConfig.builder().dropColumns(Arrays.asList("tmp")).build(),
 *     Paths.get("data/converted"));
 * ColumnarTable table = converter.convert(files, false);
 * }</pre>
 */
public class CsvToTableConverter extends AbstractDataConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvToTableConverter.class);

  static final List<String> SUPPORTED_SUFFIXES = Collections.unmodifiableList(
      Arrays.asList(".csv", ".tsv", ".csv.gz", ".tsv.gz", ".gz"));

  private final CsvConverterConfig config;
  private final RecordParser parser;
  private final ValueParser values;

  public CsvToTableConverter(CsvConverterConfig config, Path outputDirectory)
      throws IOException {
    this(config, outputDirectory, new CsvRecordParser());
  }

  public CsvToTableConverter(CsvConverterConfig config, Path outputDirectory,
      RecordParser parser) throws IOException {
    super(outputDirectory, config.getMaxCacheEntries(), config.isLockDirectory());
    this.config = config;
    this.parser = parser;
    this.values = new ValueParser(config.getTrueValues(), config.getFalseValues());
  }

  public CsvConverterConfig getConfig() {
    return config;
  }

  @Override protected void validateInputs(List<Path> inputs) throws IOException {
    for (Path input : inputs) {
      String name = input.getFileName().toString().toLowerCase(Locale.ROOT);
      boolean supported = false;
      for (String suffix : SUPPORTED_SUFFIXES) {
        if (name.endsWith(suffix)) {
          supported = true;
          break;
        }
      }
      if (!supported) {
        throw new UnsupportedFormatException("Unsupported input format: " + input
            + " (expected one of " + SUPPORTED_SUFFIXES + ")");
      }
    }
  }

  @Override protected void addConfiguration(CacheKey.Builder keyBuilder) {
    keyBuilder.add("forcedNumericalColumns", sorted(config.getForcedNumericalColumns()))
        .add("forcedCategoricalColumns", sorted(config.getForcedCategoricalColumns()))
        .add("forcedBooleanColumns", sorted(config.getForcedBooleanColumns()))
        .add("forcedTimestampColumns", sorted(config.getForcedTimestampColumns()))
        .add("dropColumns", sorted(config.getDropColumns()))
        .add("naValues", sorted(config.getNaValues()))
        .add("trueValues", sorted(config.getTrueValues()))
        .add("falseValues", sorted(config.getFalseValues()))
        .add("delimiter", config.getDelimiter())
        .add("parser", parser.getClass().getName());
  }

  @Override protected ColumnarTable doConvert(List<Path> inputs) throws IOException {
    List<ColumnarTable> parts = new ArrayList<ColumnarTable>(inputs.size());
    for (Path input : inputs) {
      RawRecords records = parser.parse(input, config.getDelimiter());
      parts.add(toRawTable(records));
    }
    ColumnarTable raw = ColumnarTable.union(parts);

    List<String> dropped = new ArrayList<String>();
    for (String column : config.getDropColumns()) {
      if (raw.hasColumn(column)) {
        dropped.add(column);
      } else {
        LOGGER.debug("Column '{}' to drop is not present in the input", column);
      }
    }
    raw = raw.dropColumns(dropped);

    List<Column> typed = new ArrayList<Column>(raw.getColumnCount());
    for (Column column : raw.getColumns()) {
      typed.add(typeColumn(column));
    }
    ColumnarTable table = new ColumnarTable(typed);
    LOGGER.info("Converted {} file(s) into {} row(s) and {} column(s)", inputs.size(),
        table.getRowCount(), table.getColumnCount());
    return table;
  }

  /**
   * Builds an all-STRING table from raw records, with NA values as null.
   */
  private ColumnarTable toRawTable(RawRecords records) {
    List<String> header = records.getHeader();
    List<Column> columns = new ArrayList<Column>(header.size());
    for (int c = 0; c < header.size(); c++) {
      List<@Nullable String> columnValues =
          new ArrayList<@Nullable String>(records.getRows().size());
      for (String[] row : records.getRows()) {
        String value = row[c];
        columnValues.add(config.getNaValues().contains(value) ? null : value);
      }
      columns.add(new Column(header.get(c), ColumnType.STRING, columnValues));
    }
    return new ColumnarTable(columns);
  }

  private Column typeColumn(Column raw) throws ConversionException {
    String name = raw.getName();
    List<@Nullable String> tokens = new ArrayList<@Nullable String>(raw.size());
    for (Object value : raw.getValues()) {
      tokens.add((String) value);
    }

    ColumnType type;
    if (config.getForcedNumericalColumns().contains(name)) {
      type = values.allParse(tokens, ColumnType.LONG) ? ColumnType.LONG : ColumnType.DOUBLE;
    } else if (config.getForcedCategoricalColumns().contains(name)) {
      type = ColumnType.STRING;
    } else if (config.getForcedBooleanColumns().contains(name)) {
      type = ColumnType.BOOLEAN;
    } else if (config.getForcedTimestampColumns().contains(name)) {
      type = ColumnType.TIMESTAMP;
    } else {
      type = values.infer(tokens);
    }
    if (type == ColumnType.STRING) {
      return raw;
    }

    List<@Nullable Object> converted = new ArrayList<@Nullable Object>(tokens.size());
    for (int row = 0; row < tokens.size(); row++) {
      String token = tokens.get(row);
      if (token == null) {
        converted.add(null);
        continue;
      }
      Object value = values.parse(token, type);
      if (value == null) {
        throw new ConversionException("Value '" + token + "' in row " + (row + 1)
            + " of column '" + name + "' is not a valid " + type);
      }
      converted.add(value);
    }
    LOGGER.debug("Column '{}' read as {}", name, type);
    return new Column(name, type, converted);
  }

  private static List<String> sorted(Collection<String> values) {
    return new ArrayList<String>(new TreeSet<String>(values));
  }
}
