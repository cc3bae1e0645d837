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
package io.quarry.etl.export;

import io.quarry.etl.cache.CacheKey;
import io.quarry.etl.cache.TableFingerprinter;
import io.quarry.etl.storage.DirectoryLock;
import io.quarry.etl.storage.OutputDirectory;
import io.quarry.etl.table.Column;
import io.quarry.etl.table.ColumnarTable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Exports a table to a CSV or JSON file in a local directory.
 *
 * <p>The file is written atomically and recorded in the directory's
 * {@link ExportManifest} under a {@link CacheKey} of the table fingerprint and
 * the export settings. A later export of an equal table with the same
 * settings is skipped while the file is unchanged.
 *
 * <p>CSV output has a header row; null values are written as empty fields.
 * JSON output is an array with one object per row. Timestamps are written in
 * ISO-8601 form in both formats.
 */
public class LocalTableExporter implements DataExporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalTableExporter.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static final long LOCK_TIMEOUT_MINUTES = 10;

  private final ExportConfig config;
  private final OutputDirectory directory;
  private final TableFingerprinter fingerprinter = new TableFingerprinter();

  public LocalTableExporter(ExportConfig config, Path directory) throws IOException {
    this.config = config;
    this.directory = new OutputDirectory(directory);
  }

  public ExportConfig getConfig() {
    return config;
  }

  @Override public Path getTarget() {
    return directory.resolve(config.getFileName());
  }

  @Override public Path export(ColumnarTable table, boolean forceRecompute) throws IOException {
    String key = exportKey(table).asString();
    Path target = getTarget();
    try (DirectoryLock lock = DirectoryLock.acquire(directory.getPath(), LOCK_TIMEOUT_MINUTES,
        TimeUnit.MINUTES)) {
      ExportManifest manifest = ExportManifest.load(directory);
      if (forceRecompute) {
        LOGGER.info("Force export of {} row(s) to {}", table.getRowCount(), target);
      } else if (manifest.isCurrent(directory, config.getFileName(), key)) {
        LOGGER.info("Cache hit: {} already holds this table, skipping export", target);
        return target;
      } else {
        LOGGER.info("Cache miss: exporting {} row(s) to {}", table.getRowCount(), target);
      }

      directory.writeAtomically(config.getFileName(), file -> write(table, file));
      manifest.record(config.getFileName(), key, target);
      manifest.save(directory);
      LOGGER.debug("Exported {} as {} to {}", table, config.getFormat(), target);
      return target;
    }
  }

  CacheKey exportKey(ColumnarTable table) throws IOException {
    return CacheKey.builder("export.local")
        .addFingerprint("table", table, fingerprinter)
        .add("fileName", config.getFileName())
        .add("format", config.getFormat().name())
        .add("delimiter", String.valueOf(config.getDelimiter()))
        .build();
  }

  private void write(ColumnarTable table, Path file) throws IOException {
    switch (config.getFormat()) {
      case JSON:
        writeJson(table, file);
        break;
      default:
        writeCsv(table, file);
        break;
    }
  }

  private void writeCsv(ColumnarTable table, Path file) throws IOException {
    List<Column> columns = table.getColumns();
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
         ICSVWriter csv = new CSVWriterBuilder(writer)
             .withSeparator(config.getDelimiter())
             .build()) {
      csv.writeNext(table.getColumnNames().toArray(new String[0]), false);
      String[] fields = new String[columns.size()];
      for (int row = 0; row < table.getRowCount(); row++) {
        for (int c = 0; c < fields.length; c++) {
          Object value = columns.get(c).get(row);
          fields[c] = value == null ? "" : value.toString();
        }
        csv.writeNext(fields, false);
      }
      if (csv.checkError()) {
        throw new IOException("Failed to write CSV export " + file);
      }
    }
  }

  private static void writeJson(ColumnarTable table, Path file) throws IOException {
    List<Map<String, @Nullable Object>> rows =
        new ArrayList<Map<String, @Nullable Object>>(table.getRowCount());
    for (int row = 0; row < table.getRowCount(); row++) {
      Map<String, @Nullable Object> values = new LinkedHashMap<String, @Nullable Object>();
      for (Column column : table.getColumns()) {
        Object value = column.get(row);
        values.put(column.getName(),
            value instanceof LocalDateTime ? value.toString() : value);
      }
      rows.add(values);
    }
    MAPPER.writeValue(file.toFile(), rows);
  }
}
