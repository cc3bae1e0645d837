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
package io.quarry.etl.cache;

import io.quarry.etl.CacheCorruptionException;
import io.quarry.etl.table.Column;
import io.quarry.etl.table.ColumnType;
import io.quarry.etl.table.ColumnarTable;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists a {@link ColumnarTable} as a JSON document with a content checksum.
 *
 * <h3>Format</h3>
 * <pre>{@code
 * {
 *   "formatVersion": 1,
 *   "rowCount": 2,
 *   "checksum": "<sha-256 of the decoded table>",
 *   "columns": [
 *     {"name": "id", "type": "LONG", "values": [1, 2]},
 *     {"name": "ts", "type": "TIMESTAMP", "values": ["2024-01-01T00:00", null]}
 *   ]
 * }
 * }</pre>
 *
 * <p>The checksum is recomputed with {@link TableFingerprinter} after decoding,
 * so truncation, edits or type mismatches are all reported as
 * {@link CacheCorruptionException}.
 */
public class TableCacheHandler implements CacheHandler<ColumnarTable> {

  static final int FORMAT_VERSION = 1;

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final TableFingerprinter fingerprinter = new TableFingerprinter();

  @Override public String getSuffix() {
    return "table.json";
  }

  @Override public void write(Path file, ColumnarTable table) throws IOException {
    try (JsonGenerator gen = MAPPER.getFactory().createGenerator(file.toFile(),
        JsonEncoding.UTF8)) {
      gen.writeStartObject();
      gen.writeNumberField("formatVersion", FORMAT_VERSION);
      gen.writeNumberField("rowCount", table.getRowCount());
      gen.writeStringField("checksum", fingerprinter.fingerprint(table));
      gen.writeArrayFieldStart("columns");
      for (Column column : table.getColumns()) {
        gen.writeStartObject();
        gen.writeStringField("name", column.getName());
        gen.writeStringField("type", column.getType().name());
        gen.writeArrayFieldStart("values");
        for (Object value : column.getValues()) {
          writeValue(gen, column.getType(), value);
        }
        gen.writeEndArray();
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  @Override public ColumnarTable read(Path file) throws IOException {
    JsonNode root;
    try {
      root = MAPPER.readTree(file.toFile());
    } catch (JsonProcessingException e) {
      throw new CacheCorruptionException("Unparseable cache file " + file + ": "
          + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new CacheCorruptionException("Cache file " + file + " is empty or not an object");
    }
    if (root.path("formatVersion").asInt(-1) != FORMAT_VERSION) {
      throw new CacheCorruptionException("Cache file " + file + " has unsupported format version "
          + root.path("formatVersion"));
    }
    JsonNode columnsNode = root.path("columns");
    if (!columnsNode.isArray() || !root.path("rowCount").canConvertToInt()
        || !root.path("checksum").isTextual()) {
      throw new CacheCorruptionException("Cache file " + file + " is missing required fields");
    }
    int rowCount = root.get("rowCount").intValue();

    List<Column> columns = new ArrayList<Column>();
    for (JsonNode columnNode : columnsNode) {
      columns.add(readColumn(file, columnNode, rowCount));
    }

    ColumnarTable table;
    try {
      table = new ColumnarTable(columns);
    } catch (IllegalArgumentException e) {
      throw new CacheCorruptionException("Cache file " + file + " is inconsistent: "
          + e.getMessage(), e);
    }
    String expected = root.get("checksum").textValue();
    String actual = fingerprinter.fingerprint(table);
    if (!expected.equals(actual)) {
      throw new CacheCorruptionException("Checksum mismatch in cache file " + file);
    }
    return table;
  }

  private static void writeValue(JsonGenerator gen, ColumnType type, @Nullable Object value)
      throws IOException {
    if (value == null) {
      gen.writeNull();
      return;
    }
    switch (type) {
      case LONG:
        gen.writeNumber((Long) value);
        break;
      case DOUBLE:
        double d = (Double) value;
        if (Double.isNaN(d) || Double.isInfinite(d)) {
          gen.writeString(Double.toString(d));
        } else {
          gen.writeNumber(d);
        }
        break;
      case BOOLEAN:
        gen.writeBoolean((Boolean) value);
        break;
      default:
        gen.writeString(value.toString());
    }
  }

  private static Column readColumn(Path file, JsonNode node, int rowCount)
      throws CacheCorruptionException {
    if (!node.path("name").isTextual() || !node.path("type").isTextual()
        || !node.path("values").isArray()) {
      throw new CacheCorruptionException("Malformed column entry in cache file " + file);
    }
    String name = node.get("name").textValue();
    ColumnType type;
    try {
      type = ColumnType.valueOf(node.get("type").textValue());
    } catch (IllegalArgumentException e) {
      throw new CacheCorruptionException("Unknown column type '" + node.get("type").textValue()
          + "' in cache file " + file, e);
    }
    JsonNode valuesNode = node.get("values");
    if (valuesNode.size() != rowCount) {
      throw new CacheCorruptionException("Column '" + name + "' in cache file " + file + " has "
          + valuesNode.size() + " values, expected " + rowCount);
    }
    List<@Nullable Object> values = new ArrayList<@Nullable Object>(rowCount);
    for (JsonNode valueNode : valuesNode) {
      values.add(readValue(file, name, type, valueNode));
    }
    return new Column(name, type, values);
  }

  private static @Nullable Object readValue(Path file, String column, ColumnType type,
      JsonNode node) throws CacheCorruptionException {
    if (node.isNull()) {
      return null;
    }
    switch (type) {
      case LONG:
        if (node.isIntegralNumber() && node.canConvertToLong()) {
          return node.longValue();
        }
        break;
      case DOUBLE:
        if (node.isNumber()) {
          return node.doubleValue();
        }
        if (node.isTextual()) {
          try {
            return Double.valueOf(node.textValue());
          } catch (NumberFormatException e) {
            break;
          }
        }
        break;
      case BOOLEAN:
        if (node.isBoolean()) {
          return node.booleanValue();
        }
        break;
      case TIMESTAMP:
        if (node.isTextual()) {
          try {
            return LocalDateTime.parse(node.textValue());
          } catch (DateTimeParseException e) {
            break;
          }
        }
        break;
      default:
        if (node.isTextual()) {
          return node.textValue();
        }
    }
    throw new CacheCorruptionException("Invalid " + type + " value '" + node + "' in column '"
        + column + "' of cache file " + file);
  }
}
