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

import io.quarry.etl.config.ConfigValues;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Configuration for {@link LocalTableExporter}.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * export:
 *   directory: data/final
 *   fileName: sales.csv
 *   format: csv       # csv or json, by default taken from the file name
 *   delimiter: ";"    # csv only
 * }</pre>
 */
public class ExportConfig {

  /** Supported output formats. */
  public enum Format {
    CSV, JSON
  }

  private final String fileName;
  private final Format format;
  private final char delimiter;

  private ExportConfig(Builder builder) {
    this.fileName = builder.fileName;
    this.format = builder.format != null ? builder.format : formatOf(builder.fileName);
    this.delimiter = builder.delimiter;
  }

  public String getFileName() {
    return fileName;
  }

  public Format getFormat() {
    return format;
  }

  public char getDelimiter() {
    return delimiter;
  }

  public static ExportConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    builder.fileName(ConfigValues.getString(map, "fileName"));
    String format = ConfigValues.getString(map, "format");
    if (format != null) {
      try {
        builder.format(Format.valueOf(format.toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown export format '" + format
            + "', expected csv or json", e);
      }
    }
    String delimiter = ConfigValues.getString(map, "delimiter");
    if (delimiter != null) {
      if (delimiter.length() != 1) {
        throw new IllegalArgumentException("Export delimiter must be a single character, got '"
            + delimiter + "'");
      }
      builder.delimiter(delimiter.charAt(0));
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  static Format formatOf(String fileName) {
    return fileName.toLowerCase(Locale.ROOT).endsWith(".json") ? Format.JSON : Format.CSV;
  }

  public static class Builder {
    private String fileName;
    private @Nullable Format format;
    private char delimiter = ',';

    public Builder fileName(String fileName) {
      this.fileName = fileName;
      return this;
    }

    public Builder format(Format format) {
      this.format = format;
      return this;
    }

    public Builder delimiter(char delimiter) {
      this.delimiter = delimiter;
      return this;
    }

    public ExportConfig build() {
      if (fileName == null || fileName.isEmpty()) {
        throw new IllegalArgumentException("ExportConfig requires 'fileName'");
      }
      if (fileName.contains("/") || fileName.contains("\\") || fileName.startsWith(".")) {
        throw new IllegalArgumentException("Export file name must be a plain file name, got '"
            + fileName + "'");
      }
      return new ExportConfig(this);
    }
  }
}
