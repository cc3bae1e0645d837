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
import io.quarry.etl.EtlException;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.zip.GZIPInputStream;

/**
 * {@link RecordParser} backed by OpenCSV.
 *
 * <p>Files ending in {@code .gz} are decompressed on the fly. Without an
 * explicit delimiter, {@code .tsv} and {@code .tsv.gz} files are read as
 * tab separated and everything else as comma separated. Blank lines are
 * skipped; any other row must have as many fields as the header.
 */
public class CsvRecordParser implements RecordParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvRecordParser.class);

  @Override public RawRecords parse(Path file, @Nullable Character delimiter) throws IOException {
    char separator = delimiter != null ? delimiter : defaultDelimiter(file);
    try (Reader reader = open(file);
         CSVReader csv = new CSVReaderBuilder(reader)
             .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
             .build()) {
      String[] headerFields = csv.readNext();
      if (headerFields == null) {
        throw new ConversionException("File " + file + " is empty, a header row is required");
      }
      List<String> header = readHeader(file, headerFields);

      List<String[]> rows = new ArrayList<String[]>();
      String[] fields;
      while ((fields = csv.readNext()) != null) {
        if (isBlank(fields)) {
          continue;
        }
        if (fields.length != header.size()) {
          throw new ConversionException("Malformed record at line " + csv.getLinesRead()
              + " of " + file + ": expected " + header.size() + " fields, found "
              + fields.length);
        }
        rows.add(fields);
      }
      LOGGER.debug("Parsed {} record(s) with {} column(s) from {}", rows.size(),
          header.size(), file);
      return new RawRecords(file, header, rows);
    } catch (CsvValidationException e) {
      throw new ConversionException("Malformed record in " + file + ": " + e.getMessage(), e);
    } catch (EtlException e) {
      throw e;
    } catch (IOException e) {
      // Truncated or corrupt compressed input surfaces as a plain IOException while reading
      if (!isGzip(file)) {
        throw e;
      }
      throw new ConversionException("Corrupt gzip data in " + file + ": " + e.getMessage(), e);
    }
  }

  static char defaultDelimiter(Path file) {
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    return name.endsWith(".tsv") || name.endsWith(".tsv.gz") ? '\t' : ',';
  }

  private static Reader open(Path file) throws IOException {
    InputStream in = Files.newInputStream(file);
    try {
      if (isGzip(file)) {
        in = new GZIPInputStream(in);
      }
    } catch (IOException e) {
      in.close();
      throw new ConversionException("Corrupt gzip data in " + file + ": " + e.getMessage(), e);
    }
    return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
  }

  private static boolean isGzip(Path file) {
    return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".gz");
  }

  private static List<String> readHeader(Path file, String[] fields) throws ConversionException {
    List<String> header = new ArrayList<String>(fields.length);
    Set<String> seen = new HashSet<String>();
    for (int i = 0; i < fields.length; i++) {
      String name = fields[i].trim();
      // Strip a UTF-8 byte order mark
      if (i == 0 && name.startsWith("\uFEFF")) {
        name = name.substring(1);
      }
      if (name.isEmpty()) {
        throw new ConversionException("Empty column name at position " + (i + 1)
            + " in header of " + file);
      }
      if (!seen.add(name)) {
        throw new ConversionException("Duplicate column '" + name + "' in header of " + file);
      }
      header.add(name);
    }
    return header;
  }

  private static boolean isBlank(String[] fields) {
    return fields.length == 0 || (fields.length == 1 && fields[0].trim().isEmpty());
  }
}
