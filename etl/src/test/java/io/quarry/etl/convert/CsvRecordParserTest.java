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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CsvRecordParser}.
 */
@Tag("unit")
public class CsvRecordParserTest {

  @TempDir
  Path tempDir;

  private final CsvRecordParser parser = new CsvRecordParser();

  private Path write(String name, String content) throws IOException {
    Path file = tempDir.resolve(name);
    Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    return file;
  }

  @Test void testParsesHeaderAndRows() throws IOException {
    Path file = write("a.csv", "\uFEFFid, name \n1,\"Smith, J\"\n\n2,\"say \"\"hi\"\"\"\n");
    RawRecords records = parser.parse(file, null);
    assertEquals(Arrays.asList("id", "name"), records.getHeader());
    assertEquals(2, records.getRows().size());
    assertArrayEquals(new String[] {"1", "Smith, J"}, records.getRows().get(0));
    assertArrayEquals(new String[] {"2", "say \"hi\""}, records.getRows().get(1));
    assertEquals(file, records.getSource());
  }

  @Test void testExplicitDelimiter() throws IOException {
    Path file = write("a.csv", "a;b\n1;2\n");
    RawRecords records = parser.parse(file, ';');
    assertEquals(Arrays.asList("a", "b"), records.getHeader());
  }

  @Test void testDefaultDelimiterByExtension() {
    assertEquals('\t', CsvRecordParser.defaultDelimiter(Paths.get("x.tsv")));
    assertEquals('\t', CsvRecordParser.defaultDelimiter(Paths.get("x.TSV.gz")));
    assertEquals(',', CsvRecordParser.defaultDelimiter(Paths.get("x.csv.gz")));
  }

  @Test void testEmptyFileFails() throws IOException {
    Path file = write("empty.csv", "");
    ConversionException e =
        assertThrows(ConversionException.class, () -> parser.parse(file, null));
    assertTrue(e.getMessage().contains("empty"), e.getMessage());
  }

  @Test void testHeaderOnlyHasNoRows() throws IOException {
    RawRecords records = parser.parse(write("h.csv", "a,b\n"), null);
    assertEquals(0, records.getRows().size());
  }

  @Test void testBadHeaders() throws IOException {
    Path duplicate = write("dup.csv", "a,a\n1,2\n");
    assertThrows(ConversionException.class, () -> parser.parse(duplicate, null));
    Path blank = write("blank.csv", "a,,c\n1,2,3\n");
    assertThrows(ConversionException.class, () -> parser.parse(blank, null));
  }

  @Test void testFieldCountMismatch() throws IOException {
    Path file = write("bad.csv", "a,b\n1,2\n1,2,3\n");
    ConversionException e =
        assertThrows(ConversionException.class, () -> parser.parse(file, null));
    assertTrue(e.getMessage().contains("Malformed record at line 3"), e.getMessage());
  }

  @Test void testCorruptGzip() throws IOException {
    Path file = write("bad.csv.gz", "plain text, not gzip");
    assertThrows(ConversionException.class, () -> parser.parse(file, null));
  }

  @Test void testTruncatedGzip() throws IOException {
    Path file = tempDir.resolve("cut.csv.gz");
    Files.write(file, truncatedGzip(5000));

    ConversionException e =
        assertThrows(ConversionException.class, () -> parser.parse(file, null));
    assertTrue(e.getMessage().contains("cut.csv.gz"), e.getMessage());
  }

  /** Gzip of a CSV with the given number of rows, cut to half its length. */
  static byte[] truncatedGzip(int rows) throws IOException {
    StringBuilder csv = new StringBuilder("id,label\n");
    for (int i = 0; i < rows; i++) {
      csv.append(i).append(",row-").append(i * 7919L % 10007).append('\n');
    }
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (OutputStream out = new GZIPOutputStream(bytes)) {
      out.write(csv.toString().getBytes(StandardCharsets.UTF_8));
    }
    byte[] complete = bytes.toByteArray();
    return Arrays.copyOf(complete, complete.length / 2);
  }
}
