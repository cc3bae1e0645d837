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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ExportConfig}.
 */
@Tag("unit")
public class ExportConfigTest {

  @Test void testFormatFollowsFileName() {
    assertEquals(ExportConfig.Format.CSV,
        ExportConfig.builder().fileName("out.csv").build().getFormat());
    assertEquals(ExportConfig.Format.JSON,
        ExportConfig.builder().fileName("OUT.JSON").build().getFormat());
    assertEquals(ExportConfig.Format.JSON, ExportConfig.builder()
        .fileName("out.txt").format(ExportConfig.Format.JSON).build().getFormat());
  }

  @Test void testFromMap() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("fileName", "out.txt");
    map.put("format", "csv");
    map.put("delimiter", "|");
    ExportConfig config = ExportConfig.fromMap(map);
    assertEquals("out.txt", config.getFileName());
    assertEquals(ExportConfig.Format.CSV, config.getFormat());
    assertEquals('|', config.getDelimiter());
  }

  @Test void testInvalidValues() {
    assertThrows(IllegalArgumentException.class,
        () -> ExportConfig.fromMap(new HashMap<String, Object>()));
    assertThrows(IllegalArgumentException.class,
        () -> ExportConfig.builder().fileName("../out.csv").build());
    assertThrows(IllegalArgumentException.class,
        () -> ExportConfig.builder().fileName(".hidden").build());

    Map<String, Object> format = new HashMap<String, Object>();
    format.put("fileName", "out.csv");
    format.put("format", "parquet");
    assertThrows(IllegalArgumentException.class, () -> ExportConfig.fromMap(format));

    Map<String, Object> delimiter = new HashMap<String, Object>();
    delimiter.put("fileName", "out.csv");
    delimiter.put("delimiter", ";;");
    assertThrows(IllegalArgumentException.class, () -> ExportConfig.fromMap(delimiter));
  }
}
