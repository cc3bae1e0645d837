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
package io.quarry.etl.config;

import io.quarry.etl.export.ExportConfig;
import io.quarry.etl.pipeline.DataContainer;
import io.quarry.etl.pipeline.Pipeline;
import io.quarry.etl.pipeline.PipelineResult;
import io.quarry.etl.source.KaggleSourceConfig;
import io.quarry.etl.source.LocalSourceConfig;
import io.quarry.etl.source.S3SourceConfig;
import io.quarry.etl.table.ColumnType;
import io.quarry.etl.table.ColumnarTable;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PipelineConfig}.
 */
@Tag("unit")
public class PipelineConfigTest {

  @TempDir
  Path tempDir;

  private static PipelineConfig fromYaml(String yaml) {
    return PipelineConfig.fromYaml(
        new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
  }

  private static PipelineConfig fromResource(String name) throws IOException {
    try (InputStream stream = PipelineConfigTest.class.getResourceAsStream(name)) {
      return PipelineConfig.fromYaml(stream);
    }
  }

  @Test void testS3Definition() throws IOException {
    PipelineConfig config = fromResource("/pipelines/s3-sales.yaml");

    assertEquals("sales", config.getName());
    assertEquals(PipelineConfig.SourceType.S3, config.getSourceType());
    S3SourceConfig s3 = (S3SourceConfig) config.getSourceConfig();
    assertEquals("acme-exports", s3.getBucket());
    assertEquals("sales/daily/", s3.getKeyPrefix());
    assertEquals(Arrays.asList("*.csv.gz"), s3.getFilePatterns());
    assertEquals(4, s3.getNumWorkers());
    assertEquals(Paths.get("data/raw/sales"), config.getDestination());
    assertEquals(Paths.get("data/converted/sales"), config.getConvertOutput());
    assertTrue(config.getConvertConfig().getForcedCategoricalColumns().contains("zip"));
    assertEquals(3, config.getConvertConfig().getMaxCacheEntries());
    assertEquals(Arrays.asList("store_id", "amount", "sold_at"), config.getSelectColumns());
  }

  @Test void testKaggleDefinition() throws IOException {
    PipelineConfig config = fromResource("/pipelines/kaggle-titanic.yaml");

    assertEquals(PipelineConfig.SourceType.KAGGLE, config.getSourceType());
    KaggleSourceConfig kaggle = (KaggleSourceConfig) config.getSourceConfig();
    assertEquals("heptapod", kaggle.getOwner());
    assertEquals(Integer.valueOf(2), kaggle.getDatasetVersion());
    assertEquals(Arrays.asList("*.csv"), kaggle.getFilePatterns());
    assertNull(config.getSelectColumns());
    assertNull(config.getExportConfig());
  }

  @Test void testMissingSections() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> fromYaml("source:\n  type: local\n"));
    assertTrue(e.getMessage().contains("'name'"), e.getMessage());

    e = assertThrows(IllegalArgumentException.class, () -> fromYaml("name: x\n"));
    assertTrue(e.getMessage().contains("'source'"), e.getMessage());

    e = assertThrows(IllegalArgumentException.class,
        () -> fromYaml("name: x\nsource:\n  type: local\n  path: in\n"));
    assertTrue(e.getMessage().contains("'destination'"), e.getMessage());

    e = assertThrows(IllegalArgumentException.class,
        () -> fromYaml("name: x\nsource:\n  type: local\n  path: in\n  destination: raw\n"));
    assertTrue(e.getMessage().contains("'convert'"), e.getMessage());

    e = assertThrows(IllegalArgumentException.class,
        () -> fromYaml("name: x\nsource:\n  type: s3\n  destination: raw\n"
            + "convert:\n  output: out\n"));
    assertTrue(e.getMessage().contains("'bucket'"), e.getMessage());
  }

  @Test void testUnknownTypes() {
    assertThrows(IllegalArgumentException.class,
        () -> fromYaml("name: x\nsource:\n  type: ftp\n  destination: raw\n"
            + "convert:\n  output: out\n"));
    assertThrows(IllegalArgumentException.class,
        () -> fromYaml("name: x\nsource:\n  type: local\n  path: in\n  destination: raw\n"
            + "convert:\n  type: parquet\n  output: out\n"));
  }

  @Test void testInvalidYaml() {
    assertThrows(IllegalArgumentException.class, () -> fromYaml("name: [unclosed\n"));
    assertThrows(IllegalArgumentException.class, () -> fromYaml("- just\n- a list\n"));
  }

  @Test void testFromMap() {
    Map<String, Object> source = new HashMap<String, Object>();
    source.put("type", "LOCAL");
    source.put("destination", "raw");
    source.put("path", "in");
    Map<String, Object> convert = new HashMap<String, Object>();
    convert.put("output", "out");
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("name", "mapped");
    map.put("source", source);
    map.put("convert", convert);

    PipelineConfig config = PipelineConfig.fromMap(map);

    assertEquals(PipelineConfig.SourceType.LOCAL, config.getSourceType());
    assertEquals("in", ((LocalSourceConfig) config.getSourceConfig()).getPath());
  }

  @Test void testJsonFileWithRelativePaths() throws IOException {
    Path project = Files.createDirectories(tempDir.resolve("project"));
    Files.createDirectories(project.resolve("input"));
    Files.write(project.resolve("input/a.csv"), "id,v\n1,x\n".getBytes(StandardCharsets.UTF_8));
    Path file = project.resolve("pipeline.json");
    Files.write(file, ("{\"name\":\"json\","
        + "\"source\":{\"type\":\"local\",\"path\":\"input\",\"destination\":\"raw\"},"
        + "\"convert\":{\"output\":\"converted\"}}").getBytes(StandardCharsets.UTF_8));

    PipelineConfig config = PipelineConfig.fromFile(file);

    assertEquals(project.resolve("raw"), config.getDestination());
    assertEquals(project.resolve("converted"), config.getConvertOutput());
    ColumnarTable table = config.createPipeline().run(false).getOutput().getTable();
    assertEquals(1, table.getRowCount());
  }

  @Test void testCreatePipelineFromYamlFile() throws IOException {
    Path project = Files.createDirectories(tempDir.resolve("project"));
    Path input = Files.createDirectories(project.resolve("input"));
    Files.write(input.resolve("a.csv"),
        "id,amount,note\n1,9.5,x\n2,3,y\n".getBytes(StandardCharsets.UTF_8));
    Files.write(input.resolve("b.csv"),
        "id,amount,note\n3,1,z\n".getBytes(StandardCharsets.UTF_8));
    Path file = project.resolve("pipeline.yaml");
    Files.write(file, ("name: local-sales\n"
        + "source:\n"
        + "  type: local\n"
        + "  path: input\n"
        + "  destination: data/raw\n"
        + "convert:\n"
        + "  type: csv\n"
        + "  output: data/converted\n"
        + "  forcedCategoricalColumns: [id]\n"
        + "select:\n"
        + "  columns: [id, amount]\n").getBytes(StandardCharsets.UTF_8));

    Pipeline pipeline = PipelineConfig.fromFile(file).createPipeline();
    assertEquals(3, pipeline.getSteps().size());
    assertEquals("ingest:local", pipeline.getSteps().get(0).getName());

    PipelineResult result = pipeline.run(false);
    DataContainer output = result.getOutput();
    ColumnarTable table = output.getTable();
    assertEquals(Arrays.asList("id", "amount"), table.getColumnNames());
    assertEquals(ColumnType.STRING, table.getColumn("id").getType());
    assertEquals(ColumnType.DOUBLE, table.getColumn("amount").getType());
    assertEquals(Arrays.asList(9.5, 3.0, 1.0), table.getColumn("amount").getValues());
    assertTrue(Files.exists(project.resolve("data/raw/a.csv")));
    assertEquals(3, result.getStepElapsedMs().size());
  }

  @Test void testExportSection() throws IOException {
    Path project = Files.createDirectories(tempDir.resolve("project"));
    Path input = Files.createDirectories(project.resolve("input"));
    Files.write(input.resolve("a.csv"), "id,amount\n1,2.5\n".getBytes(StandardCharsets.UTF_8));
    Path file = project.resolve("pipeline.yaml");
    Files.write(file, ("name: exported\n"
        + "source:\n"
        + "  type: local\n"
        + "  path: input\n"
        + "  destination: data/raw\n"
        + "convert:\n"
        + "  output: data/converted\n"
        + "export:\n"
        + "  directory: data/final\n"
        + "  fileName: amounts.json\n").getBytes(StandardCharsets.UTF_8));

    PipelineConfig config = PipelineConfig.fromFile(file);
    assertEquals(project.resolve("data/final"), config.getExportDirectory());
    assertEquals(ExportConfig.Format.JSON, config.getExportConfig().getFormat());

    Pipeline pipeline = config.createPipeline();
    assertEquals("export:LocalTableExporter", pipeline.getSteps().get(2).getName());
    DataContainer output = pipeline.run(false).getOutput();
    assertEquals(Arrays.asList(project.resolve("data/final/amounts.json")), output.getPaths());
    assertTrue(new String(Files.readAllBytes(output.getPaths().get(0)), StandardCharsets.UTF_8)
        .contains("2.5"));
  }

  @Test void testExportSectionRequiresDirectory() {
    assertThrows(IllegalArgumentException.class, () -> fromYaml("name: x\n"
        + "source: {type: local, path: in, destination: raw}\n"
        + "convert: {output: out}\n"
        + "export: {fileName: x.csv}\n"));
  }
}
