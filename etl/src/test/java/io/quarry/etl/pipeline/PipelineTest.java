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
package io.quarry.etl.pipeline;

import io.quarry.etl.SourceUnavailableException;
import io.quarry.etl.convert.CsvConverterConfig;
import io.quarry.etl.convert.CsvToTableConverter;
import io.quarry.etl.export.ExportConfig;
import io.quarry.etl.export.LocalTableExporter;
import io.quarry.etl.source.DataSource;
import io.quarry.etl.table.ColumnType;
import io.quarry.etl.table.ColumnarTable;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Pipeline} and its steps.
 */
@Tag("unit")
public class PipelineTest {

  @TempDir
  Path tempDir;

  /** Records listener callbacks as strings. */
  static class RecordingListener implements Pipeline.ProgressListener {
    final List<String> events = new ArrayList<String>();

    @Override public void onPipelineStart(String pipelineName, int stepCount) {
      events.add("start " + pipelineName + " " + stepCount);
    }

    @Override public void onStepStart(int stepNum, int stepCount, String stepName) {
      events.add("step " + stepNum + "/" + stepCount + " " + stepName);
    }

    @Override public void onStepComplete(int stepNum, int stepCount, String stepName,
        long elapsedMs, DataContainer output) {
      events.add("done " + stepNum + " " + output.getKind());
    }

    @Override public void onStepFailed(int stepNum, int stepCount, String stepName,
        Exception error) {
      events.add("failed " + stepNum + " " + error.getClass().getSimpleName());
    }

    @Override public void onPipelineComplete(String pipelineName, long elapsedMs) {
      events.add("complete " + pipelineName);
    }
  }

  /** Returns a fixed output and records what it received. */
  static class FixedStep implements PipelineStep {
    private final String name;
    private final DataContainer output;
    final List<DataContainer> inputs = new ArrayList<DataContainer>();
    final List<Boolean> forced = new ArrayList<Boolean>();

    FixedStep(String name, DataContainer output) {
      this.name = name;
      this.output = output;
    }

    @Override public DataContainer execute(DataContainer input, boolean forceRecompute) {
      inputs.add(input);
      forced.add(forceRecompute);
      return output;
    }

    @Override public String getName() {
      return name;
    }
  }

  /** Data source returning fixed paths. */
  static class FixedSource implements DataSource {
    private final List<Path> paths;
    boolean lastForce;

    FixedSource(List<Path> paths) {
      this.paths = paths;
    }

    @Override public List<Path> fetch(boolean forceRecompute) throws IOException {
      lastForce = forceRecompute;
      if (paths.isEmpty()) {
        throw new SourceUnavailableException("nothing to fetch");
      }
      return paths;
    }

    @Override public Path getDestination() {
      return Paths.get("unused");
    }

    @Override public String getType() {
      return "fixed";
    }
  }

  private static ColumnarTable table() {
    return ColumnarTable.builder()
        .column("id", ColumnType.LONG)
        .column("amount", ColumnType.DOUBLE)
        .row(1L, 10.0)
        .row(2L, 25.0)
        .row(3L, 40.0)
        .build();
  }

  @Test void testStepsRunInOrder() throws IOException {
    DataContainer paths = DataContainer.ofPaths(Arrays.asList(Paths.get("a.csv")));
    DataContainer tableOutput = DataContainer.ofTable(table());
    FixedStep first = new FixedStep("first", paths);
    FixedStep second = new FixedStep("second", tableOutput);
    RecordingListener listener = new RecordingListener();

    PipelineResult result = new Pipeline("demo", listener)
        .addStep(first)
        .addStep(second)
        .run(true);

    assertTrue(first.inputs.get(0).isEmpty());
    assertSame(paths, second.inputs.get(0));
    assertEquals(Arrays.asList(true), second.forced);
    assertSame(tableOutput, result.getOutput());
    assertEquals("demo", result.getPipelineName());
    assertEquals(Arrays.asList("1:first", "2:second"),
        new ArrayList<String>(result.getStepElapsedMs().keySet()));
    assertTrue(result.getElapsedMs() >= 0);
    assertEquals(Arrays.asList("start demo 2", "step 1/2 first", "done 1 PATHS",
        "step 2/2 second", "done 2 TABLE", "complete demo"), listener.events);
  }

  @Test void testEmptyPipelineReturnsEmptyContainer() throws IOException {
    PipelineResult result = new Pipeline("nothing").run(false);
    assertTrue(result.getOutput().isEmpty());
    assertTrue(result.getStepElapsedMs().isEmpty());
  }

  @Test void testFailureIsReportedAndPropagated() throws IOException {
    FixedStep after = new FixedStep("after", DataContainer.empty());
    RecordingListener listener = new RecordingListener();
    Pipeline pipeline = new Pipeline("failing", listener)
        .addStep(new IngestStep(new FixedSource(Collections.<Path>emptyList())))
        .addStep(after);

    assertThrows(SourceUnavailableException.class, () -> pipeline.run(false));
    assertTrue(after.inputs.isEmpty());
    assertEquals(Arrays.asList("start failing 2", "step 1/2 ingest:fixed",
        "failed 1 SourceUnavailableException"), listener.events);
  }

  @Test void testIngestStepPassesForceFlag() throws IOException {
    FixedSource source = new FixedSource(Arrays.asList(Paths.get("x.csv")));
    IngestStep step = new IngestStep(source);
    DataContainer output = step.execute(DataContainer.empty(), true);
    assertTrue(source.lastForce);
    assertEquals(Arrays.asList(Paths.get("x.csv")), output.getPaths());
    assertEquals("ingest:fixed", step.getName());
  }

  @Test void testConvertStepRequiresPaths() throws IOException {
    ConvertStep step = new ConvertStep(
        new CsvToTableConverter(CsvConverterConfig.defaults(), tempDir.resolve("out")));
    assertEquals("convert:CsvToTableConverter", step.getName());
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> step.execute(DataContainer.ofTable(table()), false));
    assertEquals("Convert step requires a PATHS container, got TABLE", e.getMessage());
  }

  @Test void testExportStepPassesOnExportedFile() throws IOException {
    ExportStep step = new ExportStep(new LocalTableExporter(
        ExportConfig.builder().fileName("amounts.csv").build(), tempDir.resolve("final")));
    assertEquals("export:LocalTableExporter", step.getName());

    DataContainer output = step.execute(DataContainer.ofTable(table()), false);

    assertEquals(Arrays.asList(tempDir.resolve("final/amounts.csv")), output.getPaths());
    assertTrue(Files.isRegularFile(output.getPaths().get(0)));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> step.execute(DataContainer.ofPaths(Arrays.asList(Paths.get("x.csv"))), false));
    assertEquals("Export step requires a TABLE container, got PATHS", e.getMessage());
  }

  @Test void testSelectStep() {
    DataContainer input = DataContainer.ofTable(table());

    ColumnarTable columns = SelectStep.columns(Arrays.asList("amount"))
        .execute(input, false).getTable();
    assertEquals(Arrays.asList("amount"), columns.getColumnNames());
    assertEquals(3, columns.getRowCount());

    ColumnarTable rows = SelectStep.rows(row -> ((Double) row.get("amount")) > 20.0)
        .execute(input, false).getTable();
    assertEquals(Arrays.asList(2L, 3L), rows.getColumn("id").getValues());

    ColumnarTable both = new SelectStep(Arrays.asList("id"), row -> row.get("id").equals(1L))
        .execute(input, false).getTable();
    assertEquals(1, both.getRowCount());
    assertEquals(Arrays.asList("id"), both.getColumnNames());

    assertThrows(IllegalArgumentException.class,
        () -> SelectStep.columns(Arrays.asList("id")).execute(DataContainer.empty(), false));
    assertThrows(IllegalArgumentException.class,
        () -> SelectStep.columns(Arrays.asList("missing")).execute(input, false));
  }

  @Test void testInvalidName() {
    assertThrows(IllegalArgumentException.class, () -> new Pipeline(""));
  }
}
