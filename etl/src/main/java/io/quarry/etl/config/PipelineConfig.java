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

import io.quarry.etl.convert.CsvConverterConfig;
import io.quarry.etl.convert.CsvToTableConverter;
import io.quarry.etl.export.ExportConfig;
import io.quarry.etl.export.LocalTableExporter;
import io.quarry.etl.pipeline.ConvertStep;
import io.quarry.etl.pipeline.ExportStep;
import io.quarry.etl.pipeline.IngestStep;
import io.quarry.etl.pipeline.Pipeline;
import io.quarry.etl.pipeline.SelectStep;
import io.quarry.etl.source.DataSource;
import io.quarry.etl.source.KaggleDataSource;
import io.quarry.etl.source.KaggleSourceConfig;
import io.quarry.etl.source.LocalDirectoryDataSource;
import io.quarry.etl.source.LocalSourceConfig;
import io.quarry.etl.source.S3DataSource;
import io.quarry.etl.source.S3SourceConfig;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declarative definition of an ingest, convert, select and export pipeline.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * name: sales
 * source:
 *   type: s3            # s3, kaggle or local
 *   destination: data/raw
 *   bucket: my-bucket
 *   keyPrefix: exports/
 * convert:
 *   type: csv
 *   output: data/converted
 *   dropColumns: [tmp]
 * select:               # optional
 *   columns: [id, amount]
 * export:               # optional
 *   directory: data/final
 *   fileName: sales.csv
 * }</pre>
 *
 * <p>The keys of the {@code source} section besides {@code type} and
 * {@code destination} are those of {@link S3SourceConfig},
 * {@link KaggleSourceConfig} or {@link LocalSourceConfig}. The keys of the
 * {@code convert} section besides {@code type} and {@code output} are those
 * of {@link CsvConverterConfig}. The keys of the {@code export} section besides
 * {@code directory} are those of {@link ExportConfig}.
 *
 * <p>Relative paths are resolved against the directory of the configuration
 * file when it is loaded with {@link #fromFile}, and against the working
 * directory otherwise.
 */
public class PipelineConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineConfig.class);
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  /** Supported source types. */
  public enum SourceType {
    S3, KAGGLE, LOCAL
  }

  private final String name;
  private final SourceType sourceType;
  private final Object sourceConfig;
  private final String destination;
  private final CsvConverterConfig convertConfig;
  private final String convertOutput;
  private final @Nullable List<String> selectColumns;
  private final @Nullable ExportConfig exportConfig;
  private final @Nullable String exportDirectory;
  private final @Nullable Path baseDirectory;

  private PipelineConfig(String name, SourceType sourceType, Object sourceConfig,
      String destination, CsvConverterConfig convertConfig, String convertOutput,
      @Nullable List<String> selectColumns, @Nullable ExportConfig exportConfig,
      @Nullable String exportDirectory, @Nullable Path baseDirectory) {
    this.name = name;
    this.sourceType = sourceType;
    this.sourceConfig = sourceConfig;
    this.destination = destination;
    this.convertConfig = convertConfig;
    this.convertOutput = convertOutput;
    this.selectColumns = selectColumns;
    this.exportConfig = exportConfig;
    this.exportDirectory = exportDirectory;
    this.baseDirectory = baseDirectory;
  }

  public String getName() {
    return name;
  }

  public SourceType getSourceType() {
    return sourceType;
  }

  /**
   * Returns the typed source configuration: an {@link S3SourceConfig},
   * {@link KaggleSourceConfig} or {@link LocalSourceConfig}.
   */
  public Object getSourceConfig() {
    return sourceConfig;
  }

  public Path getDestination() {
    return resolve(destination);
  }

  public CsvConverterConfig getConvertConfig() {
    return convertConfig;
  }

  public Path getConvertOutput() {
    return resolve(convertOutput);
  }

  public @Nullable List<String> getSelectColumns() {
    return selectColumns;
  }

  public @Nullable ExportConfig getExportConfig() {
    return exportConfig;
  }

  public @Nullable Path getExportDirectory() {
    return exportDirectory == null ? null : resolve(exportDirectory);
  }

  /**
   * Parses a YAML definition.
   *
   * @throws IllegalArgumentException If the YAML is invalid or incomplete
   */
  public static PipelineConfig fromYaml(InputStream stream) {
    return fromMap(parseYaml(stream), null);
  }

  /**
   * Loads a YAML ({@code .yaml}, {@code .yml}) or JSON definition file.
   */
  public static PipelineConfig fromFile(Path file) throws IOException {
    String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
    Map<String, Object> map;
    try (InputStream stream = Files.newInputStream(file)) {
      if (fileName.endsWith(".json")) {
        map = JSON_MAPPER.readValue(stream, new TypeReference<Map<String, Object>>() { });
      } else {
        map = parseYaml(stream);
      }
    }
    LOGGER.debug("Loaded pipeline definition from {}", file);
    Path parent = file.toAbsolutePath().getParent();
    return fromMap(map, parent);
  }

  public static PipelineConfig fromMap(Map<String, Object> map) {
    return fromMap(map, null);
  }

  private static PipelineConfig fromMap(Map<String, Object> map, @Nullable Path baseDirectory) {
    String name = ConfigValues.getString(map, "name");
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Pipeline definition requires 'name'");
    }

    Map<String, Object> source = ConfigValues.getSection(map, "source");
    if (source == null) {
      throw new IllegalArgumentException("Pipeline '" + name + "' requires a 'source' section");
    }
    String type = ConfigValues.getString(source, "type");
    if (type == null) {
      throw new IllegalArgumentException("Source of pipeline '" + name + "' requires 'type'");
    }
    SourceType sourceType;
    try {
      sourceType = SourceType.valueOf(type.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown source type '" + type
          + "', expected one of s3, kaggle, local", e);
    }
    String destination = ConfigValues.getString(source, "destination");
    if (destination == null || destination.isEmpty()) {
      throw new IllegalArgumentException("Source of pipeline '" + name
          + "' requires 'destination'");
    }
    Object sourceConfig;
    switch (sourceType) {
      case S3:
        sourceConfig = S3SourceConfig.fromMap(source);
        break;
      case KAGGLE:
        sourceConfig = KaggleSourceConfig.fromMap(source);
        break;
      default:
        sourceConfig = LocalSourceConfig.fromMap(source);
        break;
    }

    Map<String, Object> convert = ConfigValues.getSection(map, "convert");
    if (convert == null) {
      throw new IllegalArgumentException("Pipeline '" + name + "' requires a 'convert' section");
    }
    String convertType = ConfigValues.getString(convert, "type");
    if (convertType != null && !"csv".equalsIgnoreCase(convertType)) {
      throw new IllegalArgumentException("Unknown convert type '" + convertType
          + "', expected csv");
    }
    String output = ConfigValues.getString(convert, "output");
    if (output == null || output.isEmpty()) {
      throw new IllegalArgumentException("Convert section of pipeline '" + name
          + "' requires 'output'");
    }
    CsvConverterConfig convertConfig = CsvConverterConfig.fromMap(convert);

    List<String> selectColumns = null;
    Map<String, Object> select = ConfigValues.getSection(map, "select");
    if (select != null) {
      selectColumns = ConfigValues.getStringList(select, "columns");
    }

    ExportConfig exportConfig = null;
    String exportDirectory = null;
    Map<String, Object> export = ConfigValues.getSection(map, "export");
    if (export != null) {
      exportDirectory = ConfigValues.getString(export, "directory");
      if (exportDirectory == null || exportDirectory.isEmpty()) {
        throw new IllegalArgumentException("Export section of pipeline '" + name
            + "' requires 'directory'");
      }
      exportConfig = ExportConfig.fromMap(export);
    }

    return new PipelineConfig(name, sourceType, sourceConfig, destination, convertConfig,
        output, selectColumns, exportConfig, exportDirectory, baseDirectory);
  }

  /**
   * Creates the pipeline: an ingest step, a convert step, a select step if
   * columns are selected and an export step if an export is configured.
   * Creating the steps creates their directories.
   */
  public Pipeline createPipeline(Pipeline.ProgressListener progressListener) throws IOException {
    Pipeline pipeline = new Pipeline(name, progressListener)
        .addStep(new IngestStep(createSource()))
        .addStep(new ConvertStep(new CsvToTableConverter(convertConfig, getConvertOutput())));
    if (selectColumns != null) {
      pipeline.addStep(SelectStep.columns(selectColumns));
    }
    if (exportConfig != null && exportDirectory != null) {
      pipeline.addStep(new ExportStep(
          new LocalTableExporter(exportConfig, resolve(exportDirectory))));
    }
    return pipeline;
  }

  public Pipeline createPipeline() throws IOException {
    return createPipeline(new Pipeline.LoggingProgressListener());
  }

  private DataSource createSource() throws IOException {
    switch (sourceType) {
      case S3:
        return new S3DataSource((S3SourceConfig) sourceConfig, getDestination());
      case KAGGLE:
        return new KaggleDataSource((KaggleSourceConfig) sourceConfig, getDestination());
      default:
        LocalSourceConfig local = (LocalSourceConfig) sourceConfig;
        Path path = resolve(local.getPath());
        return new LocalDirectoryDataSource(
            LocalSourceConfig.builder()
                .path(path.toString())
                .filePatterns(local.getFilePatterns())
                .checkRemoteFreshness(local.isCheckRemoteFreshness())
                .build(),
            getDestination());
    }
  }

  private Path resolve(String path) {
    Path p = Paths.get(path);
    if (p.isAbsolute() || baseDirectory == null) {
      return p;
    }
    return baseDirectory.resolve(p);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> parseYaml(InputStream stream) {
    LoaderOptions loaderOptions = new LoaderOptions();
    Yaml yaml = new Yaml(new SafeConstructor(loaderOptions));
    Object parsed;
    try {
      parsed = yaml.load(stream);
    } catch (YAMLException e) {
      throw new IllegalArgumentException("Invalid pipeline YAML: " + e.getMessage(), e);
    }
    if (!(parsed instanceof Map)) {
      throw new IllegalArgumentException("Pipeline YAML must be a mapping at the top level");
    }
    return (Map<String, Object>) parsed;
  }
}
