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

import io.quarry.etl.export.DataExporter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Objects;

/**
 * Exports the table of a TABLE container and passes on the exported file as
 * a PATHS container.
 */
public class ExportStep implements PipelineStep {

  private final DataExporter exporter;

  public ExportStep(DataExporter exporter) {
    this.exporter = Objects.requireNonNull(exporter, "exporter");
  }

  public DataExporter getExporter() {
    return exporter;
  }

  @Override public DataContainer execute(DataContainer input, boolean forceRecompute)
      throws IOException {
    if (!input.isTable()) {
      throw new IllegalArgumentException("Export step requires a TABLE container, got "
          + input.getKind());
    }
    Path file = exporter.export(input.getTable(), forceRecompute);
    return DataContainer.ofPaths(Collections.singletonList(file));
  }

  @Override public String getName() {
    return "export:" + exporter.getClass().getSimpleName();
  }
}
