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

import io.quarry.etl.source.DataSource;

import java.io.IOException;
import java.util.Objects;

/**
 * Fetches files from a {@link DataSource}. The input container is ignored.
 */
public class IngestStep implements PipelineStep {

  private final DataSource source;

  public IngestStep(DataSource source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  public DataSource getSource() {
    return source;
  }

  @Override public DataContainer execute(DataContainer input, boolean forceRecompute)
      throws IOException {
    return DataContainer.ofPaths(source.fetch(forceRecompute));
  }

  @Override public String getName() {
    return "ingest:" + source.getType();
  }
}
