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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a {@link Pipeline} run: the output of the last step and the time
 * each step took.
 */
public class PipelineResult {

  private final String pipelineName;
  private final DataContainer output;
  private final Map<String, Long> stepElapsedMs;
  private final long elapsedMs;

  PipelineResult(String pipelineName, DataContainer output, Map<String, Long> stepElapsedMs,
      long elapsedMs) {
    this.pipelineName = pipelineName;
    this.output = output;
    this.stepElapsedMs = Collections.unmodifiableMap(
        new LinkedHashMap<String, Long>(stepElapsedMs));
    this.elapsedMs = elapsedMs;
  }

  public String getPipelineName() {
    return pipelineName;
  }

  public DataContainer getOutput() {
    return output;
  }

  /**
   * Returns the elapsed milliseconds per step, in execution order. Keys are
   * step names prefixed with their 1-based position, e.g. {@code 2:convert:CsvToTableConverter}.
   */
  public Map<String, Long> getStepElapsedMs() {
    return stepElapsedMs;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  @Override public String toString() {
    return "PipelineResult{pipeline=" + pipelineName + ", output=" + output
        + ", elapsedMs=" + elapsedMs + "}";
  }
}
