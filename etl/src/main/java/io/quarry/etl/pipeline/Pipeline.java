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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered sequence of {@link PipelineStep}s.
 *
 * <p>A run starts from an empty container and passes each step's output to
 * the next step. The pipeline times every step and reports it to its
 * {@link ProgressListener}. A failing step is reported and its exception
 * propagates unchanged; later steps do not run.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Pipeline pipeline = new Pipeline("sales")
 *     .addStep(new IngestStep(source))
 *     .addStep(new ConvertStep(converter))
 *     .addStep(SelectStep.columns(Arrays.asList("id", "amount")));
 * PipelineResult result = pipeline.run(false);
 * ColumnarTable table = result.getOutput().getTable();
 * }</pre>
 */
public class Pipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(Pipeline.class);

  private final String name;
  private final List<PipelineStep> steps = new ArrayList<PipelineStep>();
  private final ProgressListener progressListener;

  public Pipeline(String name) {
    this(name, new LoggingProgressListener());
  }

  public Pipeline(String name, ProgressListener progressListener) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Pipeline name cannot be null or empty");
    }
    this.name = name;
    this.progressListener = Objects.requireNonNull(progressListener, "progressListener");
  }

  public Pipeline addStep(PipelineStep step) {
    steps.add(Objects.requireNonNull(step, "step"));
    return this;
  }

  public String getName() {
    return name;
  }

  public List<PipelineStep> getSteps() {
    return Collections.unmodifiableList(steps);
  }

  /**
   * Runs all steps in order.
   *
   * @param forceRecompute Passed to every step
   * @return Output of the last step with timings
   * @throws IOException If a step fails
   */
  public PipelineResult run(boolean forceRecompute) throws IOException {
    LOGGER.debug("Running pipeline '{}' with {} step(s), forceRecompute={}", name,
        steps.size(), forceRecompute);
    progressListener.onPipelineStart(name, steps.size());
    long start = System.currentTimeMillis();

    Map<String, Long> timings = new LinkedHashMap<String, Long>();
    DataContainer current = DataContainer.empty();
    for (int i = 0; i < steps.size(); i++) {
      PipelineStep step = steps.get(i);
      int stepNum = i + 1;
      progressListener.onStepStart(stepNum, steps.size(), step.getName());
      long stepStart = System.currentTimeMillis();
      try {
        current = step.execute(current, forceRecompute);
      } catch (IOException | RuntimeException e) {
        progressListener.onStepFailed(stepNum, steps.size(), step.getName(), e);
        throw e;
      }
      long elapsed = System.currentTimeMillis() - stepStart;
      timings.put(stepNum + ":" + step.getName(), elapsed);
      progressListener.onStepComplete(stepNum, steps.size(), step.getName(), elapsed, current);
    }

    long elapsedMs = System.currentTimeMillis() - start;
    progressListener.onPipelineComplete(name, elapsedMs);
    return new PipelineResult(name, current, timings, elapsedMs);
  }

  /**
   * Receives progress notifications from a pipeline run.
   */
  public interface ProgressListener {
    /**
     * Called before the first step.
     *
     * @param pipelineName Pipeline name
     * @param stepCount Number of steps
     */
    void onPipelineStart(String pipelineName, int stepCount);

    /**
     * Called before a step runs.
     *
     * @param stepNum 1-based step position
     * @param stepCount Number of steps
     * @param stepName Step name
     */
    void onStepStart(int stepNum, int stepCount, String stepName);

    /**
     * Called after a step succeeded.
     *
     * @param stepNum 1-based step position
     * @param stepCount Number of steps
     * @param stepName Step name
     * @param elapsedMs Time the step took
     * @param output Step output
     */
    void onStepComplete(int stepNum, int stepCount, String stepName, long elapsedMs,
        DataContainer output);

    /**
     * Called when a step failed, before the exception propagates.
     */
    void onStepFailed(int stepNum, int stepCount, String stepName, Exception error);

    /**
     * Called after the last step succeeded.
     */
    void onPipelineComplete(String pipelineName, long elapsedMs);
  }

  /**
   * Default progress listener that logs to SLF4J.
   */
  public static class LoggingProgressListener implements ProgressListener {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override public void onPipelineStart(String pipelineName, int stepCount) {
      LOG.info("Starting pipeline '{}' with {} steps", pipelineName, stepCount);
    }

    @Override public void onStepStart(int stepNum, int stepCount, String stepName) {
      LOG.info("Step {}/{} '{}' started", stepNum, stepCount, stepName);
    }

    @Override public void onStepComplete(int stepNum, int stepCount, String stepName,
        long elapsedMs, DataContainer output) {
      LOG.info("Step {}/{} '{}' finished in {} ms: {}", stepNum, stepCount, stepName,
          elapsedMs, output);
    }

    @Override public void onStepFailed(int stepNum, int stepCount, String stepName,
        Exception error) {
      LOG.error("Step {}/{} '{}' failed: {}", stepNum, stepCount, stepName, error.getMessage());
    }

    @Override public void onPipelineComplete(String pipelineName, long elapsedMs) {
      LOG.info("Pipeline '{}' completed in {} ms", pipelineName, elapsedMs);
    }
  }
}
