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

import java.io.IOException;

/**
 * One stage of a {@link Pipeline}.
 */
public interface PipelineStep {

  /**
   * Runs the step.
   *
   * @param input Output of the previous step, or an empty container for the first step
   * @param forceRecompute Whether cached results must be ignored
   * @return Output passed to the next step
   * @throws IllegalArgumentException If the input is of a kind this step cannot consume
   */
  DataContainer execute(DataContainer input, boolean forceRecompute) throws IOException;

  /**
   * Returns a name for progress reporting.
   */
  String getName();
}
