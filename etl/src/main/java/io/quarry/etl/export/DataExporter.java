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

import io.quarry.etl.table.ColumnarTable;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a table to its final location.
 */
public interface DataExporter {

  /**
   * Writes the table unless the target already holds it.
   *
   * <p>Without {@code forceRecompute} the write is skipped if the target file
   * exists unchanged since it was last written by this exporter and the table
   * and the export settings are the same as then.
   *
   * @param table Table to export
   * @param forceRecompute Whether to write even if the target is up to date
   * @return The exported file
   */
  Path export(ColumnarTable table, boolean forceRecompute) throws IOException;

  /**
   * Returns the file this exporter writes.
   */
  Path getTarget();
}
