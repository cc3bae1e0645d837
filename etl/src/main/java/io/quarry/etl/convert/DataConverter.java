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
package io.quarry.etl.convert;

import io.quarry.etl.table.ColumnarTable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Converts raw input files into a {@link ColumnarTable}.
 *
 * <p>Results are cached in the converter's output directory. A call with
 * the same input files (by content) and the same converter configuration
 * returns the cached table unless {@code forceRecompute} is set.
 */
public interface DataConverter {

  /**
   * Converts input files into one table holding the rows of all of them.
   *
   * @param inputPaths Input files; must exist and be readable
   * @param forceRecompute Ignore a cached result and convert again
   * @return Union of the converted inputs, in order of file name
   * @throws IllegalArgumentException If {@code inputPaths} is empty
   * @throws io.quarry.etl.UnsupportedFormatException If an input has an unsupported format
   * @throws io.quarry.etl.ConversionException If an input is missing or malformed
   */
  ColumnarTable convert(List<Path> inputPaths, boolean forceRecompute) throws IOException;

  default ColumnarTable convert(List<Path> inputPaths) throws IOException {
    return convert(inputPaths, false);
  }

  /**
   * Returns the directory converted tables are cached in.
   */
  Path getOutputDirectory();
}
