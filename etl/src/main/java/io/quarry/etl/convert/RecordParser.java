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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a delimited file into its header and raw field values.
 */
@FunctionalInterface
public interface RecordParser {

  /**
   * Parses a file.
   *
   * @param file Input file
   * @param delimiter Field delimiter, or null to choose by file extension
   * @throws io.quarry.etl.ConversionException If the file is malformed
   */
  RawRecords parse(Path file, @Nullable Character delimiter) throws IOException;
}
