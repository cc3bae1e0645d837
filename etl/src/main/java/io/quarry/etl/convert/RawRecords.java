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

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Header and unparsed field values of one delimited file.
 */
public final class RawRecords {

  private final Path source;
  private final List<String> header;
  private final List<String[]> rows;

  public RawRecords(Path source, List<String> header, List<String[]> rows) {
    this.source = source;
    this.header = Collections.unmodifiableList(header);
    this.rows = Collections.unmodifiableList(rows);
  }

  public Path getSource() {
    return source;
  }

  public List<String> getHeader() {
    return header;
  }

  /**
   * Returns the data rows. Every row has exactly one value per header column.
   */
  public List<String[]> getRows() {
    return rows;
  }
}
