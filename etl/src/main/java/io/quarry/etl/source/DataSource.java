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
package io.quarry.etl.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Fetches raw data from an external source into a local destination directory.
 *
 * <p>The destination directory exists once the source is constructed. A
 * fetch that finds a complete, valid prior result in it returns that result
 * without contacting the remote, unless {@code forceRecompute} is set.
 *
 * <h3>Implementations</h3>
 * <ul>
 *   <li>{@link S3DataSource} - objects under an S3 bucket prefix</li>
 *   <li>{@link KaggleDataSource} - files of a Kaggle dataset</li>
 *   <li>{@link LocalDirectoryDataSource} - files of a local or mounted directory</li>
 * </ul>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * DataSource source = new S3DataSource(s3Config, Paths.get("data/raw"));
 * List<Path> files = source.fetch(false);
 * }</pre>
 *
 * @see AbstractDataSource
 */
public interface DataSource {

  /**
   * Populates the destination directory and returns the fetched files.
   *
   * @param forceRecompute Ignore any prior result and fetch again
   * @return Fetched files, sorted by file name
   * @throws io.quarry.etl.SourceUnavailableException If the remote cannot be reached
   * @throws io.quarry.etl.PartialFetchException If the remote returned incomplete data
   * @throws IOException If the destination directory cannot be written
   */
  List<Path> fetch(boolean forceRecompute) throws IOException;

  /**
   * Same as {@code fetch(false)}.
   */
  default List<Path> fetch() throws IOException {
    return fetch(false);
  }

  /**
   * Returns the destination directory.
   */
  Path getDestination();

  /**
   * Returns the source type identifier, e.g. "s3", "kaggle", "local".
   */
  String getType();
}
