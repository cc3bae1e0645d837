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
package io.quarry.etl.cache;

import io.quarry.etl.CacheCorruptionException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serializes cached values of one type to and from files.
 *
 * @param <T> Type of cached value
 */
public interface CacheHandler<T> {

  /**
   * Returns the file suffix of cache files, without a leading dot.
   */
  String getSuffix();

  /**
   * Writes a value to a file.
   */
  void write(Path file, T value) throws IOException;

  /**
   * Reads a value written by {@link #write}.
   *
   * @throws CacheCorruptionException If the file does not hold a valid value
   * @throws IOException If the file cannot be read
   */
  T read(Path file) throws IOException;
}
