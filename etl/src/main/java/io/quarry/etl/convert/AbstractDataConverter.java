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

import io.quarry.etl.ConversionException;
import io.quarry.etl.cache.ArtifactCache;
import io.quarry.etl.cache.CacheKey;
import io.quarry.etl.cache.FileContentFingerprinter;
import io.quarry.etl.cache.TableCacheHandler;
import io.quarry.etl.storage.DirectoryLock;
import io.quarry.etl.storage.OutputDirectory;
import io.quarry.etl.table.ColumnarTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Base class for converters whose output is cached by input content and
 * configuration.
 *
 * <p>The cache key of a call is built from the converter class, everything
 * {@link #addConfiguration} contributes and a SHA-256 fingerprint of the
 * input files. Subclasses only implement the conversion itself.
 */
public abstract class AbstractDataConverter implements DataConverter {

  static final long LOCK_TIMEOUT_MINUTES = 10;

  protected final OutputDirectory outputDirectory;
  private final ArtifactCache<ColumnarTable> cache;
  private final boolean lockDirectory;
  private final FileContentFingerprinter fingerprinter = new FileContentFingerprinter();

  /**
   * Creates the converter and its output directory.
   *
   * @param outputDirectory Directory converted tables are cached in
   * @param maxCacheEntries Number of cached tables kept, least recently used first out
   * @param lockDirectory Whether cache population holds a {@link DirectoryLock}
   */
  protected AbstractDataConverter(Path outputDirectory, int maxCacheEntries,
      boolean lockDirectory) throws IOException {
    this.outputDirectory = new OutputDirectory(outputDirectory);
    this.cache = new ArtifactCache<ColumnarTable>(this.outputDirectory, new TableCacheHandler(),
        maxCacheEntries);
    this.lockDirectory = lockDirectory;
  }

  @Override public Path getOutputDirectory() {
    return outputDirectory.getPath();
  }

  @Override public ColumnarTable convert(List<Path> inputPaths, boolean forceRecompute)
      throws IOException {
    if (inputPaths == null || inputPaths.isEmpty()) {
      throw new IllegalArgumentException("At least one input file is required");
    }
    final List<Path> inputs = new ArrayList<Path>(inputPaths);
    inputs.sort(Comparator.comparing((Path p) -> p.getFileName().toString())
        .thenComparing(Path::toString));
    for (Path input : inputs) {
      if (!Files.isRegularFile(input) || !Files.isReadable(input)) {
        throw new ConversionException("Input file does not exist or is not readable: " + input);
      }
    }
    validateInputs(inputs);

    CacheKey.Builder keyBuilder = CacheKey.builder(getClass().getSimpleName() + ".convert");
    addConfiguration(keyBuilder);
    keyBuilder.addFingerprint("inputs", inputs, fingerprinter);
    CacheKey key = keyBuilder.build();

    if (!lockDirectory) {
      return cache.execute(key, () -> doConvert(inputs), forceRecompute);
    }
    try (DirectoryLock lock = DirectoryLock.acquire(outputDirectory.getPath(),
        LOCK_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
      return cache.execute(key, () -> doConvert(inputs), forceRecompute);
    }
  }

  /**
   * Returns the cache backing this converter.
   */
  protected ArtifactCache<ColumnarTable> getCache() {
    return cache;
  }

  /**
   * Checks inputs before any cache lookup. The default accepts everything.
   *
   * @throws io.quarry.etl.UnsupportedFormatException If an input cannot be converted
   */
  protected void validateInputs(List<Path> inputs) throws IOException {
  }

  /**
   * Adds every setting that influences the output to the cache key.
   */
  protected abstract void addConfiguration(CacheKey.Builder keyBuilder);

  /**
   * Converts the inputs, sorted by file name. Called on a cache miss only.
   */
  protected abstract ColumnarTable doConvert(List<Path> inputs) throws IOException;
}
