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
import io.quarry.etl.storage.OutputDirectory;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Disk cache of computed artifacts inside an {@link OutputDirectory}, bounded
 * by a least-recently-used policy.
 *
 * <p>Each entry is one file named {@code <key>.<suffix>}. Entries are written
 * through {@link OutputDirectory#writeAtomically}, so a failed computation or
 * a crash mid-write never leaves a readable partial artifact. Entries that
 * fail validation on read are deleted and recomputed.
 *
 * <p>On construction, existing entries are registered in modification-time
 * order and the oldest are evicted beyond {@code maxEntries}.
 *
 * @param <T> Type of cached value
 */
public class ArtifactCache<T> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactCache.class);

  private static final Pattern KEY_PATTERN = Pattern.compile("^[0-9a-f]{64}$");

  private final OutputDirectory directory;
  private final CacheHandler<T> handler;
  private final int maxEntries;
  private final LinkedHashMap<String, Boolean> entries;

  public ArtifactCache(OutputDirectory directory, CacheHandler<T> handler, int maxEntries)
      throws IOException {
    if (maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be at least 1, got " + maxEntries);
    }
    this.directory = directory;
    this.handler = handler;
    this.maxEntries = maxEntries;
    this.entries = new LinkedHashMap<String, Boolean>(16, 0.75f, true);
    loadExistingEntries();
  }

  /**
   * Returns the cached value for a key, or computes, stores and returns it.
   *
   * <p>With {@code forceRecompute} the cached value is ignored and replaced.
   * The value returned after a computation is read back from the stored file,
   * so a cache hit later returns an equal value.
   *
   * @param key Cache key
   * @param computation Produces the value on a miss
   * @param forceRecompute Whether to bypass a cached value
   * @return Cached or freshly computed value
   */
  public synchronized T execute(CacheKey key, Computation<T> computation, boolean forceRecompute)
      throws IOException {
    String keyString = key.asString();
    if (forceRecompute) {
      LOGGER.info("Force cache refresh for {}: computing", key);
    } else {
      T cached = load(keyString);
      if (cached != null) {
        LOGGER.info("Cache hit for {}: using cached output", key);
        return cached;
      }
      LOGGER.info("Cache miss for {}: computing", key);
    }

    T output = computation.compute();
    store(keyString, output);
    T stored = load(keyString);
    if (stored == null) {
      throw new IOException("Cache entry for " + key + " was not readable after writing");
    }
    return stored;
  }

  /**
   * Returns whether an entry for the key is registered.
   */
  public synchronized boolean contains(CacheKey key) {
    return entries.containsKey(key.asString());
  }

  /**
   * Returns the file an entry for the key is stored in.
   */
  public Path getCacheFile(CacheKey key) {
    return cacheFile(key.asString());
  }

  /**
   * Returns registered keys from least to most recently used.
   */
  public synchronized List<String> getKeys() {
    return Collections.unmodifiableList(new ArrayList<String>(entries.keySet()));
  }

  public int getMaxEntries() {
    return maxEntries;
  }

  private @Nullable T load(String keyString) throws IOException {
    Path file = cacheFile(keyString);
    if (!Files.isRegularFile(file)) {
      entries.remove(keyString);
      return null;
    }
    // get() also marks the entry as most recently used
    if (entries.get(keyString) == null) {
      // Written by another instance sharing the directory
      evictUntilBelow(maxEntries);
      entries.put(keyString, Boolean.TRUE);
    }
    try {
      return handler.read(file);
    } catch (CacheCorruptionException e) {
      LOGGER.warn("Discarding corrupt cache entry {}: {}", file.getFileName(), e.getMessage());
      entries.remove(keyString);
      Files.deleteIfExists(file);
      return null;
    }
  }

  private void store(String keyString, T output) throws IOException {
    if (!entries.containsKey(keyString)) {
      evictUntilBelow(maxEntries);
    }
    directory.writeAtomically(fileName(keyString), target -> handler.write(target, output));
    entries.put(keyString, Boolean.TRUE);
  }

  private void evictUntilBelow(int limit) throws IOException {
    Iterator<String> it = entries.keySet().iterator();
    while (entries.size() >= limit && it.hasNext()) {
      String oldest = it.next();
      it.remove();
      Files.deleteIfExists(cacheFile(oldest));
      LOGGER.debug("Evicted cache entry {}", oldest);
    }
  }

  private void loadExistingEntries() throws IOException {
    String suffix = "." + handler.getSuffix();
    List<Path> files = new ArrayList<Path>();
    for (Path file : directory.listFiles("*" + suffix)) {
      String name = file.getFileName().toString();
      if (KEY_PATTERN.matcher(name.substring(0, name.length() - suffix.length())).matches()) {
        files.add(file);
      }
    }
    final Map<Path, FileTime> modified = new LinkedHashMap<Path, FileTime>();
    for (Path file : files) {
      modified.put(file, Files.getLastModifiedTime(file));
    }
    files.sort(Comparator.comparing(modified::get));

    for (Path file : files) {
      if (entries.size() >= maxEntries) {
        evictUntilBelow(maxEntries);
      }
      String name = file.getFileName().toString();
      entries.put(name.substring(0, name.length() - suffix.length()), Boolean.TRUE);
    }
    if (!entries.isEmpty()) {
      LOGGER.debug("Registered {} existing cache entries in {}", entries.size(), directory);
    }
  }

  private String fileName(String keyString) {
    return keyString + "." + handler.getSuffix();
  }

  private Path cacheFile(String keyString) {
    return directory.resolve(fileName(keyString));
  }

  /**
   * Produces a value on a cache miss.
   *
   * @param <T> Type of value
   */
  @FunctionalInterface
  public interface Computation<T> {
    T compute() throws IOException;
  }
}
