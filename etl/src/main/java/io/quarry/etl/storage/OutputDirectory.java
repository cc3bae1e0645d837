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
package io.quarry.etl.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A local directory owned by one data source or converter instance.
 *
 * <p>The directory, including missing parents, is created on construction.
 * Nothing in it is removed except through {@link #clear(String)}, which only
 * touches regular files at the top level.
 *
 * <p>No locking is done here. Owners that must support concurrent writers
 * wrap their critical sections in a {@link DirectoryLock}.
 */
public class OutputDirectory {

  private static final Logger LOGGER = LoggerFactory.getLogger(OutputDirectory.class);

  /** Glob matching every entry. */
  public static final String ALL = "*";

  private static final String TEMP_MARKER = ".tmp-";

  private final Path path;

  /**
   * Creates the directory and any missing parents. Idempotent if it exists.
   *
   * @param path Directory path
   * @throws IOException If the directory cannot be created, or the path exists
   *     and is not a directory
   */
  public OutputDirectory(Path path) throws IOException {
    this.path = path.toAbsolutePath().normalize();
    Files.createDirectories(this.path);
    LOGGER.debug("Output directory ready: {}", this.path);
  }

  public Path getPath() {
    return path;
  }

  /**
   * Resolves a file name against this directory.
   */
  public Path resolve(String fileName) {
    return path.resolve(fileName);
  }

  /**
   * Deletes every regular file at the top level.
   *
   * @return Number of deleted files
   */
  public int clear() throws IOException {
    return clear(ALL);
  }

  /**
   * Deletes the top-level regular files whose name matches a glob pattern.
   *
   * <p>Subdirectories are neither deleted nor descended into.
   *
   * @param pattern Glob pattern matched against the file name, e.g. {@code *.csv}
   * @return Number of deleted files
   */
  public int clear(String pattern) throws IOException {
    List<Path> matches = listFiles(pattern);
    for (Path file : matches) {
      Files.deleteIfExists(file);
    }
    if (!matches.isEmpty()) {
      LOGGER.debug("Cleared {} file(s) matching '{}' from {}", matches.size(), pattern, path);
    }
    return matches.size();
  }

  /**
   * Lists the top-level regular files whose name matches a glob, sorted by name.
   */
  public List<Path> listFiles(String pattern) throws IOException {
    PathMatcher matcher = path.getFileSystem().getPathMatcher("glob:" + pattern);
    List<Path> files = new ArrayList<Path>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(path)) {
      for (Path entry : stream) {
        if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
          continue;
        }
        if (matcher.matches(entry.getFileName())) {
          files.add(entry);
        }
      }
    }
    Collections.sort(files);
    return files;
  }

  /**
   * Writes a file so that readers see either the previous content or the
   * complete new content.
   *
   * <p>The callback writes to a temporary file in this directory, which is
   * then renamed over the target. If the callback fails the temporary file is
   * removed and the target is left untouched.
   *
   * @param fileName Target file name
   * @param callback Writes the content to the path it is given
   * @return The target path
   */
  public Path writeAtomically(String fileName, WriteCallback callback) throws IOException {
    Path target = path.resolve(fileName);
    Path tempFile = path.resolve(fileName + TEMP_MARKER + UUID.randomUUID());
    try {
      callback.write(tempFile);
      try {
        Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING,
            StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        LOGGER.debug("Atomic move not supported in {}, falling back to replace", path);
        Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tempFile);
    }
    return target;
  }

  @Override public String toString() {
    return path.toString();
  }

  /**
   * Writes content to the given path.
   */
  @FunctionalInterface
  public interface WriteCallback {
    void write(Path target) throws IOException;
  }
}
