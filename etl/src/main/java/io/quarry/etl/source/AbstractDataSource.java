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

import io.quarry.etl.PartialFetchException;
import io.quarry.etl.SourceUnavailableException;
import io.quarry.etl.cache.CacheKey;
import io.quarry.etl.storage.OutputDirectory;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Base class for data sources that download files into a destination
 * directory.
 *
 * <p>A fetch proceeds as follows:
 * <ol>
 *   <li>Unless forced, the fetch manifest of the destination is checked. If
 *       it was written for the same source key and every file it lists is
 *       present with the recorded size and checksum, those files are returned
 *       without contacting the remote.</li>
 *   <li>The remote is listed and every file is downloaded into a staging
 *       subdirectory.</li>
 *   <li>The download is verified against the listing.</li>
 *   <li>Files of the previous fetch are moved aside, the staged files are
 *       moved into place and the manifest is written. If that fails, the new
 *       files are removed and the previous ones are put back.</li>
 * </ol>
 *
 * <p>The staging directory is always removed. A failed fetch therefore never
 * leaves a partial result that a later fetch would accept.
 *
 * <p>The source key is a {@link CacheKey} over the source type, the remote
 * location and the file patterns. Subclasses add whatever else decides which
 * files a fetch produces via {@link #addSourceIdentity(CacheKey.Builder)}.
 */
public abstract class AbstractDataSource implements DataSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractDataSource.class);

  static final String STAGING_PREFIX = ".staging-";
  static final String BACKUP_PREFIX = ".previous-";

  protected final OutputDirectory destination;

  protected AbstractDataSource(Path destination) throws IOException {
    this.destination = new OutputDirectory(destination);
  }

  @Override public Path getDestination() {
    return destination.getPath();
  }

  @Override public List<Path> fetch(boolean forceRecompute) throws IOException {
    String sourceKey = getSourceKey();
    List<RemoteFile> remoteFiles = null;
    if (forceRecompute) {
      LOGGER.info("Force fetch from {}: clearing previous files in {}", describeRemote(),
          destination);
      clearPrevious();
    } else {
      FetchManifest manifest = FetchManifest.load(destination);
      if (manifest != null && !sourceKey.equals(manifest.sourceKey)) {
        LOGGER.info("Cache miss: previous fetch in {} was made for another source than {}",
            destination, describeRemote());
      } else if (manifest != null && manifest.isSatisfiedBy(destination)) {
        if (checkRemoteFreshness()) {
          remoteFiles = listMatchingRemoteFiles();
          if (manifest.matchesRemote(remoteFiles)) {
            return cacheHit(manifest);
          }
          LOGGER.info("Remote listing of {} changed since last fetch", describeRemote());
        } else {
          return cacheHit(manifest);
        }
      } else {
        LOGGER.info("Cache miss: no valid prior fetch of {} in {}", describeRemote(),
            destination);
      }
    }

    if (remoteFiles == null) {
      remoteFiles = listMatchingRemoteFiles();
    }
    LOGGER.info("Fetching {} file(s) from {} into {}", remoteFiles.size(), describeRemote(),
        destination);

    Path staging = Files.createDirectory(
        destination.resolve(STAGING_PREFIX + UUID.randomUUID()));
    Path backup = null;
    boolean keepBackup = false;
    try {
      List<Path> staged = downloadAll(remoteFiles, staging);
      verifyDownload(remoteFiles, staged);
      checkUniqueNames(staged);

      backup = Files.createDirectory(destination.resolve(BACKUP_PREFIX + UUID.randomUUID()));
      List<Path> displaced = new ArrayList<Path>();
      List<Path> result = new ArrayList<Path>(staged.size());
      try {
        displacePrevious(backup, displaced);
        for (Path file : staged) {
          Path target = destination.resolve(file.getFileName().toString());
          Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
          result.add(target);
        }
        Collections.sort(result);
        FetchManifest.create(getType(), sourceKey, result, remoteFiles).save(destination);
      } catch (IOException | RuntimeException e) {
        LOGGER.warn("Failed to install files fetched from {} into {}, restoring previous files",
            describeRemote(), destination);
        keepBackup = !restorePrevious(backup, displaced, result, e);
        throw e;
      }
      LOGGER.info("Fetched {} file(s) from {}", result.size(), describeRemote());
      return result;
    } finally {
      deleteDirectory(staging);
      if (backup != null) {
        if (keepBackup) {
          LOGGER.error("Previous files of {} could not all be restored and remain in {}",
              destination, backup);
        } else {
          deleteDirectory(backup);
        }
      }
    }
  }

  /**
   * Returns the key identifying which files this source fetches. A manifest
   * written under another key is never reused.
   */
  public final String getSourceKey() {
    CacheKey.Builder key = CacheKey.builder(getType() + ".fetch");
    addSourceIdentity(key);
    return key.build().asString();
  }

  /**
   * Adds the configuration that decides the fetched files to the source key.
   * Overrides must call this implementation.
   */
  protected void addSourceIdentity(CacheKey.Builder key) {
    List<String> patterns = new ArrayList<String>(getFilePatterns());
    Collections.sort(patterns);
    key.add("remote", describeRemote()).add("filePatterns", patterns);
  }

  /**
   * Lists the files to download.
   *
   * @throws SourceUnavailableException If the remote cannot be listed
   */
  protected abstract List<RemoteFile> listRemoteFiles() throws IOException;

  /**
   * Downloads one remote file into the staging directory.
   *
   * @return Files written to the staging directory, usually exactly one
   */
  protected abstract List<Path> download(RemoteFile file, Path stagingDirectory)
      throws IOException;

  /**
   * Returns the glob patterns a file name must match to be fetched.
   */
  protected abstract List<String> getFilePatterns();

  /**
   * Returns a short description of the remote for log and error messages.
   */
  protected abstract String describeRemote();

  /**
   * Whether a valid local result is compared to a fresh remote listing before
   * it is reused. Off by default, which makes a cache hit free of remote calls.
   */
  protected boolean checkRemoteFreshness() {
    return false;
  }

  /**
   * Downloads every file, one after the other.
   */
  protected List<Path> downloadAll(List<RemoteFile> files, Path stagingDirectory)
      throws IOException {
    List<Path> staged = new ArrayList<Path>();
    for (RemoteFile file : files) {
      staged.addAll(download(file, stagingDirectory));
    }
    return staged;
  }

  /**
   * Checks that every listed file was downloaded with its listed size.
   *
   * @throws PartialFetchException If a file is missing or has another size
   */
  protected void verifyDownload(List<RemoteFile> remoteFiles, List<Path> staged)
      throws IOException {
    Map<String, Path> byName = new HashMap<String, Path>();
    for (Path file : staged) {
      byName.put(file.getFileName().toString(), file);
    }
    for (RemoteFile remoteFile : remoteFiles) {
      Path file = byName.get(remoteFile.getName());
      if (file == null || !Files.isRegularFile(file)) {
        throw new PartialFetchException("Download of " + remoteFile.getLocation()
            + " from " + describeRemote() + " produced no file");
      }
      long size = Files.size(file);
      if (remoteFile.getSize() >= 0 && size != remoteFile.getSize()) {
        throw new PartialFetchException("Size mismatch for " + remoteFile.getLocation()
            + ": listed " + remoteFile.getSize() + " bytes, downloaded " + size);
      }
    }
  }

  /**
   * Returns whether a file name matches one of the glob patterns.
   */
  protected static boolean matchesAny(String fileName, List<String> patterns) {
    Path name = Paths.get(fileName);
    for (String pattern : patterns) {
      PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
      if (matcher.matches(name)) {
        return true;
      }
    }
    return false;
  }

  private List<RemoteFile> listMatchingRemoteFiles() throws IOException {
    List<RemoteFile> files = listRemoteFiles();
    if (files.isEmpty()) {
      throw new SourceUnavailableException("No files matching " + getFilePatterns()
          + " found at " + describeRemote());
    }
    return files;
  }

  private List<Path> cacheHit(FetchManifest manifest) {
    List<Path> files = new ArrayList<Path>();
    for (String name : manifest.getFileNames()) {
      files.add(destination.resolve(name));
    }
    LOGGER.info("Cache hit: reusing {} fetched file(s) of {} in {}", files.size(),
        describeRemote(), destination);
    return files;
  }

  /**
   * Removes the files of the previous fetch: everything its manifest lists,
   * every top-level file matching the source patterns and the manifest itself.
   */
  private void clearPrevious() throws IOException {
    for (Path file : collectPrevious()) {
      Files.deleteIfExists(file);
    }
  }

  /**
   * Moves the files of the previous fetch into a backup directory, recording
   * each original location in {@code displaced} as it goes.
   */
  private void displacePrevious(Path backup, List<Path> displaced) throws IOException {
    for (Path file : collectPrevious()) {
      if (Files.isRegularFile(file)) {
        Files.move(file, backup.resolve(file.getFileName().toString()));
        displaced.add(file);
      }
    }
  }

  /**
   * Removes newly installed files and moves displaced ones back.
   *
   * @return Whether every displaced file was restored
   */
  private boolean restorePrevious(Path backup, List<Path> displaced, List<Path> installed,
      Exception failure) {
    boolean restored = true;
    List<Path> newFiles = new ArrayList<Path>(installed);
    newFiles.add(destination.resolve(FetchManifest.FILE_NAME));
    for (Path file : newFiles) {
      try {
        Files.deleteIfExists(file);
      } catch (IOException e) {
        failure.addSuppressed(e);
      }
    }
    for (Path file : displaced) {
      try {
        Files.move(backup.resolve(file.getFileName().toString()), file,
            StandardCopyOption.REPLACE_EXISTING);
      } catch (IOException e) {
        failure.addSuppressed(e);
        restored = false;
      }
    }
    return restored;
  }

  private Set<Path> collectPrevious() throws IOException {
    Set<Path> files = new LinkedHashSet<Path>();
    @Nullable FetchManifest previous = FetchManifest.load(destination);
    if (previous != null) {
      for (String name : previous.getFileNames()) {
        Path file = destination.resolve(name);
        if (file.getParent().equals(destination.getPath())) {
          files.add(file);
        }
      }
    }
    for (String pattern : getFilePatterns()) {
      files.addAll(destination.listFiles(pattern));
    }
    files.add(destination.resolve(FetchManifest.FILE_NAME));
    return files;
  }

  private void checkUniqueNames(List<Path> staged) throws PartialFetchException {
    Set<String> names = new HashSet<String>();
    for (Path file : staged) {
      String name = file.getFileName().toString();
      if (!names.add(name)) {
        throw new PartialFetchException("Fetch from " + describeRemote()
            + " produced more than one file named " + name);
      }
    }
  }

  private static void deleteDirectory(Path directory) {
    try {
      MoreFiles.deleteRecursively(directory, RecursiveDeleteOption.ALLOW_INSECURE);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete working directory {}", directory, e);
    }
  }
}
