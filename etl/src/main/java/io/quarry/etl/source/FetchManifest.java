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

import io.quarry.etl.cache.FileContentFingerprinter;
import io.quarry.etl.storage.OutputDirectory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Record of a completed fetch, stored in the destination directory.
 *
 * <p>The manifest is written only after every file of a fetch is in place,
 * so its presence marks a complete result. It lists each local file with its
 * size and SHA-256, and the remote listing the fetch was made from. The
 * source key ties it to the source configuration that wrote it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FetchManifest {

  private static final Logger LOGGER = LoggerFactory.getLogger(FetchManifest.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** File name of the manifest inside the destination directory. */
  public static final String FILE_NAME = ".quarry-fetch.json";

  @JsonProperty("sourceType")
  public String sourceType;

  @JsonProperty("sourceKey")
  public @Nullable String sourceKey;

  @JsonProperty("fetchedAt")
  public long fetchedAt;

  @JsonProperty("files")
  public List<FileEntry> files = new ArrayList<FileEntry>();

  @JsonProperty("remote")
  public List<RemoteEntry> remote = new ArrayList<RemoteEntry>();

  /**
   * Local file written by a fetch.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class FileEntry {
    @JsonProperty("name")
    public String name;

    @JsonProperty("size")
    public long size;

    @JsonProperty("sha256")
    public String sha256;
  }

  /**
   * Remote file a fetch was made from.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class RemoteEntry {
    @JsonProperty("name")
    public String name;

    @JsonProperty("location")
    public String location;

    @JsonProperty("size")
    public long size;

    @JsonProperty("lastModified")
    public long lastModified;
  }

  /**
   * Builds a manifest for files already in their final location.
   */
  static FetchManifest create(String sourceType, String sourceKey, List<Path> localFiles,
      List<RemoteFile> remoteFiles) throws IOException {
    FetchManifest manifest = new FetchManifest();
    manifest.sourceType = sourceType;
    manifest.sourceKey = sourceKey;
    manifest.fetchedAt = System.currentTimeMillis();
    for (Path file : localFiles) {
      FileEntry entry = new FileEntry();
      entry.name = file.getFileName().toString();
      entry.size = Files.size(file);
      entry.sha256 = FileContentFingerprinter.contentHash(file);
      manifest.files.add(entry);
    }
    for (RemoteFile remoteFile : remoteFiles) {
      RemoteEntry entry = new RemoteEntry();
      entry.name = remoteFile.getName();
      entry.location = remoteFile.getLocation();
      entry.size = remoteFile.getSize();
      entry.lastModified = remoteFile.getLastModified();
      manifest.remote.add(entry);
    }
    return manifest;
  }

  /**
   * Loads the manifest of a directory.
   *
   * @return The manifest, or null if there is none or it cannot be parsed
   */
  static @Nullable FetchManifest load(OutputDirectory directory) throws IOException {
    Path file = directory.resolve(FILE_NAME);
    if (!Files.isRegularFile(file)) {
      return null;
    }
    try {
      FetchManifest manifest = MAPPER.readValue(file.toFile(), FetchManifest.class);
      if (manifest == null || manifest.files == null || manifest.remote == null) {
        LOGGER.warn("Ignoring incomplete fetch manifest {}", file);
        return null;
      }
      return manifest;
    } catch (JsonProcessingException e) {
      LOGGER.warn("Ignoring unreadable fetch manifest {}: {}", file, e.getOriginalMessage());
      return null;
    }
  }

  /**
   * Writes the manifest atomically into the directory.
   */
  void save(OutputDirectory directory) throws IOException {
    directory.writeAtomically(FILE_NAME, target -> MAPPER.writeValue(target.toFile(), this));
  }

  /**
   * Returns whether every listed file exists in the directory with the
   * recorded size and content hash.
   */
  boolean isSatisfiedBy(OutputDirectory directory) throws IOException {
    for (FileEntry entry : files) {
      if (entry == null || entry.name == null) {
        return false;
      }
      Path file = directory.resolve(entry.name);
      if (!Files.isRegularFile(file) || Files.size(file) != entry.size) {
        LOGGER.debug("Fetched file {} is missing or changed size", file);
        return false;
      }
      if (!FileContentFingerprinter.contentHash(file).equals(entry.sha256)) {
        LOGGER.debug("Fetched file {} changed content", file);
        return false;
      }
    }
    return true;
  }

  /**
   * Returns whether a remote listing is the one this manifest was made from,
   * compared by name, size and modification time.
   */
  boolean matchesRemote(List<RemoteFile> listing) {
    if (listing.size() != remote.size()) {
      return false;
    }
    Map<String, RemoteEntry> byName = new HashMap<String, RemoteEntry>();
    for (RemoteEntry entry : remote) {
      byName.put(entry.name, entry);
    }
    for (RemoteFile file : listing) {
      RemoteEntry entry = byName.get(file.getName());
      if (entry == null || entry.size != file.getSize()
          || entry.lastModified != file.getLastModified()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the local file names, sorted.
   */
  List<String> getFileNames() {
    List<String> names = new ArrayList<String>(files.size());
    for (FileEntry entry : files) {
      names.add(entry.name);
    }
    Collections.sort(names);
    return names;
  }
}
