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
package io.quarry.etl.export;

import io.quarry.etl.cache.FileContentFingerprinter;
import io.quarry.etl.storage.OutputDirectory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Record of the files exported into a directory, keyed by file name.
 *
 * <p>Each entry holds the export key the file was written under, and its
 * size and SHA-256 right after the write.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportManifest {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExportManifest.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** File name of the manifest inside the export directory. */
  public static final String FILE_NAME = ".quarry-export.json";

  @JsonProperty("files")
  public Map<String, Entry> files = new TreeMap<String, Entry>();

  /**
   * One exported file.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Entry {
    @JsonProperty("key")
    public String key;

    @JsonProperty("size")
    public long size;

    @JsonProperty("sha256")
    public String sha256;

    @JsonProperty("exportedAt")
    public long exportedAt;
  }

  /**
   * Loads the manifest of a directory. A missing or unreadable manifest
   * yields an empty one.
   */
  static ExportManifest load(OutputDirectory directory) throws IOException {
    Path file = directory.resolve(FILE_NAME);
    if (!Files.isRegularFile(file)) {
      return new ExportManifest();
    }
    try {
      ExportManifest manifest = MAPPER.readValue(file.toFile(), ExportManifest.class);
      if (manifest == null || manifest.files == null) {
        LOGGER.warn("Ignoring incomplete export manifest {}", file);
        return new ExportManifest();
      }
      return manifest;
    } catch (JsonProcessingException e) {
      LOGGER.warn("Ignoring unreadable export manifest {}: {}", file, e.getOriginalMessage());
      return new ExportManifest();
    }
  }

  void save(OutputDirectory directory) throws IOException {
    directory.writeAtomically(FILE_NAME, target -> MAPPER.writeValue(target.toFile(), this));
  }

  /**
   * Returns whether a file was written under the given key and is unchanged
   * since.
   */
  boolean isCurrent(OutputDirectory directory, String fileName, String key)
      throws IOException {
    Entry entry = files.get(fileName);
    if (entry == null || !key.equals(entry.key)) {
      return false;
    }
    Path file = directory.resolve(fileName);
    if (!Files.isRegularFile(file) || Files.size(file) != entry.size) {
      LOGGER.debug("Exported file {} is missing or changed size", file);
      return false;
    }
    return FileContentFingerprinter.contentHash(file).equals(entry.sha256);
  }

  void record(String fileName, String key, Path file) throws IOException {
    Entry entry = new Entry();
    entry.key = key;
    entry.size = Files.size(file);
    entry.sha256 = FileContentFingerprinter.contentHash(file);
    entry.exportedAt = System.currentTimeMillis();
    files.put(fileName, entry);
  }
}
