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

import io.quarry.etl.SourceUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fetches the matching top-level files of a local or mounted directory.
 */
public class LocalDirectoryDataSource extends AbstractDataSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalDirectoryDataSource.class);

  private final LocalSourceConfig config;
  private final Path sourceDirectory;

  public LocalDirectoryDataSource(LocalSourceConfig config, Path destination)
      throws IOException {
    super(destination);
    this.config = config;
    this.sourceDirectory = Paths.get(config.getPath()).toAbsolutePath().normalize();
    if (sourceDirectory.equals(getDestination())) {
      throw new IllegalArgumentException("Source and destination directory are the same: "
          + sourceDirectory);
    }
  }

  @Override public String getType() {
    return "local";
  }

  @Override protected List<String> getFilePatterns() {
    return config.getFilePatterns();
  }

  @Override protected boolean checkRemoteFreshness() {
    return config.isCheckRemoteFreshness();
  }

  @Override protected String describeRemote() {
    return "file://" + sourceDirectory;
  }

  @Override protected List<RemoteFile> listRemoteFiles() throws IOException {
    if (!Files.isDirectory(sourceDirectory)) {
      throw new SourceUnavailableException("Source directory " + sourceDirectory
          + " does not exist");
    }
    List<RemoteFile> files = new ArrayList<RemoteFile>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(sourceDirectory)) {
      for (Path entry : stream) {
        String name = entry.getFileName().toString();
        if (!Files.isRegularFile(entry) || !matchesAny(name, config.getFilePatterns())) {
          continue;
        }
        files.add(new RemoteFile(name, entry.toString(), Files.size(entry),
            Files.getLastModifiedTime(entry).toMillis()));
      }
    }
    Collections.sort(files, (a, b) -> a.getName().compareTo(b.getName()));
    return files;
  }

  @Override protected List<Path> download(RemoteFile file, Path stagingDirectory)
      throws IOException {
    Path target = stagingDirectory.resolve(file.getName());
    try {
      Files.copy(Paths.get(file.getLocation()), target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new SourceUnavailableException("Failed to copy " + file.getLocation() + ": "
          + e.getMessage(), e);
    }
    LOGGER.debug("Copied {} to {}", file.getLocation(), target);
    return Collections.singletonList(target);
  }
}
