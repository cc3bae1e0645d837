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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Fetches the files of a Kaggle dataset through the Kaggle REST API.
 *
 * <p>The dataset listing is filtered by the configured glob patterns. Kaggle
 * serves large files compressed; a download that starts with the zip
 * signature is unpacked into the staging directory.
 */
public class KaggleDataSource extends AbstractDataSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(KaggleDataSource.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final byte[] ZIP_SIGNATURE = {0x50, 0x4b, 0x03, 0x04};

  private final KaggleSourceConfig config;
  private final KaggleCredentials credentials;

  public KaggleDataSource(KaggleSourceConfig config, Path destination) throws IOException {
    this(config, destination, KaggleCredentials.resolve(credentialsPath(config)));
  }

  public KaggleDataSource(KaggleSourceConfig config, Path destination,
      KaggleCredentials credentials) throws IOException {
    super(destination);
    this.config = config;
    this.credentials = credentials;
  }

  @Override public String getType() {
    return "kaggle";
  }

  public KaggleSourceConfig getConfig() {
    return config;
  }

  @Override protected List<String> getFilePatterns() {
    return config.getFilePatterns();
  }

  @Override protected boolean checkRemoteFreshness() {
    return config.isCheckRemoteFreshness();
  }

  @Override protected String describeRemote() {
    return "kaggle:" + config.getOwner() + "/" + config.getDataset();
  }

  @Override protected void addSourceIdentity(CacheKey.Builder key) {
    super.addSourceIdentity(key);
    key.add("datasetVersion", config.getDatasetVersion()).add("baseUrl", config.getBaseUrl());
  }

  @Override protected List<RemoteFile> listRemoteFiles() throws IOException {
    String url = config.getBaseUrl() + "/datasets/list/" + encode(config.getOwner()) + "/"
        + encode(config.getDataset()) + versionQuery();
    JsonNode root;
    HttpURLConnection conn = open(url);
    try {
      try (InputStream in = conn.getInputStream()) {
        root = MAPPER.readTree(in);
      } catch (IOException e) {
        throw new SourceUnavailableException("Failed to read Kaggle listing of "
            + describeRemote() + ": " + e.getMessage(), e);
      }
    } finally {
      conn.disconnect();
    }

    JsonNode datasetFiles = root == null ? null : root.get("datasetFiles");
    if (datasetFiles == null || !datasetFiles.isArray()) {
      throw new SourceUnavailableException("Unexpected Kaggle listing for "
          + describeRemote() + ": no 'datasetFiles' array");
    }
    List<RemoteFile> files = new ArrayList<RemoteFile>();
    for (JsonNode file : datasetFiles) {
      String name = file.path("name").asText(null);
      if (name == null || name.isEmpty()) {
        continue;
      }
      String localName = Paths.get(name).getFileName().toString();
      if (!matchesAny(localName, config.getFilePatterns())) {
        continue;
      }
      long size = file.path("totalBytes").asLong(-1);
      files.add(new RemoteFile(localName, name, size,
          parseCreationDate(file.path("creationDate").asText(null))));
    }
    LOGGER.debug("Kaggle listing of {} has {} matching file(s)", describeRemote(),
        files.size());
    return files;
  }

  @Override protected List<Path> download(RemoteFile file, Path stagingDirectory)
      throws IOException {
    StringBuilder url = new StringBuilder(config.getBaseUrl())
        .append("/datasets/download/").append(encode(config.getOwner()))
        .append('/').append(encode(config.getDataset()));
    for (String segment : file.getLocation().split("/")) {
      url.append('/').append(encode(segment));
    }
    url.append(versionQuery());

    Path payload = stagingDirectory.resolve(file.getName() + ".download");
    HttpURLConnection conn = open(url.toString());
    try {
      try (InputStream in = conn.getInputStream()) {
        Files.copy(in, payload, StandardCopyOption.REPLACE_EXISTING);
      } catch (IOException e) {
        throw new SourceUnavailableException("Failed to download " + file.getLocation()
            + " from " + describeRemote() + ": " + e.getMessage(), e);
      }
    } finally {
      conn.disconnect();
    }

    if (isZip(payload)) {
      List<Path> extracted = unzip(payload, stagingDirectory);
      Files.delete(payload);
      if (extracted.isEmpty()) {
        throw new PartialFetchException("Archive for " + file.getLocation() + " from "
            + describeRemote() + " contains no files");
      }
      LOGGER.debug("Extracted {} file(s) from download of {}", extracted.size(),
          file.getLocation());
      return extracted;
    }
    Path target = stagingDirectory.resolve(file.getName());
    Files.move(payload, target, StandardCopyOption.REPLACE_EXISTING);
    LOGGER.debug("Downloaded {} to {}", file.getLocation(), target);
    return Collections.singletonList(target);
  }

  /**
   * Listed sizes are uncompressed sizes and archives may expand to other file
   * names, so only a non-empty result is required.
   */
  @Override protected void verifyDownload(List<RemoteFile> remoteFiles, List<Path> staged)
      throws IOException {
    if (staged.isEmpty()) {
      throw new PartialFetchException("Fetch from " + describeRemote() + " produced no files");
    }
  }

  private HttpURLConnection open(String url) throws IOException {
    HttpURLConnection conn = (HttpURLConnection) new URL(url).openConnection();
    conn.setConnectTimeout(config.getConnectTimeoutMs());
    conn.setReadTimeout(config.getReadTimeoutMs());
    String auth = credentials.getUsername() + ":" + credentials.getKey();
    conn.setRequestProperty("Authorization", "Basic "
        + Base64.getEncoder().encodeToString(auth.getBytes(StandardCharsets.UTF_8)));

    int responseCode;
    try {
      responseCode = conn.getResponseCode();
    } catch (IOException e) {
      conn.disconnect();
      throw new SourceUnavailableException("Kaggle API unreachable at " + url + ": "
          + e.getMessage(), e);
    }
    LOGGER.debug("GET {} -> {}", url, responseCode);
    if (responseCode < 200 || responseCode >= 300) {
      conn.disconnect();
      switch (responseCode) {
        case HttpURLConnection.HTTP_UNAUTHORIZED:
        case HttpURLConnection.HTTP_FORBIDDEN:
          throw new SourceUnavailableException("Kaggle API returned HTTP " + responseCode
              + " for " + url + ": check the credentials of user " + credentials.getUsername());
        case HttpURLConnection.HTTP_NOT_FOUND:
          throw new SourceUnavailableException("Kaggle API returned HTTP 404 for " + url
              + ": dataset or file not found");
        default:
          throw new SourceUnavailableException("Kaggle API returned HTTP " + responseCode
              + " for " + url);
      }
    }
    return conn;
  }

  private String versionQuery() {
    Integer version = config.getDatasetVersion();
    return version == null ? "" : "?datasetVersionNumber=" + version;
  }

  private static boolean isZip(Path file) throws IOException {
    byte[] header = new byte[ZIP_SIGNATURE.length];
    try (InputStream in = Files.newInputStream(file)) {
      int read = 0;
      while (read < header.length) {
        int n = in.read(header, read, header.length - read);
        if (n < 0) {
          return false;
        }
        read += n;
      }
    }
    for (int i = 0; i < header.length; i++) {
      if (header[i] != ZIP_SIGNATURE[i]) {
        return false;
      }
    }
    return true;
  }

  private static List<Path> unzip(Path archive, Path directory) throws IOException {
    List<Path> extracted = new ArrayList<Path>();
    try (ZipInputStream zip =
             new ZipInputStream(new BufferedInputStream(Files.newInputStream(archive)))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        if (entry.isDirectory()) {
          continue;
        }
        // Entries are flattened; the name keeps only its last segment
        Path name = Paths.get(entry.getName()).getFileName();
        if (name == null || name.toString().startsWith(".")) {
          continue;
        }
        Path target = directory.resolve(name.toString()).normalize();
        if (!directory.equals(target.getParent())) {
          throw new PartialFetchException("Refusing to extract " + entry.getName()
              + " outside of " + directory);
        }
        Files.copy(zip, target, StandardCopyOption.REPLACE_EXISTING);
        extracted.add(target);
      }
    }
    return extracted;
  }

  private static long parseCreationDate(@Nullable String value) {
    if (value == null || value.isEmpty()) {
      return 0;
    }
    String trimmed = value;
    int dot = trimmed.indexOf('.');
    if (dot > 0) {
      trimmed = trimmed.substring(0, dot);
    }
    if (trimmed.endsWith("Z")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    try {
      return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC).toEpochMilli();
    } catch (DateTimeParseException e) {
      LOGGER.debug("Unparseable Kaggle creationDate '{}'", value);
      return 0;
    }
  }

  private static String encode(String segment) {
    try {
      return URLEncoder.encode(segment, "UTF-8").replace("+", "%20");
    } catch (UnsupportedEncodingException e) {
      throw new IllegalStateException(e);
    }
  }

  private static @Nullable Path credentialsPath(KaggleSourceConfig config) {
    String file = config.getCredentialsFile();
    if (file == null) {
      return null;
    }
    if (file.startsWith("~/")) {
      return Paths.get(System.getProperty("user.home"), file.substring(2));
    }
    return Paths.get(file);
  }
}
