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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Map;
import java.util.Set;

/**
 * Kaggle API user name and key.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>an explicitly configured credentials file;</li>
 *   <li>the {@code KAGGLE_USERNAME} and {@code KAGGLE_KEY} environment variables;</li>
 *   <li>{@code ~/.kaggle/kaggle.json}.</li>
 * </ol>
 * A credentials file is a JSON object with {@code username} and {@code key}.
 */
public final class KaggleCredentials {

  private static final Logger LOGGER = LoggerFactory.getLogger(KaggleCredentials.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static final String ENV_USERNAME = "KAGGLE_USERNAME";
  static final String ENV_KEY = "KAGGLE_KEY";

  private final String username;
  private final String key;

  public KaggleCredentials(String username, String key) {
    if (username == null || username.isEmpty() || key == null || key.isEmpty()) {
      throw new IllegalArgumentException("Kaggle username and key cannot be empty");
    }
    this.username = username;
    this.key = key;
  }

  public String getUsername() {
    return username;
  }

  public String getKey() {
    return key;
  }

  /**
   * Resolves credentials from the process environment and home directory.
   *
   * @param credentialsFile Explicit credentials file, or null
   */
  public static KaggleCredentials resolve(@Nullable Path credentialsFile) throws IOException {
    return resolve(credentialsFile, System.getenv(),
        Paths.get(System.getProperty("user.home"), ".kaggle", "kaggle.json"));
  }

  static KaggleCredentials resolve(@Nullable Path credentialsFile, Map<String, String> env,
      Path defaultFile) throws IOException {
    if (credentialsFile != null) {
      LOGGER.debug("Reading Kaggle credentials from {}", credentialsFile);
      return fromFile(credentialsFile);
    }
    String username = env.get(ENV_USERNAME);
    String key = env.get(ENV_KEY);
    if (username != null && !username.isEmpty() && key != null && !key.isEmpty()) {
      LOGGER.debug("Using Kaggle credentials from {} and {}", ENV_USERNAME, ENV_KEY);
      return new KaggleCredentials(username, key);
    }
    LOGGER.debug("Kaggle credentials not set in environment, trying {}", defaultFile);
    return fromFile(defaultFile);
  }

  /**
   * Reads credentials from a JSON file.
   *
   * @throws SourceUnavailableException If the file is missing or incomplete
   */
  public static KaggleCredentials fromFile(Path file) throws IOException {
    if (!Files.exists(file)) {
      throw new SourceUnavailableException("Kaggle credentials file " + file
          + " does not exist");
    }
    if (!Files.isRegularFile(file)) {
      throw new SourceUnavailableException("Kaggle credentials file " + file
          + " is not a regular file");
    }
    warnIfReadableByOthers(file);

    JsonNode root;
    try {
      root = MAPPER.readTree(file.toFile());
    } catch (JsonProcessingException e) {
      throw new SourceUnavailableException("Kaggle credentials file " + file
          + " is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.hasNonNull("username") || !root.hasNonNull("key")) {
      throw new SourceUnavailableException("Kaggle credentials file " + file
          + " must contain 'username' and 'key'");
    }
    return new KaggleCredentials(root.get("username").asText(), root.get("key").asText());
  }

  private static void warnIfReadableByOthers(Path file) throws IOException {
    Set<PosixFilePermission> permissions;
    try {
      permissions = Files.getPosixFilePermissions(file);
    } catch (UnsupportedOperationException e) {
      return;
    }
    if (permissions.contains(PosixFilePermission.OTHERS_READ)
        || permissions.contains(PosixFilePermission.GROUP_READ)) {
      LOGGER.warn("Kaggle credentials in {} are readable by other users. "
          + "Run 'chmod 600 {}' to fix this.", file, file);
    }
  }

  @Override public String toString() {
    return "KaggleCredentials{username=" + username + "}";
  }
}
