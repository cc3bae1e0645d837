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

import io.quarry.etl.config.ConfigValues;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Configuration for {@link KaggleDataSource}.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * source:
 *   type: kaggle
 *   destination: data/raw
 *   owner: allen-institute-for-ai
 *   dataset: covid-19-masks-dataset
 *   filePatterns: ["*.csv"]
 *   datasetVersion: 2           # optional, latest if absent
 *   credentialsFile: ~/secrets/kaggle.json  # optional
 * }</pre>
 */
public class KaggleSourceConfig {

  static final String DEFAULT_BASE_URL = "https://www.kaggle.com/api/v1";

  private final String owner;
  private final String dataset;
  private final List<String> filePatterns;
  private final @Nullable Integer datasetVersion;
  private final @Nullable String credentialsFile;
  private final String baseUrl;
  private final int connectTimeoutMs;
  private final int readTimeoutMs;
  private final boolean checkRemoteFreshness;

  private KaggleSourceConfig(Builder builder) {
    this.owner = builder.owner;
    this.dataset = builder.dataset;
    this.filePatterns = builder.filePatterns;
    this.datasetVersion = builder.datasetVersion;
    this.credentialsFile = builder.credentialsFile;
    this.baseUrl = builder.baseUrl;
    this.connectTimeoutMs = builder.connectTimeoutMs;
    this.readTimeoutMs = builder.readTimeoutMs;
    this.checkRemoteFreshness = builder.checkRemoteFreshness;
  }

  public String getOwner() {
    return owner;
  }

  public String getDataset() {
    return dataset;
  }

  public List<String> getFilePatterns() {
    return filePatterns;
  }

  public @Nullable Integer getDatasetVersion() {
    return datasetVersion;
  }

  public @Nullable String getCredentialsFile() {
    return credentialsFile;
  }

  /**
   * Returns the API base URL, without trailing slash.
   */
  public String getBaseUrl() {
    return baseUrl;
  }

  public int getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public int getReadTimeoutMs() {
    return readTimeoutMs;
  }

  public boolean isCheckRemoteFreshness() {
    return checkRemoteFreshness;
  }

  public static KaggleSourceConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    builder.owner(ConfigValues.getString(map, "owner"));
    builder.dataset(ConfigValues.getString(map, "dataset"));
    List<String> patterns = ConfigValues.getStringList(map, "filePatterns");
    if (patterns != null) {
      builder.filePatterns(patterns);
    }
    builder.datasetVersion(ConfigValues.getInteger(map, "datasetVersion"));
    builder.credentialsFile(ConfigValues.getString(map, "credentialsFile"));
    String baseUrl = ConfigValues.getString(map, "baseUrl");
    if (baseUrl != null) {
      builder.baseUrl(baseUrl);
    }
    Integer connectTimeout = ConfigValues.getInteger(map, "connectTimeoutMs");
    if (connectTimeout != null) {
      builder.connectTimeoutMs(connectTimeout);
    }
    Integer readTimeout = ConfigValues.getInteger(map, "readTimeoutMs");
    if (readTimeout != null) {
      builder.readTimeoutMs(readTimeout);
    }
    Boolean checkRemoteFreshness = ConfigValues.getBoolean(map, "checkRemoteFreshness");
    if (checkRemoteFreshness != null) {
      builder.checkRemoteFreshness(checkRemoteFreshness);
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private String owner;
    private String dataset;
    private List<String> filePatterns = Collections.singletonList("*");
    private @Nullable Integer datasetVersion;
    private @Nullable String credentialsFile;
    private String baseUrl = DEFAULT_BASE_URL;
    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 60000;
    private boolean checkRemoteFreshness;

    public Builder owner(String owner) {
      this.owner = owner;
      return this;
    }

    public Builder dataset(String dataset) {
      this.dataset = dataset;
      return this;
    }

    public Builder filePatterns(List<String> filePatterns) {
      this.filePatterns = Collections.unmodifiableList(filePatterns);
      return this;
    }

    public Builder datasetVersion(@Nullable Integer datasetVersion) {
      this.datasetVersion = datasetVersion;
      return this;
    }

    public Builder credentialsFile(@Nullable String credentialsFile) {
      this.credentialsFile = credentialsFile;
      return this;
    }

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder connectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
      return this;
    }

    public Builder readTimeoutMs(int readTimeoutMs) {
      this.readTimeoutMs = readTimeoutMs;
      return this;
    }

    public Builder checkRemoteFreshness(boolean checkRemoteFreshness) {
      this.checkRemoteFreshness = checkRemoteFreshness;
      return this;
    }

    public KaggleSourceConfig build() {
      if (owner == null || owner.isEmpty()) {
        throw new IllegalArgumentException("KaggleSourceConfig requires 'owner'");
      }
      if (dataset == null || dataset.isEmpty()) {
        throw new IllegalArgumentException("KaggleSourceConfig requires 'dataset'");
      }
      if (filePatterns == null || filePatterns.isEmpty()) {
        throw new IllegalArgumentException(
            "KaggleSourceConfig requires at least one file pattern");
      }
      if (baseUrl == null || baseUrl.isEmpty()) {
        throw new IllegalArgumentException("baseUrl cannot be empty");
      }
      if (connectTimeoutMs < 0 || readTimeoutMs < 0) {
        throw new IllegalArgumentException("Timeouts cannot be negative");
      }
      while (baseUrl.endsWith("/")) {
        baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
      }
      return new KaggleSourceConfig(this);
    }
  }
}
