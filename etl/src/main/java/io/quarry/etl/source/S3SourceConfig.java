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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Configuration for {@link S3DataSource}.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * source:
 *   type: s3
 *   destination: data/raw
 *   bucket: my-bucket
 *   keyPrefix: exports/2024-01-01/
 *   region: eu-west-1           # optional
 *   endpoint: http://minio:9000 # optional, S3-compatible services
 *   filePatterns: ["*.csv", "*.gz"]
 *   numWorkers: 16
 *   checkTimestamps: true
 * }</pre>
 *
 * <p>Credentials are taken from {@code accessKeyId}/{@code secretAccessKey}
 * when both are set, otherwise from the default AWS provider chain.
 */
public class S3SourceConfig {

  static final List<String> DEFAULT_FILE_PATTERNS =
      Collections.unmodifiableList(Arrays.asList("*.csv", "*.gz"));
  static final int DEFAULT_NUM_WORKERS = 16;

  private final String bucket;
  private final String keyPrefix;
  private final @Nullable String region;
  private final @Nullable String endpoint;
  private final @Nullable String accessKeyId;
  private final @Nullable String secretAccessKey;
  private final List<String> filePatterns;
  private final int numWorkers;
  private final boolean checkTimestamps;
  private final boolean checkRemoteFreshness;

  private S3SourceConfig(Builder builder) {
    this.bucket = builder.bucket;
    this.keyPrefix = builder.keyPrefix;
    this.region = builder.region;
    this.endpoint = builder.endpoint;
    this.accessKeyId = builder.accessKeyId;
    this.secretAccessKey = builder.secretAccessKey;
    this.filePatterns = builder.filePatterns;
    this.numWorkers = builder.numWorkers;
    this.checkTimestamps = builder.checkTimestamps;
    this.checkRemoteFreshness = builder.checkRemoteFreshness;
  }

  public String getBucket() {
    return bucket;
  }

  public String getKeyPrefix() {
    return keyPrefix;
  }

  public @Nullable String getRegion() {
    return region;
  }

  public @Nullable String getEndpoint() {
    return endpoint;
  }

  public @Nullable String getAccessKeyId() {
    return accessKeyId;
  }

  public @Nullable String getSecretAccessKey() {
    return secretAccessKey;
  }

  public List<String> getFilePatterns() {
    return filePatterns;
  }

  public int getNumWorkers() {
    return numWorkers;
  }

  /**
   * Whether all listed objects must have been modified on the same UTC day.
   */
  public boolean isCheckTimestamps() {
    return checkTimestamps;
  }

  public boolean isCheckRemoteFreshness() {
    return checkRemoteFreshness;
  }

  public static S3SourceConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    builder.bucket(ConfigValues.getString(map, "bucket"));
    String keyPrefix = ConfigValues.getString(map, "keyPrefix");
    if (keyPrefix != null) {
      builder.keyPrefix(keyPrefix);
    }
    builder.region(ConfigValues.getString(map, "region"));
    builder.endpoint(ConfigValues.getString(map, "endpoint"));
    builder.accessKeyId(ConfigValues.getString(map, "accessKeyId"));
    builder.secretAccessKey(ConfigValues.getString(map, "secretAccessKey"));
    List<String> patterns = ConfigValues.getStringList(map, "filePatterns");
    if (patterns != null) {
      builder.filePatterns(patterns);
    }
    Integer numWorkers = ConfigValues.getInteger(map, "numWorkers");
    if (numWorkers != null) {
      builder.numWorkers(numWorkers);
    }
    Boolean checkTimestamps = ConfigValues.getBoolean(map, "checkTimestamps");
    if (checkTimestamps != null) {
      builder.checkTimestamps(checkTimestamps);
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
    private String bucket;
    private String keyPrefix = "";
    private @Nullable String region;
    private @Nullable String endpoint;
    private @Nullable String accessKeyId;
    private @Nullable String secretAccessKey;
    private List<String> filePatterns = DEFAULT_FILE_PATTERNS;
    private int numWorkers = DEFAULT_NUM_WORKERS;
    private boolean checkTimestamps = true;
    private boolean checkRemoteFreshness;

    public Builder bucket(String bucket) {
      this.bucket = bucket;
      return this;
    }

    public Builder keyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
      return this;
    }

    public Builder region(@Nullable String region) {
      this.region = region;
      return this;
    }

    public Builder endpoint(@Nullable String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    public Builder accessKeyId(@Nullable String accessKeyId) {
      this.accessKeyId = accessKeyId;
      return this;
    }

    public Builder secretAccessKey(@Nullable String secretAccessKey) {
      this.secretAccessKey = secretAccessKey;
      return this;
    }

    public Builder filePatterns(List<String> filePatterns) {
      this.filePatterns = Collections.unmodifiableList(filePatterns);
      return this;
    }

    public Builder numWorkers(int numWorkers) {
      this.numWorkers = numWorkers;
      return this;
    }

    public Builder checkTimestamps(boolean checkTimestamps) {
      this.checkTimestamps = checkTimestamps;
      return this;
    }

    public Builder checkRemoteFreshness(boolean checkRemoteFreshness) {
      this.checkRemoteFreshness = checkRemoteFreshness;
      return this;
    }

    public S3SourceConfig build() {
      if (bucket == null || bucket.isEmpty()) {
        throw new IllegalArgumentException("S3SourceConfig requires 'bucket'");
      }
      if (keyPrefix == null) {
        throw new IllegalArgumentException("keyPrefix cannot be null");
      }
      if (filePatterns == null || filePatterns.isEmpty()) {
        throw new IllegalArgumentException("S3SourceConfig requires at least one file pattern");
      }
      if (numWorkers < 1) {
        throw new IllegalArgumentException("numWorkers must be at least 1, got: " + numWorkers);
      }
      return new S3SourceConfig(this);
    }
  }
}
