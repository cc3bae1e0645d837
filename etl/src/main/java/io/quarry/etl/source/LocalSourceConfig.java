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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Configuration for {@link LocalDirectoryDataSource}.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * source:
 *   type: local
 *   destination: data/raw
 *   path: /mnt/exports/sales
 *   filePatterns: ["*.csv"]
 * }</pre>
 */
public class LocalSourceConfig {

  private final String path;
  private final List<String> filePatterns;
  private final boolean checkRemoteFreshness;

  private LocalSourceConfig(Builder builder) {
    this.path = builder.path;
    this.filePatterns = builder.filePatterns;
    this.checkRemoteFreshness = builder.checkRemoteFreshness;
  }

  public String getPath() {
    return path;
  }

  public List<String> getFilePatterns() {
    return filePatterns;
  }

  public boolean isCheckRemoteFreshness() {
    return checkRemoteFreshness;
  }

  public static LocalSourceConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    builder.path(ConfigValues.getString(map, "path"));
    List<String> patterns = ConfigValues.getStringList(map, "filePatterns");
    if (patterns != null) {
      builder.filePatterns(patterns);
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
    private String path;
    private List<String> filePatterns = Collections.singletonList("*.csv");
    private boolean checkRemoteFreshness;

    public Builder path(String path) {
      this.path = path;
      return this;
    }

    public Builder filePatterns(List<String> filePatterns) {
      this.filePatterns = Collections.unmodifiableList(filePatterns);
      return this;
    }

    public Builder checkRemoteFreshness(boolean checkRemoteFreshness) {
      this.checkRemoteFreshness = checkRemoteFreshness;
      return this;
    }

    public LocalSourceConfig build() {
      if (path == null || path.isEmpty()) {
        throw new IllegalArgumentException("LocalSourceConfig requires 'path'");
      }
      if (filePatterns == null || filePatterns.isEmpty()) {
        throw new IllegalArgumentException("LocalSourceConfig requires at least one file pattern");
      }
      return new LocalSourceConfig(this);
    }
  }
}
