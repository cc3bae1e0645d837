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
package io.quarry.etl.cache;

import com.google.common.hash.Hashing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Identifies one cached artifact.
 *
 * <p>A key is built from the operation name and named parameters: plain
 * configuration values, or values reduced to a fingerprint by a
 * {@link Fingerprinter}. Parameters are sorted by name, so insertion order does
 * not matter. The key string is the SHA-256 of the canonical description and
 * doubles as the cache file name.
 *
 * <pre>{@code
 * CacheKey key = CacheKey.builder("CsvToTableConverter.convert")
 *     .add("dropColumns", config.getDropColumns())
 *     .addFingerprint("inputs", paths, new FileContentFingerprinter())
 *     .build();
 * }</pre>
 */
public final class CacheKey {

  private final String operation;
  private final Map<String, String> parameters;
  private final String description;
  private final String keyString;

  private CacheKey(String operation, Map<String, String> parameters) {
    this.operation = operation;
    this.parameters = Collections.unmodifiableMap(new TreeMap<String, String>(parameters));
    this.description = buildDescription(operation, this.parameters);
    this.keyString = Hashing.sha256().hashString(description, StandardCharsets.UTF_8).toString();
  }

  /**
   * Returns the key as a 64-character lowercase hex string.
   */
  public String asString() {
    return keyString;
  }

  public String getOperation() {
    return operation;
  }

  /**
   * Returns the parameters, with fingerprinted values already reduced.
   */
  public Map<String, String> getParameters() {
    return parameters;
  }

  /**
   * Returns the human-readable text the key was hashed from.
   */
  public String getDescription() {
    return description;
  }

  public static Builder builder(String operation) {
    return new Builder(operation);
  }

  private static String buildDescription(String operation, Map<String, String> parameters) {
    StringBuilder key = new StringBuilder();
    key.append(operation.length()).append(':').append(operation);
    for (Map.Entry<String, String> entry : parameters.entrySet()) {
      key.append('|').append(entry.getKey().length()).append(':').append(entry.getKey())
          .append('=').append(entry.getValue().length()).append(':').append(entry.getValue());
    }
    return key.toString();
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return keyString.equals(((CacheKey) o).keyString);
  }

  @Override public int hashCode() {
    return keyString.hashCode();
  }

  @Override public String toString() {
    return "CacheKey{" + operation + ", " + keyString.substring(0, 12) + "}";
  }

  /**
   * Builder for {@link CacheKey}.
   */
  public static class Builder {
    private final String operation;
    private final Map<String, String> parameters = new TreeMap<String, String>();

    private Builder(String operation) {
      if (operation == null || operation.isEmpty()) {
        throw new IllegalArgumentException("operation cannot be null or empty");
      }
      this.operation = operation;
    }

    /**
     * Adds a configuration value. Collections are rendered element by element
     * in iteration order; null is rendered distinctly from the string "null".
     */
    public Builder add(String name, Object value) {
      put(name, render(value));
      return this;
    }

    /**
     * Adds the fingerprint of a value.
     */
    public <T> Builder addFingerprint(String name, T value, Fingerprinter<T> fingerprinter)
        throws IOException {
      put(name, "fp:" + fingerprinter.fingerprint(value));
      return this;
    }

    public CacheKey build() {
      return new CacheKey(operation, parameters);
    }

    private void put(String name, String rendered) {
      if (parameters.put(name, rendered) != null) {
        throw new IllegalArgumentException("Duplicate cache key parameter: " + name);
      }
    }

    private static String render(Object value) {
      if (value == null) {
        return "\u0000";
      }
      if (value instanceof Collection) {
        StringBuilder sb = new StringBuilder("[");
        for (Object element : (Collection<?>) value) {
          String rendered = render(element);
          sb.append(rendered.length()).append(':').append(rendered).append(',');
        }
        return sb.append(']').toString();
      }
      return "v:" + value;
    }
  }
}
