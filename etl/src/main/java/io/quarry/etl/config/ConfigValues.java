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
package io.quarry.etl.config;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Typed access to values of a configuration map parsed from YAML or JSON.
 *
 * <p>Scalars are accepted in their natural type or as strings, so that
 * {@code numWorkers: 8} and {@code numWorkers: "8"} are equivalent. A value
 * of the wrong shape is an {@link IllegalArgumentException} naming the key.
 */
public final class ConfigValues {

  private ConfigValues() {
  }

  public static @Nullable String getString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Map || value instanceof List) {
      throw new IllegalArgumentException("'" + key + "' must be a scalar value");
    }
    return String.valueOf(value);
  }

  public static @Nullable Integer getInteger(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    try {
      return Integer.valueOf(String.valueOf(value).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + value);
    }
  }

  public static @Nullable Boolean getBoolean(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    String text = String.valueOf(value).trim();
    if ("true".equalsIgnoreCase(text)) {
      return Boolean.TRUE;
    }
    if ("false".equalsIgnoreCase(text)) {
      return Boolean.FALSE;
    }
    throw new IllegalArgumentException("'" + key + "' must be true or false, got: " + value);
  }

  /**
   * Returns a list of strings. A single scalar is read as a one-element list.
   */
  public static @Nullable List<String> getStringList(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof List) {
      List<String> result = new ArrayList<String>();
      for (Object item : (List<?>) value) {
        if (item == null) {
          throw new IllegalArgumentException("'" + key + "' cannot contain null entries");
        }
        result.add(String.valueOf(item));
      }
      return result;
    }
    if (value instanceof Map) {
      throw new IllegalArgumentException("'" + key + "' must be a list");
    }
    return Collections.singletonList(String.valueOf(value));
  }

  /**
   * Returns a nested section.
   */
  @SuppressWarnings("unchecked")
  public static @Nullable Map<String, Object> getSection(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException("'" + key + "' must be a section");
    }
    return (Map<String, Object>) value;
  }
}
