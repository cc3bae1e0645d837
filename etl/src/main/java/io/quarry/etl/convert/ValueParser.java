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
package io.quarry.etl.convert;

import io.quarry.etl.table.ColumnType;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses raw field values into typed values and infers column types.
 */
final class ValueParser {

  private static final Pattern LONG_PATTERN = Pattern.compile("[+-]?\\d+");
  private static final Pattern DOUBLE_PATTERN =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
  private static final Pattern DATE_PATTERN = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
  private static final Pattern DATE_TIME_PATTERN =
      Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?");

  /** Candidate types, narrowest first. STRING always applies. */
  private static final ColumnType[] INFERENCE_ORDER = {
      ColumnType.LONG, ColumnType.DOUBLE, ColumnType.BOOLEAN, ColumnType.TIMESTAMP
  };

  private final Set<String> trueValues;
  private final Set<String> falseValues;

  ValueParser(Set<String> trueValues, Set<String> falseValues) {
    this.trueValues = trueValues;
    this.falseValues = falseValues;
  }

  /**
   * Returns the narrowest type every non-null token parses as. A column
   * without non-null tokens is STRING.
   */
  ColumnType infer(List<@Nullable String> tokens) {
    boolean anyValue = false;
    for (String token : tokens) {
      if (token != null) {
        anyValue = true;
        break;
      }
    }
    if (!anyValue) {
      return ColumnType.STRING;
    }
    for (ColumnType candidate : INFERENCE_ORDER) {
      if (allParse(tokens, candidate)) {
        return candidate;
      }
    }
    return ColumnType.STRING;
  }

  /**
   * Whether every non-null token parses as the type.
   */
  boolean allParse(List<@Nullable String> tokens, ColumnType type) {
    for (String token : tokens) {
      if (token != null && parse(token, type) == null) {
        return false;
      }
    }
    return true;
  }

  /**
   * Parses a token as the type.
   *
   * @return The typed value, or null if the token is not a value of the type
   */
  @Nullable Object parse(String token, ColumnType type) {
    String trimmed = token.trim();
    switch (type) {
      case STRING:
        return token;
      case LONG:
        if (!LONG_PATTERN.matcher(trimmed).matches() || trimmed.length() > 20) {
          return null;
        }
        try {
          return Long.parseLong(trimmed.startsWith("+") ? trimmed.substring(1) : trimmed);
        } catch (NumberFormatException e) {
          // Out of range for a long
          return null;
        }
      case DOUBLE:
        return DOUBLE_PATTERN.matcher(trimmed).matches() ? Double.valueOf(trimmed) : null;
      case BOOLEAN:
        if (trueValues.contains(token) || trueValues.contains(trimmed)) {
          return Boolean.TRUE;
        }
        if (falseValues.contains(token) || falseValues.contains(trimmed)) {
          return Boolean.FALSE;
        }
        return null;
      case TIMESTAMP:
        return parseTimestamp(trimmed);
      default:
        throw new AssertionError(type);
    }
  }

  private static @Nullable LocalDateTime parseTimestamp(String value) {
    try {
      if (DATE_TIME_PATTERN.matcher(value).matches()) {
        return LocalDateTime.parse(value.replace(' ', 'T'));
      }
      if (DATE_PATTERN.matcher(value).matches()) {
        return LocalDate.parse(value).atStartOfDay();
      }
    } catch (DateTimeParseException e) {
      // Well-formed but not a calendar value, e.g. 2024-02-30
      return null;
    }
    return null;
  }
}
