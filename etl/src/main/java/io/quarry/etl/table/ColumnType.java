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
package io.quarry.etl.table;

import java.time.LocalDateTime;

/**
 * Logical type of a {@link Column}.
 */
public enum ColumnType {
  STRING(String.class),
  LONG(Long.class),
  DOUBLE(Double.class),
  BOOLEAN(Boolean.class),
  TIMESTAMP(LocalDateTime.class);

  private final Class<?> javaType;

  ColumnType(Class<?> javaType) {
    this.javaType = javaType;
  }

  /**
   * Returns the Java class that non-null values of this type must have.
   */
  public Class<?> getJavaType() {
    return javaType;
  }

  /**
   * Returns the narrowest type that can hold values of both types.
   *
   * <p>LONG and DOUBLE widen to DOUBLE; any other mismatch widens to STRING.
   */
  public static ColumnType widen(ColumnType a, ColumnType b) {
    if (a == b) {
      return a;
    }
    if ((a == LONG && b == DOUBLE) || (a == DOUBLE && b == LONG)) {
      return DOUBLE;
    }
    return STRING;
  }
}
