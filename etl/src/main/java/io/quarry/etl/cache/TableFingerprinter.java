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

import io.quarry.etl.table.Column;
import io.quarry.etl.table.ColumnarTable;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Fingerprints a {@link ColumnarTable} by column names, types and every value.
 */
public class TableFingerprinter implements Fingerprinter<ColumnarTable> {

  @Override public String fingerprint(ColumnarTable table) {
    Hasher hasher = Hashing.sha256().newHasher();
    hasher.putInt(table.getColumnCount());
    hasher.putInt(table.getRowCount());
    for (Column column : table.getColumns()) {
      putString(hasher, column.getName());
      putString(hasher, column.getType().name());
      for (Object value : column.getValues()) {
        if (value == null) {
          hasher.putByte((byte) 0);
        } else {
          hasher.putByte((byte) 1);
          putString(hasher, value.toString());
        }
      }
    }
    return hasher.hash().toString();
  }

  private static void putString(Hasher hasher, String value) {
    hasher.putInt(value.length());
    hasher.putString(value, StandardCharsets.UTF_8);
  }
}
