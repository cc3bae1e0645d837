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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ConfigValues}.
 */
@Tag("unit")
public class ConfigValuesTest {

  @Test void testScalars() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("n", 8);
    map.put("s", " 12 ");
    map.put("b", "TRUE");
    map.put("flag", false);

    assertEquals(Integer.valueOf(8), ConfigValues.getInteger(map, "n"));
    assertEquals(Integer.valueOf(12), ConfigValues.getInteger(map, "s"));
    assertEquals("8", ConfigValues.getString(map, "n"));
    assertEquals(Boolean.TRUE, ConfigValues.getBoolean(map, "b"));
    assertEquals(Boolean.FALSE, ConfigValues.getBoolean(map, "flag"));
    assertNull(ConfigValues.getString(map, "absent"));
    assertNull(ConfigValues.getInteger(map, "absent"));
  }

  @Test void testLists() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("one", "*.csv");
    map.put("many", Arrays.asList("a", 1));
    map.put("holes", Arrays.asList("a", null));

    assertEquals(Collections.singletonList("*.csv"), ConfigValues.getStringList(map, "one"));
    assertEquals(Arrays.asList("a", "1"), ConfigValues.getStringList(map, "many"));
    assertThrows(IllegalArgumentException.class,
        () -> ConfigValues.getStringList(map, "holes"));
  }

  @Test void testWrongShapes() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("list", Arrays.asList("x"));
    map.put("section", new HashMap<String, Object>());
    map.put("word", "eight");

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> ConfigValues.getString(map, "list"));
    assertEquals("'list' must be a scalar value", e.getMessage());
    assertThrows(IllegalArgumentException.class, () -> ConfigValues.getInteger(map, "word"));
    assertThrows(IllegalArgumentException.class, () -> ConfigValues.getBoolean(map, "word"));
    assertThrows(IllegalArgumentException.class, () -> ConfigValues.getStringList(map, "section"));
    assertThrows(IllegalArgumentException.class, () -> ConfigValues.getSection(map, "word"));
  }
}
