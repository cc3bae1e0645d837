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

import io.quarry.etl.storage.OutputDirectory;
import io.quarry.etl.table.ColumnType;
import io.quarry.etl.table.ColumnarTable;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ArtifactCache}.
 */
@Tag("unit")
public class ArtifactCacheTest {

  @TempDir
  Path tempDir;

  private static ColumnarTable table(long value) {
    return ColumnarTable.builder().column("v", ColumnType.LONG).row(value).build();
  }

  private static CacheKey key(String name) {
    return CacheKey.builder("test").add("name", name).build();
  }

  private ArtifactCache<ColumnarTable> cache(int maxEntries) throws IOException {
    return new ArtifactCache<ColumnarTable>(new OutputDirectory(tempDir),
        new TableCacheHandler(), maxEntries);
  }

  @Test void testMissComputesAndHitReuses() throws IOException {
    ArtifactCache<ColumnarTable> cache = cache(1);
    AtomicInteger calls = new AtomicInteger();

    ColumnarTable first = cache.execute(key("a"), () -> {
      calls.incrementAndGet();
      return table(1);
    }, false);
    ColumnarTable second = cache.execute(key("a"), () -> {
      calls.incrementAndGet();
      return table(2);
    }, false);

    assertEquals(1, calls.get());
    assertEquals(table(1), first);
    assertEquals(first, second);
    assertTrue(Files.isRegularFile(cache.getCacheFile(key("a"))));
  }

  @Test void testForceRecomputesAndOverwrites() throws IOException {
    ArtifactCache<ColumnarTable> cache = cache(1);
    cache.execute(key("a"), () -> table(1), false);
    ColumnarTable forced = cache.execute(key("a"), () -> table(2), true);
    assertEquals(table(2), forced);
    assertEquals(table(2), cache.execute(key("a"), () -> table(3), false));
  }

  @Test void testEvictsLeastRecentlyUsed() throws IOException {
    ArtifactCache<ColumnarTable> cache = cache(2);
    cache.execute(key("a"), () -> table(1), false);
    cache.execute(key("b"), () -> table(2), false);
    // Touch a, so b becomes the eldest
    cache.execute(key("a"), () -> table(9), false);
    cache.execute(key("c"), () -> table(3), false);

    assertTrue(cache.contains(key("a")));
    assertFalse(cache.contains(key("b")));
    assertTrue(cache.contains(key("c")));
    assertFalse(Files.exists(cache.getCacheFile(key("b"))));
    assertEquals(Arrays.asList(key("a").asString(), key("c").asString()), cache.getKeys());
  }

  @Test void testRestoresEntriesByModificationTime() throws IOException {
    ArtifactCache<ColumnarTable> first = cache(3);
    first.execute(key("old"), () -> table(1), false);
    first.execute(key("new"), () -> table(2), false);
    Files.setLastModifiedTime(first.getCacheFile(key("old")), FileTime.fromMillis(1000));
    Files.setLastModifiedTime(first.getCacheFile(key("new")), FileTime.fromMillis(2000));

    ArtifactCache<ColumnarTable> reopened = cache(1);
    assertEquals(Arrays.asList(key("new").asString()), reopened.getKeys());
    assertFalse(Files.exists(first.getCacheFile(key("old"))));

    AtomicInteger calls = new AtomicInteger();
    ColumnarTable hit = reopened.execute(key("new"), () -> {
      calls.incrementAndGet();
      return table(0);
    }, false);
    assertEquals(0, calls.get());
    assertEquals(table(2), hit);
  }

  @Test void testCorruptEntryIsRecomputed() throws IOException {
    ArtifactCache<ColumnarTable> cache = cache(1);
    cache.execute(key("a"), () -> table(1), false);
    Files.write(cache.getCacheFile(key("a")), "{garbage".getBytes(StandardCharsets.UTF_8));

    AtomicInteger calls = new AtomicInteger();
    ColumnarTable result = cache.execute(key("a"), () -> {
      calls.incrementAndGet();
      return table(5);
    }, false);
    assertEquals(1, calls.get());
    assertEquals(table(5), result);
  }

  @Test void testFailedComputationLeavesNoEntry() throws IOException {
    ArtifactCache<ColumnarTable> cache = cache(1);
    assertThrows(IOException.class, () -> cache.execute(key("a"), () -> {
      throw new IOException("boom");
    }, false));
    assertFalse(Files.exists(cache.getCacheFile(key("a"))));
    assertFalse(cache.contains(key("a")));
  }

  @Test void testRejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> cache(0));
  }
}
