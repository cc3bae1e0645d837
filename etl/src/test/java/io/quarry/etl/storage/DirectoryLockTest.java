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
package io.quarry.etl.storage;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DirectoryLock}.
 */
@Tag("unit")
public class DirectoryLockTest {

  @TempDir
  Path tempDir;

  @Test void testAcquireCreatesLockFile() throws IOException {
    try (DirectoryLock lock = DirectoryLock.acquire(tempDir, 1, TimeUnit.SECONDS)) {
      assertEquals(tempDir.toAbsolutePath().normalize(), lock.getDirectory());
      assertTrue(Files.exists(tempDir.resolve(DirectoryLock.LOCK_FILE_NAME)));
    }
    // Released locks can be taken again
    try (DirectoryLock lock = DirectoryLock.acquire(tempDir, 1, TimeUnit.SECONDS)) {
      assertEquals(tempDir.toAbsolutePath().normalize(), lock.getDirectory());
    }
  }

  @Test void testSecondThreadTimesOutWhileLockIsHeld() throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try (DirectoryLock lock = DirectoryLock.acquire(tempDir, 1, TimeUnit.SECONDS)) {
      Future<?> other = executor.submit(() -> {
        assertThrows(IOException.class,
            () -> DirectoryLock.acquire(tempDir, 200, TimeUnit.MILLISECONDS));
        return null;
      });
      other.get(10, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test void testWaitingThreadAcquiresAfterRelease() throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    CountDownLatch waiting = new CountDownLatch(1);
    try {
      Future<Boolean> other;
      try (DirectoryLock lock = DirectoryLock.acquire(tempDir, 1, TimeUnit.SECONDS)) {
        other = executor.submit(() -> {
          waiting.countDown();
          try (DirectoryLock second = DirectoryLock.acquire(tempDir, 10, TimeUnit.SECONDS)) {
            return second.getDirectory() != null;
          }
        });
        assertTrue(waiting.await(5, TimeUnit.SECONDS));
        Thread.sleep(100);
      }
      assertTrue(other.get(10, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }
  }
}
