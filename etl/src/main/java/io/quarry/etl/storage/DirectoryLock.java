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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive lock on a directory, held across threads and processes.
 *
 * <p>Threads of this JVM are serialized with a {@link ReentrantLock} keyed by
 * the absolute directory path; other processes with a {@link FileLock} on a
 * lock file inside the directory. Use with try-with-resources:
 *
 * <pre>{@code
 * try (DirectoryLock lock = DirectoryLock.acquire(dir, 30, TimeUnit.SECONDS)) {
 *   // populate cache
 * }
 * }</pre>
 */
public final class DirectoryLock implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryLock.class);

  /** Name of the lock file created inside the locked directory. */
  public static final String LOCK_FILE_NAME = ".quarry.lock";

  private static final ConcurrentHashMap<String, ReentrantLock> LOCK_MAP =
      new ConcurrentHashMap<>();

  private static final long FILE_LOCK_POLL_MS = 50;

  private final Path directory;
  private final ReentrantLock processLock;
  private final FileChannel channel;
  private final FileLock fileLock;

  private DirectoryLock(Path directory, ReentrantLock processLock, FileChannel channel,
      FileLock fileLock) {
    this.directory = directory;
    this.processLock = processLock;
    this.channel = channel;
    this.fileLock = fileLock;
  }

  /**
   * Acquires the lock, waiting at most the given time.
   *
   * @param directory Existing directory to lock
   * @param timeout Maximum time to wait
   * @param unit Unit of {@code timeout}
   * @return The held lock
   * @throws IOException If the lock is not acquired in time or the lock file
   *     cannot be opened
   */
  public static DirectoryLock acquire(Path directory, long timeout, TimeUnit unit)
      throws IOException {
    Path absolute = directory.toAbsolutePath().normalize();
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    ReentrantLock processLock = LOCK_MAP.computeIfAbsent(absolute.toString(),
        k -> new ReentrantLock());

    boolean acquired;
    try {
      acquired = processLock.tryLock(timeout, unit);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted waiting for lock on " + absolute, e);
    }
    if (!acquired) {
      throw new IOException("Timeout waiting for lock on " + absolute);
    }

    FileChannel channel = null;
    try {
      channel = FileChannel.open(absolute.resolve(LOCK_FILE_NAME),
          StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      FileLock fileLock = channel.tryLock();
      while (fileLock == null) {
        if (System.nanoTime() > deadline) {
          throw new IOException("Timeout waiting for file lock on " + absolute);
        }
        Thread.sleep(FILE_LOCK_POLL_MS);
        fileLock = channel.tryLock();
      }
      LOGGER.debug("Acquired directory lock on {}", absolute);
      return new DirectoryLock(absolute, processLock, channel, fileLock);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      closeQuietly(channel);
      processLock.unlock();
      throw new IOException("Interrupted waiting for file lock on " + absolute, e);
    } catch (IOException | RuntimeException e) {
      closeQuietly(channel);
      processLock.unlock();
      throw e;
    }
  }

  public Path getDirectory() {
    return directory;
  }

  @Override public void close() throws IOException {
    try {
      fileLock.release();
      channel.close();
    } finally {
      processLock.unlock();
      LOGGER.debug("Released directory lock on {}", directory);
    }
  }

  private static void closeQuietly(FileChannel channel) {
    if (channel == null) {
      return;
    }
    try {
      channel.close();
    } catch (IOException e) {
      LOGGER.debug("Could not close lock file channel: {}", e.getMessage());
    }
  }
}
