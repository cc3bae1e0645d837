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

import java.util.Objects;

/**
 * A file as listed by a remote source, before it is downloaded.
 */
public final class RemoteFile {

  private final String name;
  private final String location;
  private final long size;
  private final long lastModified;

  /**
   * Creates a remote file entry.
   *
   * @param name Local file name the download is stored under
   * @param location Source-specific location (object key, URL path, absolute path)
   * @param size Size in bytes, or -1 if unknown
   * @param lastModified Modification time in epoch milliseconds, or 0 if unknown
   */
  public RemoteFile(String name, String location, long size, long lastModified) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("name cannot be null or empty");
    }
    this.name = name;
    this.location = Objects.requireNonNull(location, "location");
    this.size = size;
    this.lastModified = lastModified;
  }

  public String getName() {
    return name;
  }

  public String getLocation() {
    return location;
  }

  public long getSize() {
    return size;
  }

  public long getLastModified() {
    return lastModified;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RemoteFile)) {
      return false;
    }
    RemoteFile that = (RemoteFile) o;
    return size == that.size && lastModified == that.lastModified
        && name.equals(that.name) && location.equals(that.location);
  }

  @Override public int hashCode() {
    return Objects.hash(name, location, size, lastModified);
  }

  @Override public String toString() {
    return "RemoteFile{" + location + ", size=" + size + "}";
  }
}
