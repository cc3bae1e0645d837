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

import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fingerprints a set of files by their absolute paths and full contents.
 *
 * <p>Each file contributes the SHA-256 of its bytes together with its
 * normalized absolute path. Per-file fingerprints are sorted before being
 * combined, so the result does not depend on the order of the input list.
 */
public class FileContentFingerprinter implements Fingerprinter<List<Path>> {

  @Override public String fingerprint(List<Path> files) throws IOException {
    List<String> fileFingerprints = new ArrayList<String>(files.size());
    for (Path file : files) {
      fileFingerprints.add(fingerprintFile(file));
    }
    Collections.sort(fileFingerprints);

    Hasher hasher = Hashing.sha256().newHasher();
    for (String fileFingerprint : fileFingerprints) {
      hasher.putString(fileFingerprint, StandardCharsets.UTF_8);
    }
    return hasher.hash().toString();
  }

  /**
   * Returns the SHA-256 of the file content, as hex.
   */
  public static String contentHash(Path file) throws IOException {
    HashCode hash = MoreFiles.asByteSource(file).hash(Hashing.sha256());
    return hash.toString();
  }

  private static String fingerprintFile(Path file) throws IOException {
    String path = file.toAbsolutePath().normalize().toString();
    return Hashing.sha256().newHasher()
        .putInt(path.length())
        .putString(path, StandardCharsets.UTF_8)
        .putString(contentHash(file), StandardCharsets.UTF_8)
        .hash()
        .toString();
  }
}
