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

import java.io.IOException;

/**
 * Computes a deterministic fingerprint of a value for use in a {@link CacheKey}.
 *
 * <p>Two values with equal fingerprints are treated as interchangeable inputs,
 * so implementations must change the fingerprint whenever the value changes in
 * a way that affects the cached output.
 *
 * @param <T> Type of value fingerprinted
 */
@FunctionalInterface
public interface Fingerprinter<T> {

  /**
   * Returns the fingerprint as a lowercase hexadecimal string.
   *
   * @throws IOException If the value (e.g. a file) cannot be read
   */
  String fingerprint(T value) throws IOException;
}
