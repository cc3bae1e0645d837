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

/**
 * Content-addressed caching of computed artifacts.
 *
 * <p>A {@link io.quarry.etl.cache.CacheKey} combines an operation name, its
 * configuration and fingerprints of its inputs into a SHA-256 digest. An
 * {@link io.quarry.etl.cache.ArtifactCache} stores one file per key through a
 * {@link io.quarry.etl.cache.CacheHandler} and keeps a bounded number of
 * entries, evicting the least recently used.</p>
 *
 * <p>Key components:</p>
 * <ul>
 *   <li>{@link io.quarry.etl.cache.FileContentFingerprinter} - Fingerprints input files by content</li>
 *   <li>{@link io.quarry.etl.cache.TableFingerprinter} - Fingerprints tables, also used as checksum</li>
 *   <li>{@link io.quarry.etl.cache.TableCacheHandler} - JSON serialization of tables with validation</li>
 * </ul>
 */
package io.quarry.etl.cache;
