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

import io.quarry.etl.PartialFetchException;
import io.quarry.etl.SourceUnavailableException;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link KaggleDataSource} against a local HTTP server that mimics
 * the Kaggle REST API.
 */
@Tag("unit")
public class KaggleDataSourceTest {

  private static final String TRAIN = "id,label\n1,a\n2,b\n";
  private static final String TEST = "id\n3\n4\n";

  @TempDir
  Path tempDir;

  private HttpServer server;
  private final Map<String, byte[]> responses = new ConcurrentHashMap<String, byte[]>();
  private final List<String> requests = Collections.synchronizedList(new ArrayList<String>());
  private final KaggleCredentials credentials = new KaggleCredentials("alice", "secret");

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/", this::handle);
    server.start();

    responses.put("/api/v1/datasets/list/alice/titanic",
        listing().getBytes(StandardCharsets.UTF_8));
    responses.put("/api/v1/datasets/download/alice/titanic/train.csv",
        TRAIN.getBytes(StandardCharsets.UTF_8));
    responses.put("/api/v1/datasets/download/alice/titanic/extra/test.csv",
        zip("test.csv", TEST, ".DS_Store", "junk"));
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  private void handle(HttpExchange exchange) throws IOException {
    String query = exchange.getRequestURI().getRawQuery();
    String path = exchange.getRequestURI().getPath();
    requests.add(query == null ? path : path + "?" + query);

    String expected = "Basic " + Base64.getEncoder()
        .encodeToString("alice:secret".getBytes(StandardCharsets.UTF_8));
    byte[] body = responses.get(path);
    int status;
    if (!expected.equals(exchange.getRequestHeaders().getFirst("Authorization"))) {
      status = 401;
      body = "{\"code\":401}".getBytes(StandardCharsets.UTF_8);
    } else if (body == null) {
      status = 404;
      body = "{\"code\":404}".getBytes(StandardCharsets.UTF_8);
    } else {
      status = 200;
    }
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(body);
    }
  }

  private static String listing() {
    return "{\"datasetFiles\":["
        + "{\"name\":\"train.csv\",\"totalBytes\":" + TRAIN.length()
        + ",\"creationDate\":\"2024-03-01T12:30:00.123Z\"},"
        + "{\"name\":\"extra/test.csv\",\"totalBytes\":" + TEST.length()
        + ",\"creationDate\":\"2024-03-01T12:31:00Z\"},"
        + "{\"name\":\"README.md\",\"totalBytes\":10}"
        + "]}";
  }

  private static byte[] zip(String... namesAndContents) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
      for (int i = 0; i < namesAndContents.length; i += 2) {
        zip.putNextEntry(new ZipEntry(namesAndContents[i]));
        zip.write(namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
      }
    }
    return bytes.toByteArray();
  }

  private KaggleSourceConfig.Builder config() {
    return KaggleSourceConfig.builder()
        .owner("alice")
        .dataset("titanic")
        .filePatterns(Arrays.asList("*.csv"))
        .baseUrl("http://localhost:" + server.getAddress().getPort() + "/api/v1/");
  }

  @Test void testFetchDownloadsAndUnzipsMatchingFiles() throws IOException {
    Path destination = tempDir.resolve("kaggle");
    KaggleDataSource source = new KaggleDataSource(config().build(), destination, credentials);

    List<Path> files = source.fetch(false);

    assertEquals(Arrays.asList(destination.resolve("test.csv"), destination.resolve("train.csv")),
        files);
    assertEquals(TEST, S3DataSourceTest.read(files.get(0)));
    assertEquals(TRAIN, S3DataSourceTest.read(files.get(1)));
    assertFalse(Files.exists(destination.resolve(".DS_Store")));
    assertEquals(Arrays.asList("/api/v1/datasets/list/alice/titanic",
        "/api/v1/datasets/download/alice/titanic/train.csv",
        "/api/v1/datasets/download/alice/titanic/extra/test.csv"), requests);
    assertEquals(Arrays.asList(FetchManifest.FILE_NAME, "test.csv", "train.csv"),
        S3DataSourceTest.list(destination));
  }

  @Test void testSecondFetchIsServedLocally() throws IOException {
    KaggleDataSource source =
        new KaggleDataSource(config().build(), tempDir.resolve("kaggle"), credentials);
    List<Path> first = source.fetch(false);
    int count = requests.size();

    assertEquals(first, source.fetch(false));
    assertEquals(count, requests.size());

    source.fetch(true);
    assertEquals(2 * count, requests.size());
  }

  @Test void testDatasetVersionIsSentAsQuery() throws IOException {
    KaggleDataSource source = new KaggleDataSource(config().datasetVersion(3).build(),
        tempDir.resolve("kaggle"), credentials);
    source.fetch(false);
    assertEquals("/api/v1/datasets/list/alice/titanic?datasetVersionNumber=3", requests.get(0));
    assertEquals("/api/v1/datasets/download/alice/titanic/train.csv?datasetVersionNumber=3",
        requests.get(1));
  }

  @Test void testBadCredentialsAreSourceUnavailable() throws IOException {
    KaggleDataSource source = new KaggleDataSource(config().build(), tempDir.resolve("kaggle"),
        new KaggleCredentials("alice", "wrong"));
    SourceUnavailableException e =
        assertThrows(SourceUnavailableException.class, () -> source.fetch(false));
    assertTrue(e.getMessage().contains("401"), e.getMessage());
    assertTrue(e.getMessage().contains("alice"), e.getMessage());
  }

  @Test void testUnknownDatasetIsSourceUnavailable() throws IOException {
    KaggleDataSource source = new KaggleDataSource(config().dataset("nope").build(),
        tempDir.resolve("kaggle"), credentials);
    SourceUnavailableException e =
        assertThrows(SourceUnavailableException.class, () -> source.fetch(false));
    assertTrue(e.getMessage().contains("404"), e.getMessage());
  }

  @Test void testNoMatchingFilesIsSourceUnavailable() throws IOException {
    KaggleDataSource source = new KaggleDataSource(
        config().filePatterns(Arrays.asList("*.parquet")).build(),
        tempDir.resolve("kaggle"), credentials);
    assertThrows(SourceUnavailableException.class, () -> source.fetch(false));
  }

  @Test void testUnreachableServerIsSourceUnavailable() throws IOException {
    KaggleSourceConfig config = config().build();
    server.stop(0);
    KaggleDataSource source =
        new KaggleDataSource(config, tempDir.resolve("kaggle"), credentials);
    assertThrows(SourceUnavailableException.class, () -> source.fetch(false));
  }

  @Test void testFailedForcedFetchLeavesNothingBehind() throws IOException {
    Path destination = tempDir.resolve("kaggle");
    new KaggleDataSource(config().build(), destination, credentials).fetch(false);
    responses.remove("/api/v1/datasets/download/alice/titanic/extra/test.csv");

    KaggleDataSource forced = new KaggleDataSource(config().build(), destination, credentials);
    assertThrows(SourceUnavailableException.class, () -> forced.fetch(true));
    // A forced fetch clears first, so nothing of the old fetch remains
    assertEquals(Collections.emptyList(), S3DataSourceTest.list(destination));
  }

  @Test void testEmptyArchiveIsPartialFetch() throws IOException {
    responses.put("/api/v1/datasets/download/alice/titanic/extra/test.csv",
        zip(".hidden", "x"));
    KaggleDataSource source =
        new KaggleDataSource(config().build(), tempDir.resolve("kaggle"), credentials);
    assertThrows(PartialFetchException.class, () -> source.fetch(false));
  }

  @Test void testConfigFromMap() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("owner", "alice");
    map.put("dataset", "titanic");
    map.put("datasetVersion", 2);
    map.put("baseUrl", "http://example.com/api/");
    KaggleSourceConfig config = KaggleSourceConfig.fromMap(map);
    assertEquals("alice", config.getOwner());
    assertEquals(Integer.valueOf(2), config.getDatasetVersion());
    assertEquals("http://example.com/api", config.getBaseUrl());
    assertEquals(Arrays.asList("*"), config.getFilePatterns());
    assertNull(config.getCredentialsFile());

    map.remove("dataset");
    assertThrows(IllegalArgumentException.class, () -> KaggleSourceConfig.fromMap(map));
  }
}
