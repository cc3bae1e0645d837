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
import io.quarry.etl.cache.CacheKey;

import com.amazonaws.AmazonClientException;
import com.amazonaws.AmazonServiceException;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.regions.DefaultAwsRegionProviderChain;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.S3ObjectSummary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Fetches the objects under an S3 bucket prefix.
 *
 * <p>Objects whose file name matches one of the configured patterns are
 * downloaded in parallel by a pool of {@code numWorkers} threads. With
 * {@code checkTimestamps} enabled, a listing whose objects were modified on
 * different UTC days is rejected, since it usually means an export was only
 * partly replaced.
 */
public class S3DataSource extends AbstractDataSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3DataSource.class);

  private final S3SourceConfig config;
  private final AmazonS3 s3Client;

  public S3DataSource(S3SourceConfig config, Path destination) throws IOException {
    this(config, destination, createClient(config));
  }

  public S3DataSource(S3SourceConfig config, Path destination, AmazonS3 s3Client)
      throws IOException {
    super(destination);
    this.config = config;
    this.s3Client = s3Client;
  }

  @Override public String getType() {
    return "s3";
  }

  public S3SourceConfig getConfig() {
    return config;
  }

  @Override protected List<String> getFilePatterns() {
    return config.getFilePatterns();
  }

  @Override protected boolean checkRemoteFreshness() {
    return config.isCheckRemoteFreshness();
  }

  @Override protected String describeRemote() {
    return "s3://" + config.getBucket() + "/" + config.getKeyPrefix();
  }

  @Override protected void addSourceIdentity(CacheKey.Builder key) {
    super.addSourceIdentity(key);
    key.add("endpoint", config.getEndpoint());
  }

  @Override protected List<RemoteFile> listRemoteFiles() throws IOException {
    ListObjectsV2Request request = new ListObjectsV2Request()
        .withBucketName(config.getBucket())
        .withPrefix(config.getKeyPrefix());

    List<RemoteFile> files = new ArrayList<RemoteFile>();
    try {
      ListObjectsV2Result result;
      do {
        result = s3Client.listObjectsV2(request);
        for (S3ObjectSummary summary : result.getObjectSummaries()) {
          String key = summary.getKey();
          if (key.endsWith("/")) {
            continue;
          }
          String fileName = getFileName(key);
          if (!matchesAny(fileName, config.getFilePatterns())) {
            LOGGER.debug("Skipping s3://{}/{}: no pattern matches", config.getBucket(), key);
            continue;
          }
          long lastModified = summary.getLastModified() == null
              ? 0 : summary.getLastModified().getTime();
          files.add(new RemoteFile(fileName, key, summary.getSize(), lastModified));
        }
        request.setContinuationToken(result.getNextContinuationToken());
      } while (result.isTruncated());
    } catch (AmazonClientException e) {
      throw new SourceUnavailableException("Failed to list " + describeRemote() + ": "
          + e.getMessage(), e);
    }

    if (config.isCheckTimestamps()) {
      checkSameDay(files);
    }
    LOGGER.debug("Listed {} matching object(s) under {}", files.size(), describeRemote());
    return files;
  }

  @Override protected List<Path> download(RemoteFile file, Path stagingDirectory)
      throws IOException {
    Path target = stagingDirectory.resolve(file.getName());
    try {
      s3Client.getObject(new GetObjectRequest(config.getBucket(), file.getLocation()),
          target.toFile());
    } catch (AmazonServiceException e) {
      if (e.getStatusCode() == 404) {
        throw new PartialFetchException("Listed object s3://" + config.getBucket() + "/"
            + file.getLocation() + " no longer exists", e);
      }
      throw new SourceUnavailableException("Failed to download s3://" + config.getBucket()
          + "/" + file.getLocation() + ": " + e.getMessage(), e);
    } catch (AmazonClientException e) {
      throw new SourceUnavailableException("Failed to download s3://" + config.getBucket()
          + "/" + file.getLocation() + ": " + e.getMessage(), e);
    }
    LOGGER.debug("Downloaded s3://{}/{} to {}", config.getBucket(), file.getLocation(), target);
    return Collections.singletonList(target);
  }

  @Override protected List<Path> downloadAll(final List<RemoteFile> files,
      final Path stagingDirectory) throws IOException {
    int threads = Math.min(config.getNumWorkers(), files.size());
    if (threads <= 1) {
      return super.downloadAll(files, stagingDirectory);
    }
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<List<Path>>> futures = new ArrayList<Future<List<Path>>>(files.size());
      for (final RemoteFile file : files) {
        futures.add(executor.submit(new Callable<List<Path>>() {
          @Override public List<Path> call() throws IOException {
            return download(file, stagingDirectory);
          }
        }));
      }
      List<Path> staged = new ArrayList<Path>(files.size());
      for (Future<List<Path>> future : futures) {
        staged.addAll(await(future));
      }
      return staged;
    } finally {
      executor.shutdownNow();
      try {
        if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
          LOGGER.warn("S3 download workers did not terminate within 60 seconds");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private static List<Path> await(Future<List<Path>> future) throws IOException {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SourceUnavailableException("Interrupted while downloading from S3", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new SourceUnavailableException("S3 download failed: " + cause, cause);
    }
  }

  private void checkSameDay(List<RemoteFile> files) throws PartialFetchException {
    TreeSet<LocalDate> days = new TreeSet<LocalDate>();
    for (RemoteFile file : files) {
      if (file.getLastModified() > 0) {
        days.add(Instant.ofEpochMilli(file.getLastModified()).atZone(ZoneOffset.UTC)
            .toLocalDate());
      }
    }
    if (days.size() > 1) {
      throw new PartialFetchException("Objects under " + describeRemote()
          + " were modified on different days " + days
          + "; the export may be incomplete or contain duplicated data");
    }
  }

  private static String getFileName(String key) {
    int slash = key.lastIndexOf('/');
    return slash < 0 ? key : key.substring(slash + 1);
  }

  private static AmazonS3 createClient(S3SourceConfig config) {
    ClientConfiguration clientConfig = new ClientConfiguration();
    clientConfig.setSocketTimeout(15 * 60 * 1000);
    clientConfig.setConnectionTimeout(60 * 1000);
    clientConfig.setMaxConnections(Math.max(config.getNumWorkers(),
        ClientConfiguration.DEFAULT_MAX_CONNECTIONS));

    AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
        .withClientConfiguration(clientConfig);

    if (config.getAccessKeyId() != null && config.getSecretAccessKey() != null) {
      builder.withCredentials(
          new AWSStaticCredentialsProvider(
              new BasicAWSCredentials(config.getAccessKeyId(), config.getSecretAccessKey())));
    } else {
      builder.withCredentials(new DefaultAWSCredentialsProviderChain());
    }

    String endpoint = config.getEndpoint();
    if (endpoint == null) {
      endpoint = System.getenv("AWS_ENDPOINT_OVERRIDE");
    }
    String region = config.getRegion();
    if (region == null) {
      region = System.getenv("AWS_REGION");
    }
    if (region == null) {
      try {
        region = new DefaultAwsRegionProviderChain().getRegion();
      } catch (AmazonClientException e) {
        region = "us-east-1";
      }
    }

    if (endpoint != null) {
      builder.withEndpointConfiguration(new EndpointConfiguration(endpoint, region));
      // S3-compatible services such as MinIO expect path-style requests
      builder.withPathStyleAccessEnabled(true);
    } else {
      builder.withRegion(region);
    }
    return builder.build();
  }
}
