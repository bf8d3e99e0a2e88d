/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package gleaner.source.extractor;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;

import gleaner.configuration.ConfigurationKeys;
import gleaner.source.Completeness;
import gleaner.source.Credential;
import gleaner.source.DateRange;
import gleaner.source.Dimension;
import gleaner.source.FetchChunk;
import gleaner.source.RawProviderRow;
import gleaner.source.SearchAnalyticsClient;
import gleaner.source.SearchAnalyticsRequest;
import gleaner.source.extractor.partition.ChunkPartitioner;
import gleaner.util.ConfigUtils;
import gleaner.util.limiter.FixedDelayLimiter;
import gleaner.util.limiter.Limiter;
import gleaner.util.limiter.LimiterFactory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;


/**
 * Issues bounded queries against a {@link SearchAnalyticsClient} and reports how complete the answer is.
 *
 * <p>
 *   The provider silently stops at the requested row limit, so a query whose row count equals the limit is
 *   reported as truncated. A query that happens to match exactly the limit is indistinguishable from a
 *   truncated one and is reported the same way.
 * </p>
 *
 * <p>
 *   Chunks of one fetch are issued one after another, paced by a {@link Limiter} built per fetch. A chunk
 *   that fails is logged and skipped; the fetch carries on with the next chunk and the failure shows up in the
 *   resulting {@link Completeness}. Nothing is retried.
 * </p>
 */
@Slf4j
public class ChunkedFetcher {

  private final SearchAnalyticsClient client;
  private final ChunkPartitioner partitioner;
  private final LimiterFactory limiterFactory;
  private final Config config;
  @Getter
  private final int maxRowLimit;

  public ChunkedFetcher(SearchAnalyticsClient client, Config config) {
    this(client, new ChunkPartitioner(config), new FixedDelayLimiter.Factory(), config);
  }

  @VisibleForTesting
  ChunkedFetcher(SearchAnalyticsClient client, ChunkPartitioner partitioner, LimiterFactory limiterFactory,
      Config config) {
    this.client = client;
    this.partitioner = partitioner;
    this.limiterFactory = limiterFactory;
    this.config = config;
    this.maxRowLimit = ConfigUtils.getInt(config, ConfigurationKeys.PROVIDER_MAX_ROW_LIMIT_KEY,
        ConfigurationKeys.DEFAULT_PROVIDER_MAX_ROW_LIMIT);
  }

  /**
   * Issue exactly one query for {@code range}.
   *
   * @throws IOException if the provider call fails
   */
  public WindowFetch fetchWindow(Credential credential, String siteId, DateRange range, List<Dimension> dimensions,
      int rowCap) throws IOException {
    SearchAnalyticsRequest request = new SearchAnalyticsRequest(siteId, range, dimensions, rowCap);
    List<RawProviderRow> rows = this.client.query(credential, request);
    boolean truncated = rows.size() == rowCap;
    if (truncated) {
      log.warn(String.format("Query for %s %s over %s returned %d rows, the row cap; more rows may exist", siteId,
          dimensions, range, rows.size()));
    }
    return new WindowFetch(rows, truncated);
  }

  /**
   * Split {@code range} into chunks sized for {@code dimensions} and fetch each of them at the provider's
   * maximum row limit.
   *
   * @throws InterruptedException if the calling thread is interrupted while pacing requests
   */
  public ChunkedFetchResult fetchChunked(Credential credential, String siteId, DateRange range,
      List<Dimension> dimensions) throws InterruptedException {
    return fetchChunks(credential, siteId, this.partitioner.getChunks(range, dimensions), this.maxRowLimit);
  }

  /**
   * Fetch {@code range} with a single query, reporting failure and truncation the same way a chunked fetch
   * does.
   */
  public ChunkedFetchResult fetchSingle(Credential credential, String siteId, DateRange range,
      List<Dimension> dimensions, int rowCap) throws InterruptedException {
    return fetchChunks(credential, siteId, ImmutableList.of(new FetchChunk(range, dimensions)), rowCap);
  }

  private ChunkedFetchResult fetchChunks(Credential credential, String siteId, List<FetchChunk> chunks, int rowCap)
      throws InterruptedException {
    List<RawProviderRow> rows = new ArrayList<>();
    List<FetchChunk> failed = new ArrayList<>();
    int truncated = 0;

    log.info(String.format("Fetching %d chunk(s) for %s at row cap %d", chunks.size(), siteId, rowCap));
    Limiter limiter = this.limiterFactory.buildLimiter(this.config);
    limiter.start();
    try {
      for (FetchChunk chunk : chunks) {
        try (Closeable permit = limiter.acquirePermits(1)) {
          WindowFetch fetch = fetchWindow(credential, siteId, chunk.getRange(), chunk.getDimensions(), rowCap);
          rows.addAll(fetch.getRows());
          if (fetch.isTruncated()) {
            truncated++;
          }
          log.debug("Chunk " + chunk + " returned " + fetch.getRows().size() + " rows");
        } catch (IOException e) {
          log.warn("Skipping chunk " + chunk + " of " + siteId + " after failure", e);
          failed.add(chunk);
        }
      }
    } finally {
      limiter.stop();
    }

    Completeness completeness = new Completeness(chunks.size(), truncated, failed);
    if (completeness.isPossiblyIncomplete()) {
      log.warn("Fetch for " + siteId + " may be incomplete: " + completeness);
    }
    log.info(String.format("Fetched %d rows in %d chunk(s) for %s", rows.size(), chunks.size(), siteId));
    return new ChunkedFetchResult(rows, completeness);
  }
}
