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

package gleaner.source.extractor.partition;

import java.math.RoundingMode;
import java.util.List;

import org.joda.time.LocalDate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.math.IntMath;
import com.typesafe.config.Config;

import gleaner.configuration.ConfigurationKeys;
import gleaner.source.DateRange;
import gleaner.source.Dimension;
import gleaner.source.FetchChunk;
import gleaner.util.ConfigUtils;
import gleaner.util.window.DateWindow;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;


/**
 * Splits a {@link DateRange} into consecutive {@link FetchChunk}s.
 *
 * <p>
 *   Chunks are returned in date order, cover every day of the range exactly once and all but the last span the
 *   same number of days. If the requested chunk size would produce more than {@link #getMaxChunks()} chunks,
 *   the chunk size is widened so that the range fits into that many.
 * </p>
 */
@Slf4j
public class ChunkPartitioner {

  @Getter
  private final int maxChunks;

  public ChunkPartitioner(Config config) {
    this(ConfigUtils.getInt(config, ConfigurationKeys.FETCH_MAX_CHUNKS_KEY,
        ConfigurationKeys.DEFAULT_FETCH_MAX_CHUNKS));
  }

  public ChunkPartitioner(int maxChunks) {
    Preconditions.checkArgument(maxChunks > 0, "Invalid value for maxChunks, positive value expected.");
    this.maxChunks = maxChunks;
  }

  /**
   * Partition {@code range} using the chunk size {@link DateWindow#chooseChunkSizeDays(int, boolean)} picks for it.
   */
  public List<FetchChunk> getChunks(DateRange range, List<Dimension> dimensions) {
    return getChunks(range, dimensions, DateWindow.chooseChunkSizeDays(range.getLengthInDays(), !dimensions.isEmpty()));
  }

  /**
   * Partition {@code range} into chunks of {@code chunkDays} days; {@link DateWindow#NO_CHUNKING} yields a single
   * chunk spanning the whole range.
   */
  public List<FetchChunk> getChunks(DateRange range, List<Dimension> dimensions, int chunkDays) {
    Preconditions.checkArgument(chunkDays >= 0, "Invalid value for chunkDays, value should not be negative.");
    if (chunkDays == DateWindow.NO_CHUNKING) {
      return ImmutableList.of(new FetchChunk(range, dimensions));
    }

    int days = getChunkDays(range.getLengthInDays(), chunkDays);
    if (days != chunkDays) {
      log.info("Widened chunk size from " + chunkDays + " to " + days + " days to stay within " + this.maxChunks
          + " chunks for " + range);
    }

    ImmutableList.Builder<FetchChunk> chunks = ImmutableList.builder();
    LocalDate start = range.getStartDate();
    while (!start.isAfter(range.getEndDate())) {
      LocalDate next = start.plusDays(days - 1);
      LocalDate end = next.isAfter(range.getEndDate()) ? range.getEndDate() : next;
      chunks.add(new FetchChunk(start, end, dimensions));
      log.debug("Chunk - start:" + start + "; end:" + end);
      start = end.plusDays(1);
    }
    return chunks.build();
  }

  private int getChunkDays(int totalDays, int chunkDays) {
    int totalChunks = IntMath.divide(totalDays, chunkDays, RoundingMode.CEILING);
    if (totalChunks > this.maxChunks) {
      return IntMath.divide(totalDays, this.maxChunks, RoundingMode.CEILING);
    }
    return chunkDays;
  }
}
