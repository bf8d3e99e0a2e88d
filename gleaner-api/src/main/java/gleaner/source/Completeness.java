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

package gleaner.source;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * Advisory report on how much of a harvest actually made it back from the provider.
 *
 * <p>
 *   A truncated chunk returned exactly as many rows as it asked for, so later rows may be missing. A failed
 *   chunk returned nothing at all. The two are counted separately; a chunk is never both.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public class Completeness {

  private final int totalChunks;
  private final int chunksTruncated;
  private final ImmutableList<FetchChunk> failedChunks;

  public Completeness(int totalChunks, int chunksTruncated, List<FetchChunk> failedChunks) {
    Preconditions.checkArgument(chunksTruncated + failedChunks.size() <= totalChunks,
        "More truncated (%s) and failed (%s) chunks than chunks (%s)", chunksTruncated, failedChunks.size(),
        totalChunks);
    this.totalChunks = totalChunks;
    this.chunksTruncated = chunksTruncated;
    this.failedChunks = ImmutableList.copyOf(failedChunks);
  }

  public static Completeness complete(int totalChunks) {
    return new Completeness(totalChunks, 0, ImmutableList.<FetchChunk>of());
  }

  public int getChunksFailed() {
    return this.failedChunks.size();
  }

  /**
   * @return true if any chunk was truncated or failed, i.e. consumers should flag the data as possibly incomplete
   */
  public boolean isPossiblyIncomplete() {
    return this.chunksTruncated > 0 || !this.failedChunks.isEmpty();
  }
}
