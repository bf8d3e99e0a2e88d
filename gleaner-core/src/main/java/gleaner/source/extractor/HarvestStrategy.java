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

import java.util.List;

import gleaner.source.Dimension;
import gleaner.source.HarvestMode;


/**
 * How a {@link Harvester} turns one logical request into provider queries.
 */
public enum HarvestStrategy {
  // no dimensions: aggregate totals never come close to the row ceiling
  AGGREGATE,
  // one call at the quick row limit
  TOP_N,
  // date broken down per day, chunked for full coverage
  TIME_SERIES,
  // non-date breakdown, bounded by distinct values rather than by time
  BREAKDOWN;

  public static HarvestStrategy select(List<Dimension> dimensions, HarvestMode mode) {
    if (dimensions.isEmpty()) {
      return AGGREGATE;
    }
    if (mode == HarvestMode.QUICK) {
      return TOP_N;
    }
    return dimensions.contains(Dimension.DATE) ? TIME_SERIES : BREAKDOWN;
  }
}
