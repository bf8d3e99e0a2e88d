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

import org.joda.time.LocalDate;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.base.Supplier;
import com.typesafe.config.Config;

import gleaner.configuration.ConfigurationKeys;
import gleaner.source.Credential;
import gleaner.source.DateRange;
import gleaner.source.Dimension;
import gleaner.source.HarvestMode;
import gleaner.source.HarvestResult;
import gleaner.source.InvalidDateRangeException;
import gleaner.util.ConfigUtils;
import gleaner.util.window.DateWindow;
import gleaner.util.window.RangeValidation;

import lombok.extern.slf4j.Slf4j;


/**
 * Entry point for retrieving provider rows for one logical (site, range, dimensions) request.
 *
 * <p>
 *   The requested range is validated first: a range that can never be served fails with
 *   {@link InvalidDateRangeException}, a range starting before the provider's lookback limit is clamped and the
 *   adjustment is reported through {@link HarvestResult#getRangeWarning()}. The {@link HarvestStrategy} is then
 *   chosen from the dimensions and the {@link HarvestMode}.
 * </p>
 *
 * <p>
 *   Instances hold no per-call state and may be shared by concurrent harvests.
 * </p>
 */
@Slf4j
public class Harvester {

  private static final Supplier<LocalDate> SYSTEM_TODAY = new Supplier<LocalDate>() {
    @Override
    public LocalDate get() {
      return LocalDate.now();
    }
  };

  private final ChunkedFetcher fetcher;
  private final Supplier<LocalDate> today;
  private final int quickRowLimit;
  private final int maxLookbackMonths;

  public Harvester(ChunkedFetcher fetcher, Config config) {
    this(fetcher, config, SYSTEM_TODAY);
  }

  @VisibleForTesting
  Harvester(ChunkedFetcher fetcher, Config config, Supplier<LocalDate> today) {
    this.fetcher = fetcher;
    this.today = today;
    this.quickRowLimit = ConfigUtils.getInt(config, ConfigurationKeys.HARVEST_QUICK_ROW_LIMIT_KEY,
        ConfigurationKeys.DEFAULT_HARVEST_QUICK_ROW_LIMIT);
    this.maxLookbackMonths = ConfigUtils.getInt(config, ConfigurationKeys.WINDOW_MAX_LOOKBACK_MONTHS_KEY,
        ConfigurationKeys.DEFAULT_WINDOW_MAX_LOOKBACK_MONTHS);
  }

  /**
   * Harvest rows for {@code range}.
   *
   * @throws InvalidDateRangeException if {@code range} ends in the future or lies entirely before the lookback
   *         limit
   * @throws InterruptedException if the harvest is interrupted, e.g. because its result became stale
   */
  public HarvestResult harvest(Credential credential, String siteId, DateRange range, List<Dimension> dimensions,
      HarvestMode mode) throws InvalidDateRangeException, InterruptedException {
    RangeValidation validation =
        DateWindow.validateRange(range.getStartDate(), range.getEndDate(), this.today.get(), this.maxLookbackMonths);
    if (!validation.isOk()) {
      throw new InvalidDateRangeException(validation.getReason().get());
    }
    DateRange effective = validation.apply(range);
    Optional<String> warning = validation.isClamped() ? validation.getReason() : Optional.<String>absent();

    HarvestStrategy strategy = HarvestStrategy.select(dimensions, mode);
    log.info(String.format("Harvesting %s %s over %s in %s mode using %s", siteId, dimensions, effective, mode,
        strategy));

    ChunkedFetchResult fetch;
    switch (strategy) {
      case AGGREGATE:
      case BREAKDOWN:
        fetch = this.fetcher.fetchSingle(credential, siteId, effective, dimensions, this.fetcher.getMaxRowLimit());
        break;
      case TOP_N:
        fetch = this.fetcher.fetchSingle(credential, siteId, effective, dimensions, this.quickRowLimit);
        break;
      case TIME_SERIES:
        fetch = this.fetcher.fetchChunked(credential, siteId, effective, dimensions);
        break;
      default:
        throw new IllegalStateException(strategy + " is not supported");
    }

    return new HarvestResult(fetch.getRows(), fetch.getCompleteness(), effective, warning);
  }
}
