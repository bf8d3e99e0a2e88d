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

package gleaner.util.window;

import org.joda.time.Days;
import org.joda.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

import gleaner.source.DateRange;


/**
 * Date range arithmetic for harvests: validation against the provider's history limits, chunk sizing and
 * comparison window derivation.
 *
 * <p>
 *   All methods are pure functions of their arguments; "today" is always passed in.
 * </p>
 */
public class DateWindow {
  private static final Logger LOG = LoggerFactory.getLogger(DateWindow.class);

  /**
   * Returned by {@link #chooseChunkSizeDays(int, boolean)} when the range should be fetched in a single request.
   */
  public static final int NO_CHUNKING = 0;

  // {max total days, chunk days}; expected rows per chunk stay well below the provider's 25k ceiling
  private static final int[][] CHUNK_TIERS = {
      { 7, 1 },
      { 31, 3 },
      { 92, 7 },
      { 183, 14 }
  };
  private static final int LONG_RANGE_CHUNK_DAYS = 30;

  /**
   * Check a requested range against what the provider can serve.
   *
   * <ul>
   *   <li>{@code end} after {@code today} fails: the provider never has future data.</li>
   *   <li>{@code start} after {@code end} fails.</li>
   *   <li>{@code start} before {@code today - maxLookbackMonths} is moved up to that boundary and reported as a
   *   warning; the range is still valid unless it ends before the boundary too.</li>
   * </ul>
   */
  public static RangeValidation validateRange(LocalDate start, LocalDate end, LocalDate today,
      int maxLookbackMonths) {
    Preconditions.checkArgument(maxLookbackMonths > 0, "Lookback must be positive, got %s", maxLookbackMonths);

    if (end.isAfter(today)) {
      return RangeValidation.invalid("End date " + end + " is in the future (today is " + today + ")");
    }
    if (start.isAfter(end)) {
      return RangeValidation.invalid("Start date " + start + " is after end date " + end);
    }

    LocalDate boundary = today.minusMonths(maxLookbackMonths);
    if (start.isBefore(boundary)) {
      if (end.isBefore(boundary)) {
        return RangeValidation.invalid("Range " + start + " to " + end + " ends before the earliest available date "
            + boundary + " (" + maxLookbackMonths + " months lookback)");
      }
      String warning = "Start date " + start + " precedes the " + maxLookbackMonths
          + " months lookback limit; using " + boundary + " instead";
      LOG.warn(warning);
      return RangeValidation.clamped(boundary, warning);
    }
    return RangeValidation.valid();
  }

  /**
   * Pick how many days one chunk of a harvest should span.
   *
   * <p>
   *   Aggregate totals never come close to the provider's row ceiling, so without dimensions the whole range is
   *   one request ({@link #NO_CHUNKING}). With dimensions, short ranges get small chunks and long ranges
   *   progressively larger ones; chunk size never grows faster than the range itself.
   * </p>
   */
  public static int chooseChunkSizeDays(int totalDays, boolean hasDimensions) {
    if (!hasDimensions) {
      return NO_CHUNKING;
    }
    Preconditions.checkArgument(totalDays >= 0, "Total days must not be negative, got %s", totalDays);
    for (int[] tier : CHUNK_TIERS) {
      if (totalDays <= tier[0]) {
        return tier[1];
      }
    }
    return LONG_RANGE_CHUNK_DAYS;
  }

  /**
   * Resolve a named preset relative to {@code today}. Unknown identifiers and {@code custom} (which has no
   * windows of its own) resolve to {@link ComparisonPreset#DEFAULT}.
   */
  public static PresetWindows derivePreset(String presetId, LocalDate today) {
    return derivePreset(presetId, today, Optional.<DateRange>absent());
  }

  /**
   * Same as {@link #derivePreset(String, LocalDate)}, except that {@code custom} uses {@code customPrimary} as
   * the primary window when present and compares it with the preceding period.
   */
  public static PresetWindows derivePreset(String presetId, LocalDate today, Optional<DateRange> customPrimary) {
    Optional<ComparisonPreset> known = ComparisonPreset.forId(presetId);
    if (!known.isPresent()) {
      LOG.info("Unknown comparison preset " + presetId + ", falling back to " + ComparisonPreset.DEFAULT.getId());
    }
    ComparisonPreset preset = known.or(ComparisonPreset.DEFAULT);

    if (preset == ComparisonPreset.CUSTOM) {
      if (customPrimary.isPresent()) {
        return new PresetWindows(preset, customPrimary.get(), previousPeriod(customPrimary.get()));
      }
      LOG.info("Custom preset without a primary range, falling back to " + ComparisonPreset.DEFAULT.getId());
      preset = ComparisonPreset.DEFAULT;
    }

    DateRange primary = new DateRange(today.minus(preset.getLookback()), today);
    return new PresetWindows(preset, primary, comparisonFor(primary, preset.getComparisonKind()));
  }

  public static DateRange comparisonFor(DateRange primary, ComparisonPreset.ComparisonKind kind) {
    switch (kind) {
      case PREVIOUS_PERIOD:
        return previousPeriod(primary);
      case YEAR_AGO:
        return new DateRange(primary.getStartDate().minusYears(1), primary.getEndDate().minusYears(1));
      case WEEK_AGO:
        return new DateRange(primary.getStartDate().minusWeeks(1), primary.getEndDate().minusWeeks(1));
      default:
        throw new IllegalArgumentException(kind + " is not supported");
    }
  }

  /**
   * The window that ends the day before {@code primary} starts and spans as many days as lie between the
   * primary window's endpoints, so {@code [today-7, today]} compares against {@code [today-14, today-8]}.
   * A single-day primary window compares against the day before it.
   */
  public static DateRange previousPeriod(DateRange primary) {
    LocalDate end = primary.getStartDate().minusDays(1);
    int span = Math.max(Days.daysBetween(primary.getStartDate(), primary.getEndDate()).getDays(), 1);
    return new DateRange(end.minusDays(span - 1), end);
  }
}
