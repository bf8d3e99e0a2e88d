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

import java.util.Set;

import org.joda.time.Period;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;

import lombok.Getter;


/**
 * The fixed vocabulary of named comparison presets.
 *
 * <p>
 *   Each preset looks back {@link #getLookback()} from today for the primary window and derives the comparison
 *   window according to its {@link ComparisonKind}. Identifiers are matched exactly, aliases included.
 * </p>
 */
public enum ComparisonPreset {
  LAST_24H_VS_PREVIOUS("last_24h_vs_previous", Period.days(1), ComparisonKind.PREVIOUS_PERIOD),
  LAST_24H_VS_WEEK_AGO("last_24h_vs_week_ago", Period.days(1), ComparisonKind.WEEK_AGO,
      "last_24h_week_over_week"),
  LAST_7D_VS_PREVIOUS("last_7d_vs_previous", Period.days(7), ComparisonKind.PREVIOUS_PERIOD),
  LAST_7D_VS_YEAR_AGO("last_7d_vs_year_ago", Period.days(7), ComparisonKind.YEAR_AGO, "last_7d_year_over_year"),
  LAST_28D_VS_PREVIOUS("last_28d_vs_previous", Period.days(28), ComparisonKind.PREVIOUS_PERIOD,
      "last_30d_vs_previous"),
  LAST_28D_VS_YEAR_AGO("last_28d_vs_year_ago", Period.days(28), ComparisonKind.YEAR_AGO),
  LAST_3M_VS_PREVIOUS("last_3m_vs_previous", Period.months(3), ComparisonKind.PREVIOUS_PERIOD),
  LAST_3M_VS_YEAR_AGO("last_3m_vs_year_ago", Period.months(3), ComparisonKind.YEAR_AGO),
  LAST_6M_VS_PREVIOUS("last_6m_vs_previous", Period.months(6), ComparisonKind.PREVIOUS_PERIOD),
  // windows come from the caller
  CUSTOM("custom", Period.ZERO, ComparisonKind.PREVIOUS_PERIOD);

  public static final ComparisonPreset DEFAULT = LAST_28D_VS_PREVIOUS;

  /**
   * How the comparison window is derived from the primary one.
   */
  public enum ComparisonKind {
    // the window ending the day before the primary one starts, see DateWindow.previousPeriod
    PREVIOUS_PERIOD,
    // both ends one calendar year back
    YEAR_AGO,
    // both ends one week back
    WEEK_AGO
  }

  @Getter
  private final String id;
  @Getter
  private final Period lookback;
  @Getter
  private final ComparisonKind comparisonKind;
  private final Set<String> aliases;

  ComparisonPreset(String id, Period lookback, ComparisonKind comparisonKind, String... aliases) {
    this.id = id;
    this.lookback = lookback;
    this.comparisonKind = comparisonKind;
    this.aliases = ImmutableSet.copyOf(aliases);
  }

  /**
   * @return the preset whose identifier or alias equals {@code id}, absent for unknown identifiers
   */
  public static Optional<ComparisonPreset> forId(String id) {
    if (id == null) {
      return Optional.absent();
    }
    for (ComparisonPreset preset : values()) {
      if (preset.id.equals(id) || preset.aliases.contains(id)) {
        return Optional.of(preset);
      }
    }
    return Optional.absent();
  }
}
