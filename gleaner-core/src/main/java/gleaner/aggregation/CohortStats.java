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

package gleaner.aggregation;

import org.joda.time.LocalDate;

import com.google.common.base.Optional;

import gleaner.metric.CanonicalMetric;


/**
 * Running totals over a cohort of records.
 *
 * <p>
 *   Position is the impression-weighted mean of primary rows with impressions. Rows without impressions carry
 *   no weight, and secondary positions are point samples that never enter the mean. A cohort without any
 *   weight falls back to the most recent secondary position, if one is known.
 * </p>
 */
class CohortStats {

  private long clicks;
  private long impressions;
  private boolean hasClickData;
  private double weightedPositionSum;
  private long positionWeight;
  private long volume;
  private boolean hasVolume;
  private long traffic;
  private boolean hasTraffic;
  private CanonicalMetric latestRankedSecondary;

  static CohortStats of(Iterable<CanonicalMetric> records) {
    CohortStats stats = new CohortStats();
    for (CanonicalMetric record : records) {
      stats.add(record);
    }
    return stats;
  }

  void add(CanonicalMetric record) {
    if (record.getClicks() != null || record.getImpressions() != null) {
      this.hasClickData = true;
    }
    long recordImpressions = valueOrZero(record.getImpressions());
    this.clicks += valueOrZero(record.getClicks());
    this.impressions += recordImpressions;

    if (record.isPrimary()) {
      if (recordImpressions > 0) {
        this.weightedPositionSum += record.getPosition() * recordImpressions;
        this.positionWeight += recordImpressions;
      }
    } else if (record.getPosition() > 0 && isAtOrAfter(record.getDate(), this.latestRankedSecondary)) {
      this.latestRankedSecondary = record;
    }

    if (record.getVolume() != null) {
      this.volume += record.getVolume();
      this.hasVolume = true;
    }
    if (record.getTraffic() != null) {
      this.traffic += record.getTraffic();
      this.hasTraffic = true;
    }
  }

  long getClicks() {
    return this.clicks;
  }

  long getImpressions() {
    return this.impressions;
  }

  /**
   * @return clicks over impressions, 0 without impressions
   */
  double getCtr() {
    return this.impressions > 0 ? (double) this.clicks / this.impressions : 0;
  }

  /**
   * @return the cohort's position, 0 if unknown
   */
  double getPosition() {
    return getPositionIfKnown().or(0d);
  }

  Optional<Double> getPositionIfKnown() {
    if (this.positionWeight > 0) {
      return Optional.of(this.weightedPositionSum / this.positionWeight);
    }
    if (this.latestRankedSecondary != null) {
      return Optional.of(this.latestRankedSecondary.getPosition());
    }
    return Optional.absent();
  }

  long getVolume() {
    return this.volume;
  }

  Long getVolumeIfKnown() {
    return this.hasVolume ? Long.valueOf(this.volume) : null;
  }

  Long getTrafficIfKnown() {
    return this.hasTraffic ? Long.valueOf(this.traffic) : null;
  }

  /**
   * @return the value of {@code metric} for this cohort, absent if no record in it carried that metric
   */
  Optional<Double> value(Metric metric) {
    switch (metric) {
      case CLICKS:
        return this.hasClickData ? Optional.of((double) this.clicks) : Optional.<Double>absent();
      case IMPRESSIONS:
        return this.hasClickData ? Optional.of((double) this.impressions) : Optional.<Double>absent();
      case CTR:
        return this.hasClickData ? Optional.of(getCtr()) : Optional.<Double>absent();
      case POSITION:
        return getPositionIfKnown();
      case VOLUME:
        return this.hasVolume ? Optional.of((double) this.volume) : Optional.<Double>absent();
      case TRAFFIC:
        return this.hasTraffic ? Optional.of((double) this.traffic) : Optional.<Double>absent();
      default:
        throw new IllegalArgumentException(metric + " is not supported");
    }
  }

  private static boolean isAtOrAfter(LocalDate date, CanonicalMetric current) {
    if (current == null || current.getDate() == null) {
      return true;
    }
    return date != null && !date.isBefore(current.getDate());
  }

  private static long valueOrZero(Long value) {
    return value == null ? 0 : value;
  }
}
