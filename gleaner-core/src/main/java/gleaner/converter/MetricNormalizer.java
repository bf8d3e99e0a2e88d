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

package gleaner.converter;

import java.util.List;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import gleaner.metric.CanonicalMetric;
import gleaner.metric.MetricSource;
import gleaner.metric.SecondaryMetric;
import gleaner.source.RawProviderRow;


/**
 * Maps rows of both sources one-to-one onto {@link CanonicalMetric}s.
 *
 * <p>
 *   Never throws on malformed rows: a missing query becomes the empty string, a missing secondary position
 *   becomes 0 (unknown), other missing fields stay {@code null}. {@code null} rows are dropped.
 * </p>
 *
 * <p>
 *   Primary rows that carry neither a query nor a page were fetched without either dimension (aggregate or
 *   date-only time series) and sum over all queries; their query is {@link #TOTAL_QUERY}.
 * </p>
 */
public class MetricNormalizer {

  public static final String TOTAL_QUERY = "Total";

  public static List<CanonicalMetric> normalizePrimary(List<RawProviderRow> rows) {
    ImmutableList.Builder<CanonicalMetric> metrics = ImmutableList.builder();
    for (RawProviderRow row : rows) {
      if (row == null) {
        continue;
      }
      metrics.add(CanonicalMetric.builder()
          .date(row.getDate())
          .source(MetricSource.PRIMARY)
          .query(primaryQuery(row))
          .url(row.getPage())
          .clicks(row.getClicks())
          .impressions(row.getImpressions())
          .ctr(row.getCtr())
          .position(row.getPosition())
          .build());
    }
    return metrics.build();
  }

  private static String primaryQuery(RawProviderRow row) {
    if (row.getQuery() == null && row.getPage() == null) {
      return TOTAL_QUERY;
    }
    return Strings.nullToEmpty(row.getQuery());
  }

  /**
   * The secondary source ships its own period comparison; those fields are carried over as they are.
   */
  public static List<CanonicalMetric> normalizeSecondary(List<SecondaryMetric> rows) {
    ImmutableList.Builder<CanonicalMetric> metrics = ImmutableList.builder();
    for (SecondaryMetric row : rows) {
      if (row == null) {
        continue;
      }
      metrics.add(CanonicalMetric.builder()
          .date(row.getDate())
          .source(MetricSource.SECONDARY)
          .query(Strings.nullToEmpty(row.getKeyword()))
          .url(row.getUrl())
          .position(row.getPosition() == null ? 0 : row.getPosition())
          .volume(row.getVolume())
          .difficulty(row.getDifficulty())
          .costPerClick(row.getCpc())
          .traffic(row.getTraffic())
          .serpFeatures(row.getSerpFeatures())
          .previousTraffic(row.getPreviousTraffic())
          .trafficChange(row.getTrafficChange())
          .previousPosition(row.getPreviousPosition())
          .positionChange(row.getPositionChange())
          .previousDate(row.getPreviousDate())
          .build());
    }
    return metrics.build();
  }
}
