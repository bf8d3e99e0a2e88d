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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.joda.time.Days;
import org.joda.time.LocalDate;

import com.google.common.base.Optional;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import gleaner.metric.CanonicalMetric;
import gleaner.metric.MetricSource;

import lombok.extern.slf4j.Slf4j;


/**
 * Folds {@link CanonicalMetric}s into table rows, headline totals and chart series.
 *
 * <p>
 *   All methods are pure functions of their arguments. Clicks and impressions are summed, CTR is always derived
 *   from the sums and never averaged, and position is impression-weighted over primary records only (see
 *   {@link CohortStats}). Values are not rounded.
 * </p>
 */
@Slf4j
public class MetricAggregator {

  private static final Comparator<CanonicalMetric> BY_DATE = new Comparator<CanonicalMetric>() {
    @Override
    public int compare(CanonicalMetric a, CanonicalMetric b) {
      return compareDates(a.getDate(), b.getDate());
    }
  };

  private static final Comparator<TableRow> BY_CLICKS_DESC = new Comparator<TableRow>() {
    @Override
    public int compare(TableRow a, TableRow b) {
      return Long.compare(b.getClicks(), a.getClicks());
    }
  };

  private static final Comparator<PeriodComparisonRow> BY_CURRENT_CLICKS_DESC =
      new Comparator<PeriodComparisonRow>() {
        @Override
        public int compare(PeriodComparisonRow a, PeriodComparisonRow b) {
          return Long.compare(b.getCurrent().getTotalClicks(), a.getCurrent().getTotalClicks());
        }
      };

  /**
   * Group {@code records} by {@code key} and aggregate each group into one {@link TableRow}.
   *
   * <p>
   *   Rows are sorted by clicks, highest first; groups with equal clicks keep the order in which their first
   *   record appeared. With {@code enableComparison}, each row also carries the first and last value each metric
   *   took over the group's dates, where a date's value aggregates all of the group's records on that date. A
   *   traffic series with a single date starts from that record's own previous traffic when it has one.
   * </p>
   */
  public static List<TableRow> groupAndAggregate(List<CanonicalMetric> records, AggregationKey key,
      boolean enableComparison) {
    Map<List<String>, List<CanonicalMetric>> groups = group(records, key);
    List<TableRow> rows = new ArrayList<>(groups.size());
    for (List<CanonicalMetric> group : groups.values()) {
      rows.add(toTableRow(group, enableComparison));
    }
    rows.sort(BY_CLICKS_DESC);
    log.debug("Aggregated " + records.size() + " records into " + rows.size() + " rows by " + key.getFields());
    return rows;
  }

  /**
   * Headline totals. Clicks, impressions, CTR and position come from primary records, volume from secondary
   * ones.
   */
  public static AggregateStats summarize(Collection<CanonicalMetric> records) {
    List<CanonicalMetric> primary = new ArrayList<>();
    long volume = 0;
    for (CanonicalMetric record : records) {
      if (record.isPrimary()) {
        primary.add(record);
      } else if (record.getVolume() != null) {
        volume += record.getVolume();
      }
    }
    CohortStats stats = CohortStats.of(primary);
    return new AggregateStats(stats.getClicks(), stats.getImpressions(), stats.getCtr(), stats.getPosition(), volume);
  }

  /**
   * Compare the totals of two periods. The result has no previous totals and no changes when {@code previous}
   * is empty.
   */
  public static ComparisonResult compare(Collection<CanonicalMetric> current, Collection<CanonicalMetric> previous) {
    AggregateStats currentStats = summarize(current);
    if (previous.isEmpty()) {
      return new ComparisonResult(currentStats, Optional.<AggregateStats>absent(), Optional.<DeltaStats>absent());
    }
    AggregateStats previousStats = summarize(previous);
    return new ComparisonResult(currentStats, Optional.of(previousStats),
        Optional.of(DeltaStats.between(currentStats, previousStats)));
  }

  /**
   * Compare two periods key by key. Every key present in either period yields one row; records without a query
   * are ignored.
   */
  public static List<PeriodComparisonRow> comparePeriods(List<CanonicalMetric> current,
      List<CanonicalMetric> previous, AggregationKey key) {
    Map<List<String>, List<CanonicalMetric>> currentGroups = group(withQuery(current), key);
    Map<List<String>, List<CanonicalMetric>> previousGroups = group(withQuery(previous), key);

    Set<List<String>> keys = new LinkedHashSet<>(currentGroups.keySet());
    keys.addAll(previousGroups.keySet());

    List<PeriodComparisonRow> rows = new ArrayList<>(keys.size());
    for (List<String> groupKey : keys) {
      List<CanonicalMetric> currentGroup = orEmpty(currentGroups.get(groupKey));
      List<CanonicalMetric> previousGroup = orEmpty(previousGroups.get(groupKey));
      CanonicalMetric representative = currentGroup.isEmpty() ? previousGroup.get(0) : currentGroup.get(0);

      String url = firstUrl(currentGroup);
      if (url == null) {
        url = firstUrl(previousGroup);
      }
      AggregateStats currentStats = summarize(currentGroup);
      AggregateStats previousStats = summarize(previousGroup);
      rows.add(new PeriodComparisonRow(representative.getQuery(), Strings.nullToEmpty(url), currentStats,
          previousStats, DeltaStats.between(currentStats, previousStats)));
    }
    rows.sort(BY_CURRENT_CLICKS_DESC);
    return rows;
  }

  /**
   * Totals of the primary records whose url belongs to {@code cluster}, over whatever period {@code records}
   * covers.
   */
  public static ClusterStats summarizeCluster(Collection<CanonicalMetric> records, PerformanceCluster cluster) {
    List<CanonicalMetric> members = clusterMembers(records, cluster);
    return new ClusterStats(cluster.getId(), cluster.getName(), summarize(members), members.size());
  }

  /**
   * {@link #compare(Collection, Collection)} restricted to the primary records of {@code cluster} in each period.
   */
  public static ComparisonResult compareCluster(Collection<CanonicalMetric> current,
      Collection<CanonicalMetric> previous, PerformanceCluster cluster) {
    return compare(clusterMembers(current, cluster), clusterMembers(previous, cluster));
  }

  /**
   * One point per date that has a value for {@code metric}, in date order. Records without a date are skipped.
   */
  public static List<ChartDataPoint> prepareChartData(List<CanonicalMetric> records, Metric metric) {
    ImmutableList.Builder<ChartDataPoint> points = ImmutableList.builder();
    for (Map.Entry<LocalDate, List<CanonicalMetric>> day : byDate(records).entrySet()) {
      Optional<Double> value = CohortStats.of(day.getValue()).value(metric);
      if (value.isPresent()) {
        points.add(new ChartDataPoint(day.getKey(), value.get(), null, metric, commonSource(day.getValue())));
      }
    }
    return points.build();
  }

  /**
   * Same as {@link #prepareChartData(List, Metric)}, with each point also carrying the comparison series' value
   * on the day at the same offset from the start of its period.
   */
  public static List<ChartDataPoint> prepareChartData(List<CanonicalMetric> records,
      List<CanonicalMetric> comparisonRecords, Metric metric) {
    List<ChartDataPoint> current = prepareChartData(records, metric);
    List<ChartDataPoint> comparison = prepareChartData(comparisonRecords, metric);
    if (current.isEmpty() || comparison.isEmpty()) {
      return current;
    }

    LocalDate currentStart = byDate(records).firstKey();
    LocalDate comparisonStart = byDate(comparisonRecords).firstKey();
    Map<Integer, Double> comparisonByOffset = new LinkedHashMap<>();
    for (ChartDataPoint point : comparison) {
      comparisonByOffset.put(Days.daysBetween(comparisonStart, point.getDate()).getDays(), point.getValue());
    }

    ImmutableList.Builder<ChartDataPoint> aligned = ImmutableList.builder();
    for (ChartDataPoint point : current) {
      Double comparisonValue = comparisonByOffset.get(Days.daysBetween(currentStart, point.getDate()).getDays());
      aligned.add(new ChartDataPoint(point.getDate(), point.getValue(), comparisonValue, metric, point.getSource()));
    }
    return aligned.build();
  }

  private static TableRow toTableRow(List<CanonicalMetric> group, boolean enableComparison) {
    CanonicalMetric first = group.get(0);
    CohortStats totals = CohortStats.of(group);

    List<CanonicalMetric> latestImport = latestSecondaryImport(group);
    CohortStats latestStats = CohortStats.of(latestImport);
    CanonicalMetric latest = latestImport.isEmpty() ? null : latestImport.get(latestImport.size() - 1);

    return TableRow.builder()
        .query(Strings.nullToEmpty(first.getQuery()))
        .url(firstUrl(group))
        .serpFeatures(latest != null ? latest.getSerpFeatures() : first.getSerpFeatures())
        .source(first.getSource())
        .clicks(totals.getClicks())
        .impressions(totals.getImpressions())
        .ctr(totals.getCtr())
        .position(totals.getPosition())
        .volume(latestStats.getVolumeIfKnown())
        .difficulty(latest != null ? latest.getDifficulty() : null)
        .costPerClick(latest != null ? latest.getCostPerClick() : null)
        .traffic(latestStats.getTrafficIfKnown())
        .changes(enableComparison ? changesOf(group) : ImmutableMap.<Metric, MetricChange>of())
        .build();
  }

  private static ImmutableMap<Metric, MetricChange> changesOf(List<CanonicalMetric> group) {
    List<CanonicalMetric> ordered = new ArrayList<>(group);
    ordered.sort(BY_DATE);

    Map<LocalDate, CohortStats> days = new LinkedHashMap<>();
    for (CanonicalMetric record : ordered) {
      CohortStats day = days.get(record.getDate());
      if (day == null) {
        day = new CohortStats();
        days.put(record.getDate(), day);
      }
      day.add(record);
    }

    ImmutableMap.Builder<Metric, MetricChange> changes = ImmutableMap.builder();
    for (Metric metric : Metric.values()) {
      Double first = null;
      Double last = null;
      int observations = 0;
      for (CohortStats day : days.values()) {
        Optional<Double> value = day.value(metric);
        if (value.isPresent()) {
          if (first == null) {
            first = value.get();
          }
          last = value.get();
          observations++;
        }
      }
      if (metric == Metric.TRAFFIC && observations == 1) {
        Long previousTraffic = firstPreviousTraffic(ordered);
        if (previousTraffic != null) {
          first = previousTraffic.doubleValue();
        }
      }
      if (first != null) {
        changes.put(metric, new MetricChange(first, last));
      }
    }
    return changes.build();
  }

  private static Map<List<String>, List<CanonicalMetric>> group(List<CanonicalMetric> records, AggregationKey key) {
    Map<List<String>, List<CanonicalMetric>> groups = new LinkedHashMap<>();
    for (CanonicalMetric record : records) {
      List<String> values = key.valuesOf(record);
      List<CanonicalMetric> group = groups.get(values);
      if (group == null) {
        group = new ArrayList<>();
        groups.put(values, group);
      }
      group.add(record);
    }
    return groups;
  }

  private static TreeMap<LocalDate, List<CanonicalMetric>> byDate(List<CanonicalMetric> records) {
    TreeMap<LocalDate, List<CanonicalMetric>> days = new TreeMap<>();
    for (CanonicalMetric record : records) {
      if (record.getDate() == null) {
        continue;
      }
      List<CanonicalMetric> day = days.get(record.getDate());
      if (day == null) {
        day = new ArrayList<>();
        days.put(record.getDate(), day);
      }
      day.add(record);
    }
    return days;
  }

  /**
   * @return secondary records of the most recent date in {@code group}, in their original order
   */
  private static List<CanonicalMetric> latestSecondaryImport(List<CanonicalMetric> group) {
    List<CanonicalMetric> latest = new ArrayList<>();
    for (CanonicalMetric record : group) {
      if (record.isPrimary()) {
        continue;
      }
      int cmp = latest.isEmpty() ? 1 : compareDates(record.getDate(), latest.get(0).getDate());
      if (cmp > 0) {
        latest.clear();
      }
      if (cmp >= 0) {
        latest.add(record);
      }
    }
    return latest;
  }

  private static Long firstPreviousTraffic(List<CanonicalMetric> ordered) {
    for (CanonicalMetric record : ordered) {
      if (record.getTraffic() != null && record.getPreviousTraffic() != null) {
        return record.getPreviousTraffic();
      }
    }
    return null;
  }

  private static MetricSource commonSource(List<CanonicalMetric> records) {
    MetricSource source = records.get(0).getSource();
    for (CanonicalMetric record : records) {
      if (record.getSource() != source) {
        return null;
      }
    }
    return source;
  }

  private static String firstUrl(List<CanonicalMetric> records) {
    for (CanonicalMetric record : records) {
      if (!Strings.isNullOrEmpty(record.getUrl())) {
        return record.getUrl();
      }
    }
    return null;
  }

  private static List<CanonicalMetric> clusterMembers(Collection<CanonicalMetric> records,
      PerformanceCluster cluster) {
    List<CanonicalMetric> members = new ArrayList<>();
    for (CanonicalMetric record : records) {
      if (record.isPrimary() && cluster.matches(record.getUrl())) {
        members.add(record);
      }
    }
    return members;
  }

  private static List<CanonicalMetric> withQuery(List<CanonicalMetric> records) {
    List<CanonicalMetric> filtered = new ArrayList<>(records.size());
    for (CanonicalMetric record : records) {
      if (!Strings.isNullOrEmpty(record.getQuery())) {
        filtered.add(record);
      }
    }
    return filtered;
  }

  private static List<CanonicalMetric> orEmpty(List<CanonicalMetric> group) {
    return group == null ? ImmutableList.<CanonicalMetric>of() : group;
  }

  private static int compareDates(LocalDate a, LocalDate b) {
    if (a == null) {
      return b == null ? 0 : -1;
    }
    return b == null ? 1 : a.compareTo(b);
  }
}
