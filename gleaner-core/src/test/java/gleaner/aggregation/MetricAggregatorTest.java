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

import java.util.List;

import org.joda.time.DateTime;
import org.joda.time.LocalDate;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;

import gleaner.metric.CanonicalMetric;
import gleaner.metric.MetricSource;


/**
 * Unit tests for {@link MetricAggregator}.
 */
@Test(groups = { "gleaner.aggregation" })
public class MetricAggregatorTest {

  private static final double EPSILON = 1e-9;

  private static CanonicalMetric primary(String date, String query, String url, long clicks, long impressions,
      double position) {
    return CanonicalMetric.builder().date(LocalDate.parse(date)).source(MetricSource.PRIMARY).query(query).url(url)
        .clicks(clicks).impressions(impressions).ctr(impressions > 0 ? (double) clicks / impressions : 0)
        .position(position).build();
  }

  private static CanonicalMetric.CanonicalMetricBuilder secondary(String date, String query) {
    return CanonicalMetric.builder().date(LocalDate.parse(date)).source(MetricSource.SECONDARY).query(query);
  }

  @Test
  public void testPositionIsImpressionWeighted() {
    List<CanonicalMetric> records = ImmutableList.of(
        primary("2024-06-01", "shoes", "https://example.com/a", 10, 100, 1),
        primary("2024-06-02", "shoes", "https://example.com/a", 30, 100, 5),
        // no impressions, no say in the position
        primary("2024-06-03", "shoes", "https://example.com/a", 0, 0, 90));

    List<TableRow> rows = MetricAggregator.groupAndAggregate(records, AggregationKey.QUERY, false);

    Assert.assertEquals(rows.size(), 1);
    TableRow row = rows.get(0);
    Assert.assertEquals(row.getClicks(), 40L);
    Assert.assertEquals(row.getImpressions(), 200L);
    Assert.assertEquals(row.getCtr(), 0.2, EPSILON);
    Assert.assertEquals(row.getPosition(), 3.0, EPSILON);
    Assert.assertEquals(row.getUrl(), "https://example.com/a");
    Assert.assertTrue(row.getChanges().isEmpty());
  }

  @Test
  public void testZeroImpressionRowDoesNotMoveAverage() {
    List<CanonicalMetric> records = ImmutableList.of(
        primary("2024-06-01", "shoes", null, 5, 100, 3),
        primary("2024-06-02", "shoes", null, 0, 0, 10));

    Assert.assertEquals(MetricAggregator.groupAndAggregate(records, AggregationKey.QUERY, false).get(0).getPosition(),
        3.0);
  }

  @Test
  public void testRowsSortedByClicksWithStableTies() {
    List<CanonicalMetric> records = ImmutableList.of(
        primary("2024-06-01", "alpha", null, 5, 50, 2),
        primary("2024-06-01", "beta", null, 9, 50, 2),
        primary("2024-06-01", "gamma", null, 5, 50, 2),
        primary("2024-06-01", "delta", null, 0, 50, 2));

    List<TableRow> rows = MetricAggregator.groupAndAggregate(records, AggregationKey.QUERY, false);

    Assert.assertEquals(rows.get(0).getQuery(), "beta");
    Assert.assertEquals(rows.get(1).getQuery(), "alpha");
    Assert.assertEquals(rows.get(2).getQuery(), "gamma");
    Assert.assertEquals(rows.get(3).getQuery(), "delta");
  }

  @Test
  public void testGroupByQueryAndUrl() {
    List<CanonicalMetric> records = ImmutableList.of(
        primary("2024-06-01", "shoes", "https://example.com/a", 1, 10, 2),
        primary("2024-06-01", "shoes", "https://example.com/b", 2, 10, 2),
        primary("2024-06-02", "shoes", "https://example.com/a", 3, 10, 2));

    Assert.assertEquals(MetricAggregator.groupAndAggregate(records, AggregationKey.QUERY, false).size(), 1);
    List<TableRow> rows = MetricAggregator.groupAndAggregate(records, AggregationKey.QUERY_URL, false);
    Assert.assertEquals(rows.size(), 2);
    Assert.assertEquals(rows.get(0).getUrl(), "https://example.com/a");
    Assert.assertEquals(rows.get(0).getClicks(), 4L);
  }

  @Test
  public void testSecondaryFieldsComeFromLatestImport() {
    List<CanonicalMetric> records = ImmutableList.of(
        secondary("2024-05-01", "shoes").volume(900L).traffic(40L).difficulty(12.0).position(7).build(),
        secondary("2024-06-01", "shoes").volume(1000L).traffic(55L).difficulty(14.0).position(5)
            .serpFeatures("Sitelinks").build());

    TableRow row = MetricAggregator.groupAndAggregate(records, AggregationKey.QUERY, false).get(0);

    Assert.assertEquals(row.getSource(), MetricSource.SECONDARY);
    Assert.assertEquals(row.getVolume(), Long.valueOf(1000));
    Assert.assertEquals(row.getTraffic(), Long.valueOf(55));
    Assert.assertEquals(row.getDifficulty(), Double.valueOf(14.0));
    Assert.assertEquals(row.getSerpFeatures(), "Sitelinks");
    Assert.assertEquals(row.getPosition(), 5.0, EPSILON);
    Assert.assertEquals(row.getClicks(), 0L);
  }

  @Test
  public void testComparisonTracksFirstAndLastDay() {
    List<CanonicalMetric> records = ImmutableList.of(
        primary("2024-06-03", "shoes", null, 20, 100, 4),
        primary("2024-06-01", "shoes", null, 6, 100, 8),
        primary("2024-06-01", "shoes", null, 4, 100, 6),
        primary("2024-06-02", "shoes", null, 12, 100, 5));

    TableRow row = MetricAggregator.groupAndAggregate(records, AggregationKey.QUERY, true).get(0);

    MetricChange clicks = row.getChange(Metric.CLICKS).get();
    Assert.assertEquals(clicks.getFirst(), 10.0);
    Assert.assertEquals(clicks.getLast(), 20.0);
    Assert.assertEquals(clicks.getPercentChange(), 100L);
    MetricChange position = row.getChange(Metric.POSITION).get();
    Assert.assertEquals(position.getFirst(), 7.0, EPSILON);
    Assert.assertEquals(position.getLast(), 4.0, EPSILON);
    Assert.assertFalse(row.getChange(Metric.VOLUME).isPresent());
  }

  @Test
  public void testSingleTrafficObservationStartsFromPreviousTraffic() {
    List<CanonicalMetric> records = ImmutableList.of(
        secondary("2024-06-01", "shoes").traffic(30L).previousTraffic(60L).volume(500L).build());

    TableRow row = MetricAggregator.groupAndAggregate(records, AggregationKey.QUERY, true).get(0);

    Assert.assertEquals(row.getChange(Metric.TRAFFIC).get(), new MetricChange(60, 30));
    Assert.assertEquals(row.getChange(Metric.TRAFFIC).get().getPercentChange(), -50L);
    Assert.assertEquals(row.getChange(Metric.VOLUME).get(), new MetricChange(500, 500));
  }

  @Test
  public void testSummarize() {
    List<CanonicalMetric> records = ImmutableList.of(
        primary("2024-06-01", "shoes", null, 10, 100, 1),
        primary("2024-06-01", "boots", null, 30, 100, 5),
        secondary("2024-06-01", "shoes").volume(700L).position(40).build(),
        secondary("2024-06-01", "boots").volume(300L).build());

    AggregateStats stats = MetricAggregator.summarize(records);

    Assert.assertEquals(stats.getTotalClicks(), 40L);
    Assert.assertEquals(stats.getTotalImpressions(), 200L);
    Assert.assertEquals(stats.getCtr(), 0.2, EPSILON);
    Assert.assertEquals(stats.getPosition(), 3.0, EPSILON);
    Assert.assertEquals(stats.getTotalVolume(), 1000L);
  }

  @Test
  public void testSummarizeEmpty() {
    Assert.assertEquals(MetricAggregator.summarize(ImmutableList.<CanonicalMetric>of()),
        new AggregateStats(0, 0, 0, 0, 0));
  }

  @Test
  public void testCompareWithoutPrevious() {
    ComparisonResult result = MetricAggregator.compare(
        ImmutableList.of(primary("2024-06-01", "shoes", null, 10, 100, 2)), ImmutableList.<CanonicalMetric>of());

    Assert.assertEquals(result.getCurrent().getTotalClicks(), 10L);
    Assert.assertFalse(result.getPrevious().isPresent());
    Assert.assertFalse(result.getChanges().isPresent());
  }

  @Test
  public void testSummarizeCluster() {
    PerformanceCluster cluster = new PerformanceCluster("c1", "Footwear",
        ImmutableList.of("example.com/shoes", "https://example.com/boots/winter"), new DateTime(2024, 6, 1, 0, 0),
        new DateTime(2024, 6, 1, 0, 0));
    List<CanonicalMetric> records = ImmutableList.of(
        primary("2024-06-01", "running shoes", "https://EXAMPLE.com/shoes/running", 10, 100, 2),
        // the record url is contained in a cluster url
        primary("2024-06-01", "boots", "https://example.com/boots", 5, 50, 4),
        primary("2024-06-02", "socks", "https://example.com/socks", 90, 900, 1),
        primary("2024-06-02", "brand", null, 70, 700, 1),
        secondary("2024-06-02", "shoes").url("https://example.com/shoes").volume(500L).traffic(40L).build());

    ClusterStats stats = MetricAggregator.summarizeCluster(records, cluster);

    Assert.assertEquals(stats.getClusterId(), "c1");
    Assert.assertEquals(stats.getClusterName(), "Footwear");
    Assert.assertEquals(stats.getDataPoints(), 2);
    Assert.assertEquals(stats.getStats().getTotalClicks(), 15L);
    Assert.assertEquals(stats.getStats().getTotalImpressions(), 150L);
    Assert.assertEquals(stats.getStats().getCtr(), 0.1, EPSILON);
    Assert.assertEquals(stats.getStats().getTotalVolume(), 0L);
  }

  @Test
  public void testCompareCluster() {
    PerformanceCluster cluster = new PerformanceCluster("c1", "Shoes", ImmutableList.of("/shoes"),
        new DateTime(2024, 6, 1, 0, 0), new DateTime(2024, 6, 1, 0, 0));

    ComparisonResult result = MetricAggregator.compareCluster(
        ImmutableList.of(primary("2024-06-08", "shoes", "https://example.com/shoes", 150, 1000, 3),
            primary("2024-06-08", "socks", "https://example.com/socks", 999, 9999, 1)),
        ImmutableList.of(primary("2024-06-01", "shoes", "https://example.com/shoes/", 100, 1000, 4)),
        cluster);

    Assert.assertEquals(result.getCurrent().getTotalClicks(), 150L);
    Assert.assertEquals(result.getPrevious().get().getTotalClicks(), 100L);
    Assert.assertEquals(result.getChanges().get().getClicksChangePercent(), 50.0, EPSILON);

    ComparisonResult noHistory = MetricAggregator.compareCluster(
        ImmutableList.of(primary("2024-06-08", "shoes", "https://example.com/shoes", 150, 1000, 3)),
        ImmutableList.of(primary("2024-06-01", "socks", "https://example.com/socks", 100, 1000, 4)),
        cluster);
    Assert.assertFalse(noHistory.getChanges().isPresent());
  }

  @Test
  public void testCompare() {
    ComparisonResult result = MetricAggregator.compare(
        ImmutableList.of(primary("2024-06-08", "shoes", null, 150, 1000, 3)),
        ImmutableList.of(primary("2024-06-01", "shoes", null, 100, 1000, 4)));

    DeltaStats changes = result.getChanges().get();
    Assert.assertEquals(changes.getClicksChange(), 50L);
    Assert.assertEquals(changes.getClicksChangePercent(), 50.0, EPSILON);
    Assert.assertEquals(changes.getImpressionsChange(), 0L);
    Assert.assertEquals(changes.getImpressionsChangePercent(), 0.0, EPSILON);
    Assert.assertEquals(changes.getCtrChange(), 0.05, EPSILON);
    Assert.assertEquals(changes.getCtrChangePercent(), 50.0, 1e-6);
    // a lower rank number is an improvement
    Assert.assertEquals(changes.getPositionChange(), 1.0, EPSILON);
    Assert.assertEquals(changes.getPositionChangePercent(), 25.0, EPSILON);
  }

  @Test
  public void testComparePeriods() {
    List<CanonicalMetric> current = ImmutableList.of(
        primary("2024-06-08", "shoes", "https://example.com/a", 20, 200, 2),
        primary("2024-06-08", "boots", null, 40, 200, 2),
        primary("2024-06-08", "", "https://example.com/", 99, 999, 1));
    List<CanonicalMetric> previous = ImmutableList.of(
        primary("2024-06-01", "shoes", "https://example.com/a", 10, 100, 3),
        primary("2024-06-01", "socks", "https://example.com/s", 5, 100, 9));

    List<PeriodComparisonRow> rows = MetricAggregator.comparePeriods(current, previous, AggregationKey.QUERY);

    Assert.assertEquals(rows.size(), 3);
    Assert.assertEquals(rows.get(0).getQuery(), "boots");
    Assert.assertEquals(rows.get(0).getUrl(), "");
    Assert.assertEquals(rows.get(0).getChanges().getClicksChangePercent(), 100.0, EPSILON);
    Assert.assertEquals(rows.get(1).getQuery(), "shoes");
    Assert.assertEquals(rows.get(1).getChanges().getClicksChange(), 10L);
    Assert.assertEquals(rows.get(1).getChanges().getPositionChange(), 1.0, EPSILON);
    Assert.assertEquals(rows.get(2).getQuery(), "socks");
    Assert.assertEquals(rows.get(2).getUrl(), "https://example.com/s");
    Assert.assertEquals(rows.get(2).getCurrent().getTotalClicks(), 0L);
    Assert.assertEquals(rows.get(2).getChanges().getClicksChangePercent(), -100.0, EPSILON);
  }

  @Test
  public void testChartData() {
    List<CanonicalMetric> records = ImmutableList.of(
        primary("2024-06-02", "shoes", null, 4, 40, 2),
        primary("2024-06-01", "shoes", null, 1, 10, 2),
        primary("2024-06-02", "boots", null, 6, 60, 2),
        secondary("2024-06-02", "shoes").volume(100L).build(),
        CanonicalMetric.builder().source(MetricSource.PRIMARY).query("undated").clicks(50L).impressions(50L)
            .build());

    List<ChartDataPoint> points = MetricAggregator.prepareChartData(records, Metric.CLICKS);

    Assert.assertEquals(points.size(), 2);
    Assert.assertEquals(points.get(0).getDate(), new LocalDate(2024, 6, 1));
    Assert.assertEquals(points.get(0).getValue(), 1.0);
    Assert.assertEquals(points.get(0).getSource(), MetricSource.PRIMARY);
    Assert.assertEquals(points.get(1).getValue(), 10.0);
    Assert.assertNull(points.get(1).getSource());
    Assert.assertNull(points.get(1).getComparisonValue());

    List<ChartDataPoint> volume = MetricAggregator.prepareChartData(records, Metric.VOLUME);
    Assert.assertEquals(volume.size(), 1);
    Assert.assertEquals(volume.get(0).getValue(), 100.0);
  }

  @Test
  public void testChartComparisonAlignedByDayOffset() {
    List<CanonicalMetric> current = ImmutableList.of(
        primary("2024-06-08", "shoes", null, 8, 80, 2),
        primary("2024-06-09", "shoes", null, 9, 90, 2),
        primary("2024-06-10", "shoes", null, 10, 100, 2));
    List<CanonicalMetric> previous = ImmutableList.of(
        primary("2024-06-01", "shoes", null, 4, 80, 2),
        primary("2024-06-03", "shoes", null, 5, 90, 2));

    List<ChartDataPoint> points = MetricAggregator.prepareChartData(current, previous, Metric.CLICKS);

    Assert.assertEquals(points.size(), 3);
    Assert.assertEquals(points.get(0).getComparisonValue(), Double.valueOf(4.0));
    Assert.assertNull(points.get(1).getComparisonValue());
    Assert.assertEquals(points.get(2).getComparisonValue(), Double.valueOf(5.0));
  }
}
