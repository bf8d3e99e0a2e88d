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

import org.joda.time.LocalDate;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import gleaner.metric.CanonicalMetric;
import gleaner.metric.MetricSource;
import gleaner.source.DateRange;


/**
 * Unit tests for {@link MetricFilter}.
 */
@Test(groups = { "gleaner.aggregation" })
public class MetricFilterTest {

  private static final CanonicalMetric SHOES = record("2024-06-01", MetricSource.PRIMARY, "Running Shoes",
      "https://example.com/shoes");
  private static final CanonicalMetric BOOTS = record("2024-06-05", MetricSource.PRIMARY, "hiking boots",
      "https://example.com/boots");
  private static final CanonicalMetric SOCKS = record("2024-06-10", MetricSource.SECONDARY, "wool socks", null);
  private static final List<CanonicalMetric> ALL = ImmutableList.of(SHOES, BOOTS, SOCKS);

  private static CanonicalMetric record(String date, MetricSource source, String query, String url) {
    return CanonicalMetric.builder().date(LocalDate.parse(date)).source(source).query(query).url(url).build();
  }

  @Test
  public void testNoCriteriaKeepsEverything() {
    Assert.assertEquals(MetricFilter.filter(ALL, FilterOptions.all()), ALL);
  }

  @Test
  public void testDateRangeIsInclusive() {
    FilterOptions options =
        FilterOptions.builder().dateRange(Optional.of(DateRange.of("2024-06-01", "2024-06-05"))).build();

    Assert.assertEquals(MetricFilter.filter(ALL, options), ImmutableList.of(SHOES, BOOTS));
  }

  @Test
  public void testSources() {
    FilterOptions options = FilterOptions.builder().sources(ImmutableSet.of(MetricSource.SECONDARY)).build();

    Assert.assertEquals(MetricFilter.filter(ALL, options), ImmutableList.of(SOCKS));
  }

  @Test
  public void testQueryTermsMatchAnySubstringIgnoringCase() {
    FilterOptions options = FilterOptions.builder().queries(ImmutableList.of("SHOE", "sock")).build();

    Assert.assertEquals(MetricFilter.filter(ALL, options), ImmutableList.of(SHOES, SOCKS));
  }

  @Test
  public void testUrlTermsSkipRecordsWithoutUrl() {
    FilterOptions options = FilterOptions.builder().urls(ImmutableList.of("/boots")).build();

    Assert.assertEquals(MetricFilter.filter(ALL, options), ImmutableList.of(BOOTS, SOCKS));
  }

  @Test
  public void testExtractFilterValues() {
    CanonicalMetric unnamed = record("2024-06-02", MetricSource.PRIMARY, "", "https://example.com/boots");

    FilterValues values = MetricFilter.extractFilterValues(ImmutableList.of(SOCKS, SHOES, BOOTS, unnamed));

    Assert.assertEquals(values.getQueries(), ImmutableList.of("Running Shoes", "hiking boots", "wool socks"));
    Assert.assertEquals(values.getUrls(), ImmutableList.of("https://example.com/boots", "https://example.com/shoes"));
    Assert.assertEquals(values.getSources(), ImmutableSet.of(MetricSource.PRIMARY, MetricSource.SECONDARY));
  }
}
