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

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.joda.time.LocalDate;

import com.google.common.base.Predicate;
import com.google.common.base.Strings;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import gleaner.metric.CanonicalMetric;
import gleaner.metric.MetricSource;
import gleaner.source.DateRange;


/**
 * Narrows a dataset to what a view asked for.
 */
public class MetricFilter {

  /**
   * Keep the records that satisfy all criteria of {@code options}:
   *
   * <ul>
   *   <li>the date lies within the date range, both ends included; records without a date are dropped once a
   *   range is set,</li>
   *   <li>the source is one of the selected sources,</li>
   *   <li>the query contains any of the query terms, ignoring case,</li>
   *   <li>the url contains any of the url terms, ignoring case; records without a url are not url-filtered.</li>
   * </ul>
   */
  public static List<CanonicalMetric> filter(Collection<CanonicalMetric> records, final FilterOptions options) {
    final List<String> queries = lowerCase(options.getQueries());
    final List<String> urls = lowerCase(options.getUrls());

    return FluentIterable.from(records).filter(new Predicate<CanonicalMetric>() {
      @Override
      public boolean apply(CanonicalMetric record) {
        if (options.getDateRange().isPresent() && !inRange(record.getDate(), options.getDateRange().get())) {
          return false;
        }
        if (!options.getSources().isEmpty() && !options.getSources().contains(record.getSource())) {
          return false;
        }
        if (!queries.isEmpty() && !containsAny(record.getQuery(), queries)) {
          return false;
        }
        return urls.isEmpty() || Strings.isNullOrEmpty(record.getUrl()) || containsAny(record.getUrl(), urls);
      }
    }).toList();
  }

  public static FilterValues extractFilterValues(Collection<CanonicalMetric> records) {
    ImmutableSortedSet.Builder<String> queries = ImmutableSortedSet.naturalOrder();
    ImmutableSortedSet.Builder<String> urls = ImmutableSortedSet.naturalOrder();
    Set<MetricSource> sources = EnumSet.noneOf(MetricSource.class);
    for (CanonicalMetric record : records) {
      if (!Strings.isNullOrEmpty(record.getQuery())) {
        queries.add(record.getQuery());
      }
      if (!Strings.isNullOrEmpty(record.getUrl())) {
        urls.add(record.getUrl());
      }
      if (record.getSource() != null) {
        sources.add(record.getSource());
      }
    }
    return new FilterValues(queries.build().asList(), urls.build().asList(), Sets.immutableEnumSet(sources));
  }

  private static boolean inRange(LocalDate date, DateRange range) {
    return date != null && !date.isBefore(range.getStartDate()) && !date.isAfter(range.getEndDate());
  }

  private static boolean containsAny(String value, List<String> terms) {
    String haystack = Strings.nullToEmpty(value).toLowerCase(Locale.ROOT);
    for (String term : terms) {
      if (haystack.contains(term)) {
        return true;
      }
    }
    return false;
  }

  private static List<String> lowerCase(List<String> terms) {
    ImmutableList.Builder<String> lowered = ImmutableList.builder();
    for (String term : terms) {
      if (!Strings.isNullOrEmpty(term)) {
        lowered.add(term.toLowerCase(Locale.ROOT));
      }
    }
    return lowered.build();
  }
}
