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

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import gleaner.metric.MetricSource;
import gleaner.source.DateRange;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * What {@link MetricFilter#filter} keeps. Every empty criterion matches everything.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class FilterOptions {
  @Builder.Default
  private final Optional<DateRange> dateRange = Optional.absent();
  @Builder.Default
  private final ImmutableSet<MetricSource> sources = ImmutableSet.of();
  @Builder.Default
  private final ImmutableList<String> queries = ImmutableList.of();
  @Builder.Default
  private final ImmutableList<String> urls = ImmutableList.of();

  public static FilterOptions all() {
    return FilterOptions.builder().build();
  }
}
