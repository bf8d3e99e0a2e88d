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

package gleaner.runtime;

import java.util.List;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import gleaner.source.DateRange;
import gleaner.source.Dimension;
import gleaner.source.HarvestMode;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * What one view currently asks for. A change of filter state triggers a new harvest for that view.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FilterState {
  private final String siteId;
  private final DateRange dateRange;
  private final ImmutableList<Dimension> dimensions;
  private final HarvestMode mode;
  private final Optional<DateRange> comparisonDateRange;

  public FilterState(String siteId, DateRange dateRange, List<Dimension> dimensions, HarvestMode mode,
      Optional<DateRange> comparisonDateRange) {
    this.siteId = Preconditions.checkNotNull(siteId);
    this.dateRange = Preconditions.checkNotNull(dateRange);
    this.dimensions = ImmutableList.copyOf(dimensions);
    this.mode = Preconditions.checkNotNull(mode);
    this.comparisonDateRange = Preconditions.checkNotNull(comparisonDateRange);
  }

  public FilterState(String siteId, DateRange dateRange, List<Dimension> dimensions, HarvestMode mode) {
    this(siteId, dateRange, dimensions, mode, Optional.<DateRange>absent());
  }
}
