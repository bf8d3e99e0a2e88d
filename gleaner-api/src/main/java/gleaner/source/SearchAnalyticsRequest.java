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

package gleaner.source;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * A single bounded query against the provider.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SearchAnalyticsRequest {

  private final String siteId;
  private final DateRange range;
  private final ImmutableList<Dimension> dimensions;
  private final int rowLimit;

  public SearchAnalyticsRequest(String siteId, DateRange range, List<Dimension> dimensions, int rowLimit) {
    Preconditions.checkNotNull(siteId, "siteId");
    Preconditions.checkNotNull(range, "range");
    Preconditions.checkArgument(rowLimit > 0, "Row limit must be positive, got %s", rowLimit);
    this.siteId = siteId;
    this.range = range;
    this.dimensions = ImmutableList.copyOf(dimensions);
    this.rowLimit = rowLimit;
  }

  public boolean hasDimension(Dimension dimension) {
    return this.dimensions.contains(dimension);
  }
}
