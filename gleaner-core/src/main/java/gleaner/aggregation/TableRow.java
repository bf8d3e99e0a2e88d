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
import com.google.common.collect.ImmutableMap;

import gleaner.metric.MetricSource;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * One aggregated row of a table view.
 *
 * <p>
 *   {@link #getCtr()} is a fraction, not a percentage. The secondary-source fields come from the group's most
 *   recent import and are {@code null} for groups without secondary records. {@link #getChanges()} is empty
 *   unless the aggregation ran with comparison enabled.
 * </p>
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class TableRow {
  private final String query;
  private final String url;
  private final String serpFeatures;
  private final MetricSource source;
  private final long clicks;
  private final long impressions;
  private final double ctr;
  private final double position;
  private final Long volume;
  private final Double difficulty;
  private final Double costPerClick;
  private final Long traffic;
  @Builder.Default
  private final ImmutableMap<Metric, MetricChange> changes = ImmutableMap.of();

  public Optional<MetricChange> getChange(Metric metric) {
    return Optional.fromNullable(this.changes.get(metric));
  }
}
