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

import gleaner.metric.MetricSource;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * One day of a per-metric time series.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ChartDataPoint {
  private final LocalDate date;
  private final double value;
  // value of the comparison series at the same offset, null if it has none
  private final Double comparisonValue;
  private final Metric metric;
  // null when the point mixes sources
  private final MetricSource source;
}
