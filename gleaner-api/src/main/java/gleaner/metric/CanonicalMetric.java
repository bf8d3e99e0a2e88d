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

package gleaner.metric;

import org.joda.time.LocalDate;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * The record shape shared by both metric sources.
 *
 * <p>
 *   Fields a source does not provide are {@code null}; {@link #getQuery()} is never {@code null}.
 *   {@link #getPosition()} means different things per source: for {@link MetricSource#PRIMARY} it is an
 *   average rank that only makes sense once impression-weighted over a cohort of rows, for
 *   {@link MetricSource#SECONDARY} it is a single point-in-time rank, 0 when unknown.
 * </p>
 *
 * <p>
 *   The {@code previous*} and {@code *Change} fields are only set by sources that ship their own period
 *   comparison.
 * </p>
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class CanonicalMetric {
  private final LocalDate date;
  private final MetricSource source;
  private final String query;
  private final String url;

  private final Long clicks;
  private final Long impressions;
  private final Double ctr;
  private final double position;

  private final Long volume;
  private final Double difficulty;
  private final Double costPerClick;
  private final Long traffic;
  private final String serpFeatures;

  private final Long previousTraffic;
  private final Long trafficChange;
  private final Double previousPosition;
  private final Double positionChange;
  private final LocalDate previousDate;

  public boolean isPrimary() {
    return this.source == MetricSource.PRIMARY;
  }
}
