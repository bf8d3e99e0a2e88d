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
 * A keyword row of the secondary metrics source as produced by the CSV import.
 *
 * <p>
 *   Only {@link #getKeyword()} and {@link #getDate()} are always present.
 * </p>
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class SecondaryMetric {
  private final LocalDate date;
  private final String keyword;
  private final String url;
  private final Double position;
  private final Long volume;
  private final Double difficulty;
  private final Double cpc;
  private final Long traffic;
  private final String serpFeatures;

  private final Long previousTraffic;
  private final Long trafficChange;
  private final Double previousPosition;
  private final Double positionChange;
  private final LocalDate previousDate;
}
