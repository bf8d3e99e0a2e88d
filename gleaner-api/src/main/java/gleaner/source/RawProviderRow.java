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

import org.joda.time.LocalDate;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * One (dimension combination, metrics) tuple as returned by the provider.
 *
 * <p>
 *   Dimension values that were not requested are {@code null}. When the request did not include
 *   {@link Dimension#DATE}, {@link #getDate()} is the end date of the requested range because the row
 *   aggregates over the whole range.
 * </p>
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class RawProviderRow {
  private final LocalDate date;
  private final String query;
  private final String page;
  private final String country;
  private final String device;
  private final long clicks;
  private final long impressions;
  private final double ctr;
  private final double position;
}
