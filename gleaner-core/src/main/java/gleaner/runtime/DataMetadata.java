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

import org.joda.time.DateTime;

import com.google.common.base.Optional;

import gleaner.source.DateRange;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * Summary of what a {@link MetricSnapshotStore} holds.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class DataMetadata {
  private final boolean primaryImported;
  // earliest to latest record date of the primary snapshot
  private final Optional<DateRange> primaryDateRange;
  private final int primaryDataCount;
  private final Optional<DateTime> primaryImportedAt;

  private final boolean secondaryImported;
  private final int secondaryDataCount;
  private final Optional<DateTime> secondaryImportedAt;

  private final int totalDataPoints;
  private final Optional<DateTime> lastUpdated;
}
