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

import org.joda.time.Days;
import org.joda.time.LocalDate;

import com.google.common.base.Preconditions;

import lombok.EqualsAndHashCode;
import lombok.Getter;


/**
 * A range of calendar days, both ends inclusive.
 *
 * <p>
 *   {@link #getStartDate()} is never after {@link #getEndDate()}. The two ends are rendered in ISO form
 *   ({@code yyyy-MM-dd}) when sent to the provider.
 * </p>
 */
@Getter
@EqualsAndHashCode
public class DateRange {

  private final LocalDate startDate;
  private final LocalDate endDate;

  public DateRange(LocalDate startDate, LocalDate endDate) {
    Preconditions.checkNotNull(startDate, "startDate");
    Preconditions.checkNotNull(endDate, "endDate");
    Preconditions.checkArgument(!startDate.isAfter(endDate),
        "Start date %s is after end date %s", startDate, endDate);
    this.startDate = startDate;
    this.endDate = endDate;
  }

  public static DateRange of(String startDate, String endDate) {
    return new DateRange(LocalDate.parse(startDate), LocalDate.parse(endDate));
  }

  /**
   * @return number of calendar days covered, counting both ends
   */
  public int getLengthInDays() {
    return Days.daysBetween(this.startDate, this.endDate).getDays() + 1;
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(this.startDate) && !date.isAfter(this.endDate);
  }

  public DateRange withStartDate(LocalDate newStartDate) {
    return new DateRange(newStartDate, this.endDate);
  }

  @Override
  public String toString() {
    return this.startDate + " to " + this.endDate;
  }
}
