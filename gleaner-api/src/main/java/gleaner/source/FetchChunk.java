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

import org.joda.time.LocalDate;

import com.google.common.collect.ImmutableList;

import lombok.EqualsAndHashCode;
import lombok.Getter;


/**
 * This class encapsulates the two ends, {@link #start} and {@link #end}, of one bounded provider query
 * together with the dimensions it breaks results down by.
 *
 * <p>
 *   A harvest splits its {@link DateRange} into a sequence of {@link FetchChunk}s that do not overlap and
 *   leave no gap. Both ends are inclusive.
 * </p>
 */
@Getter
@EqualsAndHashCode
public class FetchChunk {

  private final LocalDate start;
  private final LocalDate end;
  private final ImmutableList<Dimension> dimensions;

  public FetchChunk(LocalDate start, LocalDate end, List<Dimension> dimensions) {
    this.start = start;
    this.end = end;
    this.dimensions = ImmutableList.copyOf(dimensions);
  }

  public FetchChunk(DateRange range, List<Dimension> dimensions) {
    this(range.getStartDate(), range.getEndDate(), dimensions);
  }

  public DateRange getRange() {
    return new DateRange(this.start, this.end);
  }

  @Override
  public String toString() {
    return "[" + this.start + ", " + this.end + "] " + this.dimensions;
  }
}
