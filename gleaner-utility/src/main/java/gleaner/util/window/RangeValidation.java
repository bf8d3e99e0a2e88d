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

package gleaner.util.window;

import org.joda.time.LocalDate;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

import gleaner.source.DateRange;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * Outcome of {@link DateWindow#validateRange(LocalDate, LocalDate, LocalDate, int)}.
 *
 * <p>
 *   A failed validation carries the reason. A successful one may still carry a reason, namely the warning that
 *   the start date was moved up to the lookback boundary; {@link #getClampedStart()} is then present.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public class RangeValidation {

  private final boolean ok;
  private final Optional<LocalDate> clampedStart;
  private final Optional<String> reason;

  private RangeValidation(boolean ok, Optional<LocalDate> clampedStart, Optional<String> reason) {
    this.ok = ok;
    this.clampedStart = clampedStart;
    this.reason = reason;
  }

  static RangeValidation valid() {
    return new RangeValidation(true, Optional.<LocalDate>absent(), Optional.<String>absent());
  }

  static RangeValidation clamped(LocalDate clampedStart, String warning) {
    return new RangeValidation(true, Optional.of(clampedStart), Optional.of(warning));
  }

  static RangeValidation invalid(String reason) {
    return new RangeValidation(false, Optional.<LocalDate>absent(), Optional.of(reason));
  }

  public boolean isClamped() {
    return this.clampedStart.isPresent();
  }

  /**
   * @return the range to actually query, i.e. {@code requested} with the clamped start applied if any
   */
  public DateRange apply(DateRange requested) {
    Preconditions.checkState(this.ok, "Cannot apply a failed validation: %s", this.reason.orNull());
    return this.clampedStart.isPresent() ? requested.withStartDate(this.clampedStart.get()) : requested;
  }
}
