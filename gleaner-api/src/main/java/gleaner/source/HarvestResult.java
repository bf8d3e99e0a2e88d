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

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;

import lombok.Getter;
import lombok.ToString;


/**
 * Rows of one logical harvest together with its {@link Completeness}.
 *
 * <p>
 *   {@link #getEffectiveRange()} is the range actually queried, which differs from the requested one when the
 *   start date had to be clamped to the provider's lookback limit. In that case {@link #getRangeWarning()}
 *   says so.
 * </p>
 */
@Getter
@ToString(exclude = "rows")
public class HarvestResult {

  private final ImmutableList<RawProviderRow> rows;
  private final Completeness completeness;
  private final DateRange effectiveRange;
  private final Optional<String> rangeWarning;

  public HarvestResult(List<RawProviderRow> rows, Completeness completeness, DateRange effectiveRange,
      Optional<String> rangeWarning) {
    this.rows = ImmutableList.copyOf(rows);
    this.completeness = completeness;
    this.effectiveRange = effectiveRange;
    this.rangeWarning = rangeWarning;
  }
}
