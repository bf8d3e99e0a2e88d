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

package gleaner.converter;

import java.util.List;

import com.google.common.collect.ImmutableList;

import gleaner.metric.SecondaryMetric;

import lombok.Getter;
import lombok.ToString;


/**
 * Outcome of a secondary CSV import. Rows that could not be imported are reported in {@link #getErrors()}; the
 * import succeeds as long as at least one row made it.
 */
@Getter
@ToString(exclude = "metrics")
public class SecondaryImportResult {
  private final ImmutableList<SecondaryMetric> metrics;
  private final ImmutableList<String> errors;
  private final int totalRows;

  public SecondaryImportResult(List<SecondaryMetric> metrics, List<String> errors, int totalRows) {
    this.metrics = ImmutableList.copyOf(metrics);
    this.errors = ImmutableList.copyOf(errors);
    this.totalRows = totalRows;
  }

  static SecondaryImportResult failed(String error) {
    return new SecondaryImportResult(ImmutableList.<SecondaryMetric>of(), ImmutableList.of(error), 0);
  }

  public int getValidRows() {
    return this.metrics.size();
  }

  public boolean isSuccess() {
    return !this.metrics.isEmpty();
  }
}
