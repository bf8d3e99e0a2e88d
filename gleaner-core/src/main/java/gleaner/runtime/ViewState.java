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

import com.google.common.base.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;


/**
 * Immutable snapshot of a view, replaced as a whole whenever the view changes.
 *
 * <p>
 *   {@link #getGeneration()} identifies the filter state the snapshot belongs to. While a harvest is loading,
 *   the result of the previous generation stays visible.
 * </p>
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ViewState {
  private final long generation;
  private final Optional<FilterState> filterState;
  private final boolean loading;
  private final Optional<ViewResult> result;
  private final Optional<String> error;

  static ViewState initial() {
    return new ViewState(0L, Optional.<FilterState>absent(), false, Optional.<ViewResult>absent(),
        Optional.<String>absent());
  }

  ViewState loading(long newGeneration, FilterState newFilterState) {
    return new ViewState(newGeneration, Optional.of(newFilterState), true, this.result, Optional.<String>absent());
  }

  ViewState loaded(ViewResult newResult) {
    return new ViewState(this.generation, this.filterState, false, Optional.of(newResult),
        Optional.<String>absent());
  }

  ViewState failed(String message) {
    return new ViewState(this.generation, this.filterState, false, this.result, Optional.of(message));
  }
}
