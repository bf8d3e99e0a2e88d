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

package gleaner.aggregation;

import com.google.common.base.Optional;

import lombok.Getter;


/**
 * Metrics that can be charted or compared across periods.
 */
public enum Metric {
  CLICKS("clicks"),
  IMPRESSIONS("impressions"),
  CTR("ctr"),
  POSITION("position"),
  VOLUME("volume"),
  TRAFFIC("traffic");

  @Getter
  private final String id;

  Metric(String id) {
    this.id = id;
  }

  public static Optional<Metric> forId(String id) {
    for (Metric metric : values()) {
      if (metric.id.equalsIgnoreCase(id)) {
        return Optional.of(metric);
      }
    }
    return Optional.absent();
  }
}
