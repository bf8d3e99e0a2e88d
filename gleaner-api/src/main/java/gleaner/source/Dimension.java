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

import lombok.Getter;


/**
 * Dimensions the provider can break results down by.
 */
public enum Dimension {
  DATE("date"),
  QUERY("query"),
  PAGE("page"),
  COUNTRY("country"),
  DEVICE("device");

  @Getter
  private final String apiName;

  Dimension(String apiName) {
    this.apiName = apiName;
  }

  public static Dimension forApiName(String apiName) {
    for (Dimension dimension : values()) {
      if (dimension.apiName.equalsIgnoreCase(apiName)) {
        return dimension;
      }
    }
    throw new IllegalArgumentException("Unknown dimension " + apiName);
  }
}
