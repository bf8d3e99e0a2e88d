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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import lombok.EqualsAndHashCode;
import lombok.Getter;


/**
 * An OAuth-derived access token handed in by the calling session.
 *
 * <p>
 *   Every provider call receives the {@link Credential} explicitly; nothing in Gleaner caches it beyond the
 *   lifetime of the call.
 * </p>
 */
@EqualsAndHashCode
public class Credential {

  @Getter
  private final String accessToken;

  public Credential(String accessToken) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(accessToken), "Access token must not be empty");
    this.accessToken = accessToken;
  }

  public String toAuthorizationHeader() {
    return "Bearer " + this.accessToken;
  }

  @Override
  public String toString() {
    return "Credential[****]";
  }
}
