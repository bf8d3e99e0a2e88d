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

import java.util.List;
import java.util.Locale;

import org.joda.time.DateTime;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * A named set of urls tracked together.
 *
 * <p>
 *   A record belongs to the cluster when its url and one of the cluster's urls contain each other, compared
 *   case-insensitively, so a cluster url can name a whole section of a site. Empty urls never match.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public class PerformanceCluster {
  private final String id;
  private final String name;
  private final ImmutableList<String> urls;
  private final DateTime createdAt;
  private final DateTime updatedAt;

  public PerformanceCluster(String id, String name, List<String> urls, DateTime createdAt, DateTime updatedAt) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(id), "Cluster id must not be empty");
    this.id = id;
    this.name = Strings.nullToEmpty(name);
    this.urls = ImmutableList.copyOf(urls);
    this.createdAt = Preconditions.checkNotNull(createdAt);
    this.updatedAt = Preconditions.checkNotNull(updatedAt);
  }

  public boolean matches(String url) {
    if (Strings.isNullOrEmpty(url)) {
      return false;
    }
    String candidate = url.toLowerCase(Locale.ROOT);
    for (String clusterUrl : this.urls) {
      if (Strings.isNullOrEmpty(clusterUrl)) {
        continue;
      }
      String member = clusterUrl.toLowerCase(Locale.ROOT);
      if (candidate.contains(member) || member.contains(candidate)) {
        return true;
      }
    }
    return false;
  }
}
