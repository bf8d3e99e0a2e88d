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

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import gleaner.metric.CanonicalMetric;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * The fields records are grouped by in {@link MetricAggregator#groupAndAggregate}. Missing values group
 * together with empty ones.
 */
@Getter
@ToString
@EqualsAndHashCode
public class AggregationKey {

  public enum Field {
    QUERY,
    URL,
    SERP_FEATURES
  }

  public static final AggregationKey QUERY = of(Field.QUERY);
  public static final AggregationKey URL = of(Field.URL);
  public static final AggregationKey QUERY_URL = of(Field.QUERY, Field.URL);
  public static final AggregationKey QUERY_SERP_FEATURES = of(Field.QUERY, Field.SERP_FEATURES);

  private final ImmutableList<Field> fields;

  private AggregationKey(List<Field> fields) {
    this.fields = ImmutableList.copyOf(fields);
  }

  public static AggregationKey of(Field... fields) {
    Preconditions.checkArgument(fields.length > 0, "At least one key field is required");
    Preconditions.checkArgument(ImmutableSet.copyOf(fields).size() == fields.length,
        "Duplicate key fields in %s", Arrays.toString(fields));
    return new AggregationKey(Arrays.asList(fields));
  }

  /**
   * @return the values of this key's fields in {@code record}, in field order
   */
  public List<String> valuesOf(CanonicalMetric record) {
    ImmutableList.Builder<String> values = ImmutableList.builder();
    for (Field field : this.fields) {
      switch (field) {
        case QUERY:
          values.add(Strings.nullToEmpty(record.getQuery()));
          break;
        case URL:
          values.add(Strings.nullToEmpty(record.getUrl()));
          break;
        case SERP_FEATURES:
          values.add(Strings.nullToEmpty(record.getSerpFeatures()));
          break;
        default:
          throw new IllegalArgumentException(field + " is not supported");
      }
    }
    return values.build();
  }
}
