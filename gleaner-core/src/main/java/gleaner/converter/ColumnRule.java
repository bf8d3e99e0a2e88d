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
import java.util.Locale;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * Maps one {@link SecondaryField} to a CSV column by header name.
 *
 * <p>
 *   Candidates are tried in order. For each candidate, a header equal to it (trimmed, ignoring case) wins
 *   first; failing that, a header containing the candidate or contained in it. Empty headers never match.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public class ColumnRule {

  /**
   * Rules for the keyword exports of the secondary source.
   */
  public static final ImmutableList<ColumnRule> DEFAULT_RULES = ImmutableList.of(
      new ColumnRule(SecondaryField.KEYWORD, "Keyword"),
      new ColumnRule(SecondaryField.URL, "Current URL"),
      new ColumnRule(SecondaryField.POSITION, "Current position"),
      new ColumnRule(SecondaryField.VOLUME, "Volume"),
      new ColumnRule(SecondaryField.DIFFICULTY, "KD"),
      new ColumnRule(SecondaryField.CPC, "CPC"),
      new ColumnRule(SecondaryField.TRAFFIC, "Current organic traffic"),
      new ColumnRule(SecondaryField.DATE, "Current date"),
      new ColumnRule(SecondaryField.SERP_FEATURES, "SERP features"),
      new ColumnRule(SecondaryField.PREVIOUS_TRAFFIC, "Previous organic traffic"),
      new ColumnRule(SecondaryField.TRAFFIC_CHANGE, "Organic traffic change"),
      new ColumnRule(SecondaryField.PREVIOUS_POSITION, "Previous position"),
      new ColumnRule(SecondaryField.POSITION_CHANGE, "Position change"),
      new ColumnRule(SecondaryField.PREVIOUS_DATE, "Previous date"));

  private final SecondaryField field;
  private final ImmutableList<String> candidateHeaders;

  public ColumnRule(SecondaryField field, String... candidateHeaders) {
    Preconditions.checkArgument(candidateHeaders.length > 0, "No candidate headers for %s", field);
    this.field = field;
    this.candidateHeaders = ImmutableList.copyOf(candidateHeaders);
  }

  /**
   * @return index of the column in {@code headers} this rule maps to, absent if none matches
   */
  public Optional<Integer> match(List<String> headers) {
    for (String candidate : this.candidateHeaders) {
      String wanted = normalize(candidate);
      for (int i = 0; i < headers.size(); i++) {
        if (normalize(headers.get(i)).equals(wanted)) {
          return Optional.of(i);
        }
      }
      for (int i = 0; i < headers.size(); i++) {
        String header = normalize(headers.get(i));
        if (!header.isEmpty() && (header.contains(wanted) || wanted.contains(header))) {
          return Optional.of(i);
        }
      }
    }
    return Optional.absent();
  }

  private static String normalize(String header) {
    return header == null ? "" : header.trim().toLowerCase(Locale.ROOT);
  }
}
