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

import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;


@Test(groups = { "gleaner.converter" })
public class ColumnRuleTest {

  @Test
  public void testExactMatchWinsOverSubstring() {
    List<String> headers = ImmutableList.of("Previous position", "Position change", " position ");
    ColumnRule rule = new ColumnRule(SecondaryField.POSITION, "Position");

    Assert.assertEquals(rule.match(headers), Optional.of(2));
  }

  @Test
  public void testSubstringMatchEitherWay() {
    ColumnRule rule = new ColumnRule(SecondaryField.VOLUME, "Volume");

    Assert.assertEquals(rule.match(ImmutableList.of("Keyword", "Search volume (US)")), Optional.of(1));
    Assert.assertEquals(new ColumnRule(SecondaryField.CPC, "CPC (USD)").match(ImmutableList.of("cpc")),
        Optional.of(0));
  }

  @Test
  public void testCandidatesTriedInOrder() {
    ColumnRule rule = new ColumnRule(SecondaryField.URL, "Current URL", "URL");
    List<String> headers = ImmutableList.of("Previous URL", "Current URL");

    Assert.assertEquals(rule.match(headers), Optional.of(1));
  }

  @Test
  public void testEmptyHeadersNeverMatch() {
    ColumnRule rule = new ColumnRule(SecondaryField.KEYWORD, "Keyword");

    Assert.assertEquals(rule.match(ImmutableList.of("", "Volume")), Optional.<Integer>absent());
  }

  @Test
  public void testDefaultRulesOnExportHeaders() {
    List<String> headers = ImmutableList.of("Keyword", "SERP features", "Volume", "KD", "CPC",
        "Previous organic traffic", "Current organic traffic", "Organic traffic change", "Previous position",
        "Current position", "Position change", "Previous URL", "Current URL", "Previous date", "Current date");

    Assert.assertEquals(ColumnRule.DEFAULT_RULES.size(), SecondaryField.values().length);
    for (ColumnRule rule : ColumnRule.DEFAULT_RULES) {
      Assert.assertTrue(rule.match(headers).isPresent(), rule.toString());
      Assert.assertEquals(headers.get(rule.match(headers).get()), rule.getCandidateHeaders().get(0));
    }
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testRuleNeedsCandidates() {
    new ColumnRule(SecondaryField.DATE);
  }
}
