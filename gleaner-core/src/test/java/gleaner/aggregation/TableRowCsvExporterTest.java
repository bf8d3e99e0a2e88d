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

import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;

import gleaner.metric.MetricSource;


@Test(groups = { "gleaner.aggregation" })
public class TableRowCsvExporterTest {

  @Test
  public void testExport() {
    TableRow primary = TableRow.builder().query("say \"hi\"").url("https://example.com/a,b").clicks(12)
        .impressions(400).ctr(0.03).position(4.24).source(MetricSource.PRIMARY).build();
    TableRow secondary = TableRow.builder().query("shoes").volume(2400L).position(7)
        .source(MetricSource.SECONDARY).build();

    String csv = TableRowCsvExporter.export(ImmutableList.of(primary, secondary));

    Assert.assertEquals(csv,
        "\"Query\",\"URL\",\"Clicks\",\"Impressions\",\"CTR (%)\",\"Position\",\"Volume\",\"Source\"\n"
            + "\"say \"\"hi\"\"\",\"https://example.com/a,b\",\"12\",\"400\",\"3.00\",\"4.2\",\"\",\"gsc\"\n"
            + "\"shoes\",\"\",\"0\",\"0\",\"0.00\",\"7.0\",\"2400\",\"ahrefs\"");
  }

  @Test
  public void testHeaderOnly() {
    Assert.assertEquals(TableRowCsvExporter.export(ImmutableList.<TableRow>of()),
        "\"Query\",\"URL\",\"Clicks\",\"Impressions\",\"CTR (%)\",\"Position\",\"Volume\",\"Source\"");
  }
}
