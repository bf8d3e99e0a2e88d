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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import org.joda.time.LocalDate;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.base.Optional;
import com.google.common.base.Suppliers;

import gleaner.metric.SecondaryMetric;


/**
 * Unit tests for {@link SecondaryCsvImporter}.
 */
@Test(groups = { "gleaner.converter" })
public class SecondaryCsvImporterTest {

  private static final LocalDate TODAY = new LocalDate(2024, 6, 15);

  private final SecondaryCsvImporter importer =
      new SecondaryCsvImporter(ColumnRule.DEFAULT_RULES, Suppliers.ofInstance(TODAY));

  @Test
  public void testImportKeywordExport() throws IOException {
    String csv = "Keyword,SERP features,Volume,KD,CPC,Current organic traffic,Previous organic traffic,"
        + "Organic traffic change,Current position,Previous position,Position change,Current URL,Current date,"
        + "Previous date\r\n"
        + "running shoes,\"Sitelinks, Image pack\",\"12,100\",45,$1.20,340,300,40,3,5,2,https://example.com/shoes,"
        + "2024-06-01,2024-05-01\r\n"
        + "trail shoes,,<10,,,,,,,,,,,\r\n";

    SecondaryImportResult result = this.importer.importFrom(new StringReader(csv));

    Assert.assertTrue(result.isSuccess());
    Assert.assertEquals(result.getTotalRows(), 2);
    Assert.assertEquals(result.getValidRows(), 2);
    Assert.assertTrue(result.getErrors().isEmpty());

    SecondaryMetric first = result.getMetrics().get(0);
    Assert.assertEquals(first.getKeyword(), "running shoes");
    Assert.assertEquals(first.getSerpFeatures(), "Sitelinks, Image pack");
    Assert.assertEquals(first.getVolume(), Long.valueOf(12100));
    Assert.assertEquals(first.getDifficulty(), Double.valueOf(45));
    Assert.assertEquals(first.getCpc(), Double.valueOf(1.2));
    Assert.assertEquals(first.getTraffic(), Long.valueOf(340));
    Assert.assertEquals(first.getPreviousTraffic(), Long.valueOf(300));
    Assert.assertEquals(first.getTrafficChange(), Long.valueOf(40));
    Assert.assertEquals(first.getPosition(), Double.valueOf(3));
    Assert.assertEquals(first.getPreviousPosition(), Double.valueOf(5));
    Assert.assertEquals(first.getPositionChange(), Double.valueOf(2));
    Assert.assertEquals(first.getUrl(), "https://example.com/shoes");
    Assert.assertEquals(first.getDate(), new LocalDate(2024, 6, 1));
    Assert.assertEquals(first.getPreviousDate(), new LocalDate(2024, 5, 1));

    SecondaryMetric second = result.getMetrics().get(1);
    Assert.assertEquals(second.getVolume(), Long.valueOf(10));
    Assert.assertNull(second.getDifficulty());
    Assert.assertNull(second.getUrl());
    Assert.assertEquals(second.getDate(), TODAY);
    Assert.assertNull(second.getPreviousDate());
  }

  @Test
  public void testRowsWithoutKeywordAreReported() throws IOException {
    String csv = "Keyword,Volume\nshoes,10\n,20\n  ,30\nboots,40\n";

    SecondaryImportResult result = this.importer.importFrom(new StringReader(csv));

    Assert.assertTrue(result.isSuccess());
    Assert.assertEquals(result.getTotalRows(), 4);
    Assert.assertEquals(result.getValidRows(), 2);
    Assert.assertEquals(result.getErrors().size(), 2);
    Assert.assertEquals(result.getErrors().get(0), "Row 3: Missing keyword");
    Assert.assertEquals(result.getErrors().get(1), "Row 4: Missing keyword");
  }

  @Test
  public void testMissingKeywordColumn() throws IOException {
    SecondaryImportResult result = this.importer.importFrom(new StringReader("Volume,CPC\n10,1.5\n"));

    Assert.assertFalse(result.isSuccess());
    Assert.assertEquals(result.getErrors().get(0),
        "Required column \"keyword\" not found. Available columns: Volume, CPC");
  }

  @Test
  public void testEmptyFile() throws IOException {
    SecondaryImportResult result = this.importer.importFrom(new StringReader(""));

    Assert.assertFalse(result.isSuccess());
    Assert.assertEquals(result.getErrors().get(0), "No headers found in CSV file");
    Assert.assertEquals(result.getTotalRows(), 0);
  }

  @Test
  public void testMalformedFileFails() throws IOException {
    SecondaryImportResult result = this.importer.importFrom(new StringReader("Keyword\n\"unterminated\n"));

    Assert.assertFalse(result.isSuccess());
    Assert.assertTrue(result.getErrors().get(0).startsWith("Invalid CSV"));
  }

  @Test
  public void testHeaderOnlyIsNotASuccess() throws IOException {
    SecondaryImportResult result =
        this.importer.importFrom(new ByteArrayInputStream("\uFEFFKeyword,Volume\n".getBytes(StandardCharsets.UTF_8)));

    Assert.assertFalse(result.isSuccess());
    Assert.assertTrue(result.getErrors().isEmpty());
    Assert.assertEquals(result.getTotalRows(), 0);
  }

  @Test
  public void testParseNumber() {
    Assert.assertEquals(SecondaryCsvImporter.parseNumber("$1,234.50"), Double.valueOf(1234.5));
    Assert.assertEquals(SecondaryCsvImporter.parseNumber("12.5%"), Double.valueOf(12.5));
    Assert.assertEquals(SecondaryCsvImporter.parseNumber("-3"), Double.valueOf(-3));
    Assert.assertNull(SecondaryCsvImporter.parseNumber(""));
    Assert.assertNull(SecondaryCsvImporter.parseNumber("n/a"));
  }

  @Test
  public void testParseDate() {
    LocalDate june = new LocalDate(2024, 6, 1);
    Assert.assertEquals(SecondaryCsvImporter.parseDate("2024-06-01"), Optional.of(june));
    Assert.assertEquals(SecondaryCsvImporter.parseDate("2024-06-01T08:30:00Z"), Optional.of(june));
    Assert.assertEquals(SecondaryCsvImporter.parseDate("06/01/2024"), Optional.of(june));
    Assert.assertEquals(SecondaryCsvImporter.parseDate("01.06.2024"), Optional.of(june));
    Assert.assertEquals(SecondaryCsvImporter.parseDate("Jun 1, 2024"), Optional.of(june));
    Assert.assertFalse(SecondaryCsvImporter.parseDate("yesterday").isPresent());
    Assert.assertFalse(SecondaryCsvImporter.parseDate(" ").isPresent());
  }
}
