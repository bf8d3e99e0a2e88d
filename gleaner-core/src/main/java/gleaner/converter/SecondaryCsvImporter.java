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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.joda.time.LocalDate;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.base.Strings;
import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import gleaner.metric.SecondaryMetric;
import gleaner.util.csv.InputStreamCSVReader;


/**
 * Imports keyword exports of the secondary metrics source.
 *
 * <p>
 *   The first non-blank record is the header. Columns are mapped to {@link SecondaryField}s by an ordered list of
 *   {@link ColumnRule}s; only the keyword column is required. Cells that cannot be read leave their field unknown,
 *   and a missing or unreadable date falls back to the import day.
 * </p>
 */
public class SecondaryCsvImporter {
  private static final Logger LOG = LoggerFactory.getLogger(SecondaryCsvImporter.class);

  private static final CharMatcher NUMBER_DECORATION = CharMatcher.anyOf("$,%<>");

  private static final List<DateTimeFormatter> DATE_FORMATS = ImmutableList.of(
      ISODateTimeFormat.dateTimeParser(),
      DateTimeFormat.forPattern("yyyy/MM/dd"),
      DateTimeFormat.forPattern("MM/dd/yyyy"),
      DateTimeFormat.forPattern("dd.MM.yyyy"),
      DateTimeFormat.forPattern("MMM d, yyyy").withLocale(Locale.US));

  private static final Supplier<LocalDate> SYSTEM_TODAY = new Supplier<LocalDate>() {
    @Override
    public LocalDate get() {
      return LocalDate.now();
    }
  };

  private final List<ColumnRule> rules;
  private final Supplier<LocalDate> today;

  public SecondaryCsvImporter() {
    this(ColumnRule.DEFAULT_RULES, SYSTEM_TODAY);
  }

  public SecondaryCsvImporter(List<ColumnRule> rules) {
    this(rules, SYSTEM_TODAY);
  }

  @VisibleForTesting
  SecondaryCsvImporter(List<ColumnRule> rules, Supplier<LocalDate> today) {
    this.rules = ImmutableList.copyOf(rules);
    this.today = today;
  }

  public SecondaryImportResult importFrom(InputStream input) throws IOException {
    return importFrom(new InputStreamReader(input, StandardCharsets.UTF_8));
  }

  /**
   * Read all records from {@code input}. A malformed file yields a failed result rather than an exception;
   * only I/O errors of the underlying reader are thrown.
   */
  public SecondaryImportResult importFrom(Reader input) throws IOException {
    try (InputStreamCSVReader reader = new InputStreamCSVReader(input)) {
      List<String> headers = reader.nextRecord();
      if (headers == null || headers.isEmpty()) {
        return SecondaryImportResult.failed("No headers found in CSV file");
      }

      Map<SecondaryField, Integer> columns = mapColumns(headers);
      if (!columns.containsKey(SecondaryField.KEYWORD)) {
        return SecondaryImportResult.failed("Required column \"keyword\" not found. Available columns: "
            + Joiner.on(", ").join(headers));
      }
      LOG.debug("Mapped columns " + columns);

      LocalDate importDay = this.today.get();
      List<SecondaryMetric> metrics = Lists.newArrayList();
      List<String> errors = Lists.newArrayList();
      int dataRows = 0;
      List<String> record;
      while ((record = reader.nextRecord()) != null) {
        // rows are numbered as in a spreadsheet, the header being row 1
        int rowNumber = dataRows + 2;
        dataRows++;
        Optional<SecondaryMetric> metric = toMetric(new Row(record, columns), importDay);
        if (metric.isPresent()) {
          metrics.add(metric.get());
        } else {
          errors.add("Row " + rowNumber + ": Missing keyword");
        }
      }

      if (!errors.isEmpty()) {
        LOG.warn(String.format("Skipped %d of %d rows of secondary import", errors.size(), dataRows));
      }
      return new SecondaryImportResult(metrics, errors, dataRows);
    } catch (InputStreamCSVReader.CSVParseException e) {
      LOG.warn("Could not parse secondary import", e);
      return SecondaryImportResult.failed("Invalid CSV: " + e.getMessage());
    }
  }

  private Map<SecondaryField, Integer> mapColumns(List<String> headers) {
    Map<SecondaryField, Integer> columns = new EnumMap<>(SecondaryField.class);
    for (ColumnRule rule : this.rules) {
      if (columns.containsKey(rule.getField())) {
        continue;
      }
      Optional<Integer> index = rule.match(headers);
      if (index.isPresent()) {
        columns.put(rule.getField(), index.get());
      }
    }
    return columns;
  }

  private static Optional<SecondaryMetric> toMetric(Row row, LocalDate importDay) {
    String keyword = row.text(SecondaryField.KEYWORD);
    if (keyword == null) {
      return Optional.absent();
    }
    return Optional.of(SecondaryMetric.builder()
        .keyword(keyword)
        .url(row.text(SecondaryField.URL))
        .position(row.decimal(SecondaryField.POSITION))
        .volume(row.integer(SecondaryField.VOLUME))
        .difficulty(row.decimal(SecondaryField.DIFFICULTY))
        .cpc(row.decimal(SecondaryField.CPC))
        .traffic(row.integer(SecondaryField.TRAFFIC))
        .date(row.date(SecondaryField.DATE).or(importDay))
        .serpFeatures(row.text(SecondaryField.SERP_FEATURES))
        .previousTraffic(row.integer(SecondaryField.PREVIOUS_TRAFFIC))
        .trafficChange(row.integer(SecondaryField.TRAFFIC_CHANGE))
        .previousPosition(row.decimal(SecondaryField.PREVIOUS_POSITION))
        .positionChange(row.decimal(SecondaryField.POSITION_CHANGE))
        .previousDate(row.date(SecondaryField.PREVIOUS_DATE).orNull())
        .build());
  }

  @VisibleForTesting
  static Double parseNumber(String cell) {
    String digits = NUMBER_DECORATION.removeFrom(Strings.nullToEmpty(cell)).trim();
    if (digits.isEmpty()) {
      return null;
    }
    try {
      return Double.valueOf(digits);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  @VisibleForTesting
  static Optional<LocalDate> parseDate(String cell) {
    String text = Strings.nullToEmpty(cell).trim();
    if (text.isEmpty()) {
      return Optional.absent();
    }
    for (DateTimeFormatter format : DATE_FORMATS) {
      try {
        return Optional.of(format.parseLocalDate(text));
      } catch (IllegalArgumentException e) {
        // try the next layout
      }
    }
    LOG.debug("Unreadable date " + text);
    return Optional.absent();
  }

  /**
   * Cell access for one record; columns beyond the end of a short record read as empty.
   */
  private static class Row {
    private final List<String> cells;
    private final Map<SecondaryField, Integer> columns;

    Row(List<String> cells, Map<SecondaryField, Integer> columns) {
      this.cells = cells;
      this.columns = columns;
    }

    String text(SecondaryField field) {
      Integer index = this.columns.get(field);
      if (index == null || index >= this.cells.size()) {
        return null;
      }
      return Strings.emptyToNull(this.cells.get(index).trim());
    }

    Double decimal(SecondaryField field) {
      return parseNumber(text(field));
    }

    Long integer(SecondaryField field) {
      Double value = decimal(field);
      return value == null ? null : Math.round(value);
    }

    Optional<LocalDate> date(SecondaryField field) {
      return parseDate(text(field));
    }
  }
}
