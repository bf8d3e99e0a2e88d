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

import com.google.common.base.Function;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;


/**
 * Renders table rows as CSV. Every cell is quoted; rows are separated by {@code \n} without a trailing newline.
 */
public class TableRowCsvExporter {

  static final List<String> HEADER =
      ImmutableList.of("Query", "URL", "Clicks", "Impressions", "CTR (%)", "Position", "Volume", "Source");

  private static final Joiner CELLS = Joiner.on(',');
  private static final Joiner LINES = Joiner.on('\n');

  private static final Function<String, String> QUOTE = new Function<String, String>() {
    @Override
    public String apply(String cell) {
      return '"' + Strings.nullToEmpty(cell).replace("\"", "\"\"") + '"';
    }
  };

  public static String export(List<TableRow> rows) {
    List<String> lines = Lists.newArrayListWithCapacity(rows.size() + 1);
    lines.add(line(HEADER));
    for (TableRow row : rows) {
      lines.add(line(ImmutableList.of(
          Strings.nullToEmpty(row.getQuery()),
          Strings.nullToEmpty(row.getUrl()),
          Long.toString(row.getClicks()),
          Long.toString(row.getImpressions()),
          String.format(Locale.ROOT, "%.2f", row.getCtr() * 100),
          String.format(Locale.ROOT, "%.1f", row.getPosition()),
          row.getVolume() == null ? "" : row.getVolume().toString(),
          row.getSource() == null ? "" : row.getSource().getTag())));
    }
    return LINES.join(lines);
  }

  private static String line(List<String> cells) {
    return CELLS.join(Lists.transform(cells, QUOTE));
  }
}
