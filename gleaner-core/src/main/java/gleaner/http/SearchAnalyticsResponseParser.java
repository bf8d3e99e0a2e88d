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

package gleaner.http;

import java.io.IOException;
import java.util.List;

import org.joda.time.LocalDate;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import gleaner.source.Dimension;
import gleaner.source.RawProviderRow;
import gleaner.source.SearchAnalyticsRequest;


/**
 * Turns provider JSON into {@link RawProviderRow}s and site lists.
 *
 * <p>
 *   The i-th entry of a row's {@code keys} is the value of the i-th requested dimension. Metrics missing from a
 *   row are 0.
 * </p>
 */
public class SearchAnalyticsResponseParser {

  static final String ROWS = "rows";
  static final String KEYS = "keys";
  static final String CLICKS = "clicks";
  static final String IMPRESSIONS = "impressions";
  static final String CTR = "ctr";
  static final String POSITION = "position";
  static final String SITE_ENTRY = "siteEntry";
  static final String SITE_URL = "siteUrl";
  static final String PERMISSION_LEVEL = "permissionLevel";

  private static final ImmutableSet<String> READABLE_PERMISSIONS = ImmutableSet.of("siteOwner", "siteFullUser");

  /**
   * @throws IOException if {@code json} is not a well formed query response
   */
  public List<RawProviderRow> parseRows(String json, SearchAnalyticsRequest request) throws IOException {
    try {
      JsonObject response = parseObject(json);
      if (!response.has(ROWS)) {
        return ImmutableList.of();
      }

      ImmutableList.Builder<RawProviderRow> rows = ImmutableList.builder();
      for (JsonElement element : response.getAsJsonArray(ROWS)) {
        rows.add(toRow(element.getAsJsonObject(), request));
      }
      return rows.build();
    } catch (JsonParseException | IllegalStateException | ClassCastException | IllegalArgumentException
        | UnsupportedOperationException e) {
      throw new IOException("Malformed search analytics response for " + request.getSiteId(), e);
    }
  }

  /**
   * @return identifiers of the sites listed in {@code json} that grant owner or full user permission
   */
  public List<String> parseSites(String json) throws IOException {
    try {
      JsonObject response = parseObject(json);
      if (!response.has(SITE_ENTRY)) {
        return ImmutableList.of();
      }

      ImmutableList.Builder<String> sites = ImmutableList.builder();
      for (JsonElement element : response.getAsJsonArray(SITE_ENTRY)) {
        JsonObject entry = element.getAsJsonObject();
        if (!hasValue(entry, SITE_URL) || !hasValue(entry, PERMISSION_LEVEL)) {
          continue;
        }
        if (READABLE_PERMISSIONS.contains(entry.get(PERMISSION_LEVEL).getAsString())) {
          sites.add(entry.get(SITE_URL).getAsString());
        }
      }
      return sites.build();
    } catch (JsonParseException | IllegalStateException | ClassCastException | UnsupportedOperationException e) {
      throw new IOException("Malformed site list response", e);
    }
  }

  private static boolean hasValue(JsonObject object, String name) {
    return object.has(name) && !object.get(name).isJsonNull();
  }

  private static JsonObject parseObject(String json) {
    JsonElement element = JsonParser.parseString(json);
    if (element.isJsonNull()) {
      return new JsonObject();
    }
    return element.getAsJsonObject();
  }

  private static RawProviderRow toRow(JsonObject row, SearchAnalyticsRequest request) {
    JsonArray keys = row.has(KEYS) ? row.getAsJsonArray(KEYS) : new JsonArray();
    List<Dimension> dimensions = request.getDimensions();

    String date = key(keys, dimensions, Dimension.DATE);
    return RawProviderRow.builder()
        // rows of a query without the date dimension aggregate the whole range
        .date(date == null ? request.getRange().getEndDate() : LocalDate.parse(date))
        .query(key(keys, dimensions, Dimension.QUERY))
        .page(key(keys, dimensions, Dimension.PAGE))
        .country(key(keys, dimensions, Dimension.COUNTRY))
        .device(key(keys, dimensions, Dimension.DEVICE))
        .clicks(Math.round(number(row, CLICKS)))
        .impressions(Math.round(number(row, IMPRESSIONS)))
        .ctr(number(row, CTR))
        .position(number(row, POSITION))
        .build();
  }

  private static String key(JsonArray keys, List<Dimension> dimensions, Dimension dimension) {
    int index = dimensions.indexOf(dimension);
    if (index < 0 || index >= keys.size() || keys.get(index).isJsonNull()) {
      return null;
    }
    return keys.get(index).getAsString();
  }

  private static double number(JsonObject row, String name) {
    if (!row.has(name) || row.get(name).isJsonNull()) {
      return 0;
    }
    return row.get(name).getAsDouble();
  }
}
