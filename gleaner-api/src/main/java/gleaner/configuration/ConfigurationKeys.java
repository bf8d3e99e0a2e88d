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

package gleaner.configuration;

import com.google.common.base.Charsets;


/**
 * A central place for all Gleaner configuration property keys.
 */
public class ConfigurationKeys {

  /**
   * Provider (primary reporting source) properties.
   */
  // Hard per-request row ceiling of the provider
  public static final String PROVIDER_MAX_ROW_LIMIT_KEY = "gleaner.provider.row.limit.max";
  public static final int DEFAULT_PROVIDER_MAX_ROW_LIMIT = 25000;

  // How far back the provider keeps data, in months before today
  public static final String WINDOW_MAX_LOOKBACK_MONTHS_KEY = "gleaner.window.max.lookback.months";
  public static final int DEFAULT_WINDOW_MAX_LOOKBACK_MONTHS = 16;

  /**
   * Harvest properties.
   */
  // Row cap used by quick (top N) harvests
  public static final String HARVEST_QUICK_ROW_LIMIT_KEY = "gleaner.harvest.quick.row.limit";
  public static final int DEFAULT_HARVEST_QUICK_ROW_LIMIT = 1000;

  // Pause between two consecutive chunk requests of one harvest
  public static final String FETCH_INTER_CHUNK_DELAY_MS_KEY = "gleaner.fetch.inter.chunk.delay.ms";
  public static final long DEFAULT_FETCH_INTER_CHUNK_DELAY_MS = 250L;

  // Upper bound on chunks per harvest; chunks are widened when exceeded
  public static final String FETCH_MAX_CHUNKS_KEY = "gleaner.fetch.max.chunks";
  public static final int DEFAULT_FETCH_MAX_CHUNKS = 400;

  /**
   * Http client properties.
   */
  public static final String HTTP_ENDPOINT_KEY = "gleaner.http.endpoint";
  public static final String DEFAULT_HTTP_ENDPOINT = "https://www.googleapis.com/webmasters/v3";
  public static final String HTTP_REQUEST_TIME_OUT_MS_KEY = "gleaner.http.req_time_out";
  public static final String HTTP_CONNECTION_TIME_OUT_MS_KEY = "gleaner.http.conn_time_out";

  /**
   * Coordinator properties.
   */
  // One worker per independently refreshed view is enough
  public static final String COORDINATOR_THREADS_KEY = "gleaner.coordinator.threads";
  public static final int DEFAULT_COORDINATOR_THREADS = 3;

  /**
   * Common properties.
   */
  public static final String DEFAULT_CHARSET_ENCODING = Charsets.UTF_8.name();
  public static final String ISO_DATE_FORMAT = "yyyy-MM-dd";
}
