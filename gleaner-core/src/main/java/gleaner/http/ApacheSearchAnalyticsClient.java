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
import java.net.URLEncoder;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpHeaders;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import gleaner.configuration.ConfigurationKeys;
import gleaner.source.Credential;
import gleaner.source.Dimension;
import gleaner.source.RawProviderRow;
import gleaner.source.SearchAnalyticsClient;
import gleaner.source.SearchAnalyticsRequest;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;


/**
 * A {@link SearchAnalyticsClient} that talks to the provider's REST API through a {@link CloseableHttpClient}.
 *
 * <p>
 *   Every call carries the caller's {@link Credential} as a bearer token and is timed by {@link #getSendTimer()}.
 *   Non-success responses are raised as {@link ProviderResponseException}. The client is safe to share between
 *   threads.
 * </p>
 */
@Slf4j
public class ApacheSearchAnalyticsClient implements SearchAnalyticsClient {

  static final String QUERY_PATH = "/searchAnalytics/query";
  static final String SITES_PATH = "/sites";

  private static final int POOLING_CONN_MANAGER_MAX_TOTAL_CONN = 20;
  private static final int POOLING_CONN_MANAGER_MAX_PER_CONN = 5;

  private static final Config FALLBACK =
      ConfigFactory.parseMap(ImmutableMap.<String, Object>builder()
          .put(ConfigurationKeys.HTTP_ENDPOINT_KEY, ConfigurationKeys.DEFAULT_HTTP_ENDPOINT)
          .put(ConfigurationKeys.HTTP_REQUEST_TIME_OUT_MS_KEY, TimeUnit.SECONDS.toMillis(60L))
          .put(ConfigurationKeys.HTTP_CONNECTION_TIME_OUT_MS_KEY, TimeUnit.SECONDS.toMillis(10L))
          .build());

  private final CloseableHttpClient client;
  private final String endpoint;
  private final SearchAnalyticsResponseHandler responseHandler = new SearchAnalyticsResponseHandler();
  private final SearchAnalyticsResponseParser parser = new SearchAnalyticsResponseParser();
  @Getter
  private final Timer sendTimer;

  public ApacheSearchAnalyticsClient(Config config, MetricRegistry metricRegistry) {
    this(buildHttpClient(config.withFallback(FALLBACK)), config, metricRegistry);
  }

  @VisibleForTesting
  ApacheSearchAnalyticsClient(CloseableHttpClient client, Config config, MetricRegistry metricRegistry) {
    config = config.withFallback(FALLBACK);
    this.client = client;
    this.endpoint = StringUtils.removeEnd(config.getString(ConfigurationKeys.HTTP_ENDPOINT_KEY), "/");
    this.sendTimer = metricRegistry.timer(MetricRegistry.name(ApacheSearchAnalyticsClient.class, "send"));
  }

  private static CloseableHttpClient buildHttpClient(Config config) {
    RequestConfig requestConfig = RequestConfig.copy(RequestConfig.DEFAULT)
        .setSocketTimeout(config.getInt(ConfigurationKeys.HTTP_REQUEST_TIME_OUT_MS_KEY))
        .setConnectTimeout(config.getInt(ConfigurationKeys.HTTP_CONNECTION_TIME_OUT_MS_KEY))
        .setConnectionRequestTimeout(config.getInt(ConfigurationKeys.HTTP_CONNECTION_TIME_OUT_MS_KEY))
        .build();

    PoolingHttpClientConnectionManager connManager = new PoolingHttpClientConnectionManager();
    connManager.setMaxTotal(POOLING_CONN_MANAGER_MAX_TOTAL_CONN);
    connManager.setDefaultMaxPerRoute(POOLING_CONN_MANAGER_MAX_PER_CONN);

    return HttpClientBuilder.create()
        .disableCookieManagement()
        .useSystemProperties()
        .setDefaultRequestConfig(requestConfig)
        .setConnectionManager(connManager)
        .build();
  }

  @Override
  public List<RawProviderRow> query(Credential credential, SearchAnalyticsRequest request) throws IOException {
    HttpPost post = new HttpPost(this.endpoint + SITES_PATH + "/"
        + URLEncoder.encode(request.getSiteId(), ConfigurationKeys.DEFAULT_CHARSET_ENCODING) + QUERY_PATH);
    post.setHeader(HttpHeaders.AUTHORIZATION, credential.toAuthorizationHeader());
    post.setEntity(new StringEntity(toRequestBody(request).toString(), ContentType.APPLICATION_JSON));

    log.debug("Sending search analytics query " + request);
    List<RawProviderRow> rows = this.parser.parseRows(send(post).getContentAsString(), request);
    log.debug("Received " + rows.size() + " rows for " + request.getSiteId() + " " + request.getRange());
    return rows;
  }

  @Override
  public List<String> listSites(Credential credential) throws IOException {
    HttpGet get = new HttpGet(this.endpoint + SITES_PATH);
    get.setHeader(HttpHeaders.AUTHORIZATION, credential.toAuthorizationHeader());
    return this.parser.parseSites(send(get).getContentAsString());
  }

  private ResponseStatus send(HttpUriRequest request) throws IOException {
    final Timer.Context context = this.sendTimer.time();
    try (CloseableHttpResponse response = this.client.execute(request)) {
      ResponseStatus status = this.responseHandler.handleResponse(response);
      if (status.getType() != StatusType.OK) {
        throw new ProviderResponseException(String.format("%s %s failed with status %d: %s", request.getMethod(),
            request.getURI().getPath(), status.getStatusCode(), status.getContentAsString()), status.getType(),
            status.getStatusCode());
      }
      return status;
    } finally {
      context.stop();
    }
  }

  @VisibleForTesting
  static JsonObject toRequestBody(SearchAnalyticsRequest request) {
    JsonArray dimensions = new JsonArray();
    for (Dimension dimension : request.getDimensions()) {
      dimensions.add(dimension.getApiName());
    }

    JsonObject body = new JsonObject();
    body.addProperty("startDate", request.getRange().getStartDate().toString());
    body.addProperty("endDate", request.getRange().getEndDate().toString());
    body.add("dimensions", dimensions);
    body.addProperty("rowLimit", request.getRowLimit());
    body.addProperty("startRow", 0);
    return body;
  }

  @Override
  public void close() throws IOException {
    this.client.close();
  }
}
