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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.http.HttpEntity;
import org.apache.http.StatusLine;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.testng.Assert;
import org.testng.annotations.Test;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;


@Test
public class SearchAnalyticsResponseHandlerTest {

  /**
   * Test status classification and content capture
   */
  public void testHandleResponse()
      throws IOException {
    SearchAnalyticsResponseHandler handler = new SearchAnalyticsResponseHandler();
    CloseableHttpResponse response = mock(CloseableHttpResponse.class);
    StatusLine statusLine = mock(StatusLine.class);
    when(response.getStatusLine()).thenReturn(statusLine);

    // Success 200 without a body
    when(statusLine.getStatusCode()).thenReturn(200);
    ResponseStatus status = handler.handleResponse(response);
    Assert.assertEquals(status.getType(), StatusType.OK);
    Assert.assertEquals(status.getContentAsString(), "");

    // Client error 403
    when(statusLine.getStatusCode()).thenReturn(403);
    status = handler.handleResponse(response);
    Assert.assertEquals(status.getType(), StatusType.CLIENT_ERROR);
    Assert.assertEquals(status.getStatusCode(), 403);

    // Server error 503 with a body
    HttpEntity entity = mock(HttpEntity.class);
    when(response.getEntity()).thenReturn(entity);
    when(entity.getContentLength()).thenReturn(-1L);
    when(entity.getContent()).thenReturn(
        new ByteArrayInputStream("{\"error\":\"backendError\"}".getBytes(StandardCharsets.UTF_8)));
    when(statusLine.getStatusCode()).thenReturn(503);
    status = handler.handleResponse(response);
    Assert.assertEquals(status.getType(), StatusType.SERVER_ERROR);
    Assert.assertEquals(status.getContentAsString(), "{\"error\":\"backendError\"}");
  }

  public void testStatusTypes() {
    Assert.assertEquals(StatusType.forStatusCode(204), StatusType.OK);
    Assert.assertEquals(StatusType.forStatusCode(301), StatusType.CLIENT_ERROR);
    Assert.assertEquals(StatusType.forStatusCode(429), StatusType.CLIENT_ERROR);
    Assert.assertEquals(StatusType.forStatusCode(500), StatusType.SERVER_ERROR);
  }
}
