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

import org.apache.http.HttpEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.util.EntityUtils;

import lombok.extern.slf4j.Slf4j;


/**
 * Basic logic to handle a {@link CloseableHttpResponse} from the provider: classify the status code and read
 * the entity, which is always consumed so the connection can be reused.
 */
@Slf4j
public class SearchAnalyticsResponseHandler {

  public ResponseStatus handleResponse(CloseableHttpResponse response) throws IOException {
    int statusCode = response.getStatusLine().getStatusCode();
    StatusType type = StatusType.forStatusCode(statusCode);

    HttpEntity entity = response.getEntity();
    byte[] content = null;
    if (entity != null) {
      try {
        content = EntityUtils.toByteArray(entity);
      } finally {
        EntityUtils.consume(entity);
      }
    }
    if (type != StatusType.OK) {
      log.info("Receive an unsuccessful response with status code: " + statusCode);
    }
    return new ResponseStatus(type, statusCode, content);
  }
}
