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

package gleaner.source;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;


/**
 * An interface for clients of the metered search analytics provider.
 *
 * <p>
 *   Implementations issue exactly one provider request per {@link #query} call and never page or retry on
 *   their own. The provider returns at most {@link SearchAnalyticsRequest#getRowLimit()} rows and gives no
 *   signal when more rows exist.
 * </p>
 */
public interface SearchAnalyticsClient extends Closeable {

  /**
   * Run one search analytics query.
   *
   * @param credential access token of the calling session
   * @param request the bounded query
   * @return rows returned by the provider, possibly empty
   * @throws IOException if the request cannot be sent or the provider rejects it
   */
  List<RawProviderRow> query(Credential credential, SearchAnalyticsRequest request) throws IOException;

  /**
   * @return site identifiers the credential holds owner or full-user permission on
   */
  List<String> listSites(Credential credential) throws IOException;
}
