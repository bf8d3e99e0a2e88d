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

/**
 * Different types of response status
 */
public enum StatusType {
  // success
  OK,
  // something bad happened but retrying with the same request won't help
  CLIENT_ERROR,
  // the provider failed to handle a valid request
  SERVER_ERROR;

  public static StatusType forStatusCode(int statusCode) {
    if (statusCode >= 200 && statusCode < 300) {
      return OK;
    }
    if (statusCode >= 500) {
      return SERVER_ERROR;
    }
    return CLIENT_ERROR;
  }
}
