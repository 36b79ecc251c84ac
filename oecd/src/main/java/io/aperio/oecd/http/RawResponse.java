/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.aperio.oecd.http;

import java.net.URI;

/**
 * Status and body of one completed HTTP exchange.
 */
public final class RawResponse {
  private final URI uri;
  private final int statusCode;
  private final String body;

  public RawResponse(URI uri, int statusCode, String body) {
    this.uri = uri;
    this.statusCode = statusCode;
    this.body = body == null ? "" : body;
  }

  public URI getUri() {
    return uri;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getBody() {
    return body;
  }

  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }
}
