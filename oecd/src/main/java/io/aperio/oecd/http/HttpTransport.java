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

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Performs a single HTTP GET. No retries, no pacing: those belong to
 * {@link RequestExecutor}.
 *
 * <p>Implementations must signal an exceeded deadline with
 * {@link java.net.http.HttpTimeoutException} and any other connection-level
 * failure with an {@link IOException}. Non-success statuses are returned, not
 * thrown.
 */
@FunctionalInterface
public interface HttpTransport {
  RawResponse get(URI uri, Map<String, String> headers, Duration timeout)
      throws IOException, InterruptedException;
}
