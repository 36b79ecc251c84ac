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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link HttpTransport} backed by the JDK {@link HttpClient}.
 *
 * <p>{@link HttpRequest.Builder#timeout} only covers the wait for response
 * headers, so the exchange is sent asynchronously and the caller waits on it
 * with the same deadline. A body that stalls past the deadline cancels the
 * exchange and surfaces as {@link HttpTimeoutException}.
 */
public class JdkHttpTransport implements HttpTransport {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpTransport.class);

  private final HttpClient httpClient;

  public JdkHttpTransport(Duration connectTimeout) {
    this(HttpClient.newBuilder()
        .connectTimeout(connectTimeout)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build());
  }

  public JdkHttpTransport(HttpClient httpClient) {
    this.httpClient = httpClient;
  }

  @Override public RawResponse get(URI uri, Map<String, String> headers, Duration timeout)
      throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .GET();
    headers.forEach(builder::header);

    CompletableFuture<HttpResponse<String>> future =
        httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString());
    HttpResponse<String> response;
    try {
      response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new HttpTimeoutException("GET " + uri + " exceeded " + timeout.toMillis() + " ms");
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IOException("GET " + uri + " failed", cause);
    }
    LOGGER.debug("GET {} -> {}", uri, response.statusCode());
    return new RawResponse(uri, response.statusCode(), response.body());
  }
}
