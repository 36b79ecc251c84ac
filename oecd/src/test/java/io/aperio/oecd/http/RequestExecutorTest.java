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

import io.aperio.oecd.ErrorCategory;
import io.aperio.oecd.NetworkFailureException;
import io.aperio.oecd.RemoteFailureException;
import io.aperio.oecd.RequestTimeoutException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link RequestExecutor}.
 */
@Tag("unit")
class RequestExecutorTest {

  private static final URI URL =
      URI.create("https://sdmx.example.org/rest/data/OECD.SDD.NAD,DSD_NAMAIN1@DF_QNA/all");
  private static final RequestContext CONTEXT =
      RequestContext.builder("query").dataflowId("QNA").filter("USA..").build();

  private FakeTimeSource clock;
  private ScriptedTransport transport;

  @BeforeEach
  void setUp() {
    clock = new FakeTimeSource();
    transport = new ScriptedTransport();
  }

  private RequestExecutor executor(CountingRateLimiter limiter) {
    return new RequestExecutor(transport, limiter, clock, 3, 1000, 30_000, "Aperio-OECD/1.0");
  }

  @Test
  void testSuccessOnFirstAttempt() throws Exception {
    transport.thenOk("{\"data\":{}}");
    CountingRateLimiter limiter = new CountingRateLimiter(1500, clock);

    RawResponse response = executor(limiter).execute(URL, CONTEXT);

    assertEquals(200, response.getStatusCode());
    assertEquals("{\"data\":{}}", response.getBody());
    assertEquals(1, limiter.admissions);
    assertEquals(0, clock.currentTimeMillis());
  }

  @Test
  void testSendsAcceptAndUserAgentHeaders() throws Exception {
    transport.thenOk("{}");
    executor(new CountingRateLimiter(0, clock)).execute(URL, CONTEXT);

    assertEquals("application/json", transport.getHeaders(0).get("Accept"));
    assertEquals("Aperio-OECD/1.0", transport.getHeaders(0).get("User-Agent"));
  }

  @Test
  void testServerErrorsRetriedWithExponentialBackoff() throws Exception {
    transport.thenStatus(500).thenStatus(500).thenOk("{}");
    CountingRateLimiter limiter = new CountingRateLimiter(0, clock);

    RawResponse response = executor(limiter).execute(URL, CONTEXT);

    assertEquals(200, response.getStatusCode());
    assertEquals(3000, clock.currentTimeMillis());
    assertEquals(Arrays.asList(1000L, 2000L), clock.getSleeps());
    assertEquals(3, limiter.admissions);
    assertEquals(3, transport.getCallCount());
  }

  @Test
  void testRetriesAlsoWaitForRateLimiter() throws Exception {
    transport.thenStatus(500).thenStatus(500).thenOk("{}");
    CountingRateLimiter limiter = new CountingRateLimiter(1500, clock);

    executor(limiter).execute(URL, CONTEXT);

    // 1000 ms backoff is shorter than the 1500 ms interval, so the limiter adds 500 ms
    assertEquals(Arrays.asList(1000L, 500L, 2000L), clock.getSleeps());
    assertEquals(3500, clock.currentTimeMillis());
    assertEquals(3, limiter.admissions);
  }

  @Test
  void testNeverRespondingRemoteTimesOutAfterAllAttempts() {
    transport.otherwise(ScriptedTransport.timeout(clock));
    CountingRateLimiter limiter = new CountingRateLimiter(0, clock);

    RequestTimeoutException e = assertThrows(RequestTimeoutException.class,
        () -> executor(limiter).execute(URL, CONTEXT));

    assertEquals(4, transport.getCallCount());
    assertEquals(4, limiter.admissions);
    assertEquals(30_000, e.getTimeoutMs());
    assertEquals(4 * 30_000 + 1000 + 2000 + 4000, clock.currentTimeMillis());
    assertEquals(ErrorCategory.TRANSIENT, e.getCategory());
    assertTrue(e.isRetryable());
  }

  @Test
  void testServerErrorAfterExhaustionIsRemoteFailure() {
    transport.otherwise(ScriptedTransport.status(503, "Service Unavailable"));

    RemoteFailureException e = assertThrows(RemoteFailureException.class,
        () -> executor(new CountingRateLimiter(0, clock)).execute(URL, CONTEXT));

    assertEquals(503, e.getStatusCode());
    assertEquals(4, transport.getCallCount());
    assertEquals(Arrays.asList(1000L, 2000L, 4000L), clock.getSleeps());
    assertEquals("QNA", e.getDiagnostic().getDataflowId());
    assertEquals("USA..", e.getDiagnostic().getProvidedFilter());
  }

  @Test
  void testThrottlingIsRetried() throws Exception {
    transport.thenStatus(429).thenOk("{}");

    RawResponse response = executor(new CountingRateLimiter(0, clock)).execute(URL, CONTEXT);

    assertEquals(200, response.getStatusCode());
    assertEquals(2, transport.getCallCount());
  }

  @Test
  void testClientErrorIsNotRetried() {
    transport.thenStatus(404);

    RemoteFailureException e = assertThrows(RemoteFailureException.class,
        () -> executor(new CountingRateLimiter(0, clock)).execute(URL, CONTEXT));

    assertEquals(404, e.getStatusCode());
    assertFalse(e.isRetryable());
    assertEquals(1, transport.getCallCount());
    assertTrue(clock.getSleeps().isEmpty());
  }

  @Test
  void testUnprocessableFilterCarriesSyntaxRules() {
    transport.thenStatus(422);

    RemoteFailureException e = assertThrows(RemoteFailureException.class,
        () -> executor(new CountingRateLimiter(0, clock)).execute(URL, CONTEXT));

    assertEquals(ErrorCategory.REMOTE, e.getCategory());
    assertTrue(e.getDiagnostic().getDetails().containsKey("filterSyntax"));
  }

  @Test
  void testNetworkFailureRecovers() throws Exception {
    transport.then(ScriptedTransport.connectionReset()).thenOk("{}");

    RawResponse response = executor(new CountingRateLimiter(0, clock)).execute(URL, CONTEXT);

    assertEquals(200, response.getStatusCode());
    assertEquals(Arrays.asList(1000L), clock.getSleeps());
  }

  @Test
  void testNetworkFailureAfterExhaustionWrapsCause() {
    transport.otherwise(ScriptedTransport.connectionReset());

    NetworkFailureException e = assertThrows(NetworkFailureException.class,
        () -> executor(new CountingRateLimiter(0, clock)).execute(URL, CONTEXT));

    assertEquals("Connection reset", e.getCause().getMessage());
    assertEquals(4, transport.getCallCount());
  }

  @Test
  void testZeroRetriesMeansSingleAttempt() {
    transport.otherwise(ScriptedTransport.status(500, ""));
    RequestExecutor executor = new RequestExecutor(transport,
        new CountingRateLimiter(0, clock), clock, 0, 1000, 30_000, "test");

    assertThrows(RemoteFailureException.class, () -> executor.execute(URL, CONTEXT));
    assertEquals(1, transport.getCallCount());
  }

  @Test
  void testInterruptionPropagates() {
    transport.then((uri, timeout) -> {
      throw new InterruptedException();
    });

    assertThrows(InterruptedException.class,
        () -> executor(new CountingRateLimiter(0, clock)).execute(URL, CONTEXT));
    assertEquals(1, transport.getCallCount());
  }

  @Test
  void testBackoffDelays() {
    RequestExecutor executor = executor(new CountingRateLimiter(0, clock));
    assertEquals(1000, executor.backoffDelayMs(0));
    assertEquals(2000, executor.backoffDelayMs(1));
    assertEquals(4000, executor.backoffDelayMs(2));
  }

  /** Counts admissions. */
  private static class CountingRateLimiter extends RateLimiter {
    int admissions;

    CountingRateLimiter(long minIntervalMs, TimeSource timeSource) {
      super(minIntervalMs, timeSource);
    }

    @Override public long admit() throws InterruptedException {
      admissions++;
      return super.admit();
    }
  }
}
