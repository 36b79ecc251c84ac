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

import io.aperio.oecd.NetworkFailureException;
import io.aperio.oecd.OecdException;
import io.aperio.oecd.RemoteFailureException;
import io.aperio.oecd.RequestTimeoutException;
import io.aperio.oecd.diagnostic.ErrorDiagnostics;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * Executes one outbound GET with rate limiting, a per-attempt deadline and
 * retry with exponential backoff.
 *
 * <p>The control loop is an explicit state machine:
 * <pre>
 *   ATTEMPTING --2xx--------------------------------&gt; SUCCEEDED
 *   ATTEMPTING --retryable, attempts remain---------&gt; BACKOFF --&gt; ATTEMPTING
 *   ATTEMPTING --retryable, budget spent------------&gt; EXHAUSTED (throw last failure)
 *   ATTEMPTING --permanent (4xx other than 429)-----&gt; throw immediately
 * </pre>
 *
 * <p>Retryable outcomes are 5xx, 429, an exceeded deadline and connection-level
 * I/O failures. The delay before retrying after attempt {@code n} (0-based) is
 * {@code retryDelayMs * 2^n}. Every attempt, retries included, consumes one
 * {@link RateLimiter} admission.
 */
public class RequestExecutor {
  private static final Logger LOGGER = LoggerFactory.getLogger(RequestExecutor.class);

  /** States of the retry loop. */
  enum State {
    ATTEMPTING,
    BACKOFF,
    SUCCEEDED,
    EXHAUSTED
  }

  /** Classification of one attempt's outcome. */
  enum Outcome {
    SUCCESS,
    SERVER_ERROR,
    THROTTLED,
    TIMEOUT,
    NETWORK,
    PERMANENT;

    boolean isRetryable() {
      return this != SUCCESS && this != PERMANENT;
    }
  }

  private final HttpTransport transport;
  private final RateLimiter rateLimiter;
  private final TimeSource timeSource;
  private final int maxRetries;
  private final long retryDelayMs;
  private final Duration timeout;
  private final Map<String, String> headers;

  /**
   * Creates an executor.
   *
   * @param transport Performs single HTTP exchanges
   * @param rateLimiter Admission gate consulted before every attempt
   * @param timeSource Clock used for backoff sleeps
   * @param maxRetries Retries after the first attempt (total attempts = maxRetries + 1)
   * @param retryDelayMs Initial backoff delay
   * @param timeoutMs Per-attempt deadline
   * @param userAgent User-Agent header value
   */
  public RequestExecutor(HttpTransport transport, RateLimiter rateLimiter,
      TimeSource timeSource, int maxRetries, long retryDelayMs, long timeoutMs,
      String userAgent) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
    }
    this.transport = transport;
    this.rateLimiter = rateLimiter;
    this.timeSource = timeSource;
    this.maxRetries = maxRetries;
    this.retryDelayMs = Math.max(0, retryDelayMs);
    this.timeout = Duration.ofMillis(timeoutMs);
    this.headers = ImmutableMap.of(
        "Accept", "application/json",
        "User-Agent", userAgent);
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public long getTimeoutMs() {
    return timeout.toMillis();
  }

  /**
   * Backoff delay inserted after the given failed attempt.
   *
   * @param attemptNumber 0-based number of the attempt that failed
   */
  public long backoffDelayMs(int attemptNumber) {
    return retryDelayMs * (1L << attemptNumber);
  }

  /**
   * Executes a GET against {@code uri}.
   *
   * @param uri Fully built request URI
   * @param context Dataflow and operation, for logs and diagnostics
   * @return the successful (2xx) response
   * @throws RemoteFailureException on a permanent status or when the budget is
   *     spent on 429/5xx
   * @throws RequestTimeoutException when the final attempt exceeded its deadline
   * @throws NetworkFailureException when the final attempt failed below HTTP
   * @throws InterruptedException if interrupted while queued, waiting or sleeping
   */
  public RawResponse execute(URI uri, RequestContext context) throws InterruptedException {
    State state = State.ATTEMPTING;
    Attempt attempt = null;
    int attemptNumber = 0;

    while (true) {
      switch (state) {
      case ATTEMPTING:
        rateLimiter.admit();
        attempt = attempt(uri, context, attemptNumber);
        if (attempt.outcome == Outcome.SUCCESS) {
          state = State.SUCCEEDED;
        } else if (!attempt.outcome.isRetryable()) {
          throw attempt.failure;
        } else if (attemptNumber < maxRetries) {
          state = State.BACKOFF;
        } else {
          state = State.EXHAUSTED;
        }
        break;

      case BACKOFF:
        long delay = backoffDelayMs(attemptNumber);
        LOGGER.warn("{} failed ({}) - retrying in {} ms (attempt {}/{})",
            context, attempt.outcome, delay, attemptNumber + 1, maxRetries + 1);
        timeSource.sleep(delay);
        attemptNumber++;
        state = State.ATTEMPTING;
        break;

      case SUCCEEDED:
        return attempt.response;

      case EXHAUSTED:
      default:
        LOGGER.warn("{} failed after {} attempts: {}", context, attemptNumber + 1,
            attempt.outcome);
        throw attempt.failure;
      }
    }
  }

  /**
   * Performs and classifies one attempt. Never throws for a classified failure;
   * the failure is carried in the returned {@link Attempt}.
   */
  private Attempt attempt(URI uri, RequestContext context, int attemptNumber)
      throws InterruptedException {
    LOGGER.debug("{} attempt {}: GET {}", context, attemptNumber + 1, uri);
    RawResponse response;
    try {
      response = transport.get(uri, headers, timeout);
    } catch (HttpTimeoutException e) {
      return new Attempt(attemptNumber, Outcome.TIMEOUT, null,
          new RequestTimeoutException(context, timeout.toMillis(), e));
    } catch (IOException e) {
      return new Attempt(attemptNumber, Outcome.NETWORK, null,
          new NetworkFailureException(context, e));
    }

    int status = response.getStatusCode();
    if (response.isSuccess()) {
      return new Attempt(attemptNumber, Outcome.SUCCESS, response, null);
    }
    Outcome outcome;
    if (status >= 500) {
      outcome = Outcome.SERVER_ERROR;
    } else if (status == 429) {
      outcome = Outcome.THROTTLED;
    } else {
      outcome = Outcome.PERMANENT;
    }
    return new Attempt(attemptNumber, outcome, null,
        new RemoteFailureException(status,
            ErrorDiagnostics.forStatus(status, context.getDataflowId(), context.getFilter())));
  }

  /**
   * One attempt's result. Lives only inside {@link #execute}.
   */
  private static final class Attempt {
    final int attemptNumber;
    final Outcome outcome;
    final @Nullable RawResponse response;
    final @Nullable OecdException failure;

    Attempt(int attemptNumber, Outcome outcome, @Nullable RawResponse response,
        @Nullable OecdException failure) {
      this.attemptNumber = attemptNumber;
      this.outcome = outcome;
      this.response = response;
      this.failure = failure;
    }
  }
}
