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

import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide admission gate for outbound requests.
 *
 * <p>The OECD SDMX API blocks a client IP after roughly 20-30 requests issued
 * without sufficient spacing, so every network attempt (including retries) must
 * pass through {@link #admit()} first. Admissions are granted one at a time in
 * arrival order through a fair lock; the thread holding the lock waits out the
 * remainder of the minimum interval before recording its admission time.
 *
 * <p>Invariant: the timestamps returned by any two completed admissions differ by
 * at least {@code minIntervalMs}.
 *
 * <p>Instances are independent; share one instance between all executors that
 * talk to the same remote host.
 */
public class RateLimiter {
  private static final Logger LOGGER = LoggerFactory.getLogger(RateLimiter.class);

  private final long minIntervalMs;
  private final TimeSource timeSource;
  private final ReentrantLock admissionLock = new ReentrantLock(true);

  /** Guarded by admissionLock. */
  private long lastAdmittedMs;
  private boolean admittedBefore;

  public RateLimiter(long minIntervalMs) {
    this(minIntervalMs, TimeSource.SYSTEM);
  }

  public RateLimiter(long minIntervalMs, TimeSource timeSource) {
    if (minIntervalMs < 0) {
      throw new IllegalArgumentException("minIntervalMs must be >= 0: " + minIntervalMs);
    }
    this.minIntervalMs = minIntervalMs;
    this.timeSource = timeSource;
  }

  public long getMinIntervalMs() {
    return minIntervalMs;
  }

  /**
   * Blocks until this caller may issue its request.
   *
   * @return the admission timestamp in milliseconds
   * @throws InterruptedException if interrupted while queued or waiting
   */
  public long admit() throws InterruptedException {
    admissionLock.lockInterruptibly();
    try {
      long now = timeSource.currentTimeMillis();
      if (admittedBefore) {
        long elapsed = now - lastAdmittedMs;
        if (elapsed < minIntervalMs) {
          long waitTime = minIntervalMs - elapsed;
          LOGGER.debug("Rate limiting: waiting {} ms before next OECD API request", waitTime);
          timeSource.sleep(waitTime);
          // clock granularity can report slightly less than the slept time
          now = Math.max(timeSource.currentTimeMillis(), lastAdmittedMs + minIntervalMs);
        }
      }
      lastAdmittedMs = now;
      admittedBefore = true;
      return now;
    } finally {
      admissionLock.unlock();
    }
  }

  /** Number of callers currently waiting to be admitted. */
  public int getQueueLength() {
    return admissionLock.getQueueLength();
  }
}
