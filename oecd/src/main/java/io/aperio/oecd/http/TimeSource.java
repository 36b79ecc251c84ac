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

/**
 * Wall clock and sleep used by the rate limiter and the retry loop.
 *
 * <p>Tests substitute a simulated implementation so spacing and backoff can be
 * asserted without waiting in real time.
 */
public interface TimeSource {

  /** The system clock and {@link Thread#sleep(long)}. */
  TimeSource SYSTEM = new TimeSource() {
    @Override public long currentTimeMillis() {
      return System.currentTimeMillis();
    }

    @Override public void sleep(long millis) throws InterruptedException {
      Thread.sleep(millis);
    }
  };

  long currentTimeMillis();

  void sleep(long millis) throws InterruptedException;
}
