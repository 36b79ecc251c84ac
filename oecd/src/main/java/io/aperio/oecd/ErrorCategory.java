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
package io.aperio.oecd;

/**
 * Tag carried by every {@link OecdException}.
 *
 * <p>Retry policy and user-facing messaging switch on this tag rather than on
 * exception messages.
 */
public enum ErrorCategory {
  /** Caller supplied something unusable: unknown dataset, bad filter, bad period. */
  INPUT,
  /** Deadline exceeded or connection-level failure. */
  TRANSIENT,
  /** The remote service answered with a non-success HTTP status. */
  REMOTE,
  /**
   * Malformed payload shape. Never thrown; reported through
   * {@link io.aperio.oecd.sdmx.DecodedData#getAnomalies()}.
   */
  DECODE_ANOMALY
}
