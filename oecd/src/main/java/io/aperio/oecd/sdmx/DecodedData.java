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
package io.aperio.oecd.sdmx;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Result of decoding one SDMX-JSON data message.
 */
public final class DecodedData {
  private final ImmutableList<Observation> observations;
  private final boolean truncated;
  private final ImmutableList<String> anomalies;

  public DecodedData(List<Observation> observations, boolean truncated,
      List<String> anomalies) {
    this.observations = ImmutableList.copyOf(observations);
    this.truncated = truncated;
    this.anomalies = ImmutableList.copyOf(anomalies);
  }

  public List<Observation> getObservations() {
    return observations;
  }

  /** Whether decoding stopped at the observation limit with data remaining. */
  public boolean isTruncated() {
    return truncated;
  }

  /**
   * Notes about malformed parts of the payload that were skipped. Empty for a
   * well-formed message.
   */
  public List<String> getAnomalies() {
    return anomalies;
  }
}
