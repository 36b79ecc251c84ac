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

import io.aperio.oecd.catalog.DatasetReference;
import io.aperio.oecd.sdmx.DecodedData;
import io.aperio.oecd.sdmx.Observation;

import java.net.URI;
import java.util.List;

/**
 * Observations returned by {@link OecdClient#query}, together with the dataflow
 * and the request they came from.
 */
public final class QueryResult {
  private final DatasetReference dataset;
  private final URI requestUrl;
  private final DecodedData data;

  public QueryResult(DatasetReference dataset, URI requestUrl, DecodedData data) {
    this.dataset = dataset;
    this.requestUrl = requestUrl;
    this.data = data;
  }

  public DatasetReference getDataset() {
    return dataset;
  }

  public URI getRequestUrl() {
    return requestUrl;
  }

  public List<Observation> getObservations() {
    return data.getObservations();
  }

  public int size() {
    return data.getObservations().size();
  }

  /** True when the client-side cap cut the response short. */
  public boolean isTruncated() {
    return data.isTruncated();
  }

  public List<String> getAnomalies() {
    return data.getAnomalies();
  }
}
