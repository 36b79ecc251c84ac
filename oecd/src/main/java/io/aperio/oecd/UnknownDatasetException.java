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

import io.aperio.oecd.diagnostic.ErrorDiagnostic;
import io.aperio.oecd.diagnostic.ErrorDiagnostics;

/**
 * Thrown when a dataflow id is not present in the catalog. Raised before any
 * network call is made.
 */
public class UnknownDatasetException extends OecdException {
  private final String dataflowId;

  public UnknownDatasetException(String dataflowId) {
    super(ErrorCategory.INPUT, "Unknown dataflow: " + dataflowId
        + ". Use listDataflows() to see available dataflows.");
    this.dataflowId = dataflowId;
  }

  public String getDataflowId() {
    return dataflowId;
  }

  @Override public ErrorDiagnostic getDiagnostic() {
    return ErrorDiagnostics.unknownDataset(dataflowId);
  }
}
