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

/**
 * Thrown when the remote service answered with a non-success status, either
 * immediately (4xx) or after the retry budget was spent (429, 5xx).
 */
public class RemoteFailureException extends OecdException {
  private final int statusCode;
  private final ErrorDiagnostic diagnostic;

  public RemoteFailureException(int statusCode, ErrorDiagnostic diagnostic) {
    super(ErrorCategory.REMOTE, "OECD API request failed with HTTP " + statusCode
        + ": " + diagnostic.getMessage());
    this.statusCode = statusCode;
    this.diagnostic = diagnostic;
  }

  public int getStatusCode() {
    return statusCode;
  }

  /** True for throttling and server errors. */
  @Override public boolean isRetryable() {
    return statusCode == 429 || statusCode >= 500;
  }

  @Override public ErrorDiagnostic getDiagnostic() {
    return diagnostic;
  }
}
