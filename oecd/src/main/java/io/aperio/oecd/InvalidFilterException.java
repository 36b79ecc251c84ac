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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when a dimension filter fails validation. Callers should re-prompt for
 * a different filter; repeating the request cannot succeed.
 */
public class InvalidFilterException extends OecdException {

  /** Which rule the filter broke. */
  public enum Reason {
    EMPTY,
    TOO_LONG,
    ILLEGAL_CHARACTERS
  }

  private final @Nullable String filter;
  private final Reason reason;
  private @Nullable String dataflowId;

  public InvalidFilterException(@Nullable String filter, Reason reason, String message) {
    super(ErrorCategory.INPUT, message);
    this.filter = filter;
    this.reason = reason;
  }

  /** The rejected value exactly as supplied. */
  public @Nullable String getFilter() {
    return filter;
  }

  public Reason getReason() {
    return reason;
  }

  /**
   * Attaches the dataflow the filter was meant for, so diagnostics can name it.
   */
  public InvalidFilterException withDataflowId(String dataflowId) {
    this.dataflowId = dataflowId;
    return this;
  }

  @Override public ErrorDiagnostic getDiagnostic() {
    return ErrorDiagnostics.invalidFilter(dataflowId, filter, getMessage());
  }
}
