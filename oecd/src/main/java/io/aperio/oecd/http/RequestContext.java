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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Diagnostic context for one logical request: which operation issued it, for
 * which dataflow, and with which caller-supplied filter.
 *
 * <p>Used only for logging and for building error diagnostics; it never
 * influences the request itself.
 */
public final class RequestContext {

  private final String operation;
  private final @Nullable String dataflowId;
  private final @Nullable String filter;

  private RequestContext(Builder builder) {
    this.operation = builder.operation;
    this.dataflowId = builder.dataflowId;
    this.filter = builder.filter;
  }

  public static Builder builder(String operation) {
    return new Builder(operation);
  }

  /** Operation name, e.g. {@code query} or {@code describe}. */
  public String getOperation() {
    return operation;
  }

  public @Nullable String getDataflowId() {
    return dataflowId;
  }

  /** Filter exactly as the caller supplied it, before sanitization. */
  public @Nullable String getFilter() {
    return filter;
  }

  @Override public String toString() {
    return operation + "[" + dataflowId + (filter == null ? "" : ", " + filter) + "]";
  }

  /**
   * Builder for {@link RequestContext}.
   */
  public static final class Builder {
    private final String operation;
    private @Nullable String dataflowId;
    private @Nullable String filter;

    private Builder(String operation) {
      this.operation = operation;
    }

    public Builder dataflowId(@Nullable String dataflowId) {
      this.dataflowId = dataflowId;
      return this;
    }

    public Builder filter(@Nullable String filter) {
      this.filter = filter;
      return this;
    }

    public RequestContext build() {
      return new RequestContext(this);
    }
  }
}
