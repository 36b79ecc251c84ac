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
package io.aperio.oecd.diagnostic;

import io.aperio.oecd.ErrorCategory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured, caller-safe description of a failed operation.
 *
 * <p>Contains only values the caller supplied or fixed remediation text; never
 * exception messages, stack traces, hosts or file paths.
 *
 * @see ErrorDiagnostics
 */
public final class ErrorDiagnostic {
  private final ErrorCategory category;
  private final @Nullable Integer statusCode;
  private final String error;
  private final String message;
  private final @Nullable String dataflowId;
  private final @Nullable String providedFilter;
  private final ImmutableList<String> suggestions;
  private final ImmutableMap<String, Object> details;

  private ErrorDiagnostic(Builder builder) {
    this.category = builder.category;
    this.statusCode = builder.statusCode;
    this.error = builder.error;
    this.message = builder.message;
    this.dataflowId = builder.dataflowId;
    this.providedFilter = builder.providedFilter;
    this.suggestions = builder.suggestions.build();
    this.details = builder.details.build();
  }

  public static Builder builder(ErrorCategory category, String error, String message) {
    return new Builder(category, error, message);
  }

  public ErrorCategory getCategory() {
    return category;
  }

  /** HTTP status of the remote failure, or null when no response was received. */
  public @Nullable Integer getStatusCode() {
    return statusCode;
  }

  public String getError() {
    return error;
  }

  public String getMessage() {
    return message;
  }

  public @Nullable String getDataflowId() {
    return dataflowId;
  }

  public @Nullable String getProvidedFilter() {
    return providedFilter;
  }

  public List<String> getSuggestions() {
    return suggestions;
  }

  /**
   * Status-specific extras such as {@code example}, {@code filterSyntax} or
   * {@code retryAfter}. Values are strings or nested string maps.
   */
  public Map<String, Object> getDetails() {
    return details;
  }

  /**
   * Flattens this diagnostic into an ordered map suitable for JSON serialization.
   * Absent optional fields are omitted.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("error", error);
    map.put("category", category.name());
    if (statusCode != null) {
      map.put("statusCode", statusCode);
    }
    if (dataflowId != null) {
      map.put("dataflowId", dataflowId);
    }
    if (providedFilter != null) {
      map.put("providedFilter", providedFilter);
    }
    map.put("message", message);
    if (!suggestions.isEmpty()) {
      map.put("suggestions", suggestions);
    }
    map.putAll(details);
    return map;
  }

  @Override public String toString() {
    return "ErrorDiagnostic" + toMap();
  }

  /**
   * Builder for {@link ErrorDiagnostic}.
   */
  public static final class Builder {
    private final ErrorCategory category;
    private final String error;
    private final String message;
    private @Nullable Integer statusCode;
    private @Nullable String dataflowId;
    private @Nullable String providedFilter;
    private final ImmutableList.Builder<String> suggestions = ImmutableList.builder();
    private final ImmutableMap.Builder<String, Object> details = ImmutableMap.builder();

    private Builder(ErrorCategory category, String error, String message) {
      this.category = category;
      this.error = error;
      this.message = message;
    }

    public Builder statusCode(int statusCode) {
      this.statusCode = statusCode;
      return this;
    }

    public Builder dataflowId(@Nullable String dataflowId) {
      this.dataflowId = dataflowId;
      return this;
    }

    public Builder providedFilter(@Nullable String providedFilter) {
      this.providedFilter = providedFilter;
      return this;
    }

    public Builder suggestion(String suggestion) {
      suggestions.add(suggestion);
      return this;
    }

    public Builder detail(String key, Object value) {
      details.put(key, value);
      return this;
    }

    public ErrorDiagnostic build() {
      return new ErrorDiagnostic(this);
    }
  }
}
