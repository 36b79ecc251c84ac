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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Pure mapping from failure conditions to {@link ErrorDiagnostic}s.
 *
 * <p>HTTP failures are keyed by status code:
 * <ul>
 *   <li>400 - query syntax invalid</li>
 *   <li>404 - dataflow or filter combination not found</li>
 *   <li>422 - filter does not match the dataflow's dimensions; carries the
 *       canonical filter syntax rules</li>
 *   <li>429 - throttled by the remote service</li>
 *   <li>5xx - remote server problem</li>
 *   <li>anything else - generic advice</li>
 * </ul>
 */
public final class ErrorDiagnostics {

  static final String REQUEST_FAILED = "OECD API request failed";

  /** Canonical SDMX filter rules included with 422 diagnostics. */
  public static final ImmutableMap<String, String> FILTER_SYNTAX = ImmutableMap.of(
      "format", "DIM1.DIM2.DIM3.DIM4",
      "example", "SWE.B1_GE..",
      "multipleValues", "SWE+NOR+DNK.B1_GE..",
      "allValues", "Use empty position (..) or omit trailing dimensions");

  private ErrorDiagnostics() {
  }

  /**
   * Diagnostic for a non-success HTTP status returned by the remote service.
   *
   * @param statusCode HTTP status
   * @param dataflowId Short dataflow id the request was made for
   * @param filter Filter as supplied by the caller, may be null
   */
  public static ErrorDiagnostic forStatus(int statusCode, @Nullable String dataflowId,
      @Nullable String filter) {
    String id = dataflowId == null ? "" : dataflowId;
    switch (statusCode) {
    case 400:
      return remote(statusCode, dataflowId, filter,
          "Bad request - the query syntax is invalid")
          .suggestion("Check that the dataflow_id is correct")
          .suggestion("Verify the filter syntax follows SDMX format: DIM1.DIM2.DIM3")
          .suggestion("Use dots (.) to separate dimensions, empty position means all values")
          .detail("example",
              "query_data({dataflow_id: \"" + id + "\", last_n_observations: 10})")
          .build();

    case 404:
      return remote(statusCode, dataflowId, filter,
          "Dataset or filter combination not found")
          .suggestion("Verify \"" + id + "\" exists using search_dataflows or list_dataflows")
          .suggestion("Check that the filter values exist in the dataset")
          .suggestion("Try querying without filter first to see available data")
          .detail("example", "search_dataflows({query: \"" + id + "\"})")
          .build();

    case 422:
      return remote(statusCode, dataflowId, filter,
          "Invalid filter format or dimension values")
          .suggestion("1. Use get_data_structure to see the dimension order for this dataset")
          .suggestion("2. Ensure filter matches the exact dimension order")
          .suggestion("3. Use valid country codes (ISO 3166-1 alpha-3): SWE, USA, DEU, etc.")
          .suggestion("4. For multiple countries use + separator: SWE+NOR+DNK")
          .suggestion("5. Empty position (..) means all values for that dimension")
          .suggestion("6. Try a simpler query first with just last_n_observations")
          .detail("cause", "The filter structure does not match the dataset dimensions,"
              + " or the dimension values do not exist")
          .detail("filterSyntax", FILTER_SYNTAX)
          .detail("recommendedFirstStep",
              "get_data_structure({dataflow_id: \"" + id + "\"})")
          .detail("simpleQueryExample",
              "query_data({dataflow_id: \"" + id + "\", last_n_observations: 10})")
          .build();

    case 429:
      return remote(statusCode, dataflowId, filter,
          "Rate limit exceeded - too many requests")
          .suggestion("Wait a few seconds before retrying")
          .suggestion("Reduce the frequency of API calls")
          .suggestion("The server automatically enforces rate limiting between requests")
          .detail("retryAfter", "5 seconds")
          .build();

    default:
      if (statusCode >= 500 && statusCode < 600) {
        return remote(statusCode, dataflowId, filter, "OECD server error - temporary issue")
            .suggestion("This is a server-side issue, not a problem with your query")
            .suggestion("Wait a moment and try again")
            .suggestion("If the problem persists, the OECD API may be under maintenance")
            .detail("checkStatus", "https://data.oecd.org/")
            .build();
      }
      return remote(statusCode, dataflowId, filter, "Unexpected error from OECD API")
          .suggestion("Check your query parameters")
          .suggestion("Verify the dataflow_id exists")
          .suggestion("Try a simpler query first")
          .build();
    }
  }

  public static ErrorDiagnostic unknownDataset(String dataflowId) {
    return ErrorDiagnostic.builder(ErrorCategory.INPUT, "Unknown dataflow",
            "Dataflow is not in the catalog of supported OECD dataflows")
        .dataflowId(dataflowId)
        .suggestion("Use list_dataflows or search_dataflows to find a valid dataflow_id")
        .suggestion("Dataflow ids are case-sensitive, for example QNA or HEALTH_STAT")
        .build();
  }

  public static ErrorDiagnostic invalidFilter(@Nullable String dataflowId,
      @Nullable String filter, String message) {
    return ErrorDiagnostic.builder(ErrorCategory.INPUT, "Invalid filter", message)
        .dataflowId(dataflowId)
        .providedFilter(filter)
        .suggestion("Only letters, digits and the characters . _ - : + * are allowed")
        .suggestion("Omit the filter entirely to query all values")
        .detail("filterSyntax", FILTER_SYNTAX)
        .build();
  }

  public static ErrorDiagnostic invalidParameter(String parameter, String message) {
    return ErrorDiagnostic.builder(ErrorCategory.INPUT, "Invalid parameter", message)
        .suggestion("Correct the '" + parameter + "' argument and try again")
        .detail("parameter", parameter)
        .build();
  }

  public static ErrorDiagnostic timeout(@Nullable String dataflowId, @Nullable String filter,
      long timeoutMs) {
    return ErrorDiagnostic.builder(ErrorCategory.TRANSIENT, REQUEST_FAILED,
            "OECD API request timed out after " + (timeoutMs / 1000) + " seconds")
        .dataflowId(dataflowId)
        .providedFilter(filter)
        .suggestion("Narrow the query with a filter or a shorter period range")
        .suggestion("Use last_n_observations to limit the amount of data requested")
        .suggestion("Try again in a moment")
        .build();
  }

  public static ErrorDiagnostic networkFailure(@Nullable String dataflowId,
      @Nullable String filter) {
    return ErrorDiagnostic.builder(ErrorCategory.TRANSIENT, REQUEST_FAILED,
            "Could not reach the OECD API")
        .dataflowId(dataflowId)
        .providedFilter(filter)
        .suggestion("This is a connectivity issue, not a problem with your query")
        .suggestion("Try again in a moment")
        .build();
  }

  private static ErrorDiagnostic.Builder remote(int statusCode, @Nullable String dataflowId,
      @Nullable String filter, String message) {
    return ErrorDiagnostic.builder(ErrorCategory.REMOTE, REQUEST_FAILED, message)
        .statusCode(statusCode)
        .dataflowId(dataflowId)
        .providedFilter(filter);
  }
}
