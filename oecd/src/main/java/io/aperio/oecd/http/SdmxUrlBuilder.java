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

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builder for SDMX REST data URLs of the form
 * {@code {base}/data/{agency},{dataflow}/{filter}?format=jsondata&...}.
 *
 * <p>The filter path segment only accepts a {@link SanitizedFilter}. The agency
 * and dataflow come from the curated catalog and are used verbatim, since the
 * remote identifiers contain {@code @} (for example {@code DSD_NAMAIN1@DF_QNA}).
 */
public class SdmxUrlBuilder {
  private final String baseUrl;
  private final String agency;
  private final String dataflow;
  private SanitizedFilter filter = SanitizedFilter.ALL;
  private final Map<String, String> params = new LinkedHashMap<>();

  public SdmxUrlBuilder(String baseUrl, String agency, String dataflow) {
    this.baseUrl = baseUrl.endsWith("/")
        ? baseUrl.substring(0, baseUrl.length() - 1)
        : baseUrl;
    this.agency = agency;
    this.dataflow = dataflow;
    params.put("format", "jsondata");
  }

  public SdmxUrlBuilder filter(SanitizedFilter filter) {
    this.filter = filter;
    return this;
  }

  /**
   * Add a query parameter. Null or empty values are ignored.
   */
  public SdmxUrlBuilder param(String key, @Nullable String value) {
    if (value != null && !value.isEmpty()) {
      params.put(key, value);
    }
    return this;
  }

  public SdmxUrlBuilder param(String key, @Nullable Integer value) {
    if (value != null) {
      params.put(key, value.toString());
    }
    return this;
  }

  /**
   * Builds the final URI with encoded parameters.
   */
  public URI build() {
    String queryString = params.entrySet().stream()
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
    return URI.create(baseUrl + "/data/" + agency + "," + dataflow + "/" + filter.getEncoded() + "?" + queryString);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
