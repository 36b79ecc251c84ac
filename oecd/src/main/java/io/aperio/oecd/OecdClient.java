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

import io.aperio.oecd.catalog.DataCategory;
import io.aperio.oecd.catalog.DataflowCatalog;
import io.aperio.oecd.catalog.DatasetReference;
import io.aperio.oecd.catalog.KnownDataflowCatalog;
import io.aperio.oecd.http.FilterSanitizer;
import io.aperio.oecd.http.HttpTransport;
import io.aperio.oecd.http.JdkHttpTransport;
import io.aperio.oecd.http.RateLimiter;
import io.aperio.oecd.http.RawResponse;
import io.aperio.oecd.http.RequestContext;
import io.aperio.oecd.http.RequestExecutor;
import io.aperio.oecd.http.SanitizedFilter;
import io.aperio.oecd.http.SdmxUrlBuilder;
import io.aperio.oecd.http.TimeSource;
import io.aperio.oecd.sdmx.DataStructure;
import io.aperio.oecd.sdmx.DecodedData;
import io.aperio.oecd.sdmx.ObservationDecoder;
import io.aperio.oecd.sdmx.StructureDefinition;
import io.aperio.oecd.sdmx.StructureExtractors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for reading OECD statistics through the SDMX REST API.
 *
 * <p>Catalog operations ({@link #listDataflows()}, {@link #listCategories()},
 * {@link #search(String)}) never touch the network. {@link #describe(String)} and
 * {@link #query(String, String, QueryOptions)} go through one shared
 * {@link RequestExecutor}, so every outbound request, retries included, is
 * spaced by the configured minimum interval.
 *
 * <p>Input errors ({@link UnknownDatasetException}, {@link InvalidFilterException},
 * {@link InvalidParameterException}) are raised before any request is made.
 *
 * <p>Thread-safe.
 */
public class OecdClient {
  private static final Logger LOGGER = LoggerFactory.getLogger(OecdClient.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String DATA_EXPLORER_URL = "https://data-explorer.oecd.org/vis";

  private final OecdClientConfig config;
  private final DataflowCatalog catalog;
  private final RequestExecutor executor;
  private final ObservationDecoder decoder = new ObservationDecoder();

  public OecdClient(OecdClientConfig config, DataflowCatalog catalog,
      RequestExecutor executor) {
    this.config = config;
    this.catalog = catalog;
    this.executor = executor;
  }

  /**
   * Creates a client whose executor uses {@code transport}, a new rate limiter and
   * {@code timeSource}, all parameterized from {@code config}.
   */
  public OecdClient(OecdClientConfig config, DataflowCatalog catalog,
      HttpTransport transport, TimeSource timeSource) {
    this(config, catalog,
        new RequestExecutor(transport,
            new RateLimiter(config.getMinIntervalMs(), timeSource),
            timeSource,
            config.getMaxRetries(),
            config.getRetryDelayMs(),
            config.getTimeoutMs(),
            config.getUserAgent()));
  }

  /**
   * Creates a client with the bundled configuration and catalog talking to the
   * live service.
   */
  public static OecdClient create() {
    return create(OecdClientConfig.load());
  }

  public static OecdClient create(OecdClientConfig config) {
    LOGGER.info("Creating OECD client: {}", config);
    return new OecdClient(config, KnownDataflowCatalog.load(),
        new JdkHttpTransport(Duration.ofMillis(config.getTimeoutMs())), TimeSource.SYSTEM);
  }

  public OecdClientConfig getConfig() {
    return config;
  }

  public DataflowCatalog getCatalog() {
    return catalog;
  }

  public List<DatasetReference> listDataflows() {
    return catalog.listDataflows();
  }

  public List<DatasetReference> listDataflows(String category) {
    return catalog.listDataflows(category);
  }

  public List<DataCategory> listCategories() {
    return catalog.listCategories();
  }

  public List<DatasetReference> search(String text) {
    return catalog.search(text);
  }

  /**
   * Resolves a short dataflow id against the catalog.
   *
   * @throws UnknownDatasetException if the id is not in the catalog
   */
  public DatasetReference resolve(String dataflowId) {
    Optional<DatasetReference> ref = catalog.lookup(dataflowId);
    if (!ref.isPresent()) {
      throw new UnknownDatasetException(dataflowId);
    }
    return ref.get();
  }

  /**
   * Describes the dimensions and attributes of a dataflow.
   *
   * <p>Fetches a single observation and reads the structure embedded in the
   * response. If the request fails or the response carries no recognizable
   * structure, a generic structure with {@link DataStructure.Source#DEFAULT} is
   * returned instead.
   *
   * @throws UnknownDatasetException if the id is not in the catalog
   * @throws InterruptedException if interrupted while waiting for the remote
   */
  public DataStructure describe(String dataflowId) throws InterruptedException {
    DatasetReference dataset = resolve(dataflowId);
    URI uri = new SdmxUrlBuilder(config.getBaseUrl(), dataset.getAgency(), dataset.getFullId())
        .param("lastNObservations", 1)
        .build();
    RequestContext context = RequestContext.builder("describe")
        .dataflowId(dataflowId)
        .build();
    RawResponse response;
    try {
      response = executor.execute(uri, context);
    } catch (OecdException e) {
      LOGGER.warn("Could not fetch structure for {}, using default structure: {}",
          dataflowId, e.getMessage());
      return StructureExtractors.defaultStructure(dataflowId);
    }
    Optional<StructureDefinition> structure;
    try {
      structure = StructureExtractors.extract(MAPPER.readTree(response.getBody()));
    } catch (JsonProcessingException e) {
      LOGGER.warn("Structure response for {} is not valid JSON, using default structure",
          dataflowId);
      return StructureExtractors.defaultStructure(dataflowId);
    }
    if (!structure.isPresent() || structure.get().isEmpty()) {
      LOGGER.debug("No embedded structure for {}, using default structure", dataflowId);
      return StructureExtractors.defaultStructure(dataflowId);
    }
    return structure.get().toDataStructure(dataflowId);
  }

  public QueryResult query(String dataflowId) throws InterruptedException {
    return query(dataflowId, null, QueryOptions.NONE);
  }

  public QueryResult query(String dataflowId, @Nullable String filter)
      throws InterruptedException {
    return query(dataflowId, filter, QueryOptions.NONE);
  }

  /**
   * Queries observations of a dataflow.
   *
   * @param dataflowId Short id from the catalog, e.g. {@code QNA}
   * @param filter SDMX dimension filter such as {@code USA+CAN.B1GQ..}; null
   *     selects all values
   * @param options Period range and observation limits
   * @throws InvalidParameterException if an option is malformed
   * @throws InvalidFilterException if the filter is empty or contains illegal characters
   * @throws UnknownDatasetException if the id is not in the catalog
   * @throws RemoteFailureException if the remote answered with an error status
   * @throws RequestTimeoutException if the last attempt exceeded its deadline
   * @throws NetworkFailureException if the last attempt failed below HTTP
   * @throws InterruptedException if interrupted while waiting for the remote
   */
  public QueryResult query(String dataflowId, @Nullable String filter, QueryOptions options)
      throws InterruptedException {
    options.validate(config.getMaxObservations());
    SanitizedFilter sanitized;
    try {
      sanitized = FilterSanitizer.sanitizeOrAll(filter);
    } catch (InvalidFilterException e) {
      throw e.withDataflowId(dataflowId);
    }
    DatasetReference dataset = resolve(dataflowId);

    URI uri = new SdmxUrlBuilder(config.getBaseUrl(), dataset.getAgency(), dataset.getFullId())
        .filter(sanitized)
        .param("startPeriod", options.getStartPeriod())
        .param("endPeriod", options.getEndPeriod())
        .param("lastNObservations", options.getLastNObservations())
        .build();
    RequestContext context = RequestContext.builder("query")
        .dataflowId(dataflowId)
        .filter(filter)
        .build();

    RawResponse response = executor.execute(uri, context);
    DecodedData data =
        decoder.decode(response.getBody(), options.effectiveLimit(config.getMaxObservations()));
    LOGGER.debug("{}: {} observations{}", context, data.getObservations().size(),
        data.isTruncated() ? " (truncated)" : "");
    return new QueryResult(dataset, uri, data);
  }

  /**
   * Builds a link to the dataflow in the OECD Data Explorer.
   *
   * @param dataflowId Short id from the catalog
   * @param filter Optional dimension filter; sanitized like a query filter
   * @throws UnknownDatasetException if the id is not in the catalog
   * @throws InvalidFilterException if the filter is empty or contains illegal characters
   */
  public String dataExplorerUrl(String dataflowId, @Nullable String filter) {
    DatasetReference dataset = resolve(dataflowId);
    @Nullable SanitizedFilter sanitized;
    try {
      sanitized = filter == null ? null : FilterSanitizer.sanitize(filter);
    } catch (InvalidFilterException e) {
      throw e.withDataflowId(dataflowId);
    }
    StringBuilder url = new StringBuilder(DATA_EXPLORER_URL)
        .append("?df[ds]=dsDisseminateFinalDMZ")
        .append("&df[id]=").append(URLEncoder.encode(dataset.getFullId(), StandardCharsets.UTF_8))
        .append("&df[ag]=").append(URLEncoder.encode(dataset.getAgency(), StandardCharsets.UTF_8));
    if (sanitized != null) {
      url.append("&dq=").append(sanitized.getEncoded());
    }
    return url.toString();
  }
}
