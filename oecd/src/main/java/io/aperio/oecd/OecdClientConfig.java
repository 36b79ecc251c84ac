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

import com.fasterxml.jackson.databind.JsonNode;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.function.Function;

/**
 * Settings of an {@link OecdClient}.
 *
 * <p>Defaults come from the bundled {@code /oecd/oecd-client.yaml}:
 * <pre>{@code
 * baseUrl: https://sdmx.oecd.org/public/rest
 * userAgent: Aperio-OECD/1.0
 * timeoutMs: 30000
 * maxObservations: 1000
 * rateLimit:
 *   minIntervalMs: 1500
 *   maxRetries: 3
 *   retryDelayMs: 1000
 * }</pre>
 *
 * <p>The base URL can be overridden with the system property or environment
 * variable {@value #BASE_URL_OVERRIDE}; the system property wins.
 */
public final class OecdClientConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(OecdClientConfig.class);

  public static final String DEFAULT_RESOURCE = "/oecd/oecd-client.yaml";
  public static final String BASE_URL_OVERRIDE = "OECD_SDMX_BASE_URL";

  public static final String DEFAULT_BASE_URL = "https://sdmx.oecd.org/public/rest";
  public static final String DEFAULT_USER_AGENT = "Aperio-OECD/1.0";
  public static final long DEFAULT_TIMEOUT_MS = 30_000;
  public static final int DEFAULT_MAX_OBSERVATIONS = 1000;
  public static final long DEFAULT_MIN_INTERVAL_MS = 1500;
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final long DEFAULT_RETRY_DELAY_MS = 1000;

  private final String baseUrl;
  private final String userAgent;
  private final long timeoutMs;
  private final int maxObservations;
  private final long minIntervalMs;
  private final int maxRetries;
  private final long retryDelayMs;

  private OecdClientConfig(Builder builder) {
    this.baseUrl = builder.baseUrl;
    this.userAgent = builder.userAgent;
    this.timeoutMs = builder.timeoutMs;
    this.maxObservations = builder.maxObservations;
    this.minIntervalMs = builder.minIntervalMs;
    this.maxRetries = builder.maxRetries;
    this.retryDelayMs = builder.retryDelayMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .baseUrl(baseUrl)
        .userAgent(userAgent)
        .timeoutMs(timeoutMs)
        .maxObservations(maxObservations)
        .minIntervalMs(minIntervalMs)
        .maxRetries(maxRetries)
        .retryDelayMs(retryDelayMs);
  }

  /**
   * Loads the bundled configuration and applies the
   * {@value #BASE_URL_OVERRIDE} override from system properties or the
   * environment.
   */
  public static OecdClientConfig load() {
    JsonNode root;
    try {
      root = YamlUtils.loadResource(DEFAULT_RESOURCE);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot load " + DEFAULT_RESOURCE, e);
    }
    return fromTree(root)
        .applyOverrides(key -> {
          String value = System.getProperty(key);
          return value != null ? value : System.getenv(key);
        })
        .build();
  }

  /**
   * Reads settings from a parsed configuration tree. Missing keys keep their
   * defaults.
   */
  public static Builder fromTree(JsonNode root) {
    Builder builder = builder();
    if (root.hasNonNull("baseUrl")) {
      builder.baseUrl(root.get("baseUrl").asText());
    }
    if (root.hasNonNull("userAgent")) {
      builder.userAgent(root.get("userAgent").asText());
    }
    if (root.hasNonNull("timeoutMs")) {
      builder.timeoutMs(root.get("timeoutMs").asLong());
    }
    if (root.hasNonNull("maxObservations")) {
      builder.maxObservations(root.get("maxObservations").asInt());
    }
    JsonNode rateLimit = root.path("rateLimit");
    if (rateLimit.hasNonNull("minIntervalMs")) {
      builder.minIntervalMs(rateLimit.get("minIntervalMs").asLong());
    }
    if (rateLimit.hasNonNull("maxRetries")) {
      builder.maxRetries(rateLimit.get("maxRetries").asInt());
    }
    if (rateLimit.hasNonNull("retryDelayMs")) {
      builder.retryDelayMs(rateLimit.get("retryDelayMs").asLong());
    }
    return builder;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public String getUserAgent() {
    return userAgent;
  }

  /** Per-attempt deadline. */
  public long getTimeoutMs() {
    return timeoutMs;
  }

  /** Upper bound for {@code limit} and {@code lastNObservations}, and the default client cap. */
  public int getMaxObservations() {
    return maxObservations;
  }

  public long getMinIntervalMs() {
    return minIntervalMs;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public long getRetryDelayMs() {
    return retryDelayMs;
  }

  @Override public String toString() {
    return "OecdClientConfig{baseUrl=" + baseUrl
        + ", timeoutMs=" + timeoutMs
        + ", maxObservations=" + maxObservations
        + ", minIntervalMs=" + minIntervalMs
        + ", maxRetries=" + maxRetries
        + ", retryDelayMs=" + retryDelayMs + "}";
  }

  /**
   * Builder for {@link OecdClientConfig}.
   */
  public static final class Builder {
    private String baseUrl = DEFAULT_BASE_URL;
    private String userAgent = DEFAULT_USER_AGENT;
    private long timeoutMs = DEFAULT_TIMEOUT_MS;
    private int maxObservations = DEFAULT_MAX_OBSERVATIONS;
    private long minIntervalMs = DEFAULT_MIN_INTERVAL_MS;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;

    private Builder() {
    }

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    public Builder timeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
      return this;
    }

    public Builder maxObservations(int maxObservations) {
      this.maxObservations = maxObservations;
      return this;
    }

    public Builder minIntervalMs(long minIntervalMs) {
      this.minIntervalMs = minIntervalMs;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder retryDelayMs(long retryDelayMs) {
      this.retryDelayMs = retryDelayMs;
      return this;
    }

    /**
     * Applies overrides looked up by name; a null or blank result leaves the
     * current value unchanged.
     */
    public Builder applyOverrides(Function<String, @Nullable String> lookup) {
      String override = lookup.apply(BASE_URL_OVERRIDE);
      if (override != null && !override.trim().isEmpty()) {
        LOGGER.info("Using OECD base URL from {}: {}", BASE_URL_OVERRIDE, override);
        this.baseUrl = override.trim();
      }
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public OecdClientConfig build() {
      if (baseUrl == null || !(baseUrl.startsWith("http://") || baseUrl.startsWith("https://"))) {
        throw new IllegalArgumentException("baseUrl must be an http(s) URL: " + baseUrl);
      }
      if (timeoutMs <= 0) {
        throw new IllegalArgumentException("timeoutMs must be > 0: " + timeoutMs);
      }
      if (maxObservations <= 0) {
        throw new IllegalArgumentException("maxObservations must be > 0: " + maxObservations);
      }
      if (minIntervalMs < 0 || maxRetries < 0 || retryDelayMs < 0) {
        throw new IllegalArgumentException("rateLimit values must be >= 0");
      }
      return new OecdClientConfig(this);
    }
  }
}
