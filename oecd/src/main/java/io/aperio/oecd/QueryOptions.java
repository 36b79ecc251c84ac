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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Optional parameters of {@link OecdClient#query}.
 *
 * <p>Periods use SDMX period syntax: {@code 2020}, {@code 2020-03},
 * {@code 2020-03-31}, {@code 2020-Q1}, {@code 2020-S2} or {@code 2020-W07}.
 */
public final class QueryOptions {

  public static final QueryOptions NONE = builder().build();

  private static final Pattern PERIOD = Pattern.compile(
      "\\d{4}(-(0[1-9]|1[0-2])(-(0[1-9]|[12]\\d|3[01]))?|-Q[1-4]|-S[12]|-W(0[1-9]|[1-4]\\d|5[0-3]))?");

  private final @Nullable String startPeriod;
  private final @Nullable String endPeriod;
  private final @Nullable Integer lastNObservations;
  private final @Nullable Integer limit;

  private QueryOptions(Builder builder) {
    this.startPeriod = builder.startPeriod;
    this.endPeriod = builder.endPeriod;
    this.lastNObservations = builder.lastNObservations;
    this.limit = builder.limit;
  }

  public static Builder builder() {
    return new Builder();
  }

  public @Nullable String getStartPeriod() {
    return startPeriod;
  }

  public @Nullable String getEndPeriod() {
    return endPeriod;
  }

  /** Sent to the remote as {@code lastNObservations}. */
  public @Nullable Integer getLastNObservations() {
    return lastNObservations;
  }

  /** Client-side cap on decoded observations. */
  public @Nullable Integer getLimit() {
    return limit;
  }

  /**
   * Checks every option.
   *
   * @param maxObservations Upper bound for {@code limit} and {@code lastNObservations}
   * @throws InvalidParameterException naming the first offending option
   */
  public void validate(int maxObservations) {
    checkPeriod("startPeriod", startPeriod);
    checkPeriod("endPeriod", endPeriod);
    checkCount("lastNObservations", lastNObservations, maxObservations);
    checkCount("limit", limit, maxObservations);
  }

  /**
   * The client-side cap applied while decoding: {@code limit}, else
   * {@code lastNObservations}, else {@code maxObservations}.
   */
  public int effectiveLimit(int maxObservations) {
    if (limit != null) {
      return limit;
    }
    if (lastNObservations != null) {
      return lastNObservations;
    }
    return maxObservations;
  }

  public static boolean isValidPeriod(String period) {
    return PERIOD.matcher(period).matches();
  }

  private static void checkPeriod(String name, @Nullable String period) {
    if (period != null && !isValidPeriod(period)) {
      throw new InvalidParameterException(name, "Invalid " + name + ": \"" + period
          + "\". Use YYYY, YYYY-MM, YYYY-MM-DD, YYYY-Qn, YYYY-Sn or YYYY-Wnn.");
    }
  }

  private static void checkCount(String name, @Nullable Integer value, int max) {
    if (value != null && (value < 1 || value > max)) {
      throw new InvalidParameterException(name,
          name + " must be between 1 and " + max + ", got " + value);
    }
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QueryOptions)) {
      return false;
    }
    QueryOptions that = (QueryOptions) o;
    return Objects.equals(startPeriod, that.startPeriod)
        && Objects.equals(endPeriod, that.endPeriod)
        && Objects.equals(lastNObservations, that.lastNObservations)
        && Objects.equals(limit, that.limit);
  }

  @Override public int hashCode() {
    return Objects.hash(startPeriod, endPeriod, lastNObservations, limit);
  }

  @Override public String toString() {
    return "QueryOptions{startPeriod=" + startPeriod + ", endPeriod=" + endPeriod
        + ", lastNObservations=" + lastNObservations + ", limit=" + limit + "}";
  }

  /**
   * Builder for {@link QueryOptions}. Blank periods are treated as absent.
   */
  public static final class Builder {
    private @Nullable String startPeriod;
    private @Nullable String endPeriod;
    private @Nullable Integer lastNObservations;
    private @Nullable Integer limit;

    private Builder() {
    }

    public Builder startPeriod(@Nullable String startPeriod) {
      this.startPeriod = blankToNull(startPeriod);
      return this;
    }

    public Builder endPeriod(@Nullable String endPeriod) {
      this.endPeriod = blankToNull(endPeriod);
      return this;
    }

    public Builder lastNObservations(@Nullable Integer lastNObservations) {
      this.lastNObservations = lastNObservations;
      return this;
    }

    public Builder limit(@Nullable Integer limit) {
      this.limit = limit;
      return this;
    }

    public QueryOptions build() {
      return new QueryOptions(this);
    }

    private static @Nullable String blankToNull(@Nullable String s) {
      return s == null || s.trim().isEmpty() ? null : s.trim();
    }
  }
}
