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

import io.aperio.oecd.InvalidFilterException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Validates caller-supplied SDMX dimension filters before they are placed in a
 * request path.
 *
 * <p>A filter such as {@code USA+CAN.GDP..A} is concatenated into the URL, so any
 * character outside the whitelist is rejected rather than escaped. Rejection
 * always happens before any network activity.
 */
public final class FilterSanitizer {

  public static final int MAX_LENGTH = 200;

  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._\\-:+*]+");

  private FilterSanitizer() {
  }

  /**
   * Checks {@code raw} and returns its encoded form.
   *
   * @param raw Filter as supplied by the caller
   * @return the sanitized filter
   * @throws InvalidFilterException if the filter is null, empty, longer than
   *     {@link #MAX_LENGTH} characters or contains a character outside
   *     {@code [A-Za-z0-9._\-:+*]}
   */
  public static SanitizedFilter sanitize(@Nullable String raw) {
    if (raw == null || raw.isEmpty()) {
      throw new InvalidFilterException(raw, InvalidFilterException.Reason.EMPTY,
          "Filter must not be empty. Omit the filter to query all values.");
    }
    if (raw.length() > MAX_LENGTH) {
      throw new InvalidFilterException(raw, InvalidFilterException.Reason.TOO_LONG,
          "Filter is too long: " + raw.length() + " characters (maximum "
              + MAX_LENGTH + ").");
    }
    if (!ALLOWED.matcher(raw).matches()) {
      throw new InvalidFilterException(raw, InvalidFilterException.Reason.ILLEGAL_CHARACTERS,
          "Invalid filter format: \"" + raw + "\". Only alphanumeric characters and"
              + " ._-:+* are allowed.");
    }
    return new SanitizedFilter(raw, URLEncoder.encode(raw, StandardCharsets.UTF_8));
  }

  /**
   * Like {@link #sanitize(String)} but maps a null filter to {@link SanitizedFilter#ALL}.
   * An empty string is still rejected.
   */
  public static SanitizedFilter sanitizeOrAll(@Nullable String raw) {
    if (raw == null) {
      return SanitizedFilter.ALL;
    }
    return sanitize(raw);
  }
}
