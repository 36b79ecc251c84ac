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

import java.util.Objects;

/**
 * A dimension filter that passed {@link FilterSanitizer} and is safe to place in
 * a URL path segment.
 *
 * <p>Instances are only created by the sanitizer, or as {@link #ALL}.
 */
public final class SanitizedFilter {

  /** Selects every value of every dimension. */
  public static final SanitizedFilter ALL = new SanitizedFilter("all", "all");

  private final String raw;
  private final String encoded;

  SanitizedFilter(String raw, String encoded) {
    this.raw = raw;
    this.encoded = encoded;
  }

  /** The filter as supplied; matches {@code [A-Za-z0-9._\-:+*]{1,200}}. */
  public String getRaw() {
    return raw;
  }

  /** The percent-encoded form used in the request path. */
  public String getEncoded() {
    return encoded;
  }

  public boolean isAll() {
    return this == ALL || "all".equals(raw);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SanitizedFilter)) {
      return false;
    }
    SanitizedFilter that = (SanitizedFilter) o;
    return raw.equals(that.raw);
  }

  @Override public int hashCode() {
    return Objects.hash(raw);
  }

  @Override public String toString() {
    return raw;
  }
}
