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
package io.aperio.oecd.sdmx;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * One data point: a value plus its resolved dimension coordinates.
 *
 * <p>Dimension order follows the structure (series dimensions, then observation
 * dimensions). The value is a {@link Number}, a {@link String}, or null when the
 * remote reports a missing observation.
 */
public final class Observation {
  private final ImmutableMap<String, String> dimensions;
  private final @Nullable Object value;
  private final ImmutableMap<String, String> attributes;

  public Observation(Map<String, String> dimensions, @Nullable Object value,
      Map<String, String> attributes) {
    this.dimensions = ImmutableMap.copyOf(dimensions);
    this.value = value;
    this.attributes = ImmutableMap.copyOf(attributes);
  }

  public Map<String, String> getDimensions() {
    return dimensions;
  }

  public @Nullable String getDimension(String id) {
    return dimensions.get(id);
  }

  public @Nullable Object getValue() {
    return value;
  }

  /** The value as a double, or null if it is missing or not numeric. */
  public @Nullable Double getNumericValue() {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    return null;
  }

  public Map<String, String> getAttributes() {
    return attributes;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Observation)) {
      return false;
    }
    Observation that = (Observation) o;
    return dimensions.equals(that.dimensions)
        && Objects.equals(value, that.value)
        && attributes.equals(that.attributes);
  }

  @Override public int hashCode() {
    return Objects.hash(dimensions, value, attributes);
  }

  @Override public String toString() {
    return "Observation{" + dimensions + " = " + value
        + (attributes.isEmpty() ? "" : ", " + attributes) + "}";
  }
}
