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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A dimension of a dataflow together with its ordered codelist.
 *
 * <p>Positional indices in series and observation keys refer to
 * {@link #getValues()} by position, so the order is significant.
 */
public final class DimensionDefinition {
  private final String id;
  private final String name;
  private final ImmutableList<CodedValue> values;

  public DimensionDefinition(String id, String name, List<CodedValue> values) {
    this.id = Objects.requireNonNull(id, "id");
    this.name = name == null ? id : name;
    this.values = ImmutableList.copyOf(values);
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public List<CodedValue> getValues() {
    return values;
  }

  /**
   * Whether this entry only holds a position: the message declared a
   * dimension here without an id.
   */
  public boolean isPlaceholder() {
    return id.isEmpty();
  }

  /** Returns the code at {@code index}, or null if out of range. */
  public @Nullable CodedValue valueAt(int index) {
    if (index < 0 || index >= values.size()) {
      return null;
    }
    return values.get(index);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DimensionDefinition)) {
      return false;
    }
    DimensionDefinition that = (DimensionDefinition) o;
    return id.equals(that.id) && name.equals(that.name) && values.equals(that.values);
  }

  @Override public int hashCode() {
    return Objects.hash(id, name, values);
  }

  @Override public String toString() {
    return id + values;
  }
}
