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

import java.util.List;

/**
 * Description of a dataflow's dimensions and attributes, as returned by
 * {@code OecdClient#describe}.
 */
public final class DataStructure {

  /** Where the structure came from. */
  public enum Source {
    /** Extracted from a live response. */
    LIVE,
    /** Generic placeholder used when no live structure could be obtained. */
    DEFAULT
  }

  private final String dataflowId;
  private final ImmutableList<DimensionDefinition> dimensions;
  private final ImmutableList<AttributeDefinition> attributes;
  private final Source source;

  public DataStructure(String dataflowId, List<DimensionDefinition> dimensions,
      List<AttributeDefinition> attributes, Source source) {
    this.dataflowId = dataflowId;
    this.dimensions = ImmutableList.copyOf(dimensions);
    this.attributes = ImmutableList.copyOf(attributes);
    this.source = source;
  }

  public String getDataflowId() {
    return dataflowId;
  }

  public List<DimensionDefinition> getDimensions() {
    return dimensions;
  }

  public List<AttributeDefinition> getAttributes() {
    return attributes;
  }

  public Source getSource() {
    return source;
  }

  @Override public String toString() {
    return "DataStructure{" + dataflowId + ", " + source + ", dimensions=" + dimensions + "}";
  }
}
