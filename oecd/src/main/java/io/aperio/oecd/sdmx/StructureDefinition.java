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
 * Dimension and attribute definitions embedded in one SDMX-JSON data message,
 * split by the level (series or observation) their key positions refer to.
 *
 * <p>Derived per response; never cached across calls.
 */
public final class StructureDefinition {

  /** A structure with no definitions; decoding against it yields raw positional labels. */
  public static final StructureDefinition EMPTY =
      new StructureDefinition(ImmutableList.of(), ImmutableList.of(),
          ImmutableList.of(), ImmutableList.of());

  private final ImmutableList<DimensionDefinition> seriesDimensions;
  private final ImmutableList<DimensionDefinition> observationDimensions;
  private final ImmutableList<AttributeDefinition> seriesAttributes;
  private final ImmutableList<AttributeDefinition> observationAttributes;

  public StructureDefinition(List<DimensionDefinition> seriesDimensions,
      List<DimensionDefinition> observationDimensions,
      List<AttributeDefinition> seriesAttributes,
      List<AttributeDefinition> observationAttributes) {
    this.seriesDimensions = ImmutableList.copyOf(seriesDimensions);
    this.observationDimensions = ImmutableList.copyOf(observationDimensions);
    this.seriesAttributes = ImmutableList.copyOf(seriesAttributes);
    this.observationAttributes = ImmutableList.copyOf(observationAttributes);
  }

  public List<DimensionDefinition> getSeriesDimensions() {
    return seriesDimensions;
  }

  public List<DimensionDefinition> getObservationDimensions() {
    return observationDimensions;
  }

  public List<AttributeDefinition> getSeriesAttributes() {
    return seriesAttributes;
  }

  public List<AttributeDefinition> getObservationAttributes() {
    return observationAttributes;
  }

  /** Series dimensions followed by observation dimensions. */
  public List<DimensionDefinition> getAllDimensions() {
    return ImmutableList.<DimensionDefinition>builder()
        .addAll(seriesDimensions)
        .addAll(observationDimensions)
        .build();
  }

  public List<AttributeDefinition> getAllAttributes() {
    return ImmutableList.<AttributeDefinition>builder()
        .addAll(seriesAttributes)
        .addAll(observationAttributes)
        .build();
  }

  public boolean isEmpty() {
    return seriesDimensions.isEmpty() && observationDimensions.isEmpty();
  }

  /** Converts to the caller-facing description of a dataflow. */
  public DataStructure toDataStructure(String dataflowId) {
    return new DataStructure(dataflowId, getAllDimensions(), getAllAttributes(),
        DataStructure.Source.LIVE);
  }
}
