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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * The known SDMX-JSON structure shapes, tried in order.
 *
 * <h4>SDMX-JSON 2.0 (current OECD responses)</h4>
 * <pre>{@code
 * {
 *   "data": {
 *     "dataSets": [ ... ],
 *     "structures": [ {
 *       "dimensions": { "series": [ ... ], "observation": [ ... ] },
 *       "attributes": { "series": [ ... ], "observation": [ ... ] }
 *     } ]
 *   }
 * }
 * }</pre>
 *
 * <h4>SDMX-JSON 1.0 (legacy)</h4>
 * <pre>{@code
 * {
 *   "dataSets": [ ... ],
 *   "structure": {
 *     "dimensions": { "series": [ ... ], "observation": [ ... ] },
 *     "attributes": { "series": [ ... ], "observation": [ ... ] }
 *   }
 * }
 * }</pre>
 *
 * <p>Each dimension entry is {@code {"id", "name", "values": [{"id", "name"}]}};
 * some responses carry localized {@code names: {"en": ...}} instead of
 * {@code name}.
 */
public final class StructureExtractors {

  /** {@code data.structures[0]}. */
  public static final StructureExtractor SDMX_JSON_2 =
      payload -> fromStructureNode(payload.path("data").path("structures").path(0));

  /** Top-level {@code structure}. */
  public static final StructureExtractor SDMX_JSON_1 =
      payload -> fromStructureNode(payload.path("structure"));

  /** Extractors in the order they are tried. */
  public static final List<StructureExtractor> DEFAULT_CHAIN =
      ImmutableList.of(SDMX_JSON_2, SDMX_JSON_1);

  private StructureExtractors() {
  }

  /**
   * Applies {@link #DEFAULT_CHAIN}; the first present result wins.
   */
  public static Optional<StructureDefinition> extract(JsonNode payload) {
    return extract(payload, DEFAULT_CHAIN);
  }

  public static Optional<StructureDefinition> extract(JsonNode payload,
      List<StructureExtractor> chain) {
    if (payload == null) {
      return Optional.empty();
    }
    for (StructureExtractor extractor : chain) {
      Optional<StructureDefinition> structure = extractor.extract(payload);
      if (structure.isPresent()) {
        return structure;
      }
    }
    return Optional.empty();
  }

  /**
   * Generic structure reported when no live structure is available. The values
   * are illustrative only.
   */
  public static DataStructure defaultStructure(String dataflowId) {
    return new DataStructure(dataflowId,
        ImmutableList.of(
            new DimensionDefinition("REF_AREA", "Reference Area",
                ImmutableList.of(
                    new CodedValue("all", "Use query_data to get actual dimension values"))),
            new DimensionDefinition("TIME_PERIOD", "Time Period",
                ImmutableList.of(new CodedValue("all", "Time dimension"))),
            new DimensionDefinition("MEASURE", "Measure",
                ImmutableList.of(new CodedValue("all", "Measured indicator")))),
        ImmutableList.of(
            new AttributeDefinition("UNIT_MEASURE", "Unit of Measure"),
            new AttributeDefinition("OBS_STATUS", "Observation Status")),
        DataStructure.Source.DEFAULT);
  }

  private static Optional<StructureDefinition> fromStructureNode(JsonNode structure) {
    JsonNode dimensions = structure.path("dimensions");
    if (!dimensions.isObject()) {
      return Optional.empty();
    }
    JsonNode series = dimensions.path("series");
    JsonNode observation = dimensions.path("observation");
    if (!series.isArray() && !observation.isArray()) {
      return Optional.empty();
    }
    JsonNode attributes = structure.path("attributes");
    return Optional.of(
        new StructureDefinition(
            dimensionList(series),
            dimensionList(observation),
            attributeList(attributes.path("series")),
            attributeList(attributes.path("observation"))));
  }

  private static List<DimensionDefinition> dimensionList(JsonNode array) {
    ImmutableList.Builder<DimensionDefinition> result = ImmutableList.builder();
    if (array.isArray()) {
      for (JsonNode dim : array) {
        // an entry without an id still occupies its key position
        String id = dim.path("id").asText("");
        if (id.isEmpty()) {
          result.add(new DimensionDefinition("", "", ImmutableList.of()));
          continue;
        }
        result.add(new DimensionDefinition(id, nameOf(dim, id), codes(dim.path("values"))));
      }
    }
    return result.build();
  }

  private static List<AttributeDefinition> attributeList(JsonNode array) {
    ImmutableList.Builder<AttributeDefinition> result = ImmutableList.builder();
    if (array.isArray()) {
      for (JsonNode attr : array) {
        String id = attr.path("id").asText("");
        if (id.isEmpty()) {
          result.add(new AttributeDefinition("", ""));
          continue;
        }
        result.add(new AttributeDefinition(id, nameOf(attr, id), codes(attr.path("values"))));
      }
    }
    return result.build();
  }

  private static List<CodedValue> codes(JsonNode values) {
    ImmutableList.Builder<CodedValue> result = ImmutableList.builder();
    if (values.isArray()) {
      for (JsonNode value : values) {
        // keep placeholders so positional indices stay aligned
        String id = value.path("id").asText("");
        result.add(new CodedValue(id, nameOf(value, id)));
      }
    }
    return result.build();
  }

  private static String nameOf(JsonNode node, String fallback) {
    JsonNode name = node.path("name");
    if (name.isTextual()) {
      return name.asText();
    }
    JsonNode english = node.path("names").path("en");
    if (english.isTextual()) {
      return english.asText();
    }
    return fallback;
  }
}
