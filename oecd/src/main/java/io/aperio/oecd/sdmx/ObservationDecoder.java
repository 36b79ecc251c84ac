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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens SDMX-JSON data messages into {@link Observation}s.
 *
 * <p>Walks {@code data.dataSets[*].series[*].observations[*]} (or the top-level
 * {@code dataSets} of the legacy shape). Series keys and observation keys are
 * resolved with the structure embedded in the same message. A value is given
 * either bare or as an array whose first element is the value and whose
 * remaining elements are observation attribute indices:
 * <pre>{@code
 * "series": {
 *   "0:0:1": {
 *     "attributes": [0],
 *     "observations": { "0": [101.3, 0], "1": [102.1, null] }
 *   }
 * }
 * }</pre>
 *
 * <p>An optional limit stops the walk as soon as that many observations have
 * been collected; the remote service ignores {@code lastNObservations} for some
 * dataflows and the response may otherwise be arbitrarily large.
 *
 * <p>Malformed shapes never raise. They are skipped, logged at WARN and reported
 * in {@link DecodedData#getAnomalies()}.
 */
public class ObservationDecoder {
  private static final Logger LOGGER = LoggerFactory.getLogger(ObservationDecoder.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final List<StructureExtractor> extractors;

  public ObservationDecoder() {
    this(StructureExtractors.DEFAULT_CHAIN);
  }

  public ObservationDecoder(List<StructureExtractor> extractors) {
    this.extractors = extractors;
  }

  /**
   * Parses and decodes a response body.
   *
   * @param body Raw response text
   * @param limit Maximum number of observations to return, or null for no limit
   */
  public DecodedData decode(@Nullable String body, @Nullable Integer limit) {
    if (body == null || body.trim().isEmpty()) {
      return anomaly("Empty response body");
    }
    JsonNode root;
    try {
      root = MAPPER.readTree(body);
    } catch (JsonProcessingException e) {
      LOGGER.warn("Response body is not valid JSON: {}", e.getOriginalMessage());
      return anomaly("Response body is not valid JSON");
    }
    return decode(root, limit);
  }

  /**
   * Decodes a parsed SDMX-JSON message.
   *
   * @param payload Parsed message
   * @param limit Maximum number of observations to return, or null for no limit
   */
  public DecodedData decode(@Nullable JsonNode payload, @Nullable Integer limit) {
    if (limit != null && limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1: " + limit);
    }
    if (payload == null || !payload.isObject()) {
      return anomaly("Payload is not a JSON object");
    }
    StructureDefinition structure =
        StructureExtractors.extract(payload, extractors).orElse(StructureDefinition.EMPTY);

    JsonNode dataSets = payload.path("data").path("dataSets");
    if (!dataSets.isArray()) {
      dataSets = payload.path("dataSets");
    }
    if (!dataSets.isArray()) {
      return anomaly("Payload has no data.dataSets array");
    }

    Accumulator acc = new Accumulator(limit);
    if (structure.isEmpty()) {
      acc.anomaly("No structure found in payload; dimensions use positional labels");
    }
    int dataSetIndex = 0;
    for (JsonNode dataSet : dataSets) {
      if (acc.stopped) {
        break;
      }
      if (!dataSet.isObject()) {
        acc.anomaly("dataSets[" + dataSetIndex + "] is not an object");
      } else {
        decodeDataSet(dataSet, dataSetIndex, structure, acc);
      }
      dataSetIndex++;
    }
    if (acc.truncated) {
      LOGGER.warn("Client-side limit reached: {} observations. The OECD API may have"
          + " ignored lastNObservations.", limit);
    }
    return new DecodedData(acc.observations, acc.truncated, acc.anomalies);
  }

  private void decodeDataSet(JsonNode dataSet, int dataSetIndex,
      StructureDefinition structure, Accumulator acc) {
    JsonNode series = dataSet.path("series");
    if (series.isMissingNode()) {
      // flat layout: every observation key carries all dimensions
      JsonNode observations = dataSet.path("observations");
      if (observations.isObject()) {
        decodeObservations(observations, new LinkedHashMap<>(), new LinkedHashMap<>(),
            structure.getAllDimensions(), structure, acc);
      }
      return;
    }
    if (!series.isObject()) {
      acc.anomaly("dataSets[" + dataSetIndex + "].series is not an object");
      return;
    }
    Iterator<Map.Entry<String, JsonNode>> it = series.fields();
    while (it.hasNext() && !acc.stopped) {
      Map.Entry<String, JsonNode> entry = it.next();
      JsonNode seriesNode = entry.getValue();
      if (!seriesNode.isObject()) {
        acc.anomaly("Series " + entry.getKey() + " is not an object");
        continue;
      }
      Map<String, String> seriesDimensions =
          DimensionDecoder.decodeSeriesKey(entry.getKey(), structure.getSeriesDimensions());
      Map<String, String> seriesAttributes = new LinkedHashMap<>();
      decodeAttributes(seriesNode.path("attributes"), 0, structure.getSeriesAttributes(),
          seriesAttributes);

      JsonNode observations = seriesNode.path("observations");
      if (observations.isMissingNode()) {
        continue;
      }
      if (!observations.isObject()) {
        acc.anomaly("Series " + entry.getKey() + " observations is not an object");
        continue;
      }
      decodeObservations(observations, seriesDimensions, seriesAttributes,
          structure.getObservationDimensions(), structure, acc);
    }
  }

  private void decodeObservations(JsonNode observations, Map<String, String> seriesDimensions,
      Map<String, String> seriesAttributes, List<DimensionDefinition> keyDimensions,
      StructureDefinition structure, Accumulator acc) {
    Iterator<Map.Entry<String, JsonNode>> it = observations.fields();
    while (it.hasNext()) {
      if (acc.isFull()) {
        acc.truncated = true;
        acc.stopped = true;
        return;
      }
      Map.Entry<String, JsonNode> entry = it.next();
      Map<String, String> dimensions = new LinkedHashMap<>(seriesDimensions);
      dimensions.putAll(DimensionDecoder.decodeObservationKey(entry.getKey(), keyDimensions));

      JsonNode raw = entry.getValue();
      Object value;
      Map<String, String> attributes = new LinkedHashMap<>(seriesAttributes);
      if (raw.isArray()) {
        value = raw.size() == 0 ? null : scalar(raw.get(0));
        decodeAttributes(raw, 1, structure.getObservationAttributes(), attributes);
      } else {
        value = scalar(raw);
      }
      acc.observations.add(new Observation(dimensions, value, attributes));
    }
  }

  /**
   * Resolves attribute indices starting at {@code offset} in {@code indices};
   * element {@code offset + j} refers to {@code definitions[j]}. Null entries mean
   * the attribute is not set.
   */
  private static void decodeAttributes(JsonNode indices, int offset,
      List<AttributeDefinition> definitions, Map<String, String> target) {
    if (!indices.isArray()) {
      return;
    }
    for (int i = offset; i < indices.size(); i++) {
      JsonNode index = indices.get(i);
      if (index == null || index.isNull()) {
        continue;
      }
      int position = i - offset;
      AttributeDefinition definition =
          position < definitions.size() ? definitions.get(position) : null;
      if (definition != null && definition.isPlaceholder()) {
        definition = null;
      }
      String id = definition == null ? "ATTR_" + position : definition.getId();
      CodedValue code = definition == null || !index.canConvertToInt()
          ? null
          : definition.valueAt(index.asInt());
      target.put(id, code == null ? index.asText() : code.getId());
    }
  }

  private static @Nullable Object scalar(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.numberValue();
    }
    return node.asText();
  }

  private static DecodedData anomaly(String message) {
    LOGGER.warn("SDMX decode: {}", message);
    return new DecodedData(new ArrayList<>(), false, ImmutableList.of(message));
  }

  /** Mutable state of one decode pass. */
  private static final class Accumulator {
    final @Nullable Integer limit;
    final List<Observation> observations = new ArrayList<>();
    final List<String> anomalies = new ArrayList<>();
    boolean truncated;
    boolean stopped;

    Accumulator(@Nullable Integer limit) {
      this.limit = limit;
    }

    boolean isFull() {
      return limit != null && observations.size() >= limit;
    }

    void anomaly(String message) {
      LOGGER.warn("SDMX decode: {}", message);
      anomalies.add(message);
    }
  }
}
