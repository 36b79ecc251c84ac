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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link StructureExtractors}.
 */
@Tag("unit")
class StructureExtractorsTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static JsonNode loadSample() throws Exception {
    try (InputStream in = StructureExtractorsTest.class.getResourceAsStream("/sdmx/qna-sample.json")) {
      return MAPPER.readTree(in);
    }
  }

  @Test
  void testPrimaryShape() throws Exception {
    Optional<StructureDefinition> structure = StructureExtractors.extract(loadSample());

    assertTrue(structure.isPresent());
    StructureDefinition def = structure.get();
    assertEquals(2, def.getSeriesDimensions().size());
    assertEquals("REF_AREA", def.getSeriesDimensions().get(0).getId());
    assertEquals("Canada", def.getSeriesDimensions().get(0).getValues().get(1).getName());
    // localized name
    assertEquals("Transaction", def.getSeriesDimensions().get(1).getName());
    assertEquals("TIME_PERIOD", def.getObservationDimensions().get(0).getId());
    assertEquals("UNIT_MEASURE", def.getSeriesAttributes().get(0).getId());
    assertEquals("OBS_STATUS", def.getObservationAttributes().get(0).getId());
  }

  @Test
  void testLegacyShape() throws Exception {
    JsonNode payload = MAPPER.readTree("{\"dataSets\":[],\"structure\":{\"dimensions\":{"
        + "\"series\":[{\"id\":\"LOCATION\",\"name\":\"Country\","
        + "\"values\":[{\"id\":\"AUS\",\"name\":\"Australia\"}]}],"
        + "\"observation\":[{\"id\":\"TIME_PERIOD\",\"name\":\"Time\",\"values\":[]}]},"
        + "\"attributes\":{\"series\":[],\"observation\":[{\"id\":\"OBS_STATUS\"}]}}}");

    assertFalse(StructureExtractors.SDMX_JSON_2.extract(payload).isPresent());
    StructureDefinition def = StructureExtractors.extract(payload).get();
    assertEquals("LOCATION", def.getSeriesDimensions().get(0).getId());
    assertEquals("OBS_STATUS", def.getObservationAttributes().get(0).getName());
  }

  @Test
  void testPrimaryShapeWinsOverLegacy() throws Exception {
    JsonNode payload = MAPPER.readTree("{"
        + "\"data\":{\"structures\":[{\"dimensions\":{\"series\":[{\"id\":\"NEW\"}]}}]},"
        + "\"structure\":{\"dimensions\":{\"series\":[{\"id\":\"OLD\"}]}}}");

    assertEquals("NEW", StructureExtractors.extract(payload).get()
        .getSeriesDimensions().get(0).getId());
  }

  @Test
  void testCustomChainOrder() throws Exception {
    JsonNode payload = MAPPER.readTree("{"
        + "\"data\":{\"structures\":[{\"dimensions\":{\"series\":[{\"id\":\"NEW\"}]}}]},"
        + "\"structure\":{\"dimensions\":{\"series\":[{\"id\":\"OLD\"}]}}}");

    assertEquals("OLD", StructureExtractors.extract(payload,
        ImmutableList.of(StructureExtractors.SDMX_JSON_1, StructureExtractors.SDMX_JSON_2))
        .get().getSeriesDimensions().get(0).getId());
  }

  @Test
  void testEntriesWithoutIdKeepTheirPosition() throws Exception {
    JsonNode payload = MAPPER.readTree("{\"data\":{\"structures\":[{\"dimensions\":{"
        + "\"series\":[{\"id\":\"REF_AREA\"},{\"name\":\"No id\"},{\"id\":\"MEASURE\"}]},"
        + "\"attributes\":{\"observation\":[{},{\"id\":\"OBS_STATUS\"}]}}]}}");

    StructureDefinition def = StructureExtractors.extract(payload).get();
    assertEquals(3, def.getSeriesDimensions().size());
    assertTrue(def.getSeriesDimensions().get(1).isPlaceholder());
    assertEquals("MEASURE", def.getSeriesDimensions().get(2).getId());
    assertFalse(def.getSeriesDimensions().get(2).isPlaceholder());
    assertEquals(2, def.getObservationAttributes().size());
    assertTrue(def.getObservationAttributes().get(0).isPlaceholder());
    assertEquals("OBS_STATUS", def.getObservationAttributes().get(1).getId());
  }

  @Test
  void testNoStructure() throws Exception {
    assertFalse(StructureExtractors.extract(MAPPER.readTree("{\"data\":{\"dataSets\":[]}}"))
        .isPresent());
    assertFalse(StructureExtractors.extract(MAPPER.readTree("[]")).isPresent());
    assertFalse(StructureExtractors.extract(
        MAPPER.readTree("{\"structure\":{\"dimensions\":\"oops\"}}")).isPresent());
  }

  @Test
  void testDefaultStructure() {
    DataStructure structure = StructureExtractors.defaultStructure("QNA");

    assertEquals("QNA", structure.getDataflowId());
    assertEquals(DataStructure.Source.DEFAULT, structure.getSource());
    assertEquals(ImmutableList.of("REF_AREA", "TIME_PERIOD", "MEASURE"),
        ImmutableList.of(structure.getDimensions().get(0).getId(),
            structure.getDimensions().get(1).getId(),
            structure.getDimensions().get(2).getId()));
    assertEquals("all", structure.getDimensions().get(0).getValues().get(0).getId());
    assertEquals("UNIT_MEASURE", structure.getAttributes().get(0).getId());
    assertEquals("OBS_STATUS", structure.getAttributes().get(1).getId());
  }
}
