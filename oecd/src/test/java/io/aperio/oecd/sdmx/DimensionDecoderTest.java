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
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DimensionDecoder}.
 */
@Tag("unit")
class DimensionDecoderTest {

  private static final List<DimensionDefinition> SERIES = ImmutableList.of(
      new DimensionDefinition("REF_AREA", "Reference area",
          ImmutableList.of(new CodedValue("USA", "United States"),
              new CodedValue("CAN", "Canada"))),
      new DimensionDefinition("MEASURE", "Measure",
          ImmutableList.of(new CodedValue("B1GQ", "GDP"))));

  private static final List<DimensionDefinition> TIME = ImmutableList.of(
      new DimensionDefinition("TIME_PERIOD", "Time period",
          ImmutableList.of(new CodedValue("2023", "2023"), new CodedValue("2024", "2024"))));

  @Test
  void testDecodesSeriesKeyInDeclarationOrder() {
    Map<String, String> decoded = DimensionDecoder.decodeSeriesKey("1:0", SERIES);
    assertEquals(ImmutableMap.of("REF_AREA", "CAN", "MEASURE", "B1GQ"), decoded);
    assertEquals(ImmutableList.of("REF_AREA", "MEASURE"), new ArrayList<>(decoded.keySet()));
  }

  @Test
  void testDecodesObservationKey() {
    assertEquals(ImmutableMap.of("TIME_PERIOD", "2024"),
        DimensionDecoder.decodeObservationKey("1", TIME));
  }

  @Test
  void testUnknownIndexDegradesToPositionalLabel() {
    assertEquals(ImmutableMap.of("REF_AREA", "USA", "DIM_1", "7"),
        DimensionDecoder.decodeSeriesKey("0:7", SERIES));
  }

  @Test
  void testExtraPositionsDegrade() {
    assertEquals(ImmutableMap.of("REF_AREA", "USA", "MEASURE", "B1GQ", "DIM_2", "3"),
        DimensionDecoder.decodeSeriesKey("0:0:3", SERIES));
  }

  @Test
  void testNonNumericIndexDegrades() {
    assertEquals(ImmutableMap.of("DIM_0", "x", "DIM_1", "-1"),
        DimensionDecoder.decodeSeriesKey("x:-1", SERIES));
  }

  @Test
  void testNoStructureUsesSyntheticIds() {
    List<DimensionDefinition> none = Collections.emptyList();
    assertEquals(ImmutableMap.of("DIM_0", "0", "DIM_1", "4", "DIM_2", "2"),
        DimensionDecoder.decodeSeriesKey("0:4:2", none));
    assertEquals(ImmutableMap.of("TIME_PERIOD", "3", "OBS_DIM_1", "1"),
        DimensionDecoder.decodeObservationKey("3:1", none));
  }

  @Test
  void testEmptyKeyDecodesToNothing() {
    assertTrue(DimensionDecoder.decodeSeriesKey("", SERIES).isEmpty());
  }
}
