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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link SdmxUrlBuilder}.
 */
@Tag("unit")
class SdmxUrlBuilderTest {

  @Test
  void testDefaultsToAllFilter() {
    assertEquals(
        "https://sdmx.oecd.org/public/rest/data/OECD.SDD.NAD,DSD_NAMAIN1@DF_QNA/all"
            + "?format=jsondata",
        new SdmxUrlBuilder("https://sdmx.oecd.org/public/rest", "OECD.SDD.NAD",
            "DSD_NAMAIN1@DF_QNA").build().toString());
  }

  @Test
  void testFilterAndParameters() {
    String url = new SdmxUrlBuilder("https://sdmx.oecd.org/public/rest/", "OECD.SDD.NAD",
        "DSD_NAMAIN1@DF_QNA")
        .filter(FilterSanitizer.sanitize("USA+CAN.B1GQ.."))
        .param("startPeriod", "2020-Q1")
        .param("endPeriod", (String) null)
        .param("lastNObservations", 5)
        .build()
        .toString();

    assertEquals("https://sdmx.oecd.org/public/rest/data/OECD.SDD.NAD,DSD_NAMAIN1@DF_QNA/"
        + "USA%2BCAN.B1GQ..?format=jsondata&startPeriod=2020-Q1&lastNObservations=5", url);
  }
}
