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
package io.aperio.oecd;

import io.aperio.oecd.catalog.KnownDataflowCatalog;
import io.aperio.oecd.http.FakeTimeSource;
import io.aperio.oecd.http.ScriptedTransport;
import io.aperio.oecd.sdmx.DataStructure;
import io.aperio.oecd.sdmx.Observation;

import com.google.common.io.Resources;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link OecdClient} against a scripted transport.
 */
@Tag("unit")
class OecdClientTest {

  private static final String BASE = "https://sdmx.test/rest";

  private static KnownDataflowCatalog catalog;
  private static String sample;

  private FakeTimeSource clock;
  private ScriptedTransport transport;
  private OecdClient client;

  @BeforeAll
  static void loadFixtures() throws Exception {
    catalog = KnownDataflowCatalog.load();
    sample = Resources.toString(Resources.getResource("sdmx/qna-sample.json"),
        StandardCharsets.UTF_8);
  }

  @BeforeEach
  void setUp() {
    clock = new FakeTimeSource();
    transport = new ScriptedTransport();
    OecdClientConfig config = OecdClientConfig.builder().baseUrl(BASE).build();
    client = new OecdClient(config, catalog, transport, clock);
  }

  @Test
  void testCatalogOperationsNeverTouchNetwork() {
    assertFalse(client.listDataflows().isEmpty());
    assertFalse(client.listDataflows("ECO").isEmpty());
    assertFalse(client.listCategories().isEmpty());
    assertEquals("QNA", client.search("quarterly national").get(0).getId());
    assertEquals(0, transport.getCallCount());
  }

  @Test
  void testQueryUnknownDatasetFailsWithoutNetwork() {
    UnknownDatasetException e = assertThrows(UnknownDatasetException.class,
        () -> client.query("UNKNOWN_ID", "USA"));
    assertEquals("UNKNOWN_ID", e.getDataflowId());
    assertEquals(ErrorCategory.INPUT, e.getCategory());
    assertEquals(0, transport.getCallCount());
  }

  @Test
  void testHostileFiltersRejectedWithoutNetwork() {
    String[] hostile = {"USA;rm -rf /", "http://x", "../../admin", "USA%00"};
    for (String filter : hostile) {
      InvalidFilterException e = assertThrows(InvalidFilterException.class,
          () -> client.query("QNA", filter), filter);
      assertEquals("QNA", e.getDiagnostic().getDataflowId());
    }
    InvalidFilterException empty = assertThrows(InvalidFilterException.class,
        () -> client.query("QNA", ""));
    assertEquals(InvalidFilterException.Reason.EMPTY, empty.getReason());
    assertEquals(0, transport.getCallCount());
  }

  @Test
  void testQueryBuildsRequestAndDecodes() throws Exception {
    transport.thenOk(sample);

    QueryResult result = client.query("QNA", "USA.GDP..",
        QueryOptions.builder().startPeriod("2024-Q1").endPeriod("2024-Q4").build());

    assertEquals(BASE + "/data/OECD.SDD.NAD,DSD_NAMAIN1@DF_QNA/USA.GDP.."
            + "?format=jsondata&startPeriod=2024-Q1&endPeriod=2024-Q4",
        transport.getUris().get(0).toString());
    assertEquals(transport.getUris().get(0), result.getRequestUrl());
    assertEquals("QNA", result.getDataset().getId());
    assertEquals(4, result.size());
    assertFalse(result.isTruncated());
    Observation first = result.getObservations().get(0);
    assertEquals("USA", first.getDimension("REF_AREA"));
    assertEquals("2024-Q1", first.getDimension("TIME_PERIOD"));
  }

  @Test
  void testNullFilterQueriesAll() throws Exception {
    transport.thenOk(sample);
    client.query("QNA");
    assertThat(transport.getUris().get(0).toString(),
        containsString("DSD_NAMAIN1@DF_QNA/all?format=jsondata"));
  }

  @Test
  void testLastNObservationsCapsDecoding() throws Exception {
    transport.thenOk(sample);

    QueryResult result = client.query("QNA", null,
        QueryOptions.builder().lastNObservations(2).build());

    assertThat(result.getRequestUrl().toString(), endsWith("&lastNObservations=2"));
    assertEquals(2, result.size());
    assertTrue(result.isTruncated());
  }

  @Test
  void testLimitTakesPrecedence() throws Exception {
    transport.thenOk(sample);

    QueryResult result = client.query("QNA", null,
        QueryOptions.builder().lastNObservations(3).limit(1).build());

    assertEquals(1, result.size());
  }

  @Test
  void testInvalidOptionsFailWithoutNetwork() {
    assertThrows(InvalidParameterException.class, () -> client.query("QNA", null,
        QueryOptions.builder().startPeriod("last year").build()));
    assertThrows(InvalidParameterException.class, () -> client.query("QNA", null,
        QueryOptions.builder().lastNObservations(5000).build()));
    assertEquals(0, transport.getCallCount());
  }

  @Test
  void testRemoteClientErrorSurfacesDiagnostic() {
    transport.thenStatus(422);

    RemoteFailureException e = assertThrows(RemoteFailureException.class,
        () -> client.query("QNA", "XXX"));

    assertEquals(422, e.getStatusCode());
    assertEquals("QNA", e.getDiagnostic().getDataflowId());
    assertEquals("XXX", e.getDiagnostic().getProvidedFilter());
    assertEquals(1, transport.getCallCount());
  }

  @Test
  void testRequestsAreSpacedByRateLimiter() throws Exception {
    transport.thenOk(sample).thenOk(sample).thenOk(sample);

    client.query("QNA");
    client.query("QNA");
    client.query("QNA");

    assertEquals(3000, clock.currentTimeMillis());
  }

  @Test
  void testDescribeExtractsLiveStructure() throws Exception {
    transport.thenOk(sample);

    DataStructure structure = client.describe("QNA");

    assertThat(transport.getUris().get(0).toString(),
        endsWith("/all?format=jsondata&lastNObservations=1"));
    assertEquals(DataStructure.Source.LIVE, structure.getSource());
    assertEquals("REF_AREA", structure.getDimensions().get(0).getId());
    assertEquals("TIME_PERIOD", structure.getDimensions().get(2).getId());
    assertEquals("OBS_STATUS", structure.getAttributes().get(1).getId());
  }

  @Test
  void testDescribeFallsBackOnRemoteFailure() throws Exception {
    transport.otherwise(ScriptedTransport.status(503, ""));

    DataStructure structure = client.describe("QNA");

    assertEquals(DataStructure.Source.DEFAULT, structure.getSource());
    assertEquals("QNA", structure.getDataflowId());
    assertEquals(4, transport.getCallCount());
  }

  @Test
  void testDescribeFallsBackOnUnreadableBody() throws Exception {
    transport.thenOk("<html>maintenance</html>");
    assertEquals(DataStructure.Source.DEFAULT, client.describe("QNA").getSource());
  }

  @Test
  void testDescribeFallsBackWhenNoStructureEmbedded() throws Exception {
    transport.thenOk("{\"data\":{\"dataSets\":[]}}");
    assertEquals(DataStructure.Source.DEFAULT, client.describe("QNA").getSource());
  }

  @Test
  void testDescribeUnknownDatasetFailsFast() {
    assertThrows(UnknownDatasetException.class, () -> client.describe("NOPE"));
    assertEquals(0, transport.getCallCount());
  }

  @Test
  void testDataExplorerUrl() {
    assertEquals("https://data-explorer.oecd.org/vis?df[ds]=dsDisseminateFinalDMZ"
            + "&df[id]=DSD_NAMAIN1%40DF_QNA&df[ag]=OECD.SDD.NAD",
        client.dataExplorerUrl("QNA", null));
    assertEquals("https://data-explorer.oecd.org/vis?df[ds]=dsDisseminateFinalDMZ"
            + "&df[id]=DSD_NAMAIN1%40DF_QNA&df[ag]=OECD.SDD.NAD&dq=USA%2BCAN.B1GQ",
        client.dataExplorerUrl("QNA", "USA+CAN.B1GQ"));
    assertThrows(InvalidFilterException.class,
        () -> client.dataExplorerUrl("QNA", "<script>"));
    assertThrows(UnknownDatasetException.class, () -> client.dataExplorerUrl("NOPE", null));
  }
}
