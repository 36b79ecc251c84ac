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
package io.aperio.oecd.mcp.tools;

import io.aperio.oecd.OecdClient;
import io.aperio.oecd.OecdClientConfig;
import io.aperio.oecd.QueryOptions;
import io.aperio.oecd.RemoteFailureException;
import io.aperio.oecd.catalog.KnownDataflowCatalog;
import io.aperio.oecd.mcp.StubTransport;
import io.aperio.oecd.mcp.cache.QueryCache;

import com.google.gson.JsonObject;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link QueryTools}.
 */
@Tag("unit")
class QueryToolsTest {

  private StubTransport transport;
  private QueryTools tools;

  @BeforeEach
  void setUp() {
    transport = new StubTransport().respond(200, StubTransport.loadSample());
    OecdClientConfig config = OecdClientConfig.builder()
        .baseUrl("https://sdmx.test/rest")
        .minIntervalMs(0)
        .maxRetries(0)
        .build();
    OecdClient client = new OecdClient(config, KnownDataflowCatalog.load(), transport, transport);
    tools = new QueryTools(client, new QueryCache(QueryTools.CACHE_SIZE,
        QueryTools.CACHE_TTL_MS, transport));
  }

  @Test
  void testRepeatedQueryIsServedFromCache() throws Exception {
    JsonObject first = tools.queryData("QNA", "USA+CAN", QueryOptions.NONE);
    JsonObject second = tools.queryData("QNA", "USA+CAN", QueryOptions.NONE);

    assertEquals(first, second);
    assertEquals(1, transport.getCallCount());

    tools.queryData("QNA", "USA", QueryOptions.NONE);
    assertEquals(2, transport.getCallCount());
  }

  @Test
  void testCachedResultIsNotSharedMutableState() throws Exception {
    JsonObject first = tools.queryData("QNA", null, QueryOptions.NONE);
    first.addProperty("count", -1);

    JsonObject second = tools.queryData("QNA", null, QueryOptions.NONE);
    assertEquals(4, second.get("count").getAsInt());
    assertEquals("all", second.get("filter").getAsString());
  }

  @Test
  void testObservationRowsKeepDimensionsSeparate() throws Exception {
    transport.respond(200, "{\"data\":{"
        + "\"dataSets\":[{\"series\":{\"0:0\":{\"attributes\":[0],"
        + "\"observations\":{\"0\":[12.5,0]}}}}],"
        + "\"structures\":[{\"dimensions\":{"
        + "\"series\":[{\"id\":\"REF_AREA\",\"values\":[{\"id\":\"SWE\"}]},"
        + "{\"id\":\"value\",\"values\":[{\"id\":\"V1\"}]}],"
        + "\"observation\":[{\"id\":\"TIME_PERIOD\",\"values\":[{\"id\":\"2023\"}]}]},"
        + "\"attributes\":{"
        + "\"series\":[{\"id\":\"attributes\",\"values\":[{\"id\":\"X\"}]}],"
        + "\"observation\":[{\"id\":\"OBS_STATUS\",\"values\":[{\"id\":\"A\"}]}]}}]}}");

    JsonObject row = tools.queryData("QNA", null, QueryOptions.NONE)
        .getAsJsonArray("observations").get(0).getAsJsonObject();

    assertEquals(3, row.size());
    assertEquals(12.5, row.get("value").getAsDouble());
    JsonObject dimensions = row.getAsJsonObject("dimensions");
    assertEquals("SWE", dimensions.get("REF_AREA").getAsString());
    assertEquals("V1", dimensions.get("value").getAsString());
    assertEquals("2023", dimensions.get("TIME_PERIOD").getAsString());
    JsonObject attributes = row.getAsJsonObject("attributes");
    assertEquals("X", attributes.get("attributes").getAsString());
    assertEquals("A", attributes.get("OBS_STATUS").getAsString());
  }

  @Test
  void testFailuresAreNotCached() throws Exception {
    transport.respond(503, "");
    assertThrows(RemoteFailureException.class,
        () -> tools.queryData("QNA", null, QueryOptions.NONE));

    transport.respond(200, StubTransport.loadSample());
    assertEquals(4, tools.queryData("QNA", null, QueryOptions.NONE).get("count").getAsInt());
    assertEquals(2, transport.getCallCount());
  }

  @Test
  void testTruncatedResultCarriesNote() throws Exception {
    QueryOptions options = QueryOptions.builder().lastNObservations(2).build();
    JsonObject result = tools.queryData("QNA", null, options);

    assertEquals(2, result.get("count").getAsInt());
    assertTrue(result.get("truncated").getAsBoolean());
    assertThat(result.get("note").getAsString(), startsWith("Result was capped at 2"));
    assertEquals(2, result.getAsJsonArray("observations").size());
  }
}
