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
package io.aperio.oecd.mcp.prompts;

import io.aperio.oecd.mcp.protocol.McpProtocolException;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link PromptCatalog}.
 */
@Tag("unit")
class PromptCatalogTest {

  private final PromptCatalog catalog = new PromptCatalog();

  @Test
  void testCountryGroupsAndLists() {
    assertEquals("SWE+NOR+DNK+FIN+ISL", PromptCatalog.toCountryFilter("Nordic"));
    assertEquals("USA+JPN+DEU+GBR+FRA+ITA+CAN", PromptCatalog.toCountryFilter("g7"));
    assertEquals("USA+GBR+DEU", PromptCatalog.toCountryFilter(" usa, gbr ,,deu"));
    assertEquals("", PromptCatalog.toCountryFilter(""));
  }

  @Test
  void testKeywords() {
    assertEquals("healthcare spending changed",
        PromptCatalog.keywords("How has healthcare spending changed in Europe?"));
    assertEquals("Is it up?", PromptCatalog.keywords("Is it up?"));
  }

  @Test
  void testRenderRejectsUnknownPlaceholder() {
    assertEquals("a $1 b", PromptCatalog.render("a {{x}} b", Map.of("x", "$1")));
    assertThrows(IllegalStateException.class,
        () -> PromptCatalog.render("{{missing}}", Map.of()));
  }

  @Test
  void testEveryPromptRendersWithRequiredArgumentsOnly() {
    for (JsonElement element : catalog.list()) {
      JsonObject descriptor = element.getAsJsonObject();
      JsonObject arguments = new JsonObject();
      for (JsonElement argument : descriptor.getAsJsonArray("arguments")) {
        JsonObject declared = argument.getAsJsonObject();
        if (declared.get("required").getAsBoolean()) {
          arguments.addProperty(declared.get("name").getAsString(), "SWE");
        }
      }
      String name = descriptor.get("name").getAsString();
      String text = text(catalog.get(name, arguments));
      assertThat(name, text, not(containsString("{{")));
    }
  }

  @Test
  void testTrendPromptUsesYearRange() {
    JsonObject arguments = JsonParser.parseString(
        "{\"indicator\":\"unemployment\",\"countries\":\"dach\",\"time_period\":\"2015 - 2020\"}")
        .getAsJsonObject();
    String text = text(catalog.get("analyze_economic_trend", arguments));
    assertThat(text,
        containsString("Analyze the unemployment trend for DEU, AUT, CHE during 2015 - 2020."));
    assertThat(text, containsString("\"filter\": \"DEU+AUT+CHE..\""));
    assertThat(text, containsString("\"start_period\": \"2015\", \"end_period\": \"2020\""));
  }

  @Test
  void testLatestStatisticsDefaultsToOecdAggregate() {
    JsonObject arguments = new JsonObject();
    arguments.addProperty("topic", "inflation");
    String text = text(catalog.get("get_latest_statistics", arguments));
    assertThat(text, containsString("for all OECD countries"));
    assertThat(text, containsString("\"filter\": \"OECD..\""));
  }

  @Test
  void testBuildFilterPlaceholdersWhenOptionalArgumentsAbsent() {
    JsonObject arguments = new JsonObject();
    arguments.addProperty("dataflow_id", "qna");
    String text = text(catalog.get("build_filter", arguments));
    assertThat(text, containsString("Build an SDMX filter for the dataflow QNA."));
    assertThat(text, containsString("`COUNTRY.MEASURE..`"));
    assertThat(text, not(containsString("Countries:")));
  }

  @Test
  void testArgumentErrors() {
    JsonObject blank = new JsonObject();
    blank.addProperty("question", "   ");
    McpProtocolException missing = assertThrows(McpProtocolException.class,
        () -> catalog.get("find_data_for_question", blank));
    assertEquals(McpProtocolException.INVALID_PARAMS, missing.getCode());

    JsonObject numeric = new JsonObject();
    numeric.addProperty("indicator", 42);
    McpProtocolException wrongType = assertThrows(McpProtocolException.class,
        () -> catalog.get("nordic_comparison", numeric));
    assertThat(wrongType.getMessage(), containsString("must be a string"));

    assertThrows(McpProtocolException.class, () -> catalog.get("no_such_prompt", null));
  }

  private static String text(JsonObject result) {
    return result.getAsJsonArray("messages").get(0).getAsJsonObject()
        .getAsJsonObject("content").get("text").getAsString();
  }
}
