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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Workflow prompts served through {@code prompts/list} and {@code prompts/get}.
 *
 * <p>Definitions come from {@code /mcp/prompts.json}; each names a classpath
 * template whose {@code {{name}}} placeholders are filled from the prompt
 * arguments. Country arguments accept comma-separated codes or a group name
 * such as {@code Nordic} and are rendered as an SDMX {@code +} list.
 */
public class PromptCatalog {
  private static final Logger logger = LoggerFactory.getLogger(PromptCatalog.class);

  static final String DEFINITIONS_RESOURCE = "/mcp/prompts.json";
  static final String NORDIC = "SWE+NOR+DNK+FIN+ISL";

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");
  private static final Pattern YEAR_RANGE = Pattern.compile("(\\d{4})\\s*-\\s*(\\d{4})");

  private static final Map<String, String> COUNTRY_GROUPS = Map.of(
      "NORDIC", NORDIC,
      "G7", "USA+JPN+DEU+GBR+FRA+ITA+CAN",
      "DACH", "DEU+AUT+CHE",
      "BALTIC", "EST+LVA+LTU",
      "BENELUX", "BEL+NLD+LUX");

  private final Map<String, JsonObject> definitions;
  private final Map<String, String> templates = new HashMap<>();

  public PromptCatalog() {
    this.definitions = loadDefinitions();
  }

  /**
   * Returns the prompt descriptors (name, description, arguments).
   */
  public JsonArray list() {
    JsonArray result = new JsonArray();
    for (JsonObject definition : definitions.values()) {
      JsonObject descriptor = definition.deepCopy();
      descriptor.remove("template");
      result.add(descriptor);
    }
    return result;
  }

  /**
   * Renders one prompt.
   *
   * @param name Prompt name
   * @param arguments String arguments, may be null
   * @return a {@code prompts/get} result with a single user message
   * @throws McpProtocolException with {@code INVALID_PARAMS} for an unknown
   *     prompt, a missing required argument or a non-string argument
   */
  public JsonObject get(String name, JsonObject arguments) {
    JsonObject definition = definitions.get(name);
    if (definition == null) {
      throw new McpProtocolException(McpProtocolException.INVALID_PARAMS,
          "Unknown prompt: " + name);
    }
    Map<String, String> args = readArguments(definition,
        arguments == null ? new JsonObject() : arguments);
    String text = render(template(definition), variables(name, args));
    logger.debug("prompts/get {}", name);

    JsonObject content = new JsonObject();
    content.addProperty("type", "text");
    content.addProperty("text", text);
    JsonObject message = new JsonObject();
    message.addProperty("role", "user");
    message.add("content", content);
    JsonArray messages = new JsonArray();
    messages.add(message);

    JsonObject result = new JsonObject();
    result.addProperty("description", definition.get("description").getAsString());
    result.add("messages", messages);
    return result;
  }

  /** Declared arguments, trimmed; an absent optional argument maps to "". */
  private static Map<String, String> readArguments(JsonObject definition, JsonObject arguments) {
    Map<String, String> args = new HashMap<>();
    for (JsonElement element : definition.getAsJsonArray("arguments")) {
      JsonObject declared = element.getAsJsonObject();
      String argName = declared.get("name").getAsString();
      JsonElement value = arguments.get(argName);
      String text = "";
      if (value != null && !value.isJsonNull()) {
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
          throw new McpProtocolException(McpProtocolException.INVALID_PARAMS,
              "Argument " + argName + " must be a string");
        }
        text = value.getAsString().trim();
      }
      if (text.isEmpty() && declared.get("required").getAsBoolean()) {
        throw new McpProtocolException(McpProtocolException.INVALID_PARAMS,
            "Missing required argument: " + argName);
      }
      args.put(argName, text);
    }
    return args;
  }

  private static Map<String, String> variables(String name, Map<String, String> args) {
    Map<String, String> vars = new HashMap<>(args);
    switch (name) {
      case "analyze_economic_trend":
        putCountries(vars, toCountryFilter(args.get("countries")));
        vars.put("periodClause", clause(" during ", args.get("time_period")));
        vars.put("timeArguments", periodArguments(args.get("time_period")));
        break;

      case "compare_countries":
        putCountries(vars, toCountryFilter(args.get("countries")));
        vars.put("yearClause", clause(" for the year ", args.get("year")));
        vars.put("timeArguments", yearArguments(args.get("year"), 50));
        break;

      case "get_latest_statistics":
        String country = args.get("country").toUpperCase(Locale.ROOT);
        vars.put("countryFilter", country.isEmpty() ? "OECD" : country);
        vars.put("scope", country.isEmpty() ? "for all OECD countries" : "for " + country);
        vars.put("focus", country.isEmpty() ? "the OECD aggregate and key economies" : country);
        break;

      case "explore_dataset":
        vars.put("dataflowId", args.get("dataflow_id").toUpperCase(Locale.ROOT));
        break;

      case "find_data_for_question":
        vars.put("searchQuery", keywords(args.get("question")));
        break;

      case "build_filter":
        String filter = toCountryFilter(args.get("countries"));
        vars.put("dataflowId", args.get("dataflow_id").toUpperCase(Locale.ROOT));
        vars.put("countryFilter", filter.isEmpty() ? "COUNTRY" : filter);
        vars.put("indicator", args.get("indicator").isEmpty() ? "MEASURE" : args.get("indicator"));
        vars.put("countriesLine", args.get("countries").isEmpty() ? ""
            : "Countries: " + args.get("countries") + " (" + filter + ")\n");
        vars.put("indicatorLine", args.get("indicator").isEmpty() ? ""
            : "Indicator: " + args.get("indicator") + "\n");
        break;

      case "nordic_comparison":
        vars.put("countryFilter", NORDIC);
        vars.put("yearClause", args.get("year").isEmpty() ? "" : " (" + args.get("year") + ")");
        vars.put("timeArguments", yearArguments(args.get("year"), 20));
        break;

      default:
        break;
    }
    return vars;
  }

  /**
   * Maps a country argument to an SDMX value list: a known group name, or
   * comma-separated codes joined with {@code +}.
   */
  static String toCountryFilter(String countries) {
    String upper = countries.trim().toUpperCase(Locale.ROOT);
    String group = COUNTRY_GROUPS.get(upper);
    if (group != null) {
      return group;
    }
    List<String> codes = new ArrayList<>();
    for (String code : upper.split(",")) {
      if (!code.trim().isEmpty()) {
        codes.add(code.trim());
      }
    }
    return String.join("+", codes);
  }

  /** Up to three words longer than three letters, falling back to the question. */
  static String keywords(String question) {
    List<String> words = new ArrayList<>();
    for (String word : question.toLowerCase(Locale.ROOT).replaceAll("[?.,!]", "").split("\\s+")) {
      if (word.length() > 3 && words.size() < 3) {
        words.add(word);
      }
    }
    return words.isEmpty() ? question : String.join(" ", words);
  }

  private static void putCountries(Map<String, String> vars, String filter) {
    vars.put("countryFilter", filter);
    vars.put("countryNames", filter.replace("+", ", "));
  }

  private static String clause(String prefix, String value) {
    return value.isEmpty() ? "" : prefix + value;
  }

  private static String periodArguments(String timePeriod) {
    Matcher matcher = YEAR_RANGE.matcher(timePeriod);
    if (matcher.find()) {
      return "\"start_period\": \"" + matcher.group(1) + "\", \"end_period\": \""
          + matcher.group(2) + "\", \"last_n_observations\": 100";
    }
    return "\"last_n_observations\": 100";
  }

  private static String yearArguments(String year, int lastN) {
    if (year.isEmpty()) {
      return "\"last_n_observations\": " + lastN;
    }
    return "\"start_period\": \"" + year + "\", \"end_period\": \"" + year + "\"";
  }

  static String render(String template, Map<String, String> vars) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuffer out = new StringBuffer();
    while (matcher.find()) {
      String value = vars.get(matcher.group(1));
      if (value == null) {
        throw new IllegalStateException("No value for template placeholder " + matcher.group());
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  private synchronized String template(JsonObject definition) {
    String path = definition.get("template").getAsString();
    String template = templates.get(path);
    if (template == null) {
      template = readText(path);
      templates.put(path, template);
    }
    return template;
  }

  private static String readText(String path) {
    try (InputStream stream = PromptCatalog.class.getResourceAsStream(path)) {
      if (stream == null) {
        throw new IllegalStateException("Prompt template not found: " + path);
      }
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Could not read prompt template: " + path, e);
    }
  }

  private static Map<String, JsonObject> loadDefinitions() {
    InputStream stream = PromptCatalog.class.getResourceAsStream(DEFINITIONS_RESOURCE);
    if (stream == null) {
      throw new IllegalStateException("Prompt definitions not found: " + DEFINITIONS_RESOURCE);
    }
    Map<String, JsonObject> result = new LinkedHashMap<>();
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      for (JsonElement element : JsonParser.parseReader(reader).getAsJsonArray()) {
        JsonObject definition = element.getAsJsonObject();
        result.put(definition.get("name").getAsString(), definition);
      }
    } catch (IOException e) {
      throw new IllegalStateException("Could not read prompt definitions: "
          + DEFINITIONS_RESOURCE, e);
    }
    return result;
  }
}
