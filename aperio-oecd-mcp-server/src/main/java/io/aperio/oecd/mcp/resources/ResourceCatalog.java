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
package io.aperio.oecd.mcp.resources;

import io.aperio.oecd.OecdClient;
import io.aperio.oecd.OecdClientConfig;
import io.aperio.oecd.mcp.protocol.McpProtocolException;
import io.aperio.oecd.mcp.tools.DataflowTools;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reference documents served through {@code resources/list} and
 * {@code resources/read}.
 *
 * <p>Definitions come from {@code /mcp/resources.json}. An entry with a
 * {@code path} is a static classpath document; {@code oecd://categories} and
 * {@code oecd://api/info} are built from the client's catalog and configuration.
 */
public class ResourceCatalog {
  private static final Logger logger = LoggerFactory.getLogger(ResourceCatalog.class);
  private static final Gson gson = new GsonBuilder()
      .setPrettyPrinting()
      .disableHtmlEscaping()
      .create();

  static final String DEFINITIONS_RESOURCE = "/mcp/resources.json";
  static final String CATEGORIES_URI = "oecd://categories";
  static final String API_INFO_URI = "oecd://api/info";

  private final DataflowTools dataflowTools;
  private final OecdClientConfig config;
  private final Map<String, JsonObject> definitions;

  public ResourceCatalog(DataflowTools dataflowTools, OecdClientConfig config) {
    this.dataflowTools = dataflowTools;
    this.config = config;
    this.definitions = loadDefinitions();
  }

  /**
   * Returns the resource descriptors (uri, name, description, mimeType).
   */
  public JsonArray list() {
    JsonArray result = new JsonArray();
    for (JsonObject definition : definitions.values()) {
      JsonObject descriptor = definition.deepCopy();
      descriptor.remove("path");
      result.add(descriptor);
    }
    return result;
  }

  /**
   * Reads one resource.
   *
   * @return a {@code resources/read} result holding a single content entry
   * @throws McpProtocolException with {@code INVALID_PARAMS} if {@code uri} is
   *     not a known resource
   */
  public JsonObject read(String uri) {
    JsonObject definition = definitions.get(uri);
    if (definition == null) {
      throw new McpProtocolException(McpProtocolException.INVALID_PARAMS,
          "Unknown resource: " + uri);
    }
    String text;
    if (definition.has("path")) {
      text = readText(definition.get("path").getAsString());
    } else if (CATEGORIES_URI.equals(uri)) {
      text = gson.toJson(dataflowTools.listCategories());
    } else if (API_INFO_URI.equals(uri)) {
      text = gson.toJson(apiInfo());
    } else {
      throw new IllegalStateException("Resource has no content: " + uri);
    }
    logger.debug("resources/read {} ({} chars)", uri, text.length());

    JsonObject content = new JsonObject();
    content.addProperty("uri", uri);
    content.addProperty("mimeType", definition.get("mimeType").getAsString());
    content.addProperty("text", text);
    JsonArray contents = new JsonArray();
    contents.add(content);
    JsonObject result = new JsonObject();
    result.add("contents", contents);
    return result;
  }

  private JsonObject apiInfo() {
    JsonObject info = new JsonObject();
    info.addProperty("baseUrl", config.getBaseUrl());
    info.addProperty("dataExplorerUrl", OecdClient.DATA_EXPLORER_URL);
    info.addProperty("dataPath", "/data/{agency},{dataflow}/{filter}?format=jsondata");
    info.addProperty("timeoutMs", config.getTimeoutMs());
    info.addProperty("maxObservations", config.getMaxObservations());
    info.addProperty("minRequestIntervalMs", config.getMinIntervalMs());
    info.addProperty("maxRetries", config.getMaxRetries());
    return info;
  }

  private static Map<String, JsonObject> loadDefinitions() {
    Map<String, JsonObject> result = new LinkedHashMap<>();
    try (Reader reader = open(DEFINITIONS_RESOURCE)) {
      for (JsonElement element : JsonParser.parseReader(reader).getAsJsonArray()) {
        JsonObject definition = element.getAsJsonObject();
        result.put(definition.get("uri").getAsString(), definition);
      }
    } catch (IOException e) {
      throw new IllegalStateException("Could not read resource definitions: "
          + DEFINITIONS_RESOURCE, e);
    }
    return result;
  }

  private static String readText(String path) {
    try (InputStream stream = ResourceCatalog.class.getResourceAsStream(path)) {
      if (stream == null) {
        throw new IllegalStateException("Resource content not found: " + path);
      }
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Could not read resource content: " + path, e);
    }
  }

  private static Reader open(String path) {
    InputStream stream = ResourceCatalog.class.getResourceAsStream(path);
    if (stream == null) {
      throw new IllegalStateException("Resource definitions not found: " + path);
    }
    return new InputStreamReader(stream, StandardCharsets.UTF_8);
  }
}
