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
package io.aperio.oecd.mcp;

import io.aperio.oecd.OecdClient;
import io.aperio.oecd.OecdClientConfig;
import io.aperio.oecd.OecdException;
import io.aperio.oecd.QueryOptions;
import io.aperio.oecd.mcp.prompts.PromptCatalog;
import io.aperio.oecd.mcp.protocol.McpProtocolException;
import io.aperio.oecd.mcp.protocol.McpRequest;
import io.aperio.oecd.mcp.protocol.McpResponse;
import io.aperio.oecd.mcp.protocol.ToolResult;
import io.aperio.oecd.mcp.resources.ResourceCatalog;
import io.aperio.oecd.mcp.tools.DataflowTools;
import io.aperio.oecd.mcp.tools.QueryTools;
import io.aperio.oecd.mcp.tools.ToolArguments;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * OECD MCP Server - Model Context Protocol server for the OECD SDMX API.
 *
 * <p>Lets MCP clients browse the curated dataflow catalog, inspect dataflow
 * structures, query observations, read reference documents (country codes,
 * filter syntax, glossary) and fetch workflow prompts through a JSON-RPC stdio
 * interface. One
 * JSON message per line on stdin; responses on stdout; logs on stderr.
 *
 * <p>Usage:
 * <pre>
 * java -jar aperio-oecd-mcp-server.jar [--base-url https://sdmx.oecd.org/public/rest]
 * </pre>
 */
public class OecdMcpServer {
  private static final Logger logger = LoggerFactory.getLogger(OecdMcpServer.class);
  private static final Gson gson = new Gson();

  static final String PROTOCOL_VERSION = "2024-11-05";
  static final String SERVER_NAME = "aperio-oecd-mcp-server";
  static final String SERVER_VERSION = "1.0.0";
  static final String TOOLS_RESOURCE = "/mcp/tools.json";

  private final DataflowTools dataflowTools;
  private final QueryTools queryTools;
  private final ResourceCatalog resourceCatalog;
  private final PromptCatalog promptCatalog;
  private final JsonArray toolDefinitions;

  public static void main(String[] args) {
    try {
      OecdClientConfig config = OecdClientConfig.load();
      String baseUrl = parseBaseUrl(args);
      if (baseUrl != null) {
        config = config.toBuilder().baseUrl(baseUrl).build();
      }
      OecdMcpServer server = new OecdMcpServer(OecdClient.create(config));
      server.start();

    } catch (Exception e) {
      logger.error("Failed to start MCP server", e);
      System.exit(1);
    }
  }

  public OecdMcpServer(OecdClient client) {
    this(new DataflowTools(client), new QueryTools(client), client.getConfig());
  }

  OecdMcpServer(DataflowTools dataflowTools, QueryTools queryTools, OecdClientConfig config) {
    this.dataflowTools = dataflowTools;
    this.queryTools = queryTools;
    this.resourceCatalog = new ResourceCatalog(dataflowTools, config);
    this.promptCatalog = new PromptCatalog();
    this.toolDefinitions = loadToolDefinitions();
  }

  /**
   * Start JSON-RPC stdio protocol loop.
   */
  public void start() {
    logger.info("OECD MCP Server starting...");

    try (BufferedReader in = new BufferedReader(
             new InputStreamReader(System.in, StandardCharsets.UTF_8));
         PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8)) {
      serve(in, out);
    } catch (IOException e) {
      logger.error("Fatal error in stdio loop", e);
    }
    logger.info("OECD MCP Server stopped");
  }

  /**
   * Reads requests from {@code in} until end of input and writes one response
   * line per request. Notifications get no response.
   */
  void serve(BufferedReader in, PrintWriter out) throws IOException {
    String line;
    while ((line = in.readLine()) != null) {
      if (line.trim().isEmpty()) {
        continue;
      }
      JsonObject response = handleLine(line);
      if (response != null) {
        out.println(gson.toJson(response));
        out.flush();
      }
      if (Thread.currentThread().isInterrupted()) {
        logger.warn("Interrupted, stopping stdio loop");
        return;
      }
    }
  }

  /**
   * Handles one raw protocol line.
   *
   * @return the response to write, or null for notifications
   */
  JsonObject handleLine(String line) {
    JsonElement message;
    try {
      message = JsonParser.parseString(line);
    } catch (JsonParseException e) {
      logger.debug("Unparseable request line: {}", e.getMessage());
      return McpResponse.error(null, McpProtocolException.PARSE_ERROR, "Parse error").toJson();
    }
    if (!message.isJsonObject()) {
      return McpResponse.error(null, McpProtocolException.INVALID_REQUEST,
          "Invalid request").toJson();
    }

    McpRequest request;
    try {
      request = McpRequest.fromJson(message.getAsJsonObject());
    } catch (McpProtocolException e) {
      return McpResponse.error(readableId(message.getAsJsonObject()), e.getCode(),
          e.getMessage()).toJson();
    }

    McpResponse response = handleRequest(request);
    if (request.isNotification() || response == null) {
      return null;
    }
    return response.toJson();
  }

  /**
   * Handle MCP request and return response, or null if the method produces
   * no response.
   */
  McpResponse handleRequest(McpRequest request) {
    String method = request.getMethod();
    JsonObject params = request.getParams();

    try {
      JsonElement result;

      switch (method) {
        case "initialize":
          result = initializeResult();
          break;

        case "ping":
          result = new JsonObject();
          break;

        case "tools/list":
          JsonObject tools = new JsonObject();
          tools.add("tools", toolDefinitions.deepCopy());
          result = tools;
          break;

        case "tools/call":
          result = callTool(params);
          break;

        case "resources/list":
          JsonObject resources = new JsonObject();
          resources.add("resources", resourceCatalog.list());
          result = resources;
          break;

        case "resources/read":
          result = resourceCatalog.read(requireString(params, "uri"));
          break;

        case "prompts/list":
          JsonObject prompts = new JsonObject();
          prompts.add("prompts", promptCatalog.list());
          result = prompts;
          break;

        case "prompts/get":
          result = promptCatalog.get(requireString(params, "name"),
              optionalObject(params, "arguments"));
          break;

        default:
          if (method.startsWith("notifications/")) {
            logger.debug("Notification: {}", method);
            return null;
          }
          return McpResponse.error(request.getId(), McpProtocolException.METHOD_NOT_FOUND,
              "Method not found: " + method);
      }

      return McpResponse.success(request.getId(), result);

    } catch (McpProtocolException e) {
      logger.debug("Rejected {}: {}", method, e.getMessage());
      return McpResponse.error(request.getId(), e.getCode(), e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while handling {}", method);
      return McpResponse.error(request.getId(), McpProtocolException.INTERNAL_ERROR,
          "Internal error");
    } catch (RuntimeException e) {
      logger.error("Error handling request: " + method, e);
      return McpResponse.error(request.getId(), McpProtocolException.INTERNAL_ERROR,
          "Internal error");
    }
  }

  private JsonObject callTool(JsonObject params) throws InterruptedException {
    String tool = requireString(params, "name");
    ToolArguments args = new ToolArguments(optionalObject(params, "arguments"));

    logger.info("tools/call {}", tool);
    try {
      JsonElement payload;
      switch (tool) {
        case "list_categories":
          payload = dataflowTools.listCategories();
          break;

        case "list_dataflows":
          payload = dataflowTools.listDataflows(args.getString("category"),
              args.getInteger("limit"));
          break;

        case "search_dataflows":
          payload = dataflowTools.searchDataflows(args.getRequiredString("query"),
              args.getInteger("limit"));
          break;

        case "get_data_structure":
          payload = dataflowTools.getDataStructure(args.getRequiredString("dataflow_id"));
          break;

        case "get_dataflow_url":
          payload = dataflowTools.getDataflowUrl(args.getRequiredString("dataflow_id"),
              args.getString("filter"));
          break;

        case "query_data":
          QueryOptions options = QueryOptions.builder()
              .startPeriod(args.getString("start_period"))
              .endPeriod(args.getString("end_period"))
              .lastNObservations(args.getInteger("last_n_observations"))
              .build();
          payload = queryTools.queryData(args.getRequiredString("dataflow_id"),
              args.getString("filter"), options);
          break;

        default:
          throw new McpProtocolException(McpProtocolException.INVALID_PARAMS,
              "Unknown tool: " + tool);
      }
      return ToolResult.success(payload);

    } catch (OecdException e) {
      logger.warn("{} failed: {}", tool, e.getMessage());
      return ToolResult.error(toJsonTree(e.getDiagnostic().toMap()));
    }
  }

  private static JsonObject initializeResult() {
    JsonObject capabilities = new JsonObject();
    capabilities.add("tools", new JsonObject());
    capabilities.add("resources", new JsonObject());
    capabilities.add("prompts", new JsonObject());

    JsonObject serverInfo = new JsonObject();
    serverInfo.addProperty("name", SERVER_NAME);
    serverInfo.addProperty("version", SERVER_VERSION);

    JsonObject result = new JsonObject();
    result.addProperty("protocolVersion", PROTOCOL_VERSION);
    result.add("capabilities", capabilities);
    result.add("serverInfo", serverInfo);
    return result;
  }

  /**
   * Converts diagnostic maps, lists and scalars to a Gson tree.
   */
  static JsonElement toJsonTree(Object value) {
    if (value == null) {
      return JsonNull.INSTANCE;
    }
    if (value instanceof Map) {
      JsonObject json = new JsonObject();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        json.add(String.valueOf(entry.getKey()), toJsonTree(entry.getValue()));
      }
      return json;
    }
    if (value instanceof List) {
      JsonArray json = new JsonArray();
      for (Object element : (List<?>) value) {
        json.add(toJsonTree(element));
      }
      return json;
    }
    if (value instanceof Number) {
      return new JsonPrimitive((Number) value);
    }
    if (value instanceof Boolean) {
      return new JsonPrimitive((Boolean) value);
    }
    return new JsonPrimitive(value.toString());
  }

  private static String requireString(JsonObject params, String name) {
    JsonElement value = params.get(name);
    if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
      throw new McpProtocolException(McpProtocolException.INVALID_PARAMS,
          "Missing required parameter: " + name);
    }
    return value.getAsString();
  }

  private static JsonObject optionalObject(JsonObject params, String name) {
    JsonElement value = params.get(name);
    if (value == null || value.isJsonNull()) {
      return null;
    }
    if (!value.isJsonObject()) {
      throw new McpProtocolException(McpProtocolException.INVALID_PARAMS,
          "Parameter " + name + " must be an object");
    }
    return value.getAsJsonObject();
  }

  private static JsonElement readableId(JsonObject message) {
    JsonElement id = message.get("id");
    if (id != null && id.isJsonPrimitive() && !id.getAsJsonPrimitive().isBoolean()) {
      return id;
    }
    return null;
  }

  private static JsonArray loadToolDefinitions() {
    InputStream stream = OecdMcpServer.class.getResourceAsStream(TOOLS_RESOURCE);
    if (stream == null) {
      throw new IllegalStateException("Tool definitions not found: " + TOOLS_RESOURCE);
    }
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      return JsonParser.parseReader(reader).getAsJsonArray();
    } catch (IOException e) {
      throw new IllegalStateException("Could not read tool definitions: " + TOOLS_RESOURCE, e);
    }
  }

  /**
   * Parse base URL override from command-line arguments.
   */
  static String parseBaseUrl(String[] args) {
    for (int i = 0; i < args.length - 1; i++) {
      if ("--base-url".equals(args[i])) {
        return args[i + 1];
      }
    }
    return null;
  }
}
