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
package io.aperio.oecd.mcp.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * MCP JSON-RPC request message.
 *
 * <p>A request without an {@code id} is a notification and gets no response.
 */
public class McpRequest {
  private final String jsonrpc;
  private final JsonElement id;
  private final String method;
  private final JsonObject params;

  public McpRequest(String jsonrpc, JsonElement id, String method, JsonObject params) {
    this.jsonrpc = jsonrpc;
    this.id = id;
    this.method = method;
    this.params = params;
  }

  /**
   * Reads a request from a parsed JSON-RPC message.
   *
   * @throws McpProtocolException with {@link McpProtocolException#INVALID_REQUEST}
   *     if the message is not a well-formed JSON-RPC 2.0 request
   */
  public static McpRequest fromJson(JsonObject message) {
    JsonElement id = message.get("id");
    if (id != null && !id.isJsonNull()
        && !(id.isJsonPrimitive() && !id.getAsJsonPrimitive().isBoolean())) {
      throw new McpProtocolException(McpProtocolException.INVALID_REQUEST,
          "Invalid request: id must be a string or a number");
    }
    JsonElement version = message.get("jsonrpc");
    if (version == null || !version.isJsonPrimitive()
        || !"2.0".equals(version.getAsString())) {
      throw new McpProtocolException(McpProtocolException.INVALID_REQUEST,
          "Invalid request: jsonrpc must be \"2.0\"");
    }
    JsonElement method = message.get("method");
    if (method == null || !method.isJsonPrimitive()
        || !method.getAsJsonPrimitive().isString()) {
      throw new McpProtocolException(McpProtocolException.INVALID_REQUEST,
          "Invalid request: method is missing");
    }
    JsonElement params = message.get("params");
    JsonObject paramsObject;
    if (params == null || params.isJsonNull()) {
      paramsObject = new JsonObject();
    } else if (params.isJsonObject()) {
      paramsObject = params.getAsJsonObject();
    } else {
      throw new McpProtocolException(McpProtocolException.INVALID_REQUEST,
          "Invalid request: params must be an object");
    }
    return new McpRequest("2.0", id == null || id.isJsonNull() ? null : id,
        method.getAsString(), paramsObject);
  }

  public String getJsonrpc() {
    return jsonrpc;
  }

  /** Request id; null for notifications. */
  public JsonElement getId() {
    return id;
  }

  public String getMethod() {
    return method;
  }

  /** Never null; an absent {@code params} member reads as an empty object. */
  public JsonObject getParams() {
    return params;
  }

  public boolean isNotification() {
    return id == null;
  }
}
