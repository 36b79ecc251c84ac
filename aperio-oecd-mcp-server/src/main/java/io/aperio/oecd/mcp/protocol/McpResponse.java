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
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

/**
 * MCP JSON-RPC response message.
 */
public class McpResponse {
  private final String jsonrpc = "2.0";
  private final JsonElement id;
  private JsonElement result;
  private JsonObject error;

  public McpResponse(JsonElement id) {
    this.id = id;
  }

  public String getJsonrpc() {
    return jsonrpc;
  }

  public JsonElement getId() {
    return id;
  }

  public JsonElement getResult() {
    return result;
  }

  public JsonObject getError() {
    return error;
  }

  public boolean isError() {
    return error != null;
  }

  public static McpResponse success(JsonElement id, JsonElement result) {
    McpResponse response = new McpResponse(id);
    response.result = result;
    return response;
  }

  public static McpResponse error(JsonElement id, int code, String message) {
    McpResponse response = new McpResponse(id);
    JsonObject error = new JsonObject();
    error.addProperty("code", code);
    error.addProperty("message", message);
    response.error = error;
    return response;
  }

  /**
   * Renders the wire form. The {@code id} member is always present, as
   * {@code null} when the request id could not be read.
   */
  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("jsonrpc", jsonrpc);
    json.add("id", id == null ? JsonNull.INSTANCE : id);
    if (error != null) {
      json.add("error", error);
    } else {
      json.add("result", result == null ? new JsonObject() : result);
    }
    return json;
  }
}
