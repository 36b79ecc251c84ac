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

import io.aperio.oecd.mcp.protocol.McpProtocolException;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Typed access to the {@code arguments} object of a {@code tools/call}.
 *
 * <p>A missing required argument or an argument of the wrong JSON type is a
 * protocol error ({@link McpProtocolException#INVALID_PARAMS}); range checks
 * on well-typed values are left to the client.
 */
public final class ToolArguments {
  private final JsonObject arguments;

  public ToolArguments(JsonObject arguments) {
    this.arguments = arguments == null ? new JsonObject() : arguments;
  }

  public String getRequiredString(String name) {
    String value = getString(name);
    if (value == null) {
      throw new McpProtocolException(McpProtocolException.INVALID_PARAMS,
          "Missing required argument: " + name);
    }
    return value;
  }

  /** Returns the string argument, or null if absent or JSON null. */
  public String getString(String name) {
    JsonElement element = arguments.get(name);
    if (element == null || element.isJsonNull()) {
      return null;
    }
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      throw wrongType(name, "a string");
    }
    return element.getAsString();
  }

  /** Returns the integer argument, or null if absent or JSON null. */
  public Integer getInteger(String name) {
    JsonElement element = arguments.get(name);
    if (element == null || element.isJsonNull()) {
      return null;
    }
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
      throw wrongType(name, "an integer");
    }
    JsonPrimitive primitive = element.getAsJsonPrimitive();
    double value = primitive.getAsDouble();
    if (value != Math.rint(value) || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
      throw wrongType(name, "an integer");
    }
    return (int) value;
  }

  private static McpProtocolException wrongType(String name, String expected) {
    return new McpProtocolException(McpProtocolException.INVALID_PARAMS,
        "Argument " + name + " must be " + expected);
  }
}
