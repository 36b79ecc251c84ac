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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;

/**
 * Utility methods for reading bundled YAML resources as Jackson trees.
 *
 * <p>SnakeYAML parses the document (with anchors and aliases resolved); the
 * result is converted to a {@link JsonNode} so callers share one tree API with
 * the SDMX-JSON decoding code.
 */
public final class YamlUtils {
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private YamlUtils() {
  }

  /**
   * Parse YAML/JSON stream and return JsonNode.
   *
   * @param stream InputStream containing YAML or JSON data
   * @param resourceName Name of resource (used to determine format by extension)
   * @return parsed tree; a missing node for an empty document
   * @throws IOException if the stream cannot be read or parsed
   */
  public static JsonNode parseYamlOrJson(InputStream stream, String resourceName)
      throws IOException {
    if (resourceName.endsWith(".yaml") || resourceName.endsWith(".yml")) {
      LoaderOptions loaderOptions = new LoaderOptions();
      loaderOptions.setAllowDuplicateKeys(false);
      Yaml yaml = new Yaml(loaderOptions);
      Object parsedYaml;
      try {
        parsedYaml = yaml.load(stream);
      } catch (RuntimeException e) {
        throw new IOException("Invalid YAML in " + resourceName + ": " + e.getMessage(), e);
      }
      return parsedYaml == null
          ? JSON_MAPPER.missingNode()
          : JSON_MAPPER.convertValue(parsedYaml, JsonNode.class);
    }
    return JSON_MAPPER.readTree(stream);
  }

  /**
   * Loads a classpath resource relative to the root of the classpath.
   *
   * @param resourcePath Absolute resource path, e.g. {@code /oecd/known-dataflows.yaml}
   * @throws IOException if the resource is missing or cannot be parsed
   */
  public static JsonNode loadResource(String resourcePath) throws IOException {
    try (InputStream stream = YamlUtils.class.getResourceAsStream(resourcePath)) {
      if (stream == null) {
        throw new IOException("Resource not found: " + resourcePath);
      }
      return parseYamlOrJson(stream, resourcePath);
    }
  }
}
