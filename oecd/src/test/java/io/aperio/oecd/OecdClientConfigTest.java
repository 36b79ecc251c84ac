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
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link OecdClientConfig}.
 */
@Tag("unit")
class OecdClientConfigTest {

  @Test
  void testBundledDefaults() {
    OecdClientConfig config = OecdClientConfig.load();
    assertEquals(1500, config.getMinIntervalMs());
    assertEquals(3, config.getMaxRetries());
    assertEquals(1000, config.getRetryDelayMs());
    assertEquals(30_000, config.getTimeoutMs());
    assertEquals(1000, config.getMaxObservations());
    assertEquals("Aperio-OECD/1.0", config.getUserAgent());
  }

  @Test
  void testTreeOverridesOnlyGivenKeys() throws Exception {
    String yaml = "baseUrl: http://localhost:8080/rest\n"
        + "rateLimit:\n"
        + "  minIntervalMs: 10\n";
    JsonNode tree = YamlUtils.parseYamlOrJson(
        new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test.yaml");

    OecdClientConfig config = OecdClientConfig.fromTree(tree).build();

    assertEquals("http://localhost:8080/rest", config.getBaseUrl());
    assertEquals(10, config.getMinIntervalMs());
    assertEquals(OecdClientConfig.DEFAULT_MAX_RETRIES, config.getMaxRetries());
  }

  @Test
  void testBaseUrlOverride() {
    Map<String, String> env = ImmutableMap.of(OecdClientConfig.BASE_URL_OVERRIDE,
        "https://mirror.example.org/sdmx");
    OecdClientConfig config = OecdClientConfig.builder()
        .applyOverrides(env::get)
        .build();
    assertEquals("https://mirror.example.org/sdmx", config.getBaseUrl());

    OecdClientConfig unchanged = OecdClientConfig.builder()
        .applyOverrides(key -> "  ")
        .build();
    assertEquals(OecdClientConfig.DEFAULT_BASE_URL, unchanged.getBaseUrl());
  }

  @Test
  void testInvalidValuesRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> OecdClientConfig.builder().baseUrl("file:///etc").build());
    assertThrows(IllegalArgumentException.class,
        () -> OecdClientConfig.builder().timeoutMs(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> OecdClientConfig.builder().maxRetries(-1).build());
  }

  @Test
  void testToBuilderRoundTrip() {
    OecdClientConfig config = OecdClientConfig.builder().maxObservations(50).build();
    assertEquals(50, config.toBuilder().build().getMaxObservations());
  }
}
