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
package io.aperio.oecd.catalog;

import io.aperio.oecd.YamlUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link DataflowCatalog} backed by the curated list in
 * {@code /oecd/known-dataflows.yaml}.
 */
public class KnownDataflowCatalog implements DataflowCatalog {
  private static final Logger LOGGER = LoggerFactory.getLogger(KnownDataflowCatalog.class);

  public static final String DEFAULT_RESOURCE = "/oecd/known-dataflows.yaml";

  private final ImmutableMap<String, DatasetReference> dataflows;
  private final ImmutableList<DataCategory> categories;

  public KnownDataflowCatalog(List<DatasetReference> dataflows,
      List<DataCategory> categories) {
    Map<String, DatasetReference> byId = new LinkedHashMap<>();
    for (DatasetReference ref : dataflows) {
      if (byId.put(ref.getId(), ref) != null) {
        throw new IllegalArgumentException("Duplicate dataflow id: " + ref.getId());
      }
    }
    this.dataflows = ImmutableMap.copyOf(byId);
    this.categories = ImmutableList.copyOf(categories);
  }

  /**
   * Loads the bundled catalog.
   *
   * @throws UncheckedIOException if the bundled resource is missing or invalid
   */
  public static KnownDataflowCatalog load() {
    try {
      return load(DEFAULT_RESOURCE);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot load dataflow catalog " + DEFAULT_RESOURCE, e);
    }
  }

  public static KnownDataflowCatalog load(String resourcePath) throws IOException {
    JsonNode root = YamlUtils.loadResource(resourcePath);
    ImmutableList.Builder<DatasetReference> dataflows = ImmutableList.builder();
    for (JsonNode node : root.path("dataflows")) {
      String id = requiredText(node, "id", resourcePath);
      dataflows.add(
          new DatasetReference(id,
              requiredText(node, "fullId", resourcePath),
              requiredText(node, "agency", resourcePath),
              node.path("version").asText("1.0"),
              node.path("name").asText(id),
              node.path("description").asText(""),
              node.path("category").asText("")));
    }
    ImmutableList.Builder<DataCategory> categories = ImmutableList.builder();
    for (JsonNode node : root.path("categories")) {
      ImmutableList.Builder<String> examples = ImmutableList.builder();
      for (JsonNode example : node.path("exampleDatasets")) {
        examples.add(example.asText());
      }
      String id = requiredText(node, "id", resourcePath);
      categories.add(
          new DataCategory(id,
              node.path("name").asText(id),
              node.path("description").asText(""),
              examples.build()));
    }
    KnownDataflowCatalog catalog = new KnownDataflowCatalog(dataflows.build(), categories.build());
    LOGGER.debug("Loaded {} dataflows in {} categories from {}",
        catalog.dataflows.size(), catalog.categories.size(), resourcePath);
    return catalog;
  }

  private static String requiredText(JsonNode node, String field, String resourcePath)
      throws IOException {
    String value = node.path(field).asText("");
    if (value.isEmpty()) {
      throw new IOException("Missing '" + field + "' in entry " + node + " of " + resourcePath);
    }
    return value;
  }

  @Override public List<DatasetReference> listDataflows() {
    return dataflows.values().asList();
  }

  @Override public List<DatasetReference> listDataflows(String category) {
    ImmutableList.Builder<DatasetReference> result = ImmutableList.builder();
    for (DatasetReference ref : dataflows.values()) {
      if (ref.getCategory().equalsIgnoreCase(category)) {
        result.add(ref);
      }
    }
    return result.build();
  }

  @Override public List<DataCategory> listCategories() {
    return categories;
  }

  @Override public Optional<DatasetReference> lookup(String id) {
    return Optional.ofNullable(dataflows.get(id));
  }

  @Override public List<DatasetReference> search(String text) {
    String needle = text.toLowerCase(Locale.ROOT);
    ImmutableList.Builder<DatasetReference> result = ImmutableList.builder();
    for (DatasetReference ref : dataflows.values()) {
      if (ref.getId().toLowerCase(Locale.ROOT).contains(needle)
          || ref.getName().toLowerCase(Locale.ROOT).contains(needle)
          || ref.getDescription().toLowerCase(Locale.ROOT).contains(needle)) {
        result.add(ref);
      }
    }
    return result.build();
  }
}
