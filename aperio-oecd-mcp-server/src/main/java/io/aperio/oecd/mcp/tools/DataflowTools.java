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

import io.aperio.oecd.InvalidParameterException;
import io.aperio.oecd.OecdClient;
import io.aperio.oecd.catalog.DataCategory;
import io.aperio.oecd.catalog.DatasetReference;
import io.aperio.oecd.sdmx.AttributeDefinition;
import io.aperio.oecd.sdmx.CodedValue;
import io.aperio.oecd.sdmx.DataStructure;
import io.aperio.oecd.sdmx.DimensionDefinition;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Catalog and structure tools: list_categories, list_dataflows,
 * search_dataflows, get_data_structure and get_dataflow_url.
 */
public class DataflowTools {
  private static final Logger logger = LoggerFactory.getLogger(DataflowTools.class);

  private final OecdClient client;

  public DataflowTools(OecdClient client) {
    this.client = client;
  }

  public JsonArray listCategories() {
    JsonArray result = new JsonArray();
    for (DataCategory category : client.listCategories()) {
      JsonObject json = new JsonObject();
      json.addProperty("id", category.getId());
      json.addProperty("name", category.getName());
      json.addProperty("description", category.getDescription());
      JsonArray examples = new JsonArray();
      for (String example : category.getExampleDatasets()) {
        examples.add(example);
      }
      json.add("exampleDatasets", examples);
      result.add(json);
    }
    return result;
  }

  /**
   * Lists catalog dataflows.
   *
   * @param category Category id, or null for all categories
   * @param limit Maximum number of entries, or null for no limit
   */
  public JsonArray listDataflows(String category, Integer limit) {
    List<DatasetReference> dataflows = category == null
        ? client.listDataflows()
        : client.listDataflows(category);
    return toArray(dataflows, limit);
  }

  public JsonArray searchDataflows(String query, Integer limit) {
    List<DatasetReference> matches = client.search(query.trim());
    logger.debug("search_dataflows '{}': {} matches", query, matches.size());
    return toArray(matches, limit);
  }

  /**
   * Describes a dataflow. Dimensions are listed in the order a filter must
   * follow.
   */
  public JsonObject getDataStructure(String dataflowId) throws InterruptedException {
    DatasetReference dataset = client.resolve(dataflowId);
    DataStructure structure = client.describe(dataflowId);

    JsonObject result = new JsonObject();
    result.addProperty("dataflowId", dataset.getId());
    result.addProperty("name", dataset.getName());
    result.addProperty("source", structure.getSource().name());

    JsonArray dimensions = new JsonArray();
    StringBuilder filterFormat = new StringBuilder();
    int position = 0;
    for (DimensionDefinition dimension : structure.getDimensions()) {
      JsonObject json = new JsonObject();
      json.addProperty("position", ++position);
      json.addProperty("id", dimension.getId());
      json.addProperty("name", dimension.getName());
      json.add("values", values(dimension.getValues()));
      dimensions.add(json);
      if (filterFormat.length() > 0) {
        filterFormat.append('.');
      }
      filterFormat.append(dimension.getId());
    }
    result.add("dimensions", dimensions);

    JsonArray attributes = new JsonArray();
    for (AttributeDefinition attribute : structure.getAttributes()) {
      JsonObject json = new JsonObject();
      json.addProperty("id", attribute.getId());
      json.addProperty("name", attribute.getName());
      if (!attribute.getValues().isEmpty()) {
        json.add("values", values(attribute.getValues()));
      }
      attributes.add(json);
    }
    result.add("attributes", attributes);
    result.addProperty("filterFormat", filterFormat.toString());
    if (structure.getSource() == DataStructure.Source.DEFAULT) {
      result.addProperty("note", "Live structure unavailable; showing a generic structure."
          + " Dimension order may differ for this dataflow.");
    }
    return result;
  }

  public JsonObject getDataflowUrl(String dataflowId, String filter) {
    DatasetReference dataset = client.resolve(dataflowId);
    JsonObject result = new JsonObject();
    result.addProperty("dataflowId", dataset.getId());
    result.addProperty("name", dataset.getName());
    result.addProperty("url", client.dataExplorerUrl(dataflowId, filter));
    return result;
  }

  private static JsonArray toArray(List<DatasetReference> dataflows, Integer limit) {
    if (limit != null && limit < 1) {
      throw new InvalidParameterException("limit", "limit must be at least 1, got " + limit);
    }
    JsonArray result = new JsonArray();
    for (DatasetReference dataset : dataflows) {
      if (limit != null && result.size() >= limit) {
        break;
      }
      result.add(toJson(dataset));
    }
    return result;
  }

  static JsonObject toJson(DatasetReference dataset) {
    JsonObject json = new JsonObject();
    json.addProperty("id", dataset.getId());
    json.addProperty("name", dataset.getName());
    json.addProperty("description", dataset.getDescription());
    json.addProperty("category", dataset.getCategory());
    return json;
  }

  private static JsonArray values(List<CodedValue> values) {
    JsonArray array = new JsonArray();
    for (CodedValue value : values) {
      JsonObject json = new JsonObject();
      json.addProperty("id", value.getId());
      json.addProperty("name", value.getName());
      array.add(json);
    }
    return array;
  }
}
