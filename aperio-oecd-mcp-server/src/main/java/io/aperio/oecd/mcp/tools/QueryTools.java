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

import io.aperio.oecd.OecdClient;
import io.aperio.oecd.QueryOptions;
import io.aperio.oecd.QueryResult;
import io.aperio.oecd.catalog.DatasetReference;
import io.aperio.oecd.mcp.cache.QueryCache;
import io.aperio.oecd.sdmx.Observation;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * The query_data tool. Successful results are cached by dataflow, filter and
 * options.
 */
public class QueryTools {
  private static final Logger logger = LoggerFactory.getLogger(QueryTools.class);

  public static final int CACHE_SIZE = 100;
  public static final long CACHE_TTL_MS = 60 * 60 * 1000L;

  private final OecdClient client;
  private final QueryCache cache;

  public QueryTools(OecdClient client) {
    this(client, new QueryCache(CACHE_SIZE, CACHE_TTL_MS));
  }

  public QueryTools(OecdClient client, QueryCache cache) {
    this.client = client;
    this.cache = cache;
  }

  public QueryCache getCache() {
    return cache;
  }

  /**
   * Queries observations.
   *
   * @param dataflowId Short dataflow id
   * @param filter SDMX dimension filter, or null for all values
   * @param options Period range and observation limit
   */
  public JsonObject queryData(String dataflowId, String filter, QueryOptions options)
      throws InterruptedException {
    QueryCache.Key key = new QueryCache.Key(dataflowId, filter, options);
    JsonObject cached = cache.get(key);
    if (cached != null) {
      logger.debug("query_data cache hit: {}", key);
      return cached;
    }

    QueryResult result = client.query(dataflowId, filter, options);
    JsonObject json = toJson(result, filter);
    cache.put(key, json);
    return json;
  }

  private static JsonObject toJson(QueryResult result, String filter) {
    DatasetReference dataset = result.getDataset();
    JsonObject json = new JsonObject();
    json.addProperty("dataflowId", dataset.getId());
    json.addProperty("name", dataset.getName());
    json.addProperty("filter", filter == null ? "all" : filter);
    json.addProperty("count", result.size());
    json.addProperty("truncated", result.isTruncated());
    if (result.isTruncated()) {
      json.addProperty("note", "Result was capped at " + result.size()
          + " observations. Narrow the filter or period range to see more.");
    }

    JsonArray observations = new JsonArray();
    for (Observation observation : result.getObservations()) {
      JsonObject row = new JsonObject();
      row.add("dimensions", toJsonObject(observation.getDimensions()));
      row.add("value", toJsonValue(observation.getValue()));
      row.add("attributes", toJsonObject(observation.getAttributes()));
      observations.add(row);
    }
    json.add("observations", observations);

    if (!result.getAnomalies().isEmpty()) {
      JsonArray warnings = new JsonArray();
      for (String anomaly : result.getAnomalies()) {
        warnings.add(anomaly);
      }
      json.add("warnings", warnings);
    }
    json.addProperty("source", result.getRequestUrl().toString());
    return json;
  }

  private static JsonObject toJsonObject(Map<String, String> entries) {
    JsonObject json = new JsonObject();
    for (Map.Entry<String, String> entry : entries.entrySet()) {
      json.addProperty(entry.getKey(), entry.getValue());
    }
    return json;
  }

  private static JsonElement toJsonValue(Object value) {
    if (value == null) {
      return JsonNull.INSTANCE;
    }
    if (value instanceof Number) {
      return new JsonPrimitive((Number) value);
    }
    if (value instanceof Boolean) {
      return new JsonPrimitive((Boolean) value);
    }
    return new JsonPrimitive(value.toString());
  }
}
