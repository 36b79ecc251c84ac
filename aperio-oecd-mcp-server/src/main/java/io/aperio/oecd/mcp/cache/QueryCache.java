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
package io.aperio.oecd.mcp.cache;

import io.aperio.oecd.QueryOptions;
import io.aperio.oecd.http.TimeSource;

import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Time-bounded LRU cache of {@code query_data} results.
 *
 * <p>Results are stored and handed out as deep copies, so callers may decorate
 * a returned result without affecting later hits. An entry is served for
 * {@code ttlMillis} after it was stored, measured on the injected
 * {@link TimeSource}; once the cache holds {@code maxSize} entries the least
 * recently read one is dropped.
 */
public class QueryCache {
  private static final Logger logger = LoggerFactory.getLogger(QueryCache.class);

  private final int maxSize;
  private final long ttlMillis;
  private final TimeSource timeSource;
  private final LinkedHashMap<Key, Stored> entries;
  private long hits;
  private long misses;
  private long expirations;

  public QueryCache(int maxSize, long ttlMillis) {
    this(maxSize, ttlMillis, TimeSource.SYSTEM);
  }

  public QueryCache(int maxSize, long ttlMillis, TimeSource timeSource) {
    if (maxSize < 1) {
      throw new IllegalArgumentException("maxSize must be >= 1: " + maxSize);
    }
    this.maxSize = maxSize;
    this.ttlMillis = ttlMillis;
    this.timeSource = timeSource;
    this.entries = new LinkedHashMap<Key, Stored>(16, 0.75f, true) {
      @Override protected boolean removeEldestEntry(Map.Entry<Key, Stored> eldest) {
        if (size() <= QueryCache.this.maxSize) {
          return false;
        }
        logger.debug("Evicting cached result for {}", eldest.getKey());
        return true;
      }
    };
  }

  /**
   * Returns a copy of the live result for {@code key}, or null on a miss or
   * after expiry.
   */
  public synchronized JsonObject get(Key key) {
    Stored stored = entries.get(key);
    if (stored == null) {
      misses++;
      return null;
    }
    if (timeSource.currentTimeMillis() - stored.storedAt > ttlMillis) {
      entries.remove(key);
      expirations++;
      misses++;
      return null;
    }
    hits++;
    return stored.result.deepCopy();
  }

  public synchronized void put(Key key, JsonObject result) {
    entries.put(key, new Stored(result.deepCopy(), timeSource.currentTimeMillis()));
  }

  public synchronized void clear() {
    entries.clear();
  }

  public synchronized int size() {
    return entries.size();
  }

  /** Counters since creation: size, maxSize, ttlMillis, hits, misses, expirations. */
  public synchronized Map<String, Object> getStats() {
    Map<String, Object> stats = new LinkedHashMap<>();
    stats.put("size", entries.size());
    stats.put("maxSize", maxSize);
    stats.put("ttlMillis", ttlMillis);
    stats.put("hits", hits);
    stats.put("misses", misses);
    stats.put("expirations", expirations);
    return stats;
  }

  /**
   * Identity of a query: dataflow id, raw filter (null means all values) and
   * options.
   */
  public static final class Key {
    private final String dataflowId;
    private final String filter;
    private final QueryOptions options;

    public Key(String dataflowId, String filter, QueryOptions options) {
      this.dataflowId = Objects.requireNonNull(dataflowId, "dataflowId");
      this.filter = filter;
      this.options = Objects.requireNonNull(options, "options");
    }

    @Override public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Key)) {
        return false;
      }
      Key that = (Key) o;
      return dataflowId.equals(that.dataflowId)
          && Objects.equals(filter, that.filter)
          && options.equals(that.options);
    }

    @Override public int hashCode() {
      return Objects.hash(dataflowId, filter, options);
    }

    @Override public String toString() {
      return dataflowId + "/" + (filter == null ? "all" : filter) + " " + options;
    }
  }

  private static final class Stored {
    final JsonObject result;
    final long storedAt;

    Stored(JsonObject result, long storedAt) {
      this.result = result;
      this.storedAt = storedAt;
    }
  }
}
