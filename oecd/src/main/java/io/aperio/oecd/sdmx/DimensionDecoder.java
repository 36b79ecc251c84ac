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
package io.aperio.oecd.sdmx;

import com.google.common.base.Splitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves SDMX-JSON positional keys to dimension ids and codes.
 *
 * <p>A key such as {@code 0:3:1} holds one codelist index per dimension, in
 * declaration order. Position {@code i} resolves to
 * {@code dims[i].id -> dims[i].values[index].id}. When the dimension is
 * unknown or a placeholder, or the index is unknown, the position degrades to a synthetic id paired with the raw
 * index text; decoding never fails.
 */
public final class DimensionDecoder {

  /** Id used for observation position 0 when no structure is known. */
  public static final String TIME_PERIOD = "TIME_PERIOD";

  private static final Splitter KEY_SPLITTER = Splitter.on(':');

  private DimensionDecoder() {
  }

  /**
   * Decodes a series key. Unresolved positions become {@code DIM_i}.
   */
  public static Map<String, String> decodeSeriesKey(String key,
      List<DimensionDefinition> dims) {
    return decode(key, dims, false);
  }

  /**
   * Decodes an observation key. Unresolved position 0 becomes
   * {@code TIME_PERIOD}; later positions become {@code OBS_DIM_i}.
   */
  public static Map<String, String> decodeObservationKey(String key,
      List<DimensionDefinition> dims) {
    return decode(key, dims, true);
  }

  private static Map<String, String> decode(String key, List<DimensionDefinition> dims,
      boolean observationLevel) {
    if (key == null || key.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, String> result = new LinkedHashMap<>();
    int position = 0;
    for (String part : KEY_SPLITTER.split(key)) {
      DimensionDefinition dim = position < dims.size() ? dims.get(position) : null;
      CodedValue code = dim == null || dim.isPlaceholder()
          ? null
          : dim.valueAt(parseIndex(part));
      if (code != null) {
        result.put(dim.getId(), code.getId());
      } else {
        result.put(syntheticId(position, observationLevel), part);
      }
      position++;
    }
    return result;
  }

  static String syntheticId(int position, boolean observationLevel) {
    if (!observationLevel) {
      return "DIM_" + position;
    }
    return position == 0 ? TIME_PERIOD : "OBS_DIM_" + position;
  }

  /** Returns the index, or -1 if {@code part} is not a non-negative integer. */
  static int parseIndex(String part) {
    if (part.isEmpty() || part.length() > 9) {
      return -1;
    }
    for (int i = 0; i < part.length(); i++) {
      char c = part.charAt(i);
      if (c < '0' || c > '9') {
        return -1;
      }
    }
    return Integer.parseInt(part);
  }
}
