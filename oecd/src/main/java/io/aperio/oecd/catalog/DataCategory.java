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

import com.google.common.collect.ImmutableList;

import java.util.List;

/** A topical grouping of dataflows, such as {@code ECO} (Economy). */
public final class DataCategory {
  private final String id;
  private final String name;
  private final String description;
  private final ImmutableList<String> exampleDatasets;

  public DataCategory(String id, String name, String description,
      List<String> exampleDatasets) {
    this.id = id;
    this.name = name;
    this.description = description;
    this.exampleDatasets = ImmutableList.copyOf(exampleDatasets);
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public List<String> getExampleDatasets() {
    return exampleDatasets;
  }

  @Override public String toString() {
    return id + " (" + name + ")";
  }
}
