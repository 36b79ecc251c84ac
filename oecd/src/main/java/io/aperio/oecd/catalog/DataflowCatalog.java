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

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of the dataflows that can be queried. All operations are pure
 * and perform no network activity.
 */
public interface DataflowCatalog {

  List<DatasetReference> listDataflows();

  /** Dataflows whose category id equals {@code category}, ignoring case. */
  List<DatasetReference> listDataflows(String category);

  List<DataCategory> listCategories();

  Optional<DatasetReference> lookup(String id);

  /**
   * Case-insensitive substring search over id, name and description.
   */
  List<DatasetReference> search(String text);
}
