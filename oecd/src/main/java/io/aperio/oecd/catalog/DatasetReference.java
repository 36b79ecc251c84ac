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

import java.util.Objects;

/**
 * A curated OECD dataflow: the short id callers use plus the remote identifiers
 * needed to build a request.
 */
public final class DatasetReference {
  private final String id;
  private final String fullId;
  private final String agency;
  private final String version;
  private final String name;
  private final String description;
  private final String category;

  public DatasetReference(String id, String fullId, String agency, String version,
      String name, String description, String category) {
    this.id = Objects.requireNonNull(id, "id");
    this.fullId = Objects.requireNonNull(fullId, "fullId");
    this.agency = Objects.requireNonNull(agency, "agency");
    this.version = version;
    this.name = name;
    this.description = description;
    this.category = category;
  }

  /** Short id, e.g. {@code QNA}. */
  public String getId() {
    return id;
  }

  /** Remote identifier in {@code DSD_ID@DF_ID} form, e.g. {@code DSD_NAMAIN1@DF_QNA}. */
  public String getFullId() {
    return fullId;
  }

  /** Owning agency, e.g. {@code OECD.SDD.NAD}. */
  public String getAgency() {
    return agency;
  }

  public String getVersion() {
    return version;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  /** Category id, e.g. {@code ECO}. */
  public String getCategory() {
    return category;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DatasetReference)) {
      return false;
    }
    DatasetReference that = (DatasetReference) o;
    return id.equals(that.id) && fullId.equals(that.fullId) && agency.equals(that.agency);
  }

  @Override public int hashCode() {
    return Objects.hash(id, fullId, agency);
  }

  @Override public String toString() {
    return id + " (" + agency + "," + fullId + ")";
  }
}
