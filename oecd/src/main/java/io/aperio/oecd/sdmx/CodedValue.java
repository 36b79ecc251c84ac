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

import java.util.Objects;

/**
 * One code of an SDMX codelist, such as {@code USA} / {@code United States}.
 */
public final class CodedValue {
  private final String id;
  private final String name;

  public CodedValue(String id, String name) {
    this.id = Objects.requireNonNull(id, "id");
    this.name = name == null ? id : name;
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CodedValue)) {
      return false;
    }
    CodedValue that = (CodedValue) o;
    return id.equals(that.id) && name.equals(that.name);
  }

  @Override public int hashCode() {
    return Objects.hash(id, name);
  }

  @Override public String toString() {
    return id;
  }
}
