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
package org.apache.setops.rel.type;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A field of a {@link RelDataType}: a slot of a tuple.
 */
public final class RelDataTypeField {
  private final String name;
  private final int index;
  private final SqlTypeName type;
  private final boolean nullable;

  public RelDataTypeField(String name, int index, SqlTypeName type,
      boolean nullable) {
    this.name = requireNonNull(name, "name");
    this.index = index;
    this.type = requireNonNull(type, "type");
    this.nullable = nullable;
  }

  public String getName() {
    return name;
  }

  /** Returns the ordinal of this field within its tuple, 0-based. */
  public int getIndex() {
    return index;
  }

  public SqlTypeName getType() {
    return type;
  }

  public boolean isNullable() {
    return nullable;
  }

  /** Returns the width of this slot in a fixed-layout tuple, including its
   * null indicator. */
  public int getByteSize() {
    return type.getByteSize() + (nullable ? 1 : 0);
  }

  @Override public boolean equals(@Nullable Object o) {
    return this == o
        || o instanceof RelDataTypeField
        && name.equals(((RelDataTypeField) o).name)
        && index == ((RelDataTypeField) o).index
        && type == ((RelDataTypeField) o).type
        && nullable == ((RelDataTypeField) o).nullable;
  }

  @Override public int hashCode() {
    return Objects.hash(name, index, type, nullable);
  }

  @Override public String toString() {
    return "#" + index + ": " + name + " " + type + (nullable ? "" : " NOT NULL");
  }
}

// End RelDataTypeField.java
