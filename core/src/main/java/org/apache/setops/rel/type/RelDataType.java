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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Describes the layout of a tuple: an identifier and an ordered list of
 * typed fields.
 *
 * <p>The rows of an operator, and the comparison tuple that set operators
 * build from them, are described by a RelDataType. Instances are immutable;
 * create them with {@link #builder(int)}.
 */
public final class RelDataType {
  private final int tupleId;
  private final ImmutableList<RelDataTypeField> fieldList;
  private final int byteSize;

  private RelDataType(int tupleId, ImmutableList<RelDataTypeField> fieldList) {
    this.tupleId = tupleId;
    this.fieldList = fieldList;
    int size = 0;
    for (RelDataTypeField field : fieldList) {
      size += field.getByteSize();
    }
    this.byteSize = size;
  }

  /** Creates a builder of a tuple with a given identifier. */
  public static Builder builder(int tupleId) {
    return new Builder(tupleId);
  }

  public int getTupleId() {
    return tupleId;
  }

  public List<RelDataTypeField> getFieldList() {
    return fieldList;
  }

  public int getFieldCount() {
    return fieldList.size();
  }

  public RelDataTypeField getField(int index) {
    return fieldList.get(index);
  }

  /** Returns the width in bytes of a tuple of this type. */
  public int getByteSize() {
    return byteSize;
  }

  @Override public boolean equals(@Nullable Object o) {
    return this == o
        || o instanceof RelDataType
        && tupleId == ((RelDataType) o).tupleId
        && fieldList.equals(((RelDataType) o).fieldList);
  }

  @Override public int hashCode() {
    return tupleId * 31 + fieldList.hashCode();
  }

  @Override public String toString() {
    final StringBuilder buf = new StringBuilder("RecordType(");
    for (RelDataTypeField field : fieldList) {
      if (field.getIndex() > 0) {
        buf.append(", ");
      }
      buf.append(field.getType());
      if (!field.isNullable()) {
        buf.append(" NOT NULL");
      }
      buf.append(' ').append(field.getName());
    }
    return buf.append(')').toString();
  }

  /** Builder of a {@link RelDataType}. */
  public static class Builder {
    private final int tupleId;
    private final ImmutableList.Builder<RelDataTypeField> fields =
        ImmutableList.builder();
    private int count;

    private Builder(int tupleId) {
      this.tupleId = tupleId;
    }

    /** Adds a nullable field. */
    public Builder add(String name, SqlTypeName type) {
      return add(name, type, true);
    }

    public Builder add(String name, SqlTypeName type, boolean nullable) {
      fields.add(new RelDataTypeField(name, count++, type, nullable));
      return this;
    }

    public RelDataType build() {
      return new RelDataType(tupleId, fields.build());
    }
  }
}

// End RelDataType.java
