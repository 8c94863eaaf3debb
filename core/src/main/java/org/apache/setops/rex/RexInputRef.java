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
package org.apache.setops.rex;

import org.apache.setops.rel.type.RelDataType;
import org.apache.setops.rel.type.RelDataTypeField;
import org.apache.setops.rel.type.SqlTypeName;

import static java.util.Objects.requireNonNull;

/**
 * Variable which references a field of an input row.
 *
 * <p>Fields of the input are 0-based. If there is more than one input, they
 * are numbered consecutively; a set operator compiles the expressions of each
 * child against that child's row alone, so there is only ever one input.
 *
 * <p>The digest is "$" followed by the index, for example "$0".
 */
public class RexInputRef extends RexNode {
  //~ Instance fields --------------------------------------------------------

  private final int index;
  private final SqlTypeName type;
  private final boolean nullable;

  //~ Constructors -----------------------------------------------------------

  /**
   * Creates an input variable.
   *
   * @param index    Index of the field in the underlying row type
   * @param type     Type of the column
   * @param nullable Whether the column may hold null
   */
  public RexInputRef(int index, SqlTypeName type, boolean nullable) {
    super("$" + index);
    this.index = index;
    this.type = requireNonNull(type, "type");
    this.nullable = nullable;
  }

  //~ Methods ----------------------------------------------------------------

  /**
   * Creates a reference to a given field in a row type.
   */
  public static RexInputRef of(int index, RelDataType rowType) {
    final RelDataTypeField field = rowType.getField(index);
    return new RexInputRef(index, field.getType(), field.isNullable());
  }

  public int getIndex() {
    return index;
  }

  @Override public SqlTypeName getType() {
    return type;
  }

  @Override public boolean isNullable() {
    return nullable;
  }

  @Override public <R> R accept(RexVisitor<R> visitor) {
    return visitor.visitInputRef(this);
  }
}

// End RexInputRef.java
