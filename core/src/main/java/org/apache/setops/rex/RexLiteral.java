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

import org.apache.setops.rel.type.SqlTypeName;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Constant value in a row expression.
 *
 * <p>The value is held in the Java class of its type, as given by
 * {@link SqlTypeName#getJavaClass()}; a null value has type
 * {@link SqlTypeName#NULL} unless the literal is created with an explicit
 * type.
 */
public class RexLiteral extends RexNode {
  private final @Nullable Object value;
  private final SqlTypeName type;

  /**
   * Creates a RexLiteral.
   *
   * @throws IllegalArgumentException if the value is not an instance of the
   * Java class of the type
   */
  public RexLiteral(@Nullable Object value, SqlTypeName type) {
    super(computeDigest(SqlTypeName.normalize(value), type));
    this.type = requireNonNull(type, "type");
    Preconditions.checkArgument(
        value == null || type.getJavaClass().isInstance(value),
        "value %s is not valid for type %s", value, type);
    this.value = SqlTypeName.normalize(value);
  }

  /** Creates a literal whose type is derived from the Java class of its
   * value.
   *
   * @throws IllegalArgumentException if no type holds values of that class */
  public static RexLiteral of(@Nullable Object value) {
    final SqlTypeName type = SqlTypeName.ofValue(value);
    if (type == null) {
      throw new IllegalArgumentException("no type for value " + value
          + " of class " + value.getClass().getName());
    }
    return new RexLiteral(value, type);
  }

  private static String computeDigest(@Nullable Object value,
      SqlTypeName type) {
    if (value == null) {
      return type == SqlTypeName.NULL ? "null" : "null:" + type;
    }
    if (value instanceof String) {
      return "'" + value + "'";
    }
    return value + ":" + type;
  }

  public @Nullable Object getValue() {
    return value;
  }

  /** Returns whether this literal is the null value. */
  public boolean isNull() {
    return value == null;
  }

  @Override public SqlTypeName getType() {
    return type;
  }

  @Override public boolean isNullable() {
    return value == null;
  }

  @Override public <R> R accept(RexVisitor<R> visitor) {
    return visitor.visitLiteral(this);
  }
}

// End RexLiteral.java
