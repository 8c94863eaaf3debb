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

import static java.util.Objects.requireNonNull;

/**
 * Conversion of the value of an expression to another type.
 *
 * <p>The digest is "CAST(operand):TYPE". Whether the conversion is allowed is
 * checked by {@link RexChecker}, not by the constructor.
 */
public class RexCast extends RexNode {
  private final RexNode operand;
  private final SqlTypeName type;

  public RexCast(RexNode operand, SqlTypeName type) {
    super("CAST(" + operand + "):" + type);
    this.operand = requireNonNull(operand, "operand");
    this.type = requireNonNull(type, "type");
  }

  public RexNode getOperand() {
    return operand;
  }

  @Override public SqlTypeName getType() {
    return type;
  }

  @Override public boolean isNullable() {
    return operand.isNullable();
  }

  @Override public <R> R accept(RexVisitor<R> visitor) {
    return visitor.visitCast(this);
  }
}

// End RexCast.java
