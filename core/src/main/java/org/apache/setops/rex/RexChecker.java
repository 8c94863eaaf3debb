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
import org.apache.setops.util.Litmus;

import static java.util.Objects.requireNonNull;

/**
 * Visitor which checks the validity of a {@link RexNode} expression against
 * the row type of its input.
 *
 * <p>What happens when an invalid node is detected is up to the
 * {@link Litmus}: it may throw, or return false so that {@link #isValid}
 * returns false.
 */
public class RexChecker implements RexVisitor<Boolean> {
  //~ Instance fields --------------------------------------------------------

  protected final RelDataType inputRowType;
  protected final Litmus litmus;

  //~ Constructors -----------------------------------------------------------

  /**
   * Creates a RexChecker with a given input row type.
   *
   * @param inputRowType Input row type
   * @param litmus What to do if an invalid node is detected
   */
  public RexChecker(RelDataType inputRowType, Litmus litmus) {
    this.inputRowType = requireNonNull(inputRowType, "inputRowType");
    this.litmus = requireNonNull(litmus, "litmus");
  }

  //~ Methods ----------------------------------------------------------------

  @Override public Boolean visitInputRef(RexInputRef ref) {
    final int index = ref.getIndex();
    final int fieldCount = inputRowType.getFieldCount();
    if (index < 0 || index >= fieldCount) {
      return litmus.fail("RexInputRef index {} out of range 0..{}",
          index, fieldCount - 1);
    }
    // Type of field and type of reference may differ in nullability
    final RelDataTypeField field = inputRowType.getField(index);
    if (field.getType() != ref.getType()) {
      return litmus.fail("RexInputRef {} has type {} but input field {} "
          + "has type {}", ref, ref.getType(), field.getName(),
          field.getType());
    }
    return litmus.succeed();
  }

  @Override public Boolean visitLiteral(RexLiteral literal) {
    return litmus.succeed();
  }

  @Override public Boolean visitCast(RexCast cast) {
    if (!cast.getOperand().accept(this)) {
      return litmus.fail(null);
    }
    if (!cast.getType().isCastableFrom(cast.getOperand().getType())) {
      return litmus.fail("cannot cast {} from {} to {}", cast.getOperand(),
          cast.getOperand().getType(), cast.getType());
    }
    return litmus.succeed();
  }

  /**
   * Returns whether an expression is valid.
   */
  public final boolean isValid(RexNode expr) {
    return expr.accept(this);
  }
}

// End RexChecker.java
