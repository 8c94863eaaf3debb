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
package org.apache.setops.interpreter;

import org.apache.setops.rel.type.RelDataType;
import org.apache.setops.rel.type.RelDataTypeField;
import org.apache.setops.rel.type.SqlTypeName;
import org.apache.setops.rex.RexCast;
import org.apache.setops.rex.RexChecker;
import org.apache.setops.rex.RexInputRef;
import org.apache.setops.rex.RexLiteral;
import org.apache.setops.rex.RexNode;
import org.apache.setops.rex.RexVisitor;
import org.apache.setops.runtime.SetOpsException;
import org.apache.setops.runtime.Status;
import org.apache.setops.util.Litmus;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Compiles a list of {@link RexNode} expressions into a {@link Scalar}.
 *
 * <p>Each expression is validated against the row type of the input it reads
 * and against the field of the output tuple it produces. An expression whose
 * type differs from its output field but widens to it (for example INTEGER to
 * BIGINT) gets an implicit cast. Every value the compiled scalar produces is
 * normalized, so that equal values have equal hash codes.
 */
public class ScalarCompiler {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ScalarCompiler.class);

  private final String description;

  /**
   * Creates a ScalarCompiler.
   *
   * @param description Describes what is being compiled, for example
   *                    "EXCEPT_NODE (id=3) child 1"; used in error messages
   */
  public ScalarCompiler(String description) {
    this.description = requireNonNull(description, "description");
  }

  /**
   * Compiles expressions.
   *
   * @param nodes         Expressions, one per field of the output type
   * @param inputRowType  Row type of the rows the expressions read
   * @param outputRowType Tuple the expressions produce
   * @return Compiled scalar
   * @throws SetOpsException with code {@link Status.Code#INIT_FAILED} if the
   * expressions are not valid
   */
  public Scalar compile(List<RexNode> nodes, RelDataType inputRowType,
      RelDataType outputRowType) {
    if (nodes.size() != outputRowType.getFieldCount()) {
      throw initFailed(nodes.size() + " expressions for a tuple of "
          + outputRowType.getFieldCount() + " fields " + outputRowType);
    }
    final Litmus litmus = (message, args) -> {
      throw initFailed(String.valueOf(Litmus.format(message, args)));
    };
    final RexChecker checker = new RexChecker(inputRowType, litmus);
    final ImmutableList.Builder<Function<@Nullable Object[], @Nullable Object>>
        functions = ImmutableList.builder();
    for (int i = 0; i < nodes.size(); i++) {
      RexNode node = nodes.get(i);
      final RelDataTypeField field = outputRowType.getField(i);
      checker.isValid(node);
      if (!field.getType().isAssignableFrom(node.getType())) {
        throw initFailed("expression " + node + " of type " + node.getType()
            + " cannot be assigned to field " + field);
      }
      if (node.isNullable() && !field.isNullable()) {
        throw initFailed("nullable expression " + node
            + " cannot be assigned to field " + field);
      }
      if (node.getType() != field.getType()
          && node.getType() != SqlTypeName.NULL) {
        node = new RexCast(node, field.getType());
      }
      functions.add(node.accept(EvaluatorBuilder.INSTANCE));
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("{}: compiled {} against {}", description, nodes,
          inputRowType);
    }
    return new CompiledScalar(functions.build());
  }

  private SetOpsException initFailed(String message) {
    return new SetOpsException(Status.Code.INIT_FAILED,
        description + ": " + message, null);
  }

  /** Scalar that evaluates a list of functions of the input values. */
  private static class CompiledScalar implements Scalar {
    private final ImmutableList<Function<@Nullable Object[], @Nullable Object>>
        functions;

    CompiledScalar(
        ImmutableList<Function<@Nullable Object[], @Nullable Object>> functions) {
      this.functions = functions;
    }

    @Override public void execute(Context context, @Nullable Object[] results) {
      final @Nullable Object[] values =
          requireNonNull(context.values, "context.values");
      for (int i = 0; i < functions.size(); i++) {
        results[i] = SqlTypeName.normalize(functions.get(i).apply(values));
      }
    }

    @Override public int size() {
      return functions.size();
    }
  }

  /** Translates an expression into a function of the input values. */
  private enum EvaluatorBuilder
      implements RexVisitor<Function<@Nullable Object[], @Nullable Object>> {
    INSTANCE;

    @Override public Function<@Nullable Object[], @Nullable Object>
        visitInputRef(RexInputRef inputRef) {
      final int index = inputRef.getIndex();
      return values -> values[index];
    }

    @Override public Function<@Nullable Object[], @Nullable Object>
        visitLiteral(RexLiteral literal) {
      final Object value = literal.getValue();
      return values -> value;
    }

    @Override public Function<@Nullable Object[], @Nullable Object>
        visitCast(RexCast cast) {
      final Function<@Nullable Object[], @Nullable Object> operand =
          cast.getOperand().accept(this);
      final SqlTypeName type = cast.getType();
      return values -> type.convert(operand.apply(values));
    }
  }
}

// End ScalarCompiler.java
