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
import org.apache.setops.rex.RexNode;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Plan of a set operator: what it computes, and how it maps the rows of each
 * of its children onto the comparison tuple.
 *
 * <p>Child 0 is the anchor. For {@link Kind#EXCEPT} the operator returns the
 * distinct anchor rows that appear in no other child; for
 * {@link Kind#INTERSECT}, the distinct anchor rows that appear in every
 * other child. Rows are compared, and returned, as the comparison tuple
 * {@link #getRowType()}.
 */
public class SetOp {
  private final int id;
  private final Kind kind;
  private final RelDataType rowType;
  private final ImmutableList<ImmutableList<RexNode>> exprLists;
  private final boolean findNulls;
  private final long limit;

  private SetOp(Builder builder) {
    this.id = builder.id;
    this.kind = builder.kind;
    this.rowType = requireNonNull(builder.rowType, "rowType");
    this.exprLists = builder.exprLists.build();
    this.findNulls = builder.findNulls;
    this.limit = builder.limit;
  }

  public static Builder builder(int id, Kind kind) {
    return new Builder(id, kind);
  }

  public int getId() {
    return id;
  }

  public Kind getKind() {
    return kind;
  }

  /** Returns the comparison tuple, which is also the type of the rows the
   * operator returns. */
  public RelDataType getRowType() {
    return rowType;
  }

  /** Returns the expressions of each child, in child order. */
  public List<ImmutableList<RexNode>> getExprLists() {
    return exprLists;
  }

  /** Returns whether a null in the comparison tuple equals a null. */
  public boolean isFindNulls() {
    return findNulls;
  }

  /** Returns the maximum number of rows to return, or -1. */
  public long getLimit() {
    return limit;
  }

  @Override public String toString() {
    return kind + "(id=" + id + ", " + rowType + ", " + exprLists + ")";
  }

  /** Kind of set operation. */
  public enum Kind {
    EXCEPT,
    INTERSECT
  }

  /** Builder of a {@link SetOp}. */
  public static class Builder {
    private final int id;
    private final Kind kind;
    private @Nullable RelDataType rowType;
    private final ImmutableList.Builder<ImmutableList<RexNode>> exprLists =
        ImmutableList.builder();
    private boolean findNulls = true;
    private long limit = -1;

    private Builder(int id, Kind kind) {
      this.id = id;
      this.kind = requireNonNull(kind, "kind");
    }

    public Builder rowType(RelDataType rowType) {
      this.rowType = requireNonNull(rowType, "rowType");
      return this;
    }

    /** Adds the expression list of the next child. */
    public Builder child(List<? extends RexNode> exprs) {
      exprLists.add(ImmutableList.copyOf(exprs));
      return this;
    }

    /** Adds the expression list of the next child. */
    public Builder child(RexNode... exprs) {
      return child(Arrays.asList(exprs));
    }

    public Builder findNulls(boolean findNulls) {
      this.findNulls = findNulls;
      return this;
    }

    public Builder limit(long limit) {
      this.limit = limit;
      return this;
    }

    public SetOp build() {
      return new SetOp(this);
    }
  }
}

// End SetOp.java
