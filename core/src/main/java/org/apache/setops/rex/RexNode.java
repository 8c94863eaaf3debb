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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Row expression.
 *
 * <p>A plan describes what a set operator compares by giving, for each child,
 * a list of row expressions that compute the comparison tuple from a row of
 * that child. Expressions are immutable.
 *
 * <p>Every row expression has a type and a digest. The digest is a string
 * that identifies the expression: two expressions with the same digest are
 * equivalent.
 */
public abstract class RexNode {
  //~ Instance fields --------------------------------------------------------

  // Effectively final. Set in each sub-class constructor, and never re-set.
  protected final String digest;

  //~ Constructors -----------------------------------------------------------

  protected RexNode(String digest) {
    this.digest = digest;
  }

  //~ Methods ----------------------------------------------------------------

  public abstract SqlTypeName getType();

  /** Returns whether this expression may evaluate to null. */
  public abstract boolean isNullable();

  /**
   * Accepts a visitor, dispatching to the right overloaded
   * {@link RexVisitor#visitInputRef visitXxx} method.
   *
   * <p>Also see {@link RexChecker}, which validates an expression against a
   * row type.
   */
  public abstract <R> R accept(RexVisitor<R> visitor);

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof RexNode
        && obj.getClass() == getClass()
        && digest.equals(((RexNode) obj).digest);
  }

  @Override public int hashCode() {
    return digest.hashCode();
  }

  @Override public String toString() {
    return digest;
  }
}

// End RexNode.java
