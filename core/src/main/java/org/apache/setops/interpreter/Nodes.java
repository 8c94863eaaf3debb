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
import org.apache.setops.rex.RexInputRef;
import org.apache.setops.rex.RexNode;
import org.apache.setops.runtime.SetOpsException;
import org.apache.setops.runtime.Status;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Helper methods for {@link Node} and implementations for the set
 * operators.
 */
public class Nodes {
  private Nodes() {
  }

  /** Creates and initializes the operator of a set operation plan.
   *
   * @throws SetOpsException if the plan does not compile against the
   * children */
  public static AbstractNode create(SetOp plan, List<? extends Node> children) {
    final SetOpNode node;
    switch (plan.getKind()) {
    case EXCEPT:
      node = new MinusNode(plan, children);
      break;
    case INTERSECT:
      node = new IntersectNode(plan, children);
      break;
    default:
      throw new AssertionError(plan.getKind());
    }
    final Status status = node.init();
    if (!status.isOk()) {
      throw status.toException();
    }
    return node;
  }

  /** Returns the expressions that pass each field of a row type through
   * unchanged. */
  public static ImmutableList<RexNode> identity(RelDataType rowType) {
    final ImmutableList.Builder<RexNode> exprs = ImmutableList.builder();
    for (int i = 0; i < rowType.getFieldCount(); i++) {
      exprs.add(RexInputRef.of(i, rowType));
    }
    return exprs.build();
  }

  /** Creates a plan whose children all have the row type of the result, and
   * whose expressions pass the fields through unchanged. */
  public static SetOp identityPlan(int id, SetOp.Kind kind, RelDataType rowType,
      int childCount) {
    final SetOp.Builder builder = SetOp.builder(id, kind).rowType(rowType);
    final ImmutableList<RexNode> exprs = identity(rowType);
    for (int i = 0; i < childCount; i++) {
      builder.child(exprs);
    }
    return builder.build();
  }
}

// End Nodes.java
