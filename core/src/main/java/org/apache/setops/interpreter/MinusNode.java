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

import java.util.List;

/**
 * Interpreter node that implements EXCEPT (set difference) over any number
 * of children.
 *
 * <p>Returns the distinct rows of child 0, the anchor, that appear in none of
 * the other children, the subtrahends. Each rebuild keeps the entries that
 * are still unmatched, so the table shrinks from pass to pass.
 */
public class MinusNode extends SetOpNode {
  /** Creates a MinusNode. Call {@link #init()} before using it. */
  public MinusNode(SetOp plan, List<? extends Node> children) {
    super("EXCEPT_NODE", SetOp.Kind.EXCEPT, plan, children);
  }

  @Override protected boolean keepMatched() {
    return false;
  }

  @Override protected boolean isExhausted(RowHashTable table, int i) {
    if (table.unmatchedCount() == 0) {
      LOGGER.debug("{}: no rows left after child {}", profile.getName(), i);
      return true;
    }
    return false;
  }
}

// End MinusNode.java
