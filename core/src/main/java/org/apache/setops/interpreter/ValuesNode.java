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
import org.apache.setops.runtime.RuntimeProfile;
import org.apache.setops.runtime.Status;
import org.apache.setops.util.Holder;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Interpreter node that returns a fixed list of rows.
 */
public class ValuesNode extends AbstractNode {
  private final ImmutableList<Row> rows;
  private int position;

  public ValuesNode(int id, RelDataType rowType, List<Row> rows, long limit) {
    super("VALUES_NODE", id, rowType, ImmutableList.of(), limit);
    for (Row row : rows) {
      Preconditions.checkArgument(row.size() == rowType.getFieldCount(),
          "row %s does not match %s", row, rowType);
    }
    this.rows = ImmutableList.copyOf(rows);
  }

  public ValuesNode(int id, RelDataType rowType, List<Row> rows) {
    this(id, rowType, rows, -1);
  }

  @Override public Status open(ExecutionContext context) {
    final Status status = execDebugAction(DebugAction.Phase.OPEN, context);
    if (!status.isOk()) {
      return status;
    }
    position = 0;
    return Status.OK;
  }

  @Override public Status getNext(ExecutionContext context, RowBatch batch,
      Holder<Boolean> eos) {
    try (RuntimeProfile.ScopedTimer ignored = totalTimer.start()) {
      Status status = execDebugAction(DebugAction.Phase.GETNEXT, context);
      if (!status.isOk()) {
        return status;
      }
      status = context.checkCancelled();
      if (!status.isOk()) {
        return status;
      }
      status = batch.resizeAndAllocateTupleBuffer();
      if (!status.isOk()) {
        return status;
      }
      while (position < rows.size() && !reachedLimit()
          && !batch.isFull() && !batch.atResourceLimit()) {
        batch.addRow(rows.get(position++));
        ++numRowsReturned;
      }
      eos.set(position >= rows.size() || reachedLimit());
      return Status.OK;
    }
  }

  public List<Row> getRows() {
    return rows;
  }
}

// End ValuesNode.java
