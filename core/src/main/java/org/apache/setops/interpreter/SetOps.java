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

import org.apache.setops.runtime.Hook;
import org.apache.setops.runtime.RuntimeProfile;
import org.apache.setops.runtime.SetOpsException;
import org.apache.setops.runtime.Status;
import org.apache.setops.util.Holder;
import org.apache.setops.util.Litmus;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Routines shared by the set operators, {@link MinusNode} and
 * {@link IntersectNode}.
 *
 * <p>Each routine returns the first non-OK status it meets: a failure of
 * the child, cancellation, or a breached limit.
 *
 * <p>If {@link ExecutionContext#isDebug()}, each routine verifies the hash
 * table it has filled, and fails with {@link Status.Code#INTERNAL_ERROR} if
 * the table is not consistent.
 */
public final class SetOps {
  private static final Logger LOGGER = LoggerFactory.getLogger(SetOps.class);

  /** Litmus that throws an internal error. */
  private static final Litmus INTERNAL_ERROR = (message, args) -> {
    throw new SetOpsException(Status.Code.INTERNAL_ERROR,
        String.valueOf(Litmus.format(message, args)), null);
  };

  private SetOps() {
  }

  /** Compiles the expression list of each child of a set operator.
   *
   * @throws SetOpsException with code {@link Status.Code#INIT_FAILED} if
   * there are fewer than two children, or a list does not compile */
  static ImmutableList<Scalar> compile(String name, SetOp plan,
      List<Node> children) {
    if (children.size() < 2) {
      throw new SetOpsException(Status.Code.INIT_FAILED,
          name + " needs at least two children, has " + children.size(),
          null);
    }
    if (plan.getExprLists().size() != children.size()) {
      throw new SetOpsException(Status.Code.INIT_FAILED,
          name + " has " + children.size() + " children but "
              + plan.getExprLists().size() + " expression lists",
          null);
    }
    final ImmutableList.Builder<Scalar> scalars = ImmutableList.builder();
    for (int i = 0; i < children.size(); i++) {
      final ScalarCompiler compiler = new ScalarCompiler(name + " child " + i);
      scalars.add(
          compiler.compile(plan.getExprLists().get(i),
              children.get(i).getRowType(), plan.getRowType()));
    }
    return scalars.build();
  }

  /** Opens a child of a set operator. */
  static Status openChild(ExecutionContext context, int nodeId, int i,
      Node child) {
    if (Hook.CHILD_OPENED.isActive()) {
      Hook.CHILD_OPENED.run(new Object[] {nodeId, i});
    }
    return child.open(context);
  }

  /**
   * Reads all rows of the anchor child into a hash table.
   *
   * <p>Opens the child, inserts each row with
   * {@link RowHashTable#insertUnique} so that duplicates collapse, and closes
   * the child once it is drained. Checks for cancellation before each pull
   * from the child, and the memory limit after it.
   *
   * @param context    Execution context
   * @param nodeId     Id of the set operator
   * @param child      Anchor child, child 0
   * @param table      Empty hash table whose build side is the anchor
   * @param buildTimer Timer charged with the time spent
   * @return OK, or the reason for failure
   */
  public static Status buildAnchorTable(ExecutionContext context, int nodeId,
      Node child, RowHashTable table, RuntimeProfile.Counter buildTimer) {
    try (RuntimeProfile.ScopedTimer ignored = buildTimer.start()) {
      Status status = openChild(context, nodeId, 0, child);
      if (!status.isOk()) {
        return status;
      }
      try (RowBatch batch = RowBatch.create(context, child.getRowType(), null)) {
        final Holder<Boolean> eos = Holder.of(false);
        while (!eos.get()) {
          status = context.checkCancelled();
          if (!status.isOk()) {
            return status;
          }
          status = child.getNext(context, batch, eos);
          if (!status.isOk()) {
            return status;
          }
          for (int j = 0; j < batch.getNumRows(); j++) {
            final Row row = batch.getRow(j);
            if (LOGGER.isTraceEnabled()) {
              LOGGER.trace("build row {}", row);
            }
            table.insertUnique(row);
          }
          batch.reset();
          status = context.checkLimits("building hash table of node " + nodeId,
              -1);
          if (!status.isOk()) {
            return status;
          }
        }
      }
      child.close(context);
      if (context.isDebug()) {
        table.isValid(INTERNAL_ERROR);
      }
      return Status.OK;
    }
  }

  /**
   * Reads all rows of a child and sets the matched bit of every entry whose
   * key equals the key of a row.
   *
   * <p>Checks for cancellation before each pull from the child, and the
   * memory and probe row limits after it. Closes the child once it is
   * drained.
   *
   * @return OK, or the reason for failure
   */
  static Status probe(ExecutionContext context, int nodeId, int i, Node child,
      RowHashTable table, RuntimeProfile.Counter probeTimer) {
    try (RuntimeProfile.ScopedTimer ignored = probeTimer.start()) {
      Status status = openChild(context, nodeId, i, child);
      if (!status.isOk()) {
        return status;
      }
      long rowsProbed = 0;
      try (RowBatch batch = RowBatch.create(context, child.getRowType(), null)) {
        final Holder<Boolean> eos = Holder.of(false);
        while (!eos.get()) {
          status = context.checkCancelled();
          if (!status.isOk()) {
            return status;
          }
          status = child.getNext(context, batch, eos);
          if (!status.isOk()) {
            return status;
          }
          rowsProbed += batch.getNumRows();
          status = context.checkLimits(
              "probing child " + i + " of node " + nodeId, rowsProbed);
          if (!status.isOk()) {
            return status;
          }
          for (int j = 0; j < batch.getNumRows(); j++) {
            final Row row = batch.getRow(j);
            if (LOGGER.isTraceEnabled()) {
              LOGGER.trace("probe row {}", row);
            }
            for (RowHashTable.Cursor cursor = table.find(row);
                 cursor.hasNext(); cursor.next()) {
              if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("probe matched {}", cursor.getRow());
              }
              cursor.setMatched();
            }
          }
          batch.reset();
        }
      }
      child.close(context);
      if (context.isDebug()) {
        table.isValid(INTERNAL_ERROR);
      }
      return Status.OK;
    }
  }

  /**
   * Creates a hash table that holds the entries of {@code table} whose
   * matched bit equals {@code keepMatched}, and whose probe side is the next
   * child. Closes {@code table}.
   *
   * <p>The entries of the new table are not matched.
   */
  static RowHashTable rebuild(ExecutionContext context, int nodeId, int i,
      RowHashTable table, Scalar probeScalar, boolean keepMatched,
      RuntimeProfile.Counter buildTimer) {
    try (RuntimeProfile.ScopedTimer ignored = buildTimer.start()) {
      final RowHashTable newTable = table.withProbe(probeScalar);
      try {
        int survivors = 0;
        for (RowHashTable.Cursor cursor = table.begin(); cursor.hasNext();
             cursor.next()) {
          if (cursor.matched() == keepMatched) {
            if (LOGGER.isTraceEnabled()) {
              LOGGER.trace("rebuild row {}", cursor.getRow());
            }
            newTable.insert(cursor.getRow());
            ++survivors;
          }
        }
        if (context.isDebug()) {
          verifyRebuild(newTable, survivors, INTERNAL_ERROR);
        }
      } catch (RuntimeException e) {
        newTable.close();
        throw e;
      }
      table.close();
      LOGGER.debug("node {}: rebuilt hash table with {} rows before child {}",
          nodeId, newTable.size(), i);
      if (Hook.HASH_TABLE_REBUILT.isActive()) {
        Hook.HASH_TABLE_REBUILT.run(new Object[] {nodeId, i, newTable.size()});
      }
      return newTable;
    }
  }

  /** Checks that a table rebuilt from {@code survivors} entries is
   * consistent, holds exactly that many entries, and has none matched. */
  static boolean verifyRebuild(RowHashTable table, int survivors,
      Litmus litmus) {
    return table.isValid(litmus)
        && litmus.check(table.size() == survivors,
            "rebuilt hash table {} has {} entries, expected {}", table.getId(),
            table.size(), survivors)
        && litmus.check(table.matchedCount() == 0,
            "rebuilt hash table {} has {} matched entries", table.getId(),
            table.matchedCount());
  }
}

// End SetOps.java
