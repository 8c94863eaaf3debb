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

import org.apache.setops.config.SetOpsSystemProperty;
import org.apache.setops.runtime.RuntimeProfile;
import org.apache.setops.runtime.Status;
import org.apache.setops.util.Holder;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Interpreter node that implements a set operation over any number of
 * children, as {@link MinusNode} or {@link IntersectNode}.
 *
 * <p>{@link #open} reads child 0, the anchor, into a hash table, then reads
 * each other child in turn, marking the entries it matches. Before each
 * child after the first, the table is rebuilt from the entries whose matched
 * bit equals {@link #keepMatched()}. Once no such entry remains, the
 * remaining children are not read. {@link #getNext} returns those entries of
 * the last table.
 */
public abstract class SetOpNode extends AbstractNode {
  private final SetOp plan;
  private final RuntimeProfile.Counter buildTimer;
  private final RuntimeProfile.Counter probeTimer;

  private ImmutableList<Scalar> scalars = ImmutableList.of();
  private @Nullable RowHashTable table;
  private RowHashTable.@Nullable Cursor cursor;

  protected SetOpNode(String name, SetOp.Kind kind, SetOp plan,
      List<? extends Node> children) {
    super(name, plan.getId(), plan.getRowType(), children, plan.getLimit());
    Preconditions.checkArgument(plan.getKind() == kind,
        "not an %s plan: %s", kind, plan);
    this.plan = plan;
    this.buildTimer = profile.addTimer("BuildTime");
    this.probeTimer = profile.addTimer("ProbeTime");
  }

  /** Returns the matched bit of the entries that survive a probe pass: false
   * for EXCEPT, true for INTERSECT. */
  protected abstract boolean keepMatched();

  /** Returns whether no entry of {@code table} survived the probe pass of
   * child {@code i}, so that the remaining children need not be read. */
  protected abstract boolean isExhausted(RowHashTable table, int i);

  /** Compiles the expression list of each child. Returns
   * {@link Status.Code#INIT_FAILED} if any list is not valid for its
   * child. */
  public Status init() {
    try {
      scalars = SetOps.compile(profile.getName(), plan, children);
      return Status.OK;
    } catch (RuntimeException e) {
      return Status.fromException(e);
    }
  }

  @Override public Status prepare(ExecutionContext context) {
    if (scalars.isEmpty()) {
      return Status.internalError(profile.getName() + " is not initialized");
    }
    return super.prepare(context);
  }

  @Override public Status open(ExecutionContext context) {
    try (RuntimeProfile.ScopedTimer ignored = totalTimer.start()) {
      Status status = execDebugAction(DebugAction.Phase.OPEN, context);
      if (!status.isOk()) {
        return status;
      }
      status = context.checkCancelled();
      if (!status.isOk()) {
        return status;
      }
      RowHashTable table =
          new RowHashTable(scalars.get(0), scalars.get(1),
              rowType.getByteSize(), true, plan.isFindNulls(), id,
              context.getMemoryTracker().newChild(profile.getName()),
              SetOpsSystemProperty.HASH_TABLE_INITIAL_BUCKETS.value());
      this.table = table;
      status = SetOps.buildAnchorTable(context, id, children.get(0), table,
          buildTimer);
      if (!status.isOk()) {
        return status;
      }
      if (table.size() == 0) {
        cursor = table.begin();
        return Status.OK;
      }

      for (int i = 1; i < children.size(); i++) {
        if (i >= 2) {
          status = context.checkCancelled();
          if (!status.isOk()) {
            return status;
          }
          table = SetOps.rebuild(context, id, i, table, scalars.get(i),
              keepMatched(), buildTimer);
          this.table = table;
        }
        // Entries of a new table are unmatched, so every match is new
        status = SetOps.probe(context, id, i, children.get(i), table,
            probeTimer);
        if (!status.isOk()) {
          return status;
        }
        if (isExhausted(table, i)) {
          break;
        }
      }
      cursor = table.begin();
      return Status.OK;
    } catch (RuntimeException e) {
      return Status.fromException(e);
    }
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
      eos.set(true);
      if (reachedLimit()) {
        return Status.OK;
      }
      status = batch.resizeAndAllocateTupleBuffer();
      if (!status.isOk()) {
        return status;
      }
      final RowHashTable.Cursor cursor = this.cursor;
      if (cursor == null) {
        return Status.internalError(profile.getName() + " is not open");
      }
      final boolean keepMatched = keepMatched();
      while (cursor.hasNext()) {
        if (batch.isFull() || batch.atResourceLimit()) {
          eos.set(false);
          return Status.OK;
        }
        if (cursor.matched() == keepMatched) {
          batch.addRow(cursor.getKey());
          ++numRowsReturned;
        }
        cursor.next();
        eos.set(!cursor.hasNext() || reachedLimit());
        if (eos.get() || batch.isFull() || batch.atResourceLimit()) {
          return Status.OK;
        }
      }
      return Status.OK;
    } catch (RuntimeException e) {
      return Status.fromException(e);
    }
  }

  @Override public void close(ExecutionContext context) {
    if (isClosed()) {
      return;
    }
    if (table != null) {
      table.close();
      table = null;
    }
    cursor = null;
    super.close(context);
    LOGGER.debug("{}", profile);
  }

  /** Returns the current hash table, or null if the node is not open. */
  @Nullable RowHashTable getTable() {
    return table;
  }
}

// End SetOpNode.java
