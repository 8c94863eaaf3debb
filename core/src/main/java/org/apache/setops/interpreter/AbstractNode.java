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
import org.apache.setops.runtime.Hook;
import org.apache.setops.runtime.RuntimeProfile;
import org.apache.setops.runtime.Status;
import org.apache.setops.util.Holder;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Base class for {@link Node} implementations.
 *
 * <p>Keeps the bookkeeping every operator has: its id and children, its
 * row limit and the number of rows it has returned, and its profile. It also
 * runs the {@link DebugAction} and {@link Hook#EXEC_NODE_PHASE} handlers at
 * the start of each phase.
 */
public abstract class AbstractNode implements Node {
  protected static final Logger LOGGER =
      LoggerFactory.getLogger(AbstractNode.class);

  /** Interval at which a {@link DebugAction.Kind#WAIT} action polls the
   * cancellation flag. */
  private static final long WAIT_POLL_MILLIS = 10;

  protected final int id;
  protected final RelDataType rowType;
  protected final ImmutableList<Node> children;
  protected final long limit;
  protected final RuntimeProfile profile;
  protected final RuntimeProfile.Counter totalTimer;
  protected final RuntimeProfile.Counter rowsReturnedCounter;

  /** Number of rows returned so far by {@link #getNext}. */
  protected long numRowsReturned;

  private boolean closed;

  protected AbstractNode(String name, int id, RelDataType rowType,
      List<? extends Node> children, long limit) {
    this.id = id;
    this.rowType = requireNonNull(rowType, "rowType");
    this.children = ImmutableList.copyOf(children);
    this.limit = limit;
    this.profile = new RuntimeProfile(name + " (id=" + id + ")");
    this.totalTimer = profile.getTotalTimeCounter();
    this.rowsReturnedCounter =
        profile.addCounter("RowsReturned", RuntimeProfile.Unit.UNIT);
  }

  @Override public Status prepare(ExecutionContext context) {
    final Status status = execDebugAction(DebugAction.Phase.PREPARE, context);
    if (!status.isOk()) {
      return status;
    }
    for (Node child : children) {
      final Status childStatus = child.prepare(context);
      if (!childStatus.isOk()) {
        return childStatus;
      }
    }
    return Status.OK;
  }

  /** Closes this node's children and records the rows returned. Subclasses
   * release their own resources, then call this method. */
  @Override public void close(ExecutionContext context) {
    if (closed) {
      return;
    }
    closed = true;
    final Status status = execDebugAction(DebugAction.Phase.CLOSE, context);
    if (!status.isOk()) {
      LOGGER.warn("{}: {} while closing", profile.getName(), status);
    }
    for (Node child : children) {
      child.close(context);
    }
    rowsReturnedCounter.set(numRowsReturned);
  }

  /** Returns whether {@link #close} has been called. */
  public boolean isClosed() {
    return closed;
  }

  /** Returns whether this node has returned as many rows as its limit
   * allows. */
  public boolean reachedLimit() {
    return limit >= 0 && numRowsReturned >= limit;
  }

  /**
   * Runs the debug action of the context, if it applies to this node and
   * phase, then the handlers of {@link Hook#EXEC_NODE_PHASE}.
   *
   * <p>Returns OK unless the action or a handler asks this node to fail.
   */
  protected Status execDebugAction(DebugAction.Phase phase,
      ExecutionContext context) {
    final DebugAction action = context.getDebugAction();
    if (action != null && action.appliesTo(id, phase)) {
      LOGGER.debug("{}: debug action {}", profile.getName(), action);
      switch (action.getKind()) {
      case FAIL:
        return Status.internalError("Debug Action: FAIL at " + phase
            + " of " + profile.getName());
      case WAIT:
        return waitForCancel(context);
      default:
        throw new AssertionError(action.getKind());
      }
    }
    if (Hook.EXEC_NODE_PHASE.isActive()) {
      final Holder<Status> holder = Holder.of(Status.OK);
      Hook.EXEC_NODE_PHASE.run(new Object[] {id, phase, holder});
      return holder.get();
    }
    return Status.OK;
  }

  private Status waitForCancel(ExecutionContext context) {
    while (!context.isCancelled()) {
      try {
        Thread.sleep(WAIT_POLL_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return Status.cancelled("Interrupted while waiting in "
            + profile.getName());
      }
    }
    return context.checkCancelled();
  }

  @Override public RelDataType getRowType() {
    return rowType;
  }

  @Override public RuntimeProfile getProfile() {
    return profile;
  }

  @Override public int getId() {
    return id;
  }

  @Override public long getLimit() {
    return limit;
  }

  public List<Node> getChildren() {
    return children;
  }

  @Override public String toString() {
    return profile.getName();
  }
}

// End AbstractNode.java
