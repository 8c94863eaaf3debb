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
import org.apache.setops.runtime.MemoryTracker;
import org.apache.setops.runtime.Status;
import org.apache.setops.util.CancelFlag;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * State of one fragment instance, shared by the operators that run in it.
 *
 * <p>Holds the batch sizing, the cancellation flag, the memory tracker and
 * the limits that operators check while they pull rows from their children.
 * Build one with {@link #builder()}.
 */
public class ExecutionContext {
  private final int batchSize;
  private final long batchMaxBytes;
  private final CancelFlag cancelFlag;
  private final MemoryTracker memoryTracker;
  private final long maxProbeRows;
  private final @Nullable DebugAction debugAction;
  private final boolean debug;

  private ExecutionContext(Builder builder) {
    this.batchSize = builder.batchSize;
    this.batchMaxBytes = builder.batchMaxBytes;
    this.cancelFlag = builder.cancelFlag;
    this.memoryTracker = builder.memoryTracker != null
        ? builder.memoryTracker
        : new MemoryTracker("query");
    this.maxProbeRows = builder.maxProbeRows;
    this.debugAction = builder.debugAction;
    this.debug = builder.debug;
  }

  /** Creates a builder whose settings default from
   * {@link SetOpsSystemProperty}. */
  public static Builder builder() {
    return new Builder();
  }

  public int getBatchSize() {
    return batchSize;
  }

  public long getBatchMaxBytes() {
    return batchMaxBytes;
  }

  public CancelFlag getCancelFlag() {
    return cancelFlag;
  }

  public MemoryTracker getMemoryTracker() {
    return memoryTracker;
  }

  /** Returns the maximum number of rows an operator may read from one child
   * while probing, or -1 if there is no maximum. */
  public long getMaxProbeRows() {
    return maxProbeRows;
  }

  public @Nullable DebugAction getDebugAction() {
    return debugAction;
  }

  /** Returns whether operators verify the state of their hash tables after
   * each pass. Defaults to {@link SetOpsSystemProperty#DEBUG}. */
  public boolean isDebug() {
    return debug;
  }

  public boolean isCancelled() {
    return cancelFlag.isCancelRequested();
  }

  /** Returns {@link Status.Code#CANCELLED} if cancellation has been
   * requested, otherwise OK. */
  public Status checkCancelled() {
    if (cancelFlag.isCancelRequested()) {
      return Status.cancelled("Cancelled");
    }
    return Status.OK;
  }

  /** Checks the memory limit and, if {@code rowsProbed} is not negative,
   * the probe row limit.
   *
   * @param what       Describes the work being done, for error messages
   * @param rowsProbed Rows read so far from the child being probed, or -1
   */
  public Status checkLimits(String what, long rowsProbed) {
    final MemoryTracker exceeded = memoryTracker.findLimitExceeded();
    if (exceeded != null) {
      return Status.memLimitExceeded("Memory limit exceeded: " + what
          + " consumed " + exceeded.getConsumption() + " bytes of "
          + exceeded.getLabel() + " whose limit is " + exceeded.getLimit());
    }
    if (maxProbeRows >= 0 && rowsProbed > maxProbeRows) {
      return Status.limitExceeded("Row limit exceeded: " + what + " read "
          + rowsProbed + " rows, limit is " + maxProbeRows);
    }
    return Status.OK;
  }

  @Override public String toString() {
    return "ExecutionContext(batchSize=" + batchSize + ", " + memoryTracker
        + ")";
  }

  /** Builder of an {@link ExecutionContext}. */
  public static class Builder {
    private int batchSize = SetOpsSystemProperty.BATCH_SIZE.value();
    private long batchMaxBytes = SetOpsSystemProperty.BATCH_MAX_BYTES.value();
    private CancelFlag cancelFlag = new CancelFlag();
    private @Nullable MemoryTracker memoryTracker;
    private long maxProbeRows = -1;
    private @Nullable DebugAction debugAction;
    private boolean debug = SetOpsSystemProperty.DEBUG.value();

    private Builder() {
    }

    public Builder batchSize(int batchSize) {
      Preconditions.checkArgument(batchSize > 0,
          "batch size must be positive: %s", batchSize);
      this.batchSize = batchSize;
      return this;
    }

    public Builder batchMaxBytes(long batchMaxBytes) {
      Preconditions.checkArgument(batchMaxBytes > 0,
          "batch byte budget must be positive: %s", batchMaxBytes);
      this.batchMaxBytes = batchMaxBytes;
      return this;
    }

    public Builder cancelFlag(CancelFlag cancelFlag) {
      this.cancelFlag = requireNonNull(cancelFlag, "cancelFlag");
      return this;
    }

    public Builder memoryTracker(MemoryTracker memoryTracker) {
      this.memoryTracker = requireNonNull(memoryTracker, "memoryTracker");
      return this;
    }

    /** Sets the maximum number of rows an operator may read from one child
     * while probing; -1 means no maximum. */
    public Builder maxProbeRows(long maxProbeRows) {
      this.maxProbeRows = maxProbeRows;
      return this;
    }

    public Builder debugAction(@Nullable DebugAction debugAction) {
      this.debugAction = debugAction;
      return this;
    }

    public Builder debug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public ExecutionContext build() {
      return new ExecutionContext(this);
    }
  }
}

// End ExecutionContext.java
