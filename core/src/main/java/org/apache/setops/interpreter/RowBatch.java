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
import org.apache.setops.runtime.MemoryTracker;
import org.apache.setops.runtime.Status;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * Bounded, reusable buffer of rows passed from an operator to its consumer.
 *
 * <p>A producer first calls {@link #resizeAndAllocateTupleBuffer()}, which
 * allocates the slots for {@link #getCapacity()} rows, then adds rows until
 * the batch {@link #isFull() is full} or {@link #atResourceLimit() at its
 * resource limit}. The consumer reads the rows and calls {@link #reset()}
 * before passing the batch back. The slot buffer survives a reset.
 *
 * <p>If the batch has a memory tracker, the slot buffer is charged to it
 * when allocated and released by {@link #close()}.
 */
public class RowBatch implements AutoCloseable {
  private final int capacity;
  private final long maxBytes;
  private final int rowByteSize;
  private final @Nullable MemoryTracker memoryTracker;

  private @Nullable Row @Nullable [] slots;
  private int numRows;
  private long usedBytes;
  private long chargedBytes;

  /**
   * Creates a RowBatch.
   *
   * @param capacity      Maximum number of rows
   * @param maxBytes      Byte budget; at or above it the batch is at its
   *                      resource limit
   * @param rowByteSize   Fixed width of a row
   * @param memoryTracker Tracker charged for the slot buffer, or null
   */
  public RowBatch(int capacity, long maxBytes, int rowByteSize,
      @Nullable MemoryTracker memoryTracker) {
    Preconditions.checkArgument(capacity > 0, "capacity must be positive");
    Preconditions.checkArgument(maxBytes > 0, "maxBytes must be positive");
    this.capacity = capacity;
    this.maxBytes = maxBytes;
    this.rowByteSize = rowByteSize;
    this.memoryTracker = memoryTracker;
  }

  /** Creates a batch for rows of a given type, sized by an execution
   * context. */
  public static RowBatch create(ExecutionContext context, RelDataType rowType,
      @Nullable MemoryTracker memoryTracker) {
    return new RowBatch(context.getBatchSize(), context.getBatchMaxBytes(),
        rowType.getByteSize(), memoryTracker);
  }

  /** Makes sure that the slot buffer can hold {@link #getCapacity()} rows.
   *
   * <p>Returns {@link Status.Code#MEM_ALLOC_FAILED} if the memory tracker
   * does not allow the buffer. */
  public Status resizeAndAllocateTupleBuffer() {
    if (slots != null) {
      return Status.OK;
    }
    final long bytes = (long) capacity * rowByteSize;
    if (memoryTracker != null && !memoryTracker.tryConsume(bytes)) {
      return Status.allocFailed("Failed to allocate tuple buffer of " + bytes
          + " bytes for " + capacity + " rows: " + memoryTracker);
    }
    chargedBytes = memoryTracker == null ? 0 : bytes;
    slots = new Row[capacity];
    return Status.OK;
  }

  /** Adds a row in the next free slot.
   *
   * @throws IllegalStateException if the slot buffer has not been allocated
   * @throws IndexOutOfBoundsException if the batch is full
   */
  public void addRow(Row row) {
    final Row[] slots = this.slots;
    Preconditions.checkState(slots != null, "tuple buffer not allocated");
    Preconditions.checkElementIndex(numRows, slots.length, "row");
    slots[numRows++] = requireNonNull(row, "row");
    usedBytes += rowByteSize + variableLength(row);
  }

  private static long variableLength(Row row) {
    long length = 0;
    for (int i = 0; i < row.size(); i++) {
      final Object value = row.getObject(i);
      if (value instanceof String) {
        length += ((String) value).length();
      }
    }
    return length;
  }

  /** Returns the row in a given slot.
   *
   * @throws IndexOutOfBoundsException if there is no row in the slot */
  public Row getRow(int i) {
    Preconditions.checkElementIndex(i, numRows, "row");
    return requireNonNull(requireNonNull(slots, "slots")[i]);
  }

  public int getNumRows() {
    return numRows;
  }

  public int getCapacity() {
    return capacity;
  }

  public boolean isFull() {
    return numRows >= capacity;
  }

  /** Returns whether the rows in this batch use its whole byte budget. */
  public boolean atResourceLimit() {
    return usedBytes >= maxBytes;
  }

  /** Removes all rows. Keeps the slot buffer. */
  public void reset() {
    if (slots != null) {
      Arrays.fill(slots, 0, numRows, null);
    }
    numRows = 0;
    usedBytes = 0;
  }

  /** Releases the slot buffer. */
  @Override public void close() {
    reset();
    slots = null;
    if (memoryTracker != null && chargedBytes > 0) {
      memoryTracker.release(chargedBytes);
    }
    chargedBytes = 0;
  }

  @Override public String toString() {
    return "RowBatch(" + numRows + "/" + capacity + " rows, " + usedBytes
        + "/" + maxBytes + " bytes)";
  }
}

// End RowBatch.java
