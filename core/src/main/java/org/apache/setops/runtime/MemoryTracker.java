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
package org.apache.setops.runtime;

import org.apache.setops.config.SetOpsSystemProperty;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.requireNonNull;

/**
 * Tracks the memory consumed by a query, a fragment instance or an operator.
 *
 * <p>Trackers form a tree. Consumption charged to a tracker is also charged
 * to all of its ancestors, and a tracker is over its limit if it or any
 * ancestor is. A limit less than 0 means no limit.
 *
 * <p>Counters are atomic: trackers higher in the tree are shared by the
 * fragment instances of a query, which run in different threads. Operators
 * consult the tracker, they do not lock it.
 */
public class MemoryTracker {
  private final String label;
  private final long limit;
  private final @Nullable MemoryTracker parent;
  private final AtomicLong consumption = new AtomicLong();
  private final AtomicLong peakConsumption = new AtomicLong();

  /**
   * Creates a MemoryTracker.
   *
   * @param label  name used in diagnostics
   * @param limit  limit in bytes, or a negative value for no limit
   * @param parent parent tracker, or null for a root tracker
   */
  public MemoryTracker(String label, long limit,
      @Nullable MemoryTracker parent) {
    this.label = requireNonNull(label, "label");
    this.limit = limit;
    this.parent = parent;
  }

  /** Creates a root tracker whose limit is
   * {@link SetOpsSystemProperty#MEM_LIMIT}. */
  public MemoryTracker(String label) {
    this(label, SetOpsSystemProperty.MEM_LIMIT.value(), null);
  }

  /** Creates a tracker whose consumption is also charged to this one. */
  public MemoryTracker newChild(String label, long limit) {
    return new MemoryTracker(label, limit, this);
  }

  /** Creates a tracker without a limit of its own whose consumption is also
   * charged to this one. */
  public MemoryTracker newChild(String label) {
    return newChild(label, -1);
  }

  /** Charges {@code bytes} to this tracker and its ancestors, whether or not
   * the charge takes a tracker over its limit. Check {@link #limitExceeded()}
   * afterwards. */
  public void consume(long bytes) {
    Preconditions.checkArgument(bytes >= 0, "negative consumption %s", bytes);
    for (MemoryTracker t = this; t != null; t = t.parent) {
      final long now = t.consumption.addAndGet(bytes);
      t.peakConsumption.accumulateAndGet(now, Math::max);
    }
  }

  /** Charges {@code bytes} only if no tracker in the chain would go over its
   * limit. Returns whether the charge was made. */
  public boolean tryConsume(long bytes) {
    Preconditions.checkArgument(bytes >= 0, "negative consumption %s", bytes);
    for (MemoryTracker t = this; t != null; t = t.parent) {
      if (t.limit >= 0 && t.consumption.get() + bytes > t.limit) {
        return false;
      }
    }
    consume(bytes);
    return true;
  }

  /** Releases {@code bytes} previously charged to this tracker. */
  public void release(long bytes) {
    Preconditions.checkArgument(bytes >= 0, "negative release %s", bytes);
    for (MemoryTracker t = this; t != null; t = t.parent) {
      t.consumption.addAndGet(-bytes);
    }
  }

  /** Returns whether this tracker or any ancestor is over its limit. */
  public boolean limitExceeded() {
    return findLimitExceeded() != null;
  }

  /** Returns the closest tracker in the chain that is over its limit, or
   * null. */
  public @Nullable MemoryTracker findLimitExceeded() {
    for (MemoryTracker t = this; t != null; t = t.parent) {
      if (t.limit >= 0 && t.consumption.get() > t.limit) {
        return t;
      }
    }
    return null;
  }

  public String getLabel() {
    return label;
  }

  public long getLimit() {
    return limit;
  }

  public boolean hasLimit() {
    return limit >= 0;
  }

  public @Nullable MemoryTracker getParent() {
    return parent;
  }

  public long getConsumption() {
    return consumption.get();
  }

  public long getPeakConsumption() {
    return peakConsumption.get();
  }

  @Override public String toString() {
    return "MemoryTracker(" + label + ", consumption=" + consumption.get()
        + ", limit=" + limit + ")";
  }
}

// End MemoryTracker.java
