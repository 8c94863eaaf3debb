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

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.requireNonNull;

/**
 * Named counters and timers of one operator.
 *
 * <p>Every operator owns a profile named after it, for example
 * "EXCEPT_NODE (id=3)". Counters are created once, by name, when the operator
 * is constructed; later lookups by the same name return the same counter.
 */
public class RuntimeProfile {
  /** Name of the timer that every operator has. */
  public static final String TOTAL_TIME = "TotalTime";

  private final String name;
  private final Map<String, Counter> counters = new LinkedHashMap<>();

  public RuntimeProfile(String name) {
    this.name = requireNonNull(name, "name");
    addCounter(TOTAL_TIME, Unit.TIME_NS);
  }

  public String getName() {
    return name;
  }

  /** Adds a counter, or returns the existing counter of that name.
   *
   * @throws IllegalArgumentException if a counter of that name exists with
   * another unit */
  public Counter addCounter(String counterName, Unit unit) {
    final Counter existing = counters.get(counterName);
    if (existing != null) {
      Preconditions.checkArgument(existing.unit == unit,
          "counter %s already exists with unit %s", counterName, existing.unit);
      return existing;
    }
    final Counter counter = new Counter(counterName, unit);
    counters.put(counterName, counter);
    return counter;
  }

  /** Adds a timer; a counter measured in nanoseconds. */
  public Counter addTimer(String counterName) {
    return addCounter(counterName, Unit.TIME_NS);
  }

  public @Nullable Counter getCounter(String counterName) {
    return counters.get(counterName);
  }

  public Counter getTotalTimeCounter() {
    return requireNonNull(counters.get(TOTAL_TIME), TOTAL_TIME);
  }

  /** Returns a snapshot of the counter values, in creation order. */
  public ImmutableMap<String, Long> values() {
    final ImmutableMap.Builder<String, Long> builder = ImmutableMap.builder();
    counters.forEach((k, v) -> builder.put(k, v.value()));
    return builder.build();
  }

  @Override public String toString() {
    final StringBuilder buf = new StringBuilder(name).append(':');
    for (Counter counter : counters.values()) {
      buf.append("\n   - ").append(counter);
    }
    return buf.toString();
  }

  /** Unit of a counter. */
  public enum Unit {
    UNIT,
    BYTES,
    TIME_NS
  }

  /** A named value that only grows, unless explicitly set. */
  public static class Counter {
    private final String name;
    private final Unit unit;
    private final AtomicLong value = new AtomicLong();

    Counter(String name, Unit unit) {
      this.name = name;
      this.unit = unit;
    }

    public void update(long delta) {
      value.addAndGet(delta);
    }

    public void set(long v) {
      value.set(v);
    }

    public long value() {
      return value.get();
    }

    public String getName() {
      return name;
    }

    public Unit getUnit() {
      return unit;
    }

    /** Starts timing. Closing the returned scope adds the elapsed time to
     * this counter.
     *
     * <blockquote><pre>
     * try (RuntimeProfile.ScopedTimer ignored = buildTimer.start()) {
     *   ...
     * }</pre>
     * </blockquote>
     */
    public ScopedTimer start() {
      Preconditions.checkState(unit == Unit.TIME_NS,
          "counter %s is not a timer", name);
      return new ScopedTimer(this);
    }

    @Override public String toString() {
      switch (unit) {
      case TIME_NS:
        return name + ": " + TimeUnit.NANOSECONDS.toMicros(value.get()) + "us";
      case BYTES:
        return name + ": " + value.get() + "B";
      default:
        return name + ": " + value.get();
      }
    }
  }

  /** Running measurement of a timer. Not thread-safe; close it once. */
  public static class ScopedTimer implements AutoCloseable {
    private final Counter counter;
    private final Stopwatch stopwatch = Stopwatch.createStarted();

    ScopedTimer(Counter counter) {
      this.counter = counter;
    }

    @Override public void close() {
      if (stopwatch.isRunning()) {
        stopwatch.stop();
        counter.update(stopwatch.elapsed(TimeUnit.NANOSECONDS));
      }
    }
  }
}

// End RuntimeProfile.java
