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

import org.apache.setops.util.Holder;

import org.apiguardian.api.API;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Collection of hooks that can be set by observers and are executed at various
 * points of operator execution.
 *
 * <p>Handlers are registered per thread, and see only the operators that run
 * on that thread. For testing and debugging rather than for end-users.
 */
public enum Hook {
  /** Called when an operator enters a phase of its lifecycle, with an array
   * {node id, {@link org.apache.setops.interpreter.DebugAction.Phase},
   * {@link Holder} of {@link Status}}. A handler may put a failed status into
   * the holder; the operator then returns it from that phase. */
  EXEC_NODE_PHASE,

  /** Called by a set operator after it has rebuilt its hash table before a
   * probe pass, with an array {node id, child index, rows in the new table}. */
  HASH_TABLE_REBUILT,

  /** Called by a set operator when it opens a child, with an array
   * {node id, child index}. */
  @API(status = API.Status.EXPERIMENTAL)
  CHILD_OPENED;

  @SuppressWarnings("ImmutableEnumChecker")
  private final ThreadLocal<List<Consumer<Object>>> threadHandlers =
      ThreadLocal.withInitial(ArrayList::new);

  /** Adds a handler for this thread.
   *
   * <p>Returns a {@link Hook.Closeable} so that you can use the following
   * try-with-resources pattern to prevent leaks:
   *
   * <blockquote><pre>
   *     try (Hook.Closeable ignored = Hook.FOO.addThread(HANDLER)) {
   *         ...
   *     }</pre>
   * </blockquote>
   */
  @API(status = API.Status.MAINTAINED)
  public <T> Closeable addThread(final Consumer<T> handler) {
    //noinspection unchecked
    threadHandlers.get().add((Consumer<Object>) handler);
    return () -> removeThread(handler);
  }

  /** Removes a thread handler from this Hook. */
  @SuppressWarnings({"rawtypes", "UnusedReturnValue"})
  private boolean removeThread(Consumer handler) {
    return threadHandlers.get().remove(handler);
  }

  /** Runs all handlers registered for this Hook, with the given argument. */
  public void run(Object arg) {
    for (Consumer<Object> handler : threadHandlers.get()) {
      handler.accept(arg);
    }
  }

  /** Returns whether any handler is registered for this thread. Callers use
   * it to avoid building the argument of {@link #run}. */
  public boolean isActive() {
    return !threadHandlers.get().isEmpty();
  }

  /** Removes a Hook after use. */
  public interface Closeable extends AutoCloseable {
    // override, removing "throws"
    @Override void close();
  }
}

// End Hook.java
