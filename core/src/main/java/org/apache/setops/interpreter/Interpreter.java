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

import org.apache.setops.runtime.SetOpsException;
import org.apache.setops.runtime.Status;
import org.apache.setops.util.Holder;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Interpreter.
 *
 * <p>Executes a tree of {@link Node}s in one fragment instance: prepares and
 * opens the root, pulls batches until end of stream, and closes it. The rows
 * are collected the first time they are asked for.
 *
 * <p>A failure of any node becomes an exception: a
 * {@link org.apache.setops.runtime.CancelledException} if the fragment was
 * cancelled, a {@link org.apache.setops.runtime.LimitExceededException} if a
 * limit was breached, otherwise a {@link SetOpsException}.
 */
public class Interpreter implements Iterable<Row>, AutoCloseable {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Interpreter.class);

  private final ExecutionContext context;
  private final Node root;
  private @Nullable ImmutableList<Row> rows;

  /** Creates an Interpreter. */
  public Interpreter(ExecutionContext context, Node root) {
    this.context = requireNonNull(context, "context");
    this.root = requireNonNull(root, "root");
  }

  /** Returns the rows of the root node, executing it if it has not been
   * executed yet.
   *
   * @throws SetOpsException if execution fails */
  public List<Row> rows() {
    if (rows == null) {
      rows = execute();
    }
    return rows;
  }

  @Override public Iterator<Row> iterator() {
    return rows().iterator();
  }

  private ImmutableList<Row> execute() {
    final ImmutableList.Builder<Row> builder = ImmutableList.builder();
    try (RowBatch batch = RowBatch.create(context, root.getRowType(),
        context.getMemoryTracker())) {
      Status status = root.prepare(context);
      if (status.isOk()) {
        status = root.open(context);
      }
      final Holder<Boolean> eos = Holder.of(false);
      while (status.isOk() && !eos.get()) {
        status = root.getNext(context, batch, eos);
        for (int i = 0; i < batch.getNumRows(); i++) {
          builder.add(batch.getRow(i));
        }
        batch.reset();
      }
      if (!status.isOk()) {
        LOGGER.debug("{} failed: {}", root, status);
        throw status.toException();
      }
    } finally {
      root.close(context);
    }
    return builder.build();
  }

  /** Closes the root node, releasing its resources. */
  @Override public void close() {
    root.close(context);
  }
}

// End Interpreter.java
