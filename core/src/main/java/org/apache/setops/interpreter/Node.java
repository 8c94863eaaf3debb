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

/**
 * Relational expression that can be executed using an interpreter.
 *
 * <p>A node is a pull-based operator. Its consumer calls {@link #prepare}
 * and {@link #open} once, then {@link #getNext} until it signals end of
 * stream, then {@link #close}. Every call runs in the thread of the fragment
 * instance; a node never starts threads of its own.
 *
 * <p>Methods report failure by returning a {@link Status}, never by
 * throwing.
 */
public interface Node {
  /** Prepares this node and its children for execution. */
  Status prepare(ExecutionContext context);

  /** Opens this node. May read all of the input of some children. */
  Status open(ExecutionContext context);

  /**
   * Adds rows to a batch.
   *
   * <p>Stops when the batch is full or at its resource limit, or when there
   * are no more rows. Sets {@code eos} to true if there are no more rows;
   * the consumer must not call again after that.
   *
   * @param context Execution context
   * @param batch   Batch to fill; the consumer resets it between calls
   * @param eos     Receives whether the end of the stream has been reached
   * @return OK, or the reason for failure
   */
  Status getNext(ExecutionContext context, RowBatch batch,
      Holder<Boolean> eos);

  /** Releases the resources of this node and closes its children. Can be
   * called more than once, and at any point after construction. */
  void close(ExecutionContext context);

  /** Returns the type of the rows this node produces. */
  RelDataType getRowType();

  RuntimeProfile getProfile();

  int getId();

  /** Returns the maximum number of rows this node returns, or -1. */
  long getLimit();
}

// End Node.java
