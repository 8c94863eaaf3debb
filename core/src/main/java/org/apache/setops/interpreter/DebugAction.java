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

import static java.util.Objects.requireNonNull;

/**
 * Failure or wait injected into one phase of one operator, for testing.
 *
 * @see ExecutionContext.Builder#debugAction(DebugAction)
 */
public class DebugAction {
  private final int nodeId;
  private final Phase phase;
  private final Kind kind;

  private DebugAction(int nodeId, Phase phase, Kind kind) {
    this.nodeId = nodeId;
    this.phase = requireNonNull(phase, "phase");
    this.kind = requireNonNull(kind, "kind");
  }

  public static DebugAction of(int nodeId, Phase phase, Kind kind) {
    return new DebugAction(nodeId, phase, kind);
  }

  /** Returns whether this action applies to a given node and phase. */
  public boolean appliesTo(int nodeId, Phase phase) {
    return this.nodeId == nodeId && this.phase == phase;
  }

  public int getNodeId() {
    return nodeId;
  }

  public Phase getPhase() {
    return phase;
  }

  public Kind getKind() {
    return kind;
  }

  @Override public String toString() {
    return kind + " at " + phase + " of node " + nodeId;
  }

  /** Phase of an operator's lifecycle. */
  public enum Phase {
    PREPARE,
    OPEN,
    GETNEXT,
    CLOSE
  }

  /** What to do. */
  public enum Kind {
    /** Return an internal error. */
    FAIL,
    /** Block until the query is cancelled, then return cancellation. */
    WAIT
  }
}

// End DebugAction.java
