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

import org.apache.setops.runtime.CancelledException;
import org.apache.setops.runtime.Hook;
import org.apache.setops.runtime.LimitExceededException;
import org.apache.setops.runtime.SetOpsException;
import org.apache.setops.runtime.Status;
import org.apache.setops.util.CancelFlag;
import org.apache.setops.util.Holder;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.apache.setops.interpreter.SetOpFixtures.context;
import static org.apache.setops.interpreter.SetOpFixtures.except;
import static org.apache.setops.interpreter.SetOpFixtures.ints;
import static org.apache.setops.interpreter.SetOpFixtures.intersect;
import static org.apache.setops.interpreter.SetOpFixtures.run;

import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link DebugAction} and the
 * {@link Hook#EXEC_NODE_PHASE} hook.
 */
class DebugActionTest {
  private static ExecutionContext debugContext(int nodeId,
      DebugAction.Phase phase, DebugAction.Kind kind) {
    return context().debugAction(DebugAction.of(nodeId, phase, kind)).build();
  }

  @Test void testFailAtOpen() {
    final SetOpsException e = assertThrows(SetOpsException.class, () ->
        run(debugContext(10, DebugAction.Phase.OPEN, DebugAction.Kind.FAIL),
            except(10, ints(1, 1), ints(2, 2))));
    assertThat(e.getCode(), is(Status.Code.INTERNAL_ERROR));
    assertThat(e.getMessage(),
        is("Debug Action: FAIL at OPEN of EXCEPT_NODE (id=10)"));
  }

  /** A failure injected into a child surfaces from the set operator. */
  @Test void testFailInChild() {
    final SetOpsException e = assertThrows(SetOpsException.class, () ->
        run(debugContext(2, DebugAction.Phase.GETNEXT, DebugAction.Kind.FAIL),
            intersect(10, ints(1, 1), ints(2, 2))));
    assertThat(e.getMessage(),
        is("Debug Action: FAIL at GETNEXT of VALUES_NODE (id=2)"));

    final SetOpsException e2 = assertThrows(SetOpsException.class, () ->
        run(debugContext(1, DebugAction.Phase.PREPARE, DebugAction.Kind.FAIL),
            except(10, ints(1, 1), ints(2, 2))));
    assertThat(e2.getMessage(),
        is("Debug Action: FAIL at PREPARE of VALUES_NODE (id=1)"));
  }

  /** A failure while closing is logged, not reported. */
  @Test void testFailAtClose() {
    final AbstractNode node = except(10, ints(1, 1, 2), ints(2, 2));
    assertThat(
        run(debugContext(10, DebugAction.Phase.CLOSE, DebugAction.Kind.FAIL), node),
        hasSize(1));
    assertThat(node.isClosed(), is(true));
  }

  /** An action for another node or phase does nothing. */
  @Test void testNotApplicable() {
    final DebugAction action =
        DebugAction.of(10, DebugAction.Phase.OPEN, DebugAction.Kind.FAIL);
    assertThat(action.appliesTo(10, DebugAction.Phase.OPEN), is(true));
    assertThat(action.appliesTo(11, DebugAction.Phase.OPEN), is(false));
    assertThat(action.appliesTo(10, DebugAction.Phase.GETNEXT), is(false));
    assertThat(
        run(debugContext(99, DebugAction.Phase.OPEN, DebugAction.Kind.FAIL),
            except(10, ints(1, 1, 2), ints(2, 2))),
        hasSize(1));
  }

  /** A node told to wait blocks until the query is cancelled. */
  @Test @Timeout(value = 10, unit = TimeUnit.SECONDS)
  void testWaitUntilCancelled() throws InterruptedException {
    final CancelFlag cancelFlag = new CancelFlag();
    final ExecutionContext context = context()
        .cancelFlag(cancelFlag)
        .debugAction(
            DebugAction.of(10, DebugAction.Phase.OPEN, DebugAction.Kind.WAIT))
        .build();
    final Thread canceller = new Thread(() -> {
      try {
        Thread.sleep(50);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      cancelFlag.requestCancel();
    });
    canceller.start();
    final CancelledException e = assertThrows(CancelledException.class, () ->
        run(context, except(10, ints(1, 1), ints(2, 2))));
    assertThat(e.getCode(), is(Status.Code.CANCELLED));
    canceller.join();
  }

  /** A handler of the phase hook sees every phase of every node, and can make
   * a node fail. */
  @SuppressWarnings("unchecked")
  @Test void testPhaseHook() {
    final List<String> phases = new ArrayList<>();
    try (Hook.Closeable ignored =
             Hook.EXEC_NODE_PHASE.addThread((Object[] args) -> {
               phases.add(args[0] + ":" + args[1]);
               if ((Integer) args[0] == 10
                   && args[1] == DebugAction.Phase.GETNEXT) {
                 ((Holder<Status>) args[2]).set(
                     Status.limitExceeded("too slow"));
               }
             })) {
      final LimitExceededException e =
          assertThrows(LimitExceededException.class, () ->
              run(except(10, ints(1, 1), ints(2, 2))));
      assertThat(e.getMessage(), is("too slow"));
    }
    assertThat(phases, hasItem("10:PREPARE"));
    assertThat(phases, hasItem("1:OPEN"));
    assertThat(phases, hasItem("2:GETNEXT"));
    assertThat(phases, hasItem("10:CLOSE"));
    assertThat(phases.indexOf("10:OPEN") < phases.indexOf("1:OPEN"),
        is(true));
  }
}

// End DebugActionTest.java
