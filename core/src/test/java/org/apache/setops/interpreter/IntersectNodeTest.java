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

import org.apache.setops.runtime.Hook;
import org.apache.setops.runtime.SetOpsException;
import org.apache.setops.runtime.Status;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.apache.setops.interpreter.SetOpFixtures.column;
import static org.apache.setops.interpreter.SetOpFixtures.context;
import static org.apache.setops.interpreter.SetOpFixtures.ints;
import static org.apache.setops.interpreter.SetOpFixtures.intersect;
import static org.apache.setops.interpreter.SetOpFixtures.plan;
import static org.apache.setops.interpreter.SetOpFixtures.range;
import static org.apache.setops.interpreter.SetOpFixtures.run;
import static org.apache.setops.interpreter.SetOpFixtures.sorted;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link IntersectNode}.
 */
class IntersectNodeTest {
  @Test void testTwoChildren() {
    final List<Row> rows =
        run(intersect(10, ints(1, 1, 2, 3, 4), ints(2, 4, 2, 9)));
    assertThat(sorted(column(rows)), is(ImmutableList.of(2, 4)));
  }

  @Test void testThreeChildren() {
    final List<Row> rows =
        run(intersect(10, range(1, 1, 10), range(2, 3, 12), range(3, 0, 5)));
    assertThat(sorted(column(rows)), is(ImmutableList.of(3, 4, 5)));
  }

  /** Once a child matches nothing, the result is empty and later children
   * are not opened. */
  @Test void testNoMatchStopsEarly() {
    final SetOpFixtures.ScriptedNode last =
        new SetOpFixtures.ScriptedNode(range(3, 1, 10));
    final List<Row> rows =
        run(intersect(10, range(1, 1, 5), ints(2, 7, 8), last));
    assertThat(rows, empty());
    assertThat(last.opens, is(0));
    assertThat(last.closed, is(true));
  }

  @Test void testDuplicates() {
    final List<Row> rows =
        run(intersect(10, ints(1, 3, 3, 1, 3), ints(2, 3, 3, 3)));
    assertThat(column(rows), is(Arrays.<Object>asList(3)));
  }

  /** The rebuild before each later child keeps only the entries the previous
   * child matched. */
  @Test void testRebuildKeepsMatched() {
    final List<Integer> sizes = new ArrayList<>();
    final List<Row> rows;
    try (Hook.Closeable ignored =
             Hook.HASH_TABLE_REBUILT.addThread((Object[] args) ->
                 sizes.add((Integer) args[2]))) {
      rows = run(
          intersect(10, range(1, 1, 10), range(2, 2, 8), range(3, 4, 20),
              ints(4, 5, 6, 100)));
    }
    assertThat(sizes, is(Arrays.asList(7, 5)));
    assertThat(sorted(column(rows)), is(ImmutableList.of(5, 6)));
  }

  /** A null matches a null unless {@code findNulls} is false. */
  @Test void testNulls() {
    final List<Row> rows =
        run(intersect(10, ints(1, null, 1, 2), ints(2, null, 2)));
    assertThat(rows, hasSize(2));
    assertThat(rows.contains(Row.of((Object) null)), is(true));

    final AbstractNode node =
        Nodes.create(plan(10, SetOp.Kind.INTERSECT, 2).findNulls(false).build(),
            Arrays.asList(ints(1, null, 1, 2), ints(2, null, 2)));
    assertThat(column(run(node)), is(Arrays.<Object>asList(2)));
  }

  @Test void testLimit() {
    final AbstractNode node =
        Nodes.create(plan(10, SetOp.Kind.INTERSECT, 2).limit(2).build(),
            Arrays.asList(range(1, 1, 10), range(2, 1, 10)));
    final List<Row> rows = run(context().batchSize(3).build(), node);
    assertThat(rows, hasSize(2));
    assertThat(node.getProfile().values().get("RowsReturned"), is(2L));
  }

  /** An empty first child gives an empty result without opening the
   * others. */
  @Test void testEmptyAnchor() {
    final SetOpFixtures.ScriptedNode other =
        new SetOpFixtures.ScriptedNode(range(2, 1, 3));
    assertThat(run(intersect(10, ints(1), other)), empty());
    assertThat(other.opens, is(0));
  }

  @Test void testWrongKind() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            new IntersectNode(plan(10, SetOp.Kind.EXCEPT, 2).build(),
                Arrays.asList(ints(1, 1), ints(2, 1))));
    assertThat(e.getMessage(), containsString("not an INTERSECT plan"));
  }

  @Test void testInitFailure() {
    final SetOpsException e = assertThrows(SetOpsException.class, () ->
        Nodes.create(plan(10, SetOp.Kind.INTERSECT, 3).build(),
            Arrays.asList(ints(1, 1), ints(2, 1))));
    assertThat(e.getCode(), is(Status.Code.INIT_FAILED));
    assertThat(e.getMessage(),
        is("INTERSECT_NODE (id=10) has 2 children but 3 expression lists"));
  }

  /** Intersecting with the same input twice gives its distinct rows, and
   * the hash table is released on close. */
  @Test void testSelfIntersection() {
    final ExecutionContext context = context().batchSize(5).build();
    final List<Row> rows =
        run(context, intersect(10, ints(1, 4, 4, 2, 9), ints(2, 4, 4, 2, 9)));
    assertThat(column(rows), is(Arrays.<Object>asList(4, 2, 9)));
    assertThat(context.getMemoryTracker().getConsumption(), is(0L));
    assertThat(context.getMemoryTracker().getPeakConsumption() > 0, is(true));
  }
}

// End IntersectNodeTest.java
