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

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link MemoryTracker}.
 */
class MemoryTrackerTest {
  @Test void testConsumeAndRelease() {
    final MemoryTracker root = new MemoryTracker("query", 1000, null);
    final MemoryTracker child = root.newChild("node");
    child.consume(300);
    assertThat(child.getConsumption(), is(300L));
    assertThat(root.getConsumption(), is(300L));
    child.release(200);
    assertThat(root.getConsumption(), is(100L));
    assertThat(root.getPeakConsumption(), is(300L));
    assertThrows(IllegalArgumentException.class, () -> child.consume(-1));
  }

  /** {@link MemoryTracker#consume} may go over a limit, and the tracker
   * reports the closest ancestor that is over. */
  @Test void testLimitExceeded() {
    final MemoryTracker root = new MemoryTracker("query", 1000, null);
    final MemoryTracker child = root.newChild("node");
    assertThat(child.limitExceeded(), is(false));
    child.consume(1001);
    assertThat(child.limitExceeded(), is(true));
    assertThat(child.findLimitExceeded(), sameInstance(root));

    final MemoryTracker limited = root.newChild("limited", 10);
    limited.consume(11);
    assertThat(limited.findLimitExceeded(), sameInstance(limited));
  }

  @Test void testTryConsume() {
    final MemoryTracker root = new MemoryTracker("query", 100, null);
    final MemoryTracker child = root.newChild("node", 50);
    assertThat(child.tryConsume(40), is(true));
    assertThat(child.tryConsume(20), is(false));
    assertThat(root.tryConsume(60), is(true));
    assertThat(root.tryConsume(1), is(false));
    assertThat(child.getConsumption(), is(40L));
    assertThat(root.getConsumption(), is(100L));
    assertThat(root.findLimitExceeded(), nullValue());
  }

  @Test void testNoLimit() {
    final MemoryTracker tracker = new MemoryTracker("query", -1, null);
    assertThat(tracker.hasLimit(), is(false));
    assertThat(tracker.tryConsume(Long.MAX_VALUE / 2), is(true));
    assertThat(tracker.limitExceeded(), is(false));
    // Without a configured limit, the default tracker has none
    assertThat(new MemoryTracker("query").getLimit(), is(-1L));
  }
}

// End MemoryTrackerTest.java
