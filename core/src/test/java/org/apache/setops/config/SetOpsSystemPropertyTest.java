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
package org.apache.setops.config;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Unit tests for {@link SetOpsSystemProperty}.
 */
class SetOpsSystemPropertyTest {
  /** Values come from the "setops.properties" file on the test class
   * path, or the defaults. */
  @Test void testValues() {
    assertThat(SetOpsSystemProperty.HASH_TABLE_INITIAL_BUCKETS.value(),
        is(16));
    assertThat(SetOpsSystemProperty.BATCH_SIZE.value(), is(4096));
    assertThat(SetOpsSystemProperty.BATCH_MAX_BYTES.value(),
        is(8L * 1024 * 1024));
    assertThat(SetOpsSystemProperty.DEBUG.value(), is(false));
    assertThat(SetOpsSystemProperty.MEM_LIMIT.value(), is(-1L));
  }

  @Test void testKey() {
    assertThat(SetOpsSystemProperty.BATCH_SIZE.key(), is("setops.batch.size"));
    assertThat(SetOpsSystemProperty.HASH_TABLE_INITIAL_BUCKETS.toString(),
        is("setops.hashtable.initial.buckets=16"));
  }
}

// End SetOpsSystemPropertyTest.java
