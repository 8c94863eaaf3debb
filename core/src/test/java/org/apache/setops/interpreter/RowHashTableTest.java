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
import org.apache.setops.rel.type.SqlTypeName;
import org.apache.setops.rex.RexInputRef;
import org.apache.setops.runtime.MemoryTracker;
import org.apache.setops.util.Litmus;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.apache.setops.interpreter.SetOpFixtures.INT_ROW;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link RowHashTable}.
 */
class RowHashTableTest {
  /** Rows of (key, payload); the key is the first column. */
  private static final RelDataType PAIR_ROW = RelDataType.builder(1)
      .add("K", SqlTypeName.INTEGER)
      .add("V", SqlTypeName.VARCHAR)
      .build();

  private static final int TUPLE_BYTES = INT_ROW.getByteSize();

  private MemoryTracker tracker;

  @BeforeEach void setUp() {
    tracker = new MemoryTracker("test", -1, null);
  }

  private static Scalar identity() {
    return new ScalarCompiler("identity")
        .compile(Nodes.identity(INT_ROW), INT_ROW, INT_ROW);
  }

  private static Scalar pairKey() {
    return new ScalarCompiler("pair key")
        .compile(ImmutableList.of(RexInputRef.of(0, PAIR_ROW)), PAIR_ROW,
            INT_ROW);
  }

  private RowHashTable table(boolean storesNulls, boolean findNulls,
      int buckets) {
    return new RowHashTable(identity(), identity(), TUPLE_BYTES, storesNulls,
        findNulls, 1, tracker, buckets);
  }

  @Test void testInsertUnique() {
    final RowHashTable table = table(true, true, 16);
    assertThat(table.insertUnique(Row.of(1)), is(true));
    assertThat(table.insertUnique(Row.of(2)), is(true));
    assertThat(table.insertUnique(Row.of(1)), is(false));
    assertThat(table.insertUnique(Row.of((Object) null)), is(true));
    assertThat(table.insertUnique(Row.of((Object) null)), is(false));
    assertThat(table.size(), is(3));
  }

  /** {@link RowHashTable#insert} keeps duplicate keys, and a cursor from
   * {@link RowHashTable#find} visits each of them. */
  @Test void testFindDuplicates() {
    final RowHashTable table =
        new RowHashTable(pairKey(), identity(), TUPLE_BYTES, true, true, 1,
            tracker, 4);
    table.insert(Row.of(1, "a"));
    table.insert(Row.of(2, "b"));
    table.insert(Row.of(1, "c"));
    final List<Object> payloads = new ArrayList<>();
    for (RowHashTable.Cursor cursor = table.find(Row.of(1));
         cursor.hasNext(); cursor.next()) {
      assertThat(cursor.getKey(), is(Row.of(1)));
      payloads.add(cursor.getRow().getObject(1));
    }
    assertThat(payloads.size(), is(2));
    assertThat(payloads.contains("a") && payloads.contains("c"), is(true));
    assertThat(table.find(Row.of(3)), is(table.end()));
  }

  @Test void testFindNulls() {
    final RowHashTable table = table(true, true, 16);
    table.insertUnique(Row.of((Object) null));
    assertThat(table.find(Row.of((Object) null)).hasNext(), is(true));

    final RowHashTable table2 = table(true, false, 16);
    table2.insertUnique(Row.of((Object) null));
    assertThat(table2.size(), is(1));
    assertThat(table2.find(Row.of((Object) null)), is(table2.end()));
  }

  @Test void testStoresNulls() {
    final RowHashTable table = table(false, true, 16);
    assertThat(table.insert(Row.of((Object) null)), is(false));
    assertThat(table.insertUnique(Row.of((Object) null)), is(false));
    assertThat(table.insert(Row.of(1)), is(true));
    assertThat(table.size(), is(1));
  }

  @Test void testMatched() {
    final RowHashTable table = table(true, true, 16);
    for (int i = 0; i < 5; i++) {
      table.insertUnique(Row.of(i));
    }
    assertThat(table.matchedCount(), is(0));
    final RowHashTable.Cursor cursor = table.find(Row.of(3));
    assertThat(cursor.matched(), is(false));
    cursor.setMatched();
    cursor.setMatched();
    assertThat(cursor.matched(), is(true));
    table.find(Row.of(0)).setMatched();
    assertThat(table.matchedCount(), is(2));
    assertThat(table.unmatchedCount(), is(3));

    final List<Object> unmatched = new ArrayList<>();
    for (RowHashTable.Cursor c = table.begin(); c.hasNext(); c.next()) {
      if (!c.matched()) {
        unmatched.add(c.getRow().getObject(0));
      }
    }
    assertThat(unmatched, is(ImmutableList.<Object>of(1, 2, 4)));
  }

  /** A traversal visits the entries in the order they were inserted, also
   * after the bucket array has grown. */
  @Test void testGrowth() {
    final RowHashTable table = table(true, true, 4);
    assertThat(table.getBucketCount(), is(4));
    for (int i = 0; i < 100; i++) {
      table.insertUnique(Row.of(i * 7 % 100));
    }
    assertThat(table.size(), is(100));
    assertThat(table.getBucketCount(), is(256));
    int n = 0;
    for (RowHashTable.Cursor c = table.begin(); c.hasNext(); c.next()) {
      assertThat(c.getRow(), is(Row.of(n * 7 % 100)));
      assertThat(table.find(c.getRow()), is(c));
      ++n;
    }
    assertThat(n, is(100));
  }

  @Test void testMemoryAccounting() {
    final RowHashTable table = table(true, true, 10);
    assertThat(table.getBucketCount(), is(16));
    assertThat(tracker.getConsumption(), is(16L * 4));
    for (int i = 0; i < 10; i++) {
      table.insertUnique(Row.of(i));
    }
    table.insertUnique(Row.of(3));
    assertThat(tracker.getConsumption(), is(16L * 4 + 10L * TUPLE_BYTES));
    for (int i = 10; i < 13; i++) {
      table.insertUnique(Row.of(i));
    }
    assertThat(table.getBucketCount(), is(32));
    assertThat(tracker.getConsumption(), is(32L * 4 + 13L * TUPLE_BYTES));
    table.close();
    table.close();
    assertThat(tracker.getConsumption(), is(0L));
  }

  /** A table made by {@link RowHashTable#withProbe} is empty and charges the
   * same tracker. */
  @Test void testWithProbe() {
    final RowHashTable table = table(true, true, 4);
    table.insertUnique(Row.of(1));
    final RowHashTable table2 = table.withProbe(identity());
    assertThat(table2.size(), is(0));
    assertThat(table2.getBucketCount(), is(4));
    table2.insert(Row.of(1));
    assertThat(table2.find(Row.of(1)).hasNext(), is(true));
    table.close();
    assertThat(tracker.getConsumption(), is(4L * 4 + TUPLE_BYTES));
    table2.close();
    assertThat(tracker.getConsumption(), is(0L));
  }

  /** A table stays consistent through growth, skipped nulls and matching,
   * and a closed table is not valid. */
  @Test void testIsValid() {
    final List<String> failures = new ArrayList<>();
    final Litmus litmus = (message, args) -> {
      failures.add(String.valueOf(Litmus.format(message, args)));
      return false;
    };
    final RowHashTable table = table(false, false, 4);
    assertThat(table.isValid(litmus), is(true));
    for (int i = 0; i < 50; i++) {
      table.insert(Row.of(i % 20));
    }
    assertThat(table.insert(Row.of((Object) null)), is(false));
    for (int i = 0; i < 10; i++) {
      for (RowHashTable.Cursor c = table.find(Row.of(i)); c.hasNext();
           c.next()) {
        c.setMatched();
        c.setMatched();
      }
    }
    assertThat(table.size(), is(50));
    assertThat(table.matchedCount(), is(30));
    assertThat(table.isValid(litmus), is(true));
    assertThat(failures.isEmpty(), is(true));

    table.close();
    assertThat(table.isValid(litmus), is(false));
    assertThat(failures, is(ImmutableList.of("hash table 1 is closed")));
  }

  @Test void testClosed() {
    final RowHashTable table = table(true, true, 4);
    table.insertUnique(Row.of(1));
    final RowHashTable.Cursor cursor = table.begin();
    table.close();
    assertThat(table.isClosed(), is(true));
    assertThrows(IllegalStateException.class, () -> table.insert(Row.of(2)));
    assertThrows(IllegalStateException.class, () -> table.find(Row.of(1)));
    assertThrows(IllegalStateException.class, cursor::getRow);
  }

  @Test void testCursorAtEnd() {
    final RowHashTable table = table(true, true, 4);
    final RowHashTable.Cursor cursor = table.begin();
    assertThat(cursor.hasNext(), is(false));
    assertThat(cursor, is(table.end()));
    assertThrows(IllegalStateException.class, cursor::next);
    assertThrows(IllegalStateException.class, cursor::getKey);
    table.insertUnique(Row.of(1));
    assertThat(table.begin(), not(table.end()));
  }
}

// End RowHashTableTest.java
