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

import org.apache.setops.runtime.MemoryTracker;
import org.apache.setops.util.Litmus;

import com.google.common.base.Preconditions;
import com.google.common.math.IntMath;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.BitSet;

import static java.util.Objects.requireNonNull;

/**
 * Hash table of rows, keyed by a comparison tuple, with a "matched" bit per
 * entry.
 *
 * <p>Rows are inserted from the build side; their key is computed by the
 * build {@link Scalar}. Rows of the probe side are looked up by a key
 * computed by the probe Scalar. Two keys are equal if their values are equal
 * column by column. Whether a null equals a null during {@link #find} is
 * fixed at construction.
 *
 * <p>Entries live in an arena of parallel arrays and are addressed by their
 * index, which never changes. Each bucket holds the index of the first entry
 * of its chain, and each entry the index of the next one. A {@link Cursor}
 * is an index into the arena.
 *
 * <p>Each entry is charged to the memory tracker at the width of the
 * comparison tuple, and the bucket array at four bytes per bucket. Closing
 * the table releases everything it charged.
 *
 * <p>Not thread-safe.
 */
public class RowHashTable {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(RowHashTable.class);

  /** Index that denotes "no entry". */
  private static final int NONE = -1;

  private static final double LOAD_FACTOR = 0.75d;

  private static final int MAX_BUCKETS = 1 << 30;

  private static final int INITIAL_ARENA_SIZE = 16;

  //~ Instance fields --------------------------------------------------------

  private final Scalar buildScalar;
  private final Scalar probeScalar;
  private final int tupleByteSize;
  private final boolean storesNulls;
  private final boolean findNulls;
  private final int id;
  private final MemoryTracker memoryTracker;
  private final int initialBuckets;
  private final Context context = new Context();
  private final Cursor end = new Cursor(NONE, null);

  private @Nullable Row[] rows = new Row[INITIAL_ARENA_SIZE];
  private @Nullable Row[] keys = new Row[INITIAL_ARENA_SIZE];
  private int[] hashes = new int[INITIAL_ARENA_SIZE];
  private int[] nextInChain = new int[INITIAL_ARENA_SIZE];
  private final BitSet matched = new BitSet();
  private int[] buckets;

  private int size;
  private int matchedCount;
  private long chargedBytes;
  private boolean closed;

  //~ Constructors -----------------------------------------------------------

  /**
   * Creates a RowHashTable.
   *
   * @param buildScalar    Computes the key of a build row
   * @param probeScalar    Computes the key of a probe row
   * @param tupleByteSize  Width of the comparison tuple, charged per entry
   * @param storesNulls    Whether to store build rows whose key contains a
   *                       null; if false, {@link #insert} skips them
   * @param findNulls      Whether a null key value equals a null key value
   *                       in {@link #find}
   * @param id             Identifies the table in diagnostics
   * @param memoryTracker  Tracker to charge
   * @param initialBuckets Hint for the initial number of buckets; rounded
   *                       up to a power of two
   */
  public RowHashTable(Scalar buildScalar, Scalar probeScalar,
      int tupleByteSize, boolean storesNulls, boolean findNulls, int id,
      MemoryTracker memoryTracker, int initialBuckets) {
    Preconditions.checkArgument(buildScalar.size() == probeScalar.size(),
        "build key has %s values, probe key has %s", buildScalar.size(),
        probeScalar.size());
    this.buildScalar = buildScalar;
    this.probeScalar = probeScalar;
    this.tupleByteSize = tupleByteSize;
    this.storesNulls = storesNulls;
    this.findNulls = findNulls;
    this.id = id;
    this.memoryTracker = requireNonNull(memoryTracker, "memoryTracker");
    this.initialBuckets = initialBuckets;
    this.buckets = newBuckets(bucketCount(initialBuckets));
  }

  /** Creates an empty table with the same parameters as this one but a
   * different probe side. */
  public RowHashTable withProbe(Scalar probeScalar) {
    return new RowHashTable(buildScalar, probeScalar, tupleByteSize,
        storesNulls, findNulls, id, memoryTracker, initialBuckets);
  }

  //~ Methods ----------------------------------------------------------------

  private static int bucketCount(int hint) {
    return IntMath.ceilingPowerOfTwo(Math.min(Math.max(hint, 1), MAX_BUCKETS));
  }

  private int[] newBuckets(int n) {
    memoryTracker.consume((long) n * Integer.BYTES);
    chargedBytes += (long) n * Integer.BYTES;
    final int[] newBuckets = new int[n];
    Arrays.fill(newBuckets, NONE);
    return newBuckets;
  }

  /** Inserts a build row. Returns false if the row was skipped because its
   * key contains a null and this table does not store nulls. */
  public boolean insert(Row row) {
    checkOpen();
    final Row key = buildScalar.project(context, row);
    if (!storesNulls && key.containsNull()) {
      return false;
    }
    append(row, key, hash(key));
    return true;
  }

  /** Inserts a build row unless an entry with an equal key exists. Returns
   * whether an entry was created.
   *
   * <p>Keys are compared with null equal to null, whatever the value of
   * {@code findNulls}, so duplicate keys that contain nulls collapse to one
   * entry. */
  public boolean insertUnique(Row row) {
    checkOpen();
    final Row key = buildScalar.project(context, row);
    if (!storesNulls && key.containsNull()) {
      return false;
    }
    final int hash = hash(key);
    if (firstEqual(buckets[hash & (buckets.length - 1)], key, hash)
        != NONE) {
      return false;
    }
    append(row, key, hash);
    return true;
  }

  /** Finds the entries whose key equals the probe key of a row. Returns
   * {@link #end()} if there are none. */
  public Cursor find(Row probeRow) {
    checkOpen();
    final Row key = probeScalar.project(context, probeRow);
    if (LOGGER.isTraceEnabled()) {
      LOGGER.trace("find row {} key {} in hash table {}", probeRow, key, id);
    }
    if (!findNulls && key.containsNull()) {
      return end;
    }
    final int hash = hash(key);
    final int index =
        firstEqual(buckets[hash & (buckets.length - 1)], key, hash);
    return index == NONE ? end : new Cursor(index, key);
  }

  /** Returns a cursor positioned on the first entry, in insertion order, or
   * at the end if the table is empty. */
  public Cursor begin() {
    checkOpen();
    return new Cursor(size == 0 ? NONE : 0, null);
  }

  /** Returns the cursor that is past the last entry. */
  public Cursor end() {
    return end;
  }

  /** Returns the number of entries. */
  public int size() {
    return size;
  }

  /** Returns the number of entries whose matched bit is set. */
  public int matchedCount() {
    return matchedCount;
  }

  /** Returns the number of entries whose matched bit is not set. */
  public int unmatchedCount() {
    return size - matchedCount;
  }

  public int getId() {
    return id;
  }

  /** Returns the number of buckets. */
  public int getBucketCount() {
    return buckets.length;
  }

  /** Releases the memory charged by this table. A closed table cannot be
   * used. Can be called more than once. */
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    memoryTracker.release(chargedBytes);
    chargedBytes = 0;
    rows = new Row[0];
    keys = new Row[0];
    hashes = new int[0];
    nextInChain = new int[0];
    buckets = new int[0];
    matched.clear();
  }

  public boolean isClosed() {
    return closed;
  }

  private void checkOpen() {
    Preconditions.checkState(!closed, "hash table %s is closed", id);
  }

  private static int hash(Row key) {
    final int h = key.hashCode();
    return h ^ (h >>> 16);
  }

  /** Returns the first entry, starting at {@code index} and following the
   * chain, whose key equals {@code key}, or {@link #NONE}. */
  private int firstEqual(int index, Row key, int hash) {
    for (int e = index; e != NONE; e = nextInChain[e]) {
      if (hashes[e] == hash && key.equals(keys[e])) {
        return e;
      }
    }
    return NONE;
  }

  private void append(Row row, Row key, int hash) {
    if (size == rows.length) {
      final int n = size * 2;
      rows = Arrays.copyOf(rows, n);
      keys = Arrays.copyOf(keys, n);
      hashes = Arrays.copyOf(hashes, n);
      nextInChain = Arrays.copyOf(nextInChain, n);
    }
    if (size + 1 > buckets.length * LOAD_FACTOR
        && buckets.length < MAX_BUCKETS) {
      rehash(buckets.length * 2);
    }
    final int index = size++;
    rows[index] = row;
    keys[index] = key;
    hashes[index] = hash;
    final int bucket = hash & (buckets.length - 1);
    nextInChain[index] = buckets[bucket];
    buckets[bucket] = index;
    memoryTracker.consume(tupleByteSize);
    chargedBytes += tupleByteSize;
  }

  private void rehash(int n) {
    final int[] newBuckets = newBuckets(n);
    for (int e = 0; e < size; e++) {
      final int bucket = hashes[e] & (n - 1);
      nextInChain[e] = newBuckets[bucket];
      newBuckets[bucket] = e;
    }
    memoryTracker.release((long) buckets.length * Integer.BYTES);
    chargedBytes -= (long) buckets.length * Integer.BYTES;
    buckets = newBuckets;
  }

  /**
   * Checks that the state of this table is consistent: the matched count
   * agrees with the matched bits, every entry is chained from the bucket
   * its hash selects, and the bytes charged agree with the bucket count and
   * size.
   *
   * <p>Takes time proportional to the number of buckets and entries.
   */
  public boolean isValid(Litmus litmus) {
    if (closed) {
      return litmus.fail("hash table {} is closed", id);
    }
    if (matchedCount != matched.cardinality()) {
      return litmus.fail("hash table {} has matched count {} but {} matched "
          + "bits", id, matchedCount, matched.cardinality());
    }
    if (matched.length() > size) {
      return litmus.fail("hash table {} has matched bit {} but {} entries",
          id, matched.length() - 1, size);
    }
    final long expectedBytes =
        (long) buckets.length * Integer.BYTES + (long) size * tupleByteSize;
    if (chargedBytes != expectedBytes) {
      return litmus.fail("hash table {} charged {} bytes, expected {}", id,
          chargedBytes, expectedBytes);
    }
    int chained = 0;
    for (int b = 0; b < buckets.length; b++) {
      for (int e = buckets[b]; e != NONE; e = nextInChain[e]) {
        if ((hashes[e] & (buckets.length - 1)) != b) {
          return litmus.fail("hash table {} has entry {} in bucket {}", id, e,
              b);
        }
        if (++chained > size) {
          return litmus.fail("hash table {} has a cycle in bucket {}", id, b);
        }
      }
    }
    return litmus.check(chained == size,
        "hash table {} has {} entries but {} are chained", id, size, chained);
  }

  @Override public String toString() {
    return "RowHashTable(id=" + id + ", size=" + size + ", matched="
        + matchedCount + ", buckets=" + buckets.length + ")";
  }

  /** Position in a {@link RowHashTable}.
   *
   * <p>A cursor from {@link #begin()} visits every entry in insertion
   * order; a cursor from {@link #find} visits the entries whose key equals
   * the probe key. */
  public final class Cursor {
    private int index;
    private final @Nullable Row key;

    private Cursor(int index, @Nullable Row key) {
      this.index = index;
      this.key = key;
    }

    /** Returns whether this cursor is positioned on an entry, that is,
     * whether it has not reached the end. */
    public boolean hasNext() {
      return index != NONE;
    }

    /** Moves to the next entry. */
    public void next() {
      Preconditions.checkState(index != NONE, "cursor is at end");
      if (key == null) {
        index = index + 1 < size ? index + 1 : NONE;
      } else {
        index = firstEqual(nextInChain[index], key, hashes[index]);
      }
    }

    /** Returns the build row of the current entry. */
    public Row getRow() {
      return requireNonNull(rows[checkIndex()]);
    }

    /** Returns the key of the current entry, as computed by the build
     * scalar. */
    public Row getKey() {
      return requireNonNull(keys[checkIndex()]);
    }

    public boolean matched() {
      return matched.get(checkIndex());
    }

    /** Sets the matched bit of the current entry. */
    public void setMatched() {
      final int i = checkIndex();
      if (!matched.get(i)) {
        matched.set(i);
        ++matchedCount;
      }
    }

    private int checkIndex() {
      checkOpen();
      Preconditions.checkState(index != NONE, "cursor is at end");
      return index;
    }

    private RowHashTable table() {
      return RowHashTable.this;
    }

    @Override public boolean equals(@Nullable Object o) {
      return o == this
          || o instanceof Cursor
          && ((Cursor) o).table() == RowHashTable.this
          && ((Cursor) o).index == index;
    }

    @Override public int hashCode() {
      return index;
    }

    @Override public String toString() {
      return index == NONE ? "end" : "entry " + index;
    }
  }
}

// End RowHashTable.java
