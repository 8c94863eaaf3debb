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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiled scalar expression.
 *
 * <p>A Scalar computes a fixed number of values from the row in
 * {@link Context#values}. Set operators use one per child to compute the
 * comparison tuple of a row.
 */
public interface Scalar {
  /** Evaluates the expressions, writing one value per expression into
   * {@code results}. */
  void execute(Context context, @Nullable Object[] results);

  /** Returns the number of values computed by {@link #execute}. */
  int size();

  /** Computes the values for a given row, as a new row. */
  default Row project(Context context, Row row) {
    context.values = row.getValues();
    final Object[] results = new Object[size()];
    execute(context, results);
    return new Row(results);
  }
}

// End Scalar.java
