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

import com.google.common.base.MoreObjects;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.IntPredicate;
import java.util.function.LongPredicate;

import static java.util.Objects.requireNonNull;

/**
 * A system property that configures the execution runtime.
 *
 * <p>Properties must be in the "setops" root namespace. Values are read once,
 * from the file <code>setops.properties</code> on the classpath (if present),
 * then overridden by JVM system properties.</p>
 *
 * @param <T> the type of the property value
 */
public final class SetOpsSystemProperty<T> {
  /**
   * Holds all system properties related to the runtime.
   */
  private static final Properties PROPERTIES = loadProperties();

  /**
   * Whether to run in debug mode.
   *
   * <p>In debug mode exceptions are logged at ERROR level when they are
   * created. It is also the default of
   * {@link org.apache.setops.interpreter.ExecutionContext#isDebug()}, under
   * which set operators verify their hash table after each pass.</p>
   */
  public static final SetOpsSystemProperty<Boolean> DEBUG =
      booleanProperty("setops.debug", false);

  /**
   * Default number of rows in a row batch.
   *
   * <p>An {@link org.apache.setops.interpreter.ExecutionContext} may override
   * it. The value must be positive.</p>
   */
  public static final SetOpsSystemProperty<Integer> BATCH_SIZE =
      intProperty("setops.batch.size", 4096, v -> v > 0);

  /**
   * Default byte budget of a row batch. Once the estimated size of its rows
   * reaches the budget, a batch is at its resource limit, and operators stop
   * adding rows to it even if it has free row slots.
   */
  public static final SetOpsSystemProperty<Long> BATCH_MAX_BYTES =
      longProperty("setops.batch.max.bytes", 8L * 1024 * 1024, v -> v > 0);

  /**
   * Initial number of buckets of a set operation hash table.
   *
   * <p>It is a hint; the table rounds it up to a power of two and grows as
   * rows are inserted.</p>
   */
  public static final SetOpsSystemProperty<Integer> HASH_TABLE_INITIAL_BUCKETS =
      intProperty("setops.hashtable.initial.buckets", 1024, v -> v > 0);

  /**
   * Memory limit, in bytes, of a root memory tracker created without an
   * explicit limit.
   *
   * <p>If the value is less than 0, there is no limit.</p>
   */
  public static final SetOpsSystemProperty<Long> MEM_LIMIT =
      longProperty("setops.mem.limit", -1L, v -> true);

  private static SetOpsSystemProperty<Boolean> booleanProperty(String key,
      boolean defaultValue) {
    // Note that "" -> true (convenient for command-lines flags like '-Dflag')
    return new SetOpsSystemProperty<>(key,
        v -> v == null ? defaultValue
            : "".equals(v) || Boolean.parseBoolean(v));
  }

  /**
   * Returns the value of the system property with the specified name as {@code
   * int}. If any of the conditions below hold, returns the
   * <code>defaultValue</code>:
   *
   * <ol>
   * <li>the property is not defined;
   * <li>the property value cannot be transformed to an int;
   * <li>the property value does not satisfy the checker.
   * </ol>
   */
  private static SetOpsSystemProperty<Integer> intProperty(String key,
      int defaultValue, IntPredicate valueChecker) {
    return new SetOpsSystemProperty<>(key, v -> {
      if (v == null) {
        return defaultValue;
      }
      try {
        int intVal = Integer.parseInt(v.trim());
        return valueChecker.test(intVal) ? intVal : defaultValue;
      } catch (NumberFormatException nfe) {
        return defaultValue;
      }
    });
  }

  /** As {@link #intProperty(String, int, IntPredicate)}, for {@code long}
   * values. */
  private static SetOpsSystemProperty<Long> longProperty(String key,
      long defaultValue, LongPredicate valueChecker) {
    return new SetOpsSystemProperty<>(key, v -> {
      if (v == null) {
        return defaultValue;
      }
      try {
        long longVal = Long.parseLong(v.trim());
        return valueChecker.test(longVal) ? longVal : defaultValue;
      } catch (NumberFormatException nfe) {
        return defaultValue;
      }
    });
  }

  private static Properties loadProperties() {
    Properties fileProperties = new Properties();
    ClassLoader classLoader = MoreObjects.firstNonNull(
        Thread.currentThread().getContextClassLoader(),
        SetOpsSystemProperty.class.getClassLoader());
    // Read properties from the file "setops.properties", if it exists in classpath
    try (InputStream stream = requireNonNull(classLoader, "classLoader")
        .getResourceAsStream("setops.properties")) {
      if (stream != null) {
        fileProperties.load(stream);
      }
    } catch (IOException e) {
      throw new RuntimeException("while reading from setops.properties file", e);
    }

    final Properties allProperties = new Properties();
    fileProperties.stringPropertyNames().forEach(key -> {
      if (key.startsWith("setops.")) {
        allProperties.setProperty(key, fileProperties.getProperty(key));
      }
    });
    System.getProperties().stringPropertyNames().forEach(key -> {
      if (key.startsWith("setops.")) {
        allProperties.setProperty(key, System.getProperty(key));
      }
    });
    return allProperties;
  }

  private final String key;
  private final T value;

  private SetOpsSystemProperty(String key,
      Function<? super @Nullable String, ? extends T> valueParser) {
    this.key = key;
    this.value = valueParser.apply(PROPERTIES.getProperty(key));
  }

  /** Returns the name of this property, for example "setops.batch.size". */
  public String key() {
    return key;
  }

  /**
   * Returns the value of this property.
   *
   * @return the value of this property, or its default value if the property
   * is not set or its value is not valid
   */
  public T value() {
    return value;
  }

  @Override public String toString() {
    return key + "=" + value;
  }
}

// End SetOpsSystemProperty.java
