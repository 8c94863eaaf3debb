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
package org.apache.setops.rel.type;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Enumeration of the column types a comparison tuple may hold.
 *
 * <p>Each type has the Java class of its values and the number of bytes a
 * value occupies in a fixed-layout tuple. Variable-length values (VARCHAR)
 * count the size of their slot, not of their characters.
 */
public enum SqlTypeName {
  BOOLEAN(Boolean.class, 1),
  INTEGER(Integer.class, 4),
  BIGINT(Long.class, 8),
  DECIMAL(BigDecimal.class, 16),
  DOUBLE(Double.class, 8),
  DATE(LocalDate.class, 4),
  VARCHAR(String.class, 16),
  /** Type of the NULL literal; assignable to every other type. */
  NULL(Void.class, 0);

  private final Class<?> javaClass;
  private final int byteSize;

  SqlTypeName(Class<?> javaClass, int byteSize) {
    this.javaClass = javaClass;
    this.byteSize = byteSize;
  }

  public Class<?> getJavaClass() {
    return javaClass;
  }

  /** Returns the width of a value of this type in a fixed-layout tuple. */
  public int getByteSize() {
    return byteSize;
  }

  public boolean isNumeric() {
    switch (this) {
    case INTEGER:
    case BIGINT:
    case DECIMAL:
    case DOUBLE:
      return true;
    default:
      return false;
    }
  }

  /** Returns whether a value of type {@code from} may be stored in a column
   * of this type without an explicit cast. Numeric types widen:
   * INTEGER to BIGINT, DECIMAL or DOUBLE; BIGINT to DECIMAL or DOUBLE. */
  public boolean isAssignableFrom(SqlTypeName from) {
    if (from == this || from == NULL) {
      return true;
    }
    switch (this) {
    case BIGINT:
      return from == INTEGER;
    case DECIMAL:
    case DOUBLE:
      return from == INTEGER || from == BIGINT;
    default:
      return false;
    }
  }

  /** Returns whether an explicit cast from {@code from} to this type is
   * allowed. */
  public boolean isCastableFrom(SqlTypeName from) {
    if (isAssignableFrom(from) || this == VARCHAR || from == VARCHAR) {
      return true;
    }
    return isNumeric() && from.isNumeric();
  }

  /** Converts a value to this type.
   *
   * <p>The value must be null or an instance of the Java class of a type from
   * which {@link #isCastableFrom} allows a cast.
   *
   * @throws NumberFormatException if a string does not represent a number
   * @throws java.time.format.DateTimeParseException if a string does not
   * represent a date
   * @throws IllegalArgumentException if the conversion is not supported
   */
  public @Nullable Object convert(@Nullable Object value) {
    if (value == null || javaClass.isInstance(value)) {
      return normalize(value);
    }
    switch (this) {
    case VARCHAR:
      return value.toString();
    case BOOLEAN:
      if (value instanceof String) {
        return Boolean.valueOf(((String) value).trim());
      }
      break;
    case INTEGER:
      if (value instanceof String) {
        return Integer.valueOf(((String) value).trim());
      }
      if (value instanceof Number) {
        return ((Number) value).intValue();
      }
      break;
    case BIGINT:
      if (value instanceof String) {
        return Long.valueOf(((String) value).trim());
      }
      if (value instanceof Number) {
        return ((Number) value).longValue();
      }
      break;
    case DOUBLE:
      if (value instanceof String) {
        return normalize(Double.valueOf(((String) value).trim()));
      }
      if (value instanceof Number) {
        return normalize(((Number) value).doubleValue());
      }
      break;
    case DECIMAL:
      if (value instanceof String) {
        return normalize(new BigDecimal(((String) value).trim()));
      }
      if (value instanceof Double) {
        return normalize(BigDecimal.valueOf((Double) value));
      }
      if (value instanceof Number) {
        return normalize(BigDecimal.valueOf(((Number) value).longValue()));
      }
      break;
    case DATE:
      if (value instanceof String) {
        return LocalDate.parse(((String) value).trim());
      }
      break;
    default:
      break;
    }
    throw new IllegalArgumentException("cannot convert "
        + value.getClass().getSimpleName() + " value '" + value + "' to "
        + this);
  }

  /** Brings a value of this type to the canonical form used for equality
   * and hashing: DECIMAL values lose trailing zeros (so that 1.0 equals
   * 1.00) and DOUBLE negative zero becomes zero. */
  public static @Nullable Object normalize(@Nullable Object value) {
    if (value instanceof BigDecimal) {
      final BigDecimal d = (BigDecimal) value;
      return d.signum() == 0 ? BigDecimal.ZERO : d.stripTrailingZeros();
    }
    if (value instanceof Double && (Double) value == 0d) {
      return 0d;
    }
    return value;
  }

  /** Returns the type of a Java value, or null if no type holds it. */
  public static @Nullable SqlTypeName ofValue(@Nullable Object value) {
    if (value == null) {
      return NULL;
    }
    for (SqlTypeName typeName : values()) {
      if (typeName != NULL && typeName.javaClass.isInstance(value)) {
        return typeName;
      }
    }
    return null;
  }

  /** Looks up a type by name, ignoring case; returns null if there is no
   * such type. */
  public static @Nullable SqlTypeName get(String name) {
    try {
      return valueOf(name.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}

// End SqlTypeName.java
