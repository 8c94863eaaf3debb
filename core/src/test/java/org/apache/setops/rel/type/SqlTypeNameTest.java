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

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link SqlTypeName} and {@link RelDataType}.
 */
class SqlTypeNameTest {
  @Test void testAssignable() {
    assertThat(SqlTypeName.BIGINT.isAssignableFrom(SqlTypeName.INTEGER),
        is(true));
    assertThat(SqlTypeName.INTEGER.isAssignableFrom(SqlTypeName.BIGINT),
        is(false));
    assertThat(SqlTypeName.DOUBLE.isAssignableFrom(SqlTypeName.BIGINT),
        is(true));
    assertThat(SqlTypeName.DECIMAL.isAssignableFrom(SqlTypeName.DOUBLE),
        is(false));
    assertThat(SqlTypeName.DATE.isAssignableFrom(SqlTypeName.NULL), is(true));
    assertThat(SqlTypeName.VARCHAR.isAssignableFrom(SqlTypeName.INTEGER),
        is(false));
  }

  @Test void testCastable() {
    assertThat(SqlTypeName.INTEGER.isCastableFrom(SqlTypeName.DOUBLE),
        is(true));
    assertThat(SqlTypeName.DATE.isCastableFrom(SqlTypeName.VARCHAR),
        is(true));
    assertThat(SqlTypeName.BOOLEAN.isCastableFrom(SqlTypeName.INTEGER),
        is(false));
  }

  @Test void testConvert() {
    assertThat(SqlTypeName.BIGINT.convert(3), is(3L));
    assertThat(SqlTypeName.INTEGER.convert(3.9d), is(3));
    assertThat(SqlTypeName.DECIMAL.convert("1.500"),
        is(new BigDecimal("1.5")));
    assertThat(SqlTypeName.DECIMAL.convert(2.5d), is(new BigDecimal("2.5")));
    assertThat(SqlTypeName.VARCHAR.convert(LocalDate.of(2020, 1, 2)),
        is("2020-01-02"));
    assertThat(SqlTypeName.BOOLEAN.convert(" true "), is(true));
    assertThat(SqlTypeName.DATE.convert(null), nullValue());
    assertThrows(NumberFormatException.class, () ->
        SqlTypeName.INTEGER.convert("x"));
    assertThrows(IllegalArgumentException.class, () ->
        SqlTypeName.DATE.convert(3));
  }

  /** Values that compare equal as SQL values normalize to equal Java
   * objects. */
  @Test void testNormalize() {
    assertThat(SqlTypeName.normalize(new BigDecimal("1.0")),
        is(SqlTypeName.normalize(new BigDecimal("1.00"))));
    assertThat(SqlTypeName.normalize(new BigDecimal("0.000")),
        is(BigDecimal.ZERO));
    assertThat(SqlTypeName.normalize(-0.0d), is(0.0d));
    assertThat(SqlTypeName.normalize("a"), is("a"));
  }

  @Test void testLookup() {
    assertThat(SqlTypeName.ofValue(1), is(SqlTypeName.INTEGER));
    assertThat(SqlTypeName.ofValue("s"), is(SqlTypeName.VARCHAR));
    assertThat(SqlTypeName.ofValue(null), is(SqlTypeName.NULL));
    assertThat(SqlTypeName.ofValue(new Object()), nullValue());
    assertThat(SqlTypeName.get("decimal"), is(SqlTypeName.DECIMAL));
    assertThat(SqlTypeName.get("blob"), nullValue());
  }

  @Test void testRowType() {
    final RelDataType rowType = RelDataType.builder(4)
        .add("ID", SqlTypeName.INTEGER, false)
        .add("NAME", SqlTypeName.VARCHAR)
        .build();
    assertThat(rowType.getTupleId(), is(4));
    assertThat(rowType.getFieldCount(), is(2));
    assertThat(rowType.getByteSize(), is(4 + 16 + 1));
    assertThat(rowType.getField(1).getIndex(), is(1));
    assertThat(rowType.toString(),
        is("RecordType(INTEGER NOT NULL ID, VARCHAR NAME)"));
    assertThat(rowType,
        is(RelDataType.builder(4)
            .add("ID", SqlTypeName.INTEGER, false)
            .add("NAME", SqlTypeName.VARCHAR)
            .build()));
    assertThat(rowType.equals(RelDataType.builder(5)
            .add("ID", SqlTypeName.INTEGER, false)
            .add("NAME", SqlTypeName.VARCHAR)
            .build()),
        is(false));
  }
}

// End SqlTypeNameTest.java
