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

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link Status}.
 */
class StatusTest {
  @Test void testOk() {
    assertThat(Status.OK.isOk(), is(true));
    assertThat(Status.of(Status.Code.OK, "ignored"), sameInstance(Status.OK));
    assertThat(Status.OK.toString(), is("OK"));
    assertThrows(IllegalStateException.class, Status.OK::toException);
  }

  @Test void testPredicates() {
    assertThat(Status.cancelled("c").isCancelled(), is(true));
    assertThat(Status.limitExceeded("l").isLimitExceeded(), is(true));
    assertThat(Status.memLimitExceeded("m").isLimitExceeded(), is(true));
    assertThat(Status.allocFailed("a").isLimitExceeded(), is(false));
    assertThat(Status.internalError("x").isOk(), is(false));
    assertThat(Status.initFailed("i").getCode(), is(Status.Code.INIT_FAILED));
  }

  /** Each failure code becomes the matching exception class. */
  @Test void testToException() {
    assertThat(Status.cancelled("c").toException(),
        instanceOf(CancelledException.class));
    assertThat(Status.limitExceeded("l").toException(),
        instanceOf(LimitExceededException.class));
    final SetOpsException e = Status.memLimitExceeded("m").toException();
    assertThat(e, instanceOf(LimitExceededException.class));
    assertThat(e.getCode(), is(Status.Code.MEM_LIMIT_EXCEEDED));
    assertThat(e.getMessage(), is("m"));

    final IllegalStateException cause = new IllegalStateException("boom");
    final SetOpsException e2 =
        Status.internalError("failed", cause).toException();
    assertThat(e2.getClass() == SetOpsException.class, is(true));
    assertThat(e2.getCause(), sameInstance(cause));
    assertThat(Status.allocFailed("a").toException().getCode(),
        is(Status.Code.MEM_ALLOC_FAILED));
  }

  @Test void testFromException() {
    final Status status =
        Status.fromException(new NumberFormatException("For input string"));
    assertThat(status.getCode(), is(Status.Code.INTERNAL_ERROR));
    assertThat(status.getMessage(),
        is("java.lang.NumberFormatException: For input string"));

    final SetOpsException e =
        new SetOpsException(Status.Code.INIT_FAILED, "bad plan", null);
    assertThat(Status.fromException(e).getCode(), is(Status.Code.INIT_FAILED));
    assertThat(e.toStatus(), is(Status.initFailed("bad plan")));
  }

  @Test void testEquals() {
    assertThat(Status.cancelled("x"), is(Status.cancelled("x")));
    assertThat(Status.cancelled("x").equals(Status.internalError("x")),
        is(false));
    assertThat(Status.cancelled("x").hashCode(),
        is(Status.cancelled("x").hashCode()));
    assertThat(Status.limitExceeded("too many").toString(),
        is("LIMIT_EXCEEDED: too many"));
  }

  @Test void testLimitExceededCode() {
    assertThrows(IllegalArgumentException.class, () ->
        new LimitExceededException(Status.Code.INTERNAL_ERROR, "x"));
  }
}

// End StatusTest.java
