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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of an operator call: either success or a typed failure.
 *
 * <p>Operators never throw across their boundary. Each lifecycle method
 * returns a Status, and the caller returns any non-OK status unchanged:
 *
 * <blockquote><pre>
 * Status status = child.open(context);
 * if (!status.isOk()) {
 *   return status;
 * }</pre>
 * </blockquote>
 *
 * <p>The code that drives a tree of operators turns a failed status into an
 * exception by calling {@link #toException()}.
 */
public final class Status {
  /** The successful status. */
  public static final Status OK = new Status(Code.OK, "", null);

  private final Code code;
  private final String message;
  private final @Nullable Throwable cause;

  private Status(Code code, String message, @Nullable Throwable cause) {
    this.code = requireNonNull(code, "code");
    this.message = requireNonNull(message, "message");
    this.cause = cause;
  }

  /** Creates a status with a given code. Use {@link #OK} for success. */
  public static Status of(Code code, String message) {
    if (code == Code.OK) {
      return OK;
    }
    return new Status(code, message, null);
  }

  public static Status initFailed(String message) {
    return new Status(Code.INIT_FAILED, message, null);
  }

  public static Status initFailed(String message, Throwable cause) {
    return new Status(Code.INIT_FAILED, message, cause);
  }

  public static Status cancelled(String message) {
    return new Status(Code.CANCELLED, message, null);
  }

  public static Status limitExceeded(String message) {
    return new Status(Code.LIMIT_EXCEEDED, message, null);
  }

  public static Status memLimitExceeded(String message) {
    return new Status(Code.MEM_LIMIT_EXCEEDED, message, null);
  }

  public static Status allocFailed(String message) {
    return new Status(Code.MEM_ALLOC_FAILED, message, null);
  }

  public static Status internalError(String message) {
    return new Status(Code.INTERNAL_ERROR, message, null);
  }

  public static Status internalError(String message, Throwable cause) {
    return new Status(Code.INTERNAL_ERROR, message, cause);
  }

  /** Converts an exception thrown by a collaborator into a status.
   *
   * <p>A {@link SetOpsException} keeps its code; anything else becomes
   * {@link Code#INTERNAL_ERROR}. */
  public static Status fromException(Throwable e) {
    if (e instanceof SetOpsException) {
      final SetOpsException se = (SetOpsException) e;
      return new Status(se.getCode(), String.valueOf(se.getMessage()), e);
    }
    return new Status(Code.INTERNAL_ERROR, String.valueOf(e), e);
  }

  public boolean isOk() {
    return code == Code.OK;
  }

  public boolean isCancelled() {
    return code == Code.CANCELLED;
  }

  /** Returns whether this status reports a breached row or memory limit. */
  public boolean isLimitExceeded() {
    return code == Code.LIMIT_EXCEEDED || code == Code.MEM_LIMIT_EXCEEDED;
  }

  public Code getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  public @Nullable Throwable getCause() {
    return cause;
  }

  /** Converts a failed status into the matching exception.
   *
   * @throws IllegalStateException if this status is OK
   */
  public SetOpsException toException() {
    switch (code) {
    case OK:
      throw new IllegalStateException("status is OK");
    case CANCELLED:
      return new CancelledException(message);
    case LIMIT_EXCEEDED:
    case MEM_LIMIT_EXCEEDED:
      return new LimitExceededException(code, message);
    default:
      return new SetOpsException(code, message, cause);
    }
  }

  @Override public boolean equals(@Nullable Object o) {
    return this == o
        || o instanceof Status
        && code == ((Status) o).code
        && message.equals(((Status) o).message);
  }

  @Override public int hashCode() {
    return Objects.hash(code, message);
  }

  @Override public String toString() {
    return isOk() ? "OK" : code + ": " + message;
  }

  /** Kind of outcome. */
  public enum Code {
    OK,
    /** Plan description could not be turned into an operator. */
    INIT_FAILED,
    /** Cancellation was requested. Not a data error. */
    CANCELLED,
    /** A configured row-count ceiling was breached. */
    LIMIT_EXCEEDED,
    /** The memory tracker's limit was breached. */
    MEM_LIMIT_EXCEEDED,
    /** A buffer could not be allocated. */
    MEM_ALLOC_FAILED,
    INTERNAL_ERROR
  }
}

// End Status.java
