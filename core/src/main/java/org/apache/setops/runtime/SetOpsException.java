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

import org.apache.setops.config.SetOpsSystemProperty;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Base class for all exceptions thrown by the execution runtime.
 *
 * <p>Operators report failures as a {@link Status}; this exception is what a
 * failed status becomes once it leaves the operator tree.
 *
 * @see CancelledException
 * @see LimitExceededException
 */
public class SetOpsException extends RuntimeException {
  private static final long serialVersionUID = 4871103392614650913L;

  private static final Logger LOGGER =
      LoggerFactory.getLogger(SetOpsException.class);

  private final Status.Code code;

  /**
   * Creates a SetOpsException.
   *
   * @param code    kind of failure
   * @param message error message
   * @param cause   underlying cause, or null
   */
  public SetOpsException(Status.Code code, String message,
      @Nullable Throwable cause) {
    super(message, cause);
    this.code = requireNonNull(code, "code");
    LOGGER.trace("SetOpsException", this);
    if (SetOpsSystemProperty.DEBUG.value()) {
      LOGGER.error(toString());
    }
  }

  /** Creates a SetOpsException with code
   * {@link Status.Code#INTERNAL_ERROR}. */
  public SetOpsException(String message, @Nullable Throwable cause) {
    this(Status.Code.INTERNAL_ERROR, message, cause);
  }

  /** Returns the kind of failure. */
  public Status.Code getCode() {
    return code;
  }

  /** Returns this exception as a status. */
  public Status toStatus() {
    return Status.fromException(this);
  }
}

// End SetOpsException.java
