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

import com.google.common.base.Preconditions;

/**
 * Thrown when a row-count or memory ceiling is breached during execution.
 */
public class LimitExceededException extends SetOpsException {
  private static final long serialVersionUID = 6152337210493385870L;

  /**
   * Creates a LimitExceededException.
   *
   * @param code    {@link Status.Code#LIMIT_EXCEEDED} or
   *                {@link Status.Code#MEM_LIMIT_EXCEEDED}
   * @param message error message
   */
  public LimitExceededException(Status.Code code, String message) {
    super(checkCode(code), message, null);
  }

  private static Status.Code checkCode(Status.Code code) {
    Preconditions.checkArgument(code == Status.Code.LIMIT_EXCEEDED
        || code == Status.Code.MEM_LIMIT_EXCEEDED, "not a limit code: %s", code);
    return code;
  }
}

// End LimitExceededException.java
