/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.exception;

/** An unexpected runtime fault caught at an operator boundary. */
public class ExecutionPanicException extends QueryEngineException {

  public ExecutionPanicException(Throwable cause, String message) {
    super(ErrorCode.EXECUTION_PANIC, Severity.FATAL, message, cause);
  }
}
