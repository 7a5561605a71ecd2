/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.exception;

/** Raised when an internal consistency check of the engine fails. */
public class ExecutionInternalException extends QueryEngineException {

  public ExecutionInternalException(String message) {
    super(ErrorCode.EXECUTION_INTERNAL, Severity.FATAL, message);
  }

  public ExecutionInternalException(String message, Throwable cause) {
    super(ErrorCode.EXECUTION_INTERNAL, Severity.FATAL, message, cause);
  }
}
