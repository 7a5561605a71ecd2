/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.exception;

/** An expression could not be evaluated against the current item. */
public class EvaluationException extends QueryEngineException {

  public EvaluationException(String message) {
    super(ErrorCode.EVALUATION, Severity.ERROR, message);
  }

  public EvaluationException(String message, Throwable cause) {
    super(ErrorCode.EVALUATION, Severity.ERROR, message, cause);
  }
}
