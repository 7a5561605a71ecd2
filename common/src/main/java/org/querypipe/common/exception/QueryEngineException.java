/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.exception;

import lombok.Getter;

/**
 * Root of all errors raised while executing a query. Every error carries an {@link ErrorCode} and a
 * {@link Severity}; the severity decides whether the request keeps streaming results.
 */
@Getter
public class QueryEngineException extends RuntimeException {

  private final ErrorCode code;
  private final Severity severity;

  public QueryEngineException(ErrorCode code, Severity severity, String message) {
    super(message);
    this.code = code;
    this.severity = severity;
  }

  public QueryEngineException(ErrorCode code, Severity severity, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.severity = severity;
  }

  /** Returns true if this error must abort the whole request. */
  public boolean isFatal() {
    return severity == Severity.FATAL;
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", code.name(), code.getNumber(), getMessage());
  }

  /** How an error affects the request that raised it. */
  public enum Severity {
    /** Aborts the request; result streaming stops. */
    FATAL,
    /** Reported with the result; processing continues. */
    ERROR,
    /** Informational. */
    WARNING
  }
}
