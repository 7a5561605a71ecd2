/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.exception;

/** A configuration value could not be read or is out of range. */
public class InvalidSettingException extends QueryEngineException {

  public InvalidSettingException(String message) {
    super(ErrorCode.INVALID_SETTING, Severity.FATAL, message);
  }

  public InvalidSettingException(String message, Throwable cause) {
    super(ErrorCode.INVALID_SETTING, Severity.FATAL, message, cause);
  }
}
