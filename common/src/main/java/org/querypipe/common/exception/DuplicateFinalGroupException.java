/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.exception;

/** The same group key reached the final grouping step twice. */
public class DuplicateFinalGroupException extends QueryEngineException {

  public DuplicateFinalGroupException(String groupKey) {
    super(
        ErrorCode.DUPLICATE_FINAL_GROUP,
        Severity.FATAL,
        "Duplicate final group: " + groupKey);
  }
}
