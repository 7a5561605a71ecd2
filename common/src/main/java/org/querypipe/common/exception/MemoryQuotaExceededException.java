/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.exception;

/** The request used more memory than its configured quota. */
public class MemoryQuotaExceededException extends QueryEngineException {

  public MemoryQuotaExceededException(long quotaBytes, long usedBytes) {
    super(
        ErrorCode.MEMORY_QUOTA_EXCEEDED,
        Severity.FATAL,
        String.format(
            "Request has exceeded memory quota (quota=%d bytes, used=%d bytes)",
            quotaBytes, usedBytes));
  }
}
