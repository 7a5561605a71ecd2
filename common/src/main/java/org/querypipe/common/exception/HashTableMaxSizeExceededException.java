/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.exception;

/** A hash table would need to grow past its hard size ceiling. */
public class HashTableMaxSizeExceededException extends QueryEngineException {

  public HashTableMaxSizeExceededException(int maxSize) {
    super(
        ErrorCode.HASH_TABLE_MAX_SIZE_EXCEEDED,
        Severity.FATAL,
        "Hash table size exceeds maximum of " + maxSize + " buckets");
  }
}
