/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Numeric codes reported alongside query errors. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
  EXECUTION_PANIC(5001),
  EXECUTION_INTERNAL(5002),
  EVALUATION(5010),
  DUPLICATE_FINAL_GROUP(5020),
  GROUP_UPDATE(5021),
  HASH_TABLE_MAX_SIZE_EXCEEDED(5030),
  MEMORY_QUOTA_EXCEEDED(5500),
  SPILL(5510),
  DATASTORE_FETCH(12001),
  DATASTORE_SCAN(12002),
  DATASTORE_MUTATION(12003),
  MUTATION_KEY(12004),
  KEYSPACE_NOT_FOUND(12005),
  DOCUMENT_NOT_FOUND(12006),
  INVALID_SETTING(1065),
  REQUEST_TIMEOUT(1080);

  private final int number;
}
