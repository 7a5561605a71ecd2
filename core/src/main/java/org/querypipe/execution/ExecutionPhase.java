/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Request level phases for which operator counts, item counts and times are accrued. */
@Getter
@RequiredArgsConstructor
public enum ExecutionPhase {
  PRIMARY_SCAN("primaryScan"),
  FETCH("fetch"),
  FILTER("filter"),
  HASH_JOIN("hashJoin"),
  GROUP("group"),
  SORT("sort"),
  WINDOW("window"),
  INSERT("insert"),
  UPSERT("upsert"),
  UPDATE("update"),
  DELETE("delete");

  private final String displayName;
}
