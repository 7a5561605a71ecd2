/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Types of physical operators, with the name used in profiles. */
@Getter
@RequiredArgsConstructor
public enum PhysicalOperatorType {

  /** Keyspace primary scan - reads document keys from storage. */
  SCAN("PrimaryScan"),

  /** Literal rows. */
  VALUES("ValueScan"),

  /** Bulk document fetch by key. */
  FETCH("Fetch"),

  /** Filter operator - applies predicates to rows. */
  FILTER("Filter"),

  /** Projection operator - selects and transforms fields. */
  PROJECTION("InitialProject"),

  INITIAL_GROUP("InitialGroup"),
  INTERMEDIATE_GROUP("IntermediateGroup"),
  FINAL_GROUP("FinalGroup"),

  /** Sort, optionally bounded by offset and limit. */
  ORDER("Order"),

  OFFSET("Offset"),

  /** Limit operator - limits number of rows. */
  LIMIT("Limit"),

  WINDOW_AGGREGATE("WindowAggregate"),

  HASH_JOIN("HashJoin"),

  /** INSERT, UPSERT, UPDATE or DELETE. */
  SEND_MUTATION("SendMutation"),

  SEQUENCE("Sequence"),
  PARALLEL("Parallel"),

  /** Collects sub-query results. */
  COLLECT("Collect"),

  /** Delivers results to the client. */
  STREAM("Stream");

  private final String displayName;
}
